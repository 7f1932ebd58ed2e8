package last.transmission.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Class containing small numeric helpers shared by the forward model and the solvers:
 * orthogonal polynomial evaluation, coordinate rescaling and summary statistics of residuals.
 */
public class NumericUtils {

  /**
   * 2.5 / ln(10); converts a natural-log flux ratio into magnitudes
   */
  public static final double MAGNITUDE_PER_LN = 2.5 / Math.log(10.);

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.######");
        setInfinityPrintable(format);
        return format;
      });

  public static final ThreadLocal<DecimalFormat> SCIENTIFIC_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("0.0000E0");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Evaluate the Chebyshev polynomial of the first kind T_n(x) by the three-term recurrence
   * T_n(x) = 2x T_{n-1}(x) - T_{n-2}(x), with T_0(x) = 1 and T_1(x) = x.
   *
   * @param x Point to evaluate at, normally within [-1, 1]
   * @param order Polynomial order, 0 or greater
   * @return Value of T_order(x)
   */
  public static double chebyshev(double x, int order) {
    if (order < 0) {
      throw new IllegalArgumentException("Chebyshev order must be non-negative: " + order);
    }
    if (order == 0) {
      return 1.;
    }
    double previous = 1.;
    double current = x;
    for (int n = 2; n <= order; ++n) {
      double next = 2. * x * current - previous;
      previous = current;
      current = next;
    }
    return current;
  }

  /**
   * Linearly map a value from one range to another
   *
   * @param value Value to rescale
   * @param fromMin Lower end of the source range
   * @param fromMax Upper end of the source range
   * @param toMin Lower end of the target range
   * @param toMax Upper end of the target range
   * @return Rescaled value
   */
  public static double rescale(double value, double fromMin, double fromMax,
      double toMin, double toMax) {
    return toMin + (value - fromMin) * (toMax - toMin) / (fromMax - fromMin);
  }

  /**
   * Sum of squared values; this is the cost reported for a residual vector
   *
   * @param values Array of values
   * @return Sum of squares, 0 for an empty array
   */
  public static double sumOfSquares(double[] values) {
    double sum = 0.;
    for (double value : values) {
      sum += value * value;
    }
    return sum;
  }

  /**
   * Root mean square of an array
   *
   * @param values Array of values
   * @return RMS of the array, or NaN if the array is empty
   */
  public static double rms(double[] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    return Math.sqrt(sumOfSquares(values) / values.length);
  }

  /**
   * Get the mean and sample standard deviation (n - 1 normalization) of an array
   *
   * @param values Array of values
   * @return Two-element array of {mean, standard deviation}
   */
  public static double[] meanAndDeviation(double[] values) {
    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    return new double[]{stats.getMean(), stats.getStandardDeviation()};
  }

  /**
   * Sets a DecimalFormat's infinity symbol to a printable character (the default symbol is not
   * representable in plain-text reports)
   *
   * @param df DecimalFormat to modify
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf");
    symbols.setNaN("NaN");
    df.setDecimalFormatSymbols(symbols);
  }

}
