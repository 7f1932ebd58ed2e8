package last.transmission.model;

import java.util.List;
import last.transmission.utils.NumericUtils;

/**
 * Position-dependent corrections for detector-plane non-uniformity, expressed with Chebyshev
 * polynomials of normalized detector coordinates.
 *
 * The additive model gives a magnitude offset
 * <pre>
 *   kx0 + ky0 + sum_n kxn T_n(x) + sum_n kyn T_n(y) + kxy x y,   n = 1..4
 * </pre>
 * which is linear in its coefficients; {@link #basisValue(String, double, double)} exposes the
 * basis function paired with each coefficient so that a design matrix can be built from it.
 *
 * The multiplicative model scales the predicted flux by exp(sum_n cxn T_n(x) + sum_n cyn T_n(y)),
 * n = 0..4, and is reported here as the equivalent magnitude offset.
 */
public final class FieldCorrection {

  /**
   * Highest Chebyshev order used by either model
   */
  public static final int MAX_ORDER = 4;

  private static final List<String> ADDITIVE_TERMS = TransmissionParameter.namesInGroup(
      TransmissionParameter.ParameterGroup.FIELD_ADDITIVE);

  private FieldCorrection() {
  }

  /**
   * Names of the coefficients of the additive model, which is also the set of names the linear
   * least-squares solver accepts
   *
   * @return Coefficient names, in vocabulary order
   */
  public static List<String> additiveTerms() {
    return ADDITIVE_TERMS;
  }

  /**
   * Evaluate the basis function paired with an additive-model coefficient
   *
   * @param term Coefficient name (kx0, ky0, kx, ky, kx2..ky4, kxy)
   * @param x Normalized x coordinate
   * @param y Normalized y coordinate
   * @return Value of the basis function at (x, y)
   * @throws IllegalArgumentException If the name is not an additive field term
   */
  public static double basisValue(String term, double x, double y) {
    TransmissionParameter parameter = TransmissionParameter.fromName(term);
    if (parameter == null || !parameter.isLinearFieldTerm()) {
      throw new IllegalArgumentException("Not an additive field-correction term: " + term);
    }
    switch (parameter) {
      case KX0:
      case KY0:
        return 1.;
      case KX:
        return x;
      case KY:
        return y;
      case KX2:
        return NumericUtils.chebyshev(x, 2);
      case KY2:
        return NumericUtils.chebyshev(y, 2);
      case KX3:
        return NumericUtils.chebyshev(x, 3);
      case KY3:
        return NumericUtils.chebyshev(y, 3);
      case KX4:
        return NumericUtils.chebyshev(x, 4);
      case KY4:
        return NumericUtils.chebyshev(y, 4);
      case KXY:
        return x * y;
      default:
        throw new IllegalArgumentException("Not an additive field-correction term: " + term);
    }
  }

  /**
   * Magnitude offset of the additive model. Coefficients missing from the parameter set are 0.
   *
   * @param params Parameters holding any of the additive coefficients
   * @param x Normalized x coordinate
   * @param y Normalized y coordinate
   * @return Offset in magnitudes
   */
  public static double additiveOffset(ParameterSet params, double x, double y) {
    double offset = 0.;
    for (String term : ADDITIVE_TERMS) {
      double coefficient = params.get(term, 0.);
      if (coefficient != 0.) {
        offset += coefficient * basisValue(term, x, y);
      }
    }
    return offset;
  }

  /**
   * Magnitude offset of the multiplicative model. Coefficients missing from the parameter set
   * are 0.
   *
   * @param params Parameters holding any of cx0..cx4, cy0..cy4
   * @param x Normalized x coordinate
   * @param y Normalized y coordinate
   * @return Offset in magnitudes, 2.5 log10 of the flux scaling
   */
  public static double multiplicativeOffset(ParameterSet params, double x, double y) {
    double exponent = 0.;
    for (int order = 0; order <= MAX_ORDER; ++order) {
      double cx = params.get("cx" + order, 0.);
      double cy = params.get("cy" + order, 0.);
      if (cx != 0.) {
        exponent += cx * NumericUtils.chebyshev(x, order);
      }
      if (cy != 0.) {
        exponent += cy * NumericUtils.chebyshev(y, order);
      }
    }
    return NumericUtils.MAGNITUDE_PER_LN * exponent;
  }

}
