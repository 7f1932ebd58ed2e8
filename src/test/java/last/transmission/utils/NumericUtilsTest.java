package last.transmission.utils;

import static org.junit.Assert.*;

import org.junit.Test;

public class NumericUtilsTest {

  @Test
  public void chebyshevMatchesClosedForm() {
    for (double x = -1.; x <= 1.; x += 0.125) {
      double theta = Math.acos(x);
      for (int n = 0; n <= 4; ++n) {
        assertEquals(Math.cos(n * theta), NumericUtils.chebyshev(x, n), 1E-12);
      }
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void chebyshevRejectsNegativeOrder() {
    NumericUtils.chebyshev(0.5, -1);
  }

  @Test
  public void rescaleMapsEndpoints() {
    assertEquals(-1., NumericUtils.rescale(0., 0., 1726., -1., 1.), 1E-12);
    assertEquals(1., NumericUtils.rescale(1726., 0., 1726., -1., 1.), 1E-12);
    assertEquals(0.5, NumericUtils.rescale(5., 0., 10., 0., 1.), 1E-12);
  }

  @Test
  public void statisticsUseSampleDeviation() {
    double[] values = {1., 2., 3., 4.};
    double[] stats = NumericUtils.meanAndDeviation(values);
    assertEquals(2.5, stats[0], 1E-12);
    assertEquals(Math.sqrt(5. / 3.), stats[1], 1E-12);
    assertEquals(30., NumericUtils.sumOfSquares(values), 1E-12);
    assertEquals(Math.sqrt(7.5), NumericUtils.rms(values), 1E-12);
    assertTrue(Double.isNaN(NumericUtils.rms(new double[]{})));
  }

  @Test
  public void formatsPrintInfinity() {
    assertEquals("Inf", NumericUtils.DECIMAL_FORMAT.get().format(Double.POSITIVE_INFINITY));
    assertEquals("NaN", NumericUtils.SCIENTIFIC_FORMAT.get().format(Double.NaN));
  }

}
