package last.transmission.model;

import static org.junit.Assert.*;

import last.transmission.utils.NumericUtils;
import org.junit.Test;

public class FieldCorrectionTest {

  private static final double DELTA = 1E-12;

  @Test
  public void basisMatchesTermNames() {
    double x = 0.3;
    double y = -0.6;
    assertEquals(1., FieldCorrection.basisValue("kx0", x, y), DELTA);
    assertEquals(1., FieldCorrection.basisValue("ky0", x, y), DELTA);
    assertEquals(x, FieldCorrection.basisValue("kx", x, y), DELTA);
    assertEquals(y, FieldCorrection.basisValue("ky", x, y), DELTA);
    assertEquals(2. * x * x - 1., FieldCorrection.basisValue("kx2", x, y), DELTA);
    assertEquals(4. * y * y * y - 3. * y, FieldCorrection.basisValue("ky3", x, y), DELTA);
    assertEquals(8. * Math.pow(x, 4) - 8. * x * x + 1., FieldCorrection.basisValue("kx4", x, y),
        DELTA);
    assertEquals(x * y, FieldCorrection.basisValue("kxy", x, y), DELTA);
  }

  @Test(expected = IllegalArgumentException.class)
  public void basisRejectsMultiplicativeTerm() {
    FieldCorrection.basisValue("cx1", 0., 0.);
  }

  @Test
  public void additiveOffsetIsSumOfTerms() {
    ParameterSet params = ParameterSet.of("kx0", 0.01).with("kx", 0.02).with("kxy", -0.03)
        .with("Norm_", 5.);
    double x = 0.5;
    double y = -0.25;
    assertEquals(0.01 + 0.02 * x - 0.03 * x * y,
        FieldCorrection.additiveOffset(params, x, y), DELTA);
    assertEquals(0., FieldCorrection.additiveOffset(ParameterSet.empty(), x, y), 0.);
  }

  @Test
  public void multiplicativeOffsetIsInMagnitudes() {
    ParameterSet params = ParameterSet.of("cx0", 0.1).with("cy1", 0.2);
    double x = 0.4;
    double y = 0.5;
    double exponent = 0.1 + 0.2 * y;
    assertEquals(2.5 * Math.log10(Math.exp(exponent)),
        FieldCorrection.multiplicativeOffset(params, x, y), DELTA);
    assertEquals(NumericUtils.MAGNITUDE_PER_LN * exponent,
        FieldModel.MULTIPLICATIVE.magnitudeOffset(params, x, y), DELTA);
  }

  @Test
  public void fieldModelsIgnoreOtherFamily() {
    ParameterSet params = ParameterSet.of("kx0", 0.1).with("cx0", 0.2);
    assertEquals(0.1, FieldModel.ADDITIVE.magnitudeOffset(params, 0., 0.), DELTA);
    assertEquals(NumericUtils.MAGNITUDE_PER_LN * 0.2,
        FieldModel.MULTIPLICATIVE.magnitudeOffset(params, 0., 0.), DELTA);
    assertEquals(0., FieldModel.NONE.magnitudeOffset(params, 0., 0.), 0.);
  }

}
