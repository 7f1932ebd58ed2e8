package last.transmission.model;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class ParameterSetTest {

  @Test
  public void mergeLetsArgumentWin() {
    ParameterSet base = ParameterSet.of("Norm_", 0.5).with("kx", 0.1);
    ParameterSet merged = base.merge(ParameterSet.of("kx", 0.3).with("ky", -0.2));
    assertEquals(0.5, merged.get("Norm_"), 0.);
    assertEquals(0.3, merged.get("kx"), 0.);
    assertEquals(-0.2, merged.get("ky"), 0.);
    assertEquals(Arrays.asList("Norm_", "kx", "ky"), merged.nameList());
    // receiver unchanged
    assertEquals(0.1, base.get("kx"), 0.);
    assertFalse(base.contains("ky"));
  }

  @Test
  public void withReplacesValueInPlace() {
    ParameterSet params = ParameterSet.of("Norm_", 0.5).with("Center", 570.).with("Norm_", 0.7);
    assertEquals(Arrays.asList("Norm_", "Center"), params.nameList());
    assertEquals(0.7, params.get("Norm_"), 0.);
  }

  @Test
  public void withoutAndSelect() {
    ParameterSet params = TransmissionParameter.defaults();
    ParameterSet dropped = params.without(Arrays.asList("Norm_", "notAName"));
    assertFalse(dropped.contains("Norm_"));
    assertEquals(params.size() - 1, dropped.size());

    ParameterSet picked = params.select(Arrays.asList("kx", "Norm_", "notAName"));
    assertEquals(Arrays.asList("kx", "Norm_"), picked.nameList());
  }

  @Test
  public void arrayConversionKeepsOrder() {
    ParameterSet params = ParameterSet.fromArray(Arrays.asList("kx", "ky"), new double[]{1., 2.});
    assertArrayEquals(new double[]{2., 1.}, params.toArray(Arrays.asList("ky", "kx")), 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromArrayRejectsLengthMismatch() {
    ParameterSet.fromArray(Collections.singletonList("kx"), new double[]{1., 2.});
  }

  @Test(expected = IllegalArgumentException.class)
  public void getMissingNameThrows() {
    ParameterSet.empty().get("Norm_");
  }

  @Test
  public void getWithFallback() {
    assertEquals(3., ParameterSet.empty().get("Norm_", 3.), 0.);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void mapViewIsReadOnly() {
    ParameterSet.of("Norm_", 1.).asMap().put("kx", 2.);
  }

  @Test
  public void equalityIsByContent() {
    assertEquals(ParameterSet.of("kx", 1.).with("ky", 2.),
        ParameterSet.of("kx", 1.).merge(ParameterSet.of("ky", 2.)));
    assertEquals("{kx=1.0}", ParameterSet.of("kx", 1.).toString());
  }

}
