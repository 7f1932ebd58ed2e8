package last.transmission.model;

import static org.junit.Assert.*;

import java.util.List;
import last.transmission.model.TransmissionParameter.ParameterGroup;
import org.junit.Test;

public class TransmissionParameterTest {

  @Test
  public void lookupByVocabularyName() {
    assertEquals(TransmissionParameter.NORM, TransmissionParameter.fromName("Norm_"));
    assertEquals(TransmissionParameter.KX2, TransmissionParameter.fromName("kx2"));
    assertNull(TransmissionParameter.fromName("KX2"));
    assertFalse(TransmissionParameter.isKnown("norm"));
  }

  @Test
  public void onlyAdditiveTermsAreLinear() {
    assertTrue(TransmissionParameter.isLinearFieldTerm("kx0"));
    assertTrue(TransmissionParameter.isLinearFieldTerm("kxy"));
    assertFalse(TransmissionParameter.isLinearFieldTerm("cx0"));
    assertFalse(TransmissionParameter.isLinearFieldTerm("Norm_"));
    assertFalse(TransmissionParameter.isLinearFieldTerm("bogus"));
  }

  @Test
  public void groupsPartitionVocabulary() {
    int total = 0;
    for (ParameterGroup group : ParameterGroup.values()) {
      total += TransmissionParameter.namesInGroup(group).size();
    }
    assertEquals(TransmissionParameter.values().length, total);
    List<String> additive = TransmissionParameter.namesInGroup(ParameterGroup.FIELD_ADDITIVE);
    assertEquals(11, additive.size());
    assertEquals(10,
        TransmissionParameter.namesInGroup(ParameterGroup.FIELD_MULTIPLICATIVE).size());
  }

  @Test
  public void defaultsCoverVocabulary() {
    ParameterSet defaults = TransmissionParameter.defaults();
    assertEquals(TransmissionParameter.values().length, defaults.size());
    assertEquals(0.5, defaults.get("Norm_"), 0.);
    assertEquals(0., defaults.get("kxy"), 0.);
    assertEquals("Norm_", defaults.nameList().get(0));
  }

}
