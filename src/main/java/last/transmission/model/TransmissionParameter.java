package last.transmission.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed vocabulary of parameters the transmission model understands. Every free or fixed
 * parameter named by a calibration stage must resolve to one of these entries.
 *
 * Names match the keys used in configuration files and stage definitions (i.e., "Norm_",
 * "Pwv_cm", "kx2"), so lookups are done by {@link #fromName(String)} rather than by enum name.
 */
public enum TransmissionParameter {

  NORM("Norm_", ParameterGroup.NORMALIZATION, 0.5),

  CENTER("Center", ParameterGroup.QUANTUM_EFFICIENCY, 570.973),
  AMPLITUDE("Amplitude", ParameterGroup.QUANTUM_EFFICIENCY, 328.1936),
  SIGMA("Sigma", ParameterGroup.QUANTUM_EFFICIENCY, 139.77),
  GAMMA("Gamma", ParameterGroup.QUANTUM_EFFICIENCY, -0.1517),

  PWV_CM("Pwv_cm", ParameterGroup.ATMOSPHERIC, 1.4),
  TAU_AOD500("Tau_aod500", ParameterGroup.ATMOSPHERIC, 0.084),
  ALPHA("Alpha", ParameterGroup.ATMOSPHERIC, 0.6),
  DOBSON_UNITS("Dobson_units", ParameterGroup.ATMOSPHERIC, 300.),
  TEMPERATURE_C("Temperature_C", ParameterGroup.ATMOSPHERIC, 15.2),
  PRESSURE("Pressure", ParameterGroup.ATMOSPHERIC, 965.),

  KX0("kx0", ParameterGroup.FIELD_ADDITIVE, 0.),
  KY0("ky0", ParameterGroup.FIELD_ADDITIVE, 0.),
  KX("kx", ParameterGroup.FIELD_ADDITIVE, 0.),
  KY("ky", ParameterGroup.FIELD_ADDITIVE, 0.),
  KX2("kx2", ParameterGroup.FIELD_ADDITIVE, 0.),
  KY2("ky2", ParameterGroup.FIELD_ADDITIVE, 0.),
  KX3("kx3", ParameterGroup.FIELD_ADDITIVE, 0.),
  KY3("ky3", ParameterGroup.FIELD_ADDITIVE, 0.),
  KX4("kx4", ParameterGroup.FIELD_ADDITIVE, 0.),
  KY4("ky4", ParameterGroup.FIELD_ADDITIVE, 0.),
  KXY("kxy", ParameterGroup.FIELD_ADDITIVE, 0.),

  CX0("cx0", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CX1("cx1", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CX2("cx2", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CX3("cx3", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CX4("cx4", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CY0("cy0", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CY1("cy1", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CY2("cy2", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CY3("cy3", ParameterGroup.FIELD_MULTIPLICATIVE, 0.),
  CY4("cy4", ParameterGroup.FIELD_MULTIPLICATIVE, 0.);

  /**
   * Broad category of a parameter, used to decide which solver may optimize it
   */
  public enum ParameterGroup {
    NORMALIZATION,
    QUANTUM_EFFICIENCY,
    ATMOSPHERIC,
    FIELD_ADDITIVE,
    FIELD_MULTIPLICATIVE
  }

  private static final Map<String, TransmissionParameter> BY_NAME;

  static {
    Map<String, TransmissionParameter> byName = new LinkedHashMap<>();
    for (TransmissionParameter parameter : values()) {
      byName.put(parameter.name, parameter);
    }
    BY_NAME = Collections.unmodifiableMap(byName);
  }

  private final String name;
  private final ParameterGroup group;
  private final double defaultValue;

  TransmissionParameter(String name, ParameterGroup group, double defaultValue) {
    this.name = name;
    this.group = group;
    this.defaultValue = defaultValue;
  }

  /**
   * Get the name of this parameter as used in stage definitions and parameter sets
   *
   * @return Parameter name (case-sensitive)
   */
  public String getName() {
    return name;
  }

  public ParameterGroup getGroup() {
    return group;
  }

  /**
   * Get the starting value used for this parameter when neither a previous stage nor the
   * configuration supplies one. Field-correction coefficients start at 0 (no correction).
   *
   * @return Default value of the parameter
   */
  public double getDefaultValue() {
    return defaultValue;
  }

  /**
   * True if this parameter enters the model linearly through the additive field-correction basis
   * and can therefore be solved for in closed form.
   *
   * @return True for kx0, ky0, kx, ky, kx2..ky4 and kxy
   */
  public boolean isLinearFieldTerm() {
    return group == ParameterGroup.FIELD_ADDITIVE;
  }

  /**
   * Look up a parameter by its vocabulary name
   *
   * @param name Name such as "Norm_" or "kx2"
   * @return Matching parameter, or null if the name is not in the vocabulary
   */
  public static TransmissionParameter fromName(String name) {
    return BY_NAME.get(name);
  }

  public static boolean isKnown(String name) {
    return BY_NAME.containsKey(name);
  }

  /**
   * True if the given name is part of the additive field-correction vocabulary
   *
   * @param name Parameter name
   * @return True if linear solvers may optimize the named parameter
   */
  public static boolean isLinearFieldTerm(String name) {
    TransmissionParameter parameter = BY_NAME.get(name);
    return parameter != null && parameter.isLinearFieldTerm();
  }

  /**
   * Get a parameter set holding the default value of every parameter in the vocabulary
   *
   * @return Defaults, in declaration order
   */
  public static ParameterSet defaults() {
    Map<String, Double> map = new LinkedHashMap<>();
    for (TransmissionParameter parameter : values()) {
      map.put(parameter.name, parameter.defaultValue);
    }
    return ParameterSet.fromMap(map);
  }

  /**
   * List the names of all parameters in a group, in declaration order
   *
   * @param group Group to list
   * @return Names of parameters belonging to the group
   */
  public static List<String> namesInGroup(ParameterGroup group) {
    List<String> names = new ArrayList<>();
    for (TransmissionParameter parameter : values()) {
      if (parameter.group == group) {
        names.add(parameter.name);
      }
    }
    return Collections.unmodifiableList(names);
  }

}
