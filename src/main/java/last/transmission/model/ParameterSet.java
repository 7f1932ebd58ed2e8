package last.transmission.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, immutable mapping from parameter names to values. All operations that would change
 * the mapping return a new instance, so a parameter set handed to a solver or stored in a stage
 * result cannot be modified afterwards.
 *
 * Iteration order is insertion order; merging keeps the position of names already present and
 * appends new names at the end.
 */
public final class ParameterSet {

  private static final ParameterSet EMPTY = new ParameterSet(new LinkedHashMap<>());

  private final Map<String, Double> values;

  private ParameterSet(LinkedHashMap<String, Double> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static ParameterSet empty() {
    return EMPTY;
  }

  /**
   * Create a parameter set with a single entry
   *
   * @param name Parameter name
   * @param value Parameter value
   * @return New parameter set
   */
  public static ParameterSet of(String name, double value) {
    return EMPTY.with(name, value);
  }

  /**
   * Create a parameter set from a map, preserving the map's iteration order
   *
   * @param map Name to value mapping
   * @return New parameter set
   */
  public static ParameterSet fromMap(Map<String, Double> map) {
    LinkedHashMap<String, Double> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : map.entrySet()) {
      copy.put(entry.getKey(), checkValue(entry.getKey(), entry.getValue()));
    }
    return new ParameterSet(copy);
  }

  /**
   * Build a parameter set from parallel arrays of names and values, as used when converting a
   * solver's free-parameter vector back into named parameters
   *
   * @param names Parameter names, in vector order
   * @param vector Values for each name
   * @return New parameter set with entries in the order given
   */
  public static ParameterSet fromArray(List<String> names, double[] vector) {
    if (names.size() != vector.length) {
      throw new IllegalArgumentException("Got " + vector.length + " values for "
          + names.size() + " parameter names");
    }
    LinkedHashMap<String, Double> map = new LinkedHashMap<>();
    for (int i = 0; i < vector.length; ++i) {
      map.put(names.get(i), vector[i]);
    }
    return new ParameterSet(map);
  }

  private static Double checkValue(String name, Double value) {
    if (name == null) {
      throw new IllegalArgumentException("Parameter names cannot be null");
    }
    if (value == null) {
      throw new IllegalArgumentException("No value given for parameter " + name);
    }
    return value;
  }

  public boolean contains(String name) {
    return values.containsKey(name);
  }

  /**
   * Get the value of a parameter
   *
   * @param name Parameter name
   * @return Value of the parameter
   * @throws IllegalArgumentException if the parameter is not present
   */
  public double get(String name) {
    Double value = values.get(name);
    if (value == null) {
      throw new IllegalArgumentException("Parameter set has no value for " + name);
    }
    return value;
  }

  /**
   * Get the value of a parameter, or a fallback if it is not present
   *
   * @param name Parameter name
   * @param defaultValue Value to return if name is absent
   * @return Parameter value or defaultValue
   */
  public double get(String name, double defaultValue) {
    Double value = values.get(name);
    return value == null ? defaultValue : value;
  }

  public Set<String> names() {
    return values.keySet();
  }

  public Map<String, Double> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Return a copy of this set with one value added or replaced
   *
   * @param name Parameter name
   * @param value New value
   * @return New parameter set
   */
  public ParameterSet with(String name, double value) {
    LinkedHashMap<String, Double> copy = new LinkedHashMap<>(values);
    copy.put(name, checkValue(name, value));
    return new ParameterSet(copy);
  }

  /**
   * Merge another set into this one. Values in the other set take precedence.
   *
   * @param other Parameters to overlay on this set
   * @return New parameter set containing the union of both
   */
  public ParameterSet merge(ParameterSet other) {
    if (other.isEmpty()) {
      return this;
    }
    LinkedHashMap<String, Double> copy = new LinkedHashMap<>(values);
    copy.putAll(other.values);
    return new ParameterSet(copy);
  }

  /**
   * Return a copy of this set without the given names
   *
   * @param names Names to drop; names not in this set are ignored
   * @return New parameter set
   */
  public ParameterSet without(Collection<String> names) {
    LinkedHashMap<String, Double> copy = new LinkedHashMap<>(values);
    for (String name : names) {
      copy.remove(name);
    }
    return new ParameterSet(copy);
  }

  /**
   * Return the subset of this set with the given names, in the order the names are given
   *
   * @param names Names to keep; names not in this set are ignored
   * @return New parameter set
   */
  public ParameterSet select(Collection<String> names) {
    LinkedHashMap<String, Double> copy = new LinkedHashMap<>();
    for (String name : names) {
      Double value = values.get(name);
      if (value != null) {
        copy.put(name, value);
      }
    }
    return new ParameterSet(copy);
  }

  /**
   * Extract values for the given names into a vector
   *
   * @param names Names in vector order, all of which must be present
   * @return Values of the named parameters
   */
  public double[] toArray(List<String> names) {
    double[] vector = new double[names.size()];
    for (int i = 0; i < vector.length; ++i) {
      vector[i] = get(names.get(i));
    }
    return vector;
  }

  public List<String> nameList() {
    return new ArrayList<>(values.keySet());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ParameterSet)) {
      return false;
    }
    return values.equals(((ParameterSet) obj).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Double> entry : values.entrySet()) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(entry.getKey()).append('=').append(entry.getValue());
    }
    return '{' + sb.toString() + '}';
  }

}
