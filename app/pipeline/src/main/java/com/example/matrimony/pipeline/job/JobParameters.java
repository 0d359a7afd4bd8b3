/*
 * Where: pipeline job layer
 * What: typed read access to a definition's JSON parameter bag
 * Why: templates validate and read parameters through one set of conversion rules
 */
package com.example.matrimony.pipeline.job;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class JobParameters {

  private final Map<String, Object> values;

  public JobParameters(Map<String, Object> values) {
    this.values = values == null ? Map.of() : Collections.unmodifiableMap(values);
  }

  public static JobParameters of(Map<String, Object> values) {
    return new JobParameters(values);
  }

  public boolean contains(String name) {
    return values.get(name) != null;
  }

  /** Integer parameter, defaulted when absent, rejected when not integral or outside [min, max]. */
  public int getInt(String name, int defaultValue, int min, int max) {
    final Object raw = values.get(name);
    if (raw == null) {
      return checkRange(name, BigDecimal.valueOf(defaultValue), min, max);
    }
    final BigDecimal value;
    try {
      if (raw instanceof Number number) {
        value = new BigDecimal(number.toString());
      } else if (raw instanceof String text && text.trim().matches("-?\\d+")) {
        value = new BigDecimal(text.trim());
      } else {
        throw new InvalidJobParametersException(name + " must be an integer");
      }
    } catch (NumberFormatException ex) {
      throw new InvalidJobParametersException(name + " must be an integer", ex);
    }
    if (value.signum() != 0 && value.stripTrailingZeros().scale() > 0) {
      throw new InvalidJobParametersException(name + " must be an integer");
    }
    return checkRange(name, value, min, max);
  }

  // compared before narrowing so out-of-int-range values cannot wrap into range
  private static int checkRange(String name, BigDecimal value, int min, int max) {
    if (value.compareTo(BigDecimal.valueOf(min)) < 0 || value.compareTo(BigDecimal.valueOf(max)) > 0) {
      throw new InvalidJobParametersException(
          name + " must be between " + min + " and " + max + " but was " + value.toPlainString());
    }
    return value.intValue();
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    final Object raw = values.get(name);
    if (raw == null) {
      return defaultValue;
    }
    if (raw instanceof Boolean flag) {
      return flag;
    }
    if (raw instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
      return Boolean.parseBoolean(text);
    }
    throw new InvalidJobParametersException(name + " must be a boolean");
  }

  /** String parameter, or {@code null} when absent or blank. */
  public String getString(String name) {
    final Object raw = values.get(name);
    if (raw == null) {
      return null;
    }
    if (!(raw instanceof String text)) {
      throw new InvalidJobParametersException(name + " must be a string");
    }
    return text.isBlank() ? null : text;
  }

  /** List of JSON objects, or an empty list when absent. */
  public List<Map<String, Object>> getObjectList(String name) {
    final Object raw = values.get(name);
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> items)) {
      throw new InvalidJobParametersException(name + " must be a list");
    }
    final List<Map<String, Object>> result = new ArrayList<>(items.size());
    for (Object item : items) {
      if (!(item instanceof Map<?, ?> entry)) {
        throw new InvalidJobParametersException(name + " entries must be objects");
      }
      @SuppressWarnings("unchecked")
      final Map<String, Object> typed = (Map<String, Object>) entry;
      result.add(typed);
    }
    return result;
  }

  public Map<String, Object> asMap() {
    return values;
  }
}
