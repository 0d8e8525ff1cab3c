package com.airsentinel.processor.detection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Human-readable description plus the numbers that triggered the rule.
 *
 * @param metrics named measurements, in insertion order
 * @param previousValue earlier value of the measured quantity, when the rule compares two
 * @param currentValue current value of the measured quantity
 */
public record AnomalyDetails(
    String description, Map<String, Double> metrics, Double previousValue, Double currentValue) {

  public AnomalyDetails {
    metrics = metrics == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
  }

  public static AnomalyDetails of(String description, Map<String, Double> metrics) {
    return new AnomalyDetails(description, metrics, null, null);
  }
}
