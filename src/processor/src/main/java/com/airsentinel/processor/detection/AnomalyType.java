package com.airsentinel.processor.detection;

/**
 * Anomaly categories with their wire names.
 *
 * <p>{@link #ROUTE_DEVIATION} and {@link #DIVERSION} are reserved; no detector emits them yet.
 */
public enum AnomalyType {
  ALTITUDE_DROP("altitude_drop"),
  HOLDING_PATTERN("holding_pattern"),
  EMERGENCY_SQUAWK("emergency_squawk"),
  ROUTE_DEVIATION("route_deviation"),
  RAPID_DESCENT("rapid_descent"),
  UNUSUAL_SPEED("unusual_speed"),
  GO_AROUND("go_around"),
  DIVERSION("diversion");

  private final String wireName;

  AnomalyType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
