package com.airsentinel.processor.aircraft;

/**
 * Registry data for one airframe, loaded from the local reference SQLite DB.
 *
 * <p>Any field except {@code icao24} may be {@code null} depending on source coverage.
 */
public record AircraftMetadata(
    String icao24,
    String registration,
    String manufacturerIcao,
    String manufacturerName,
    String model,
    String typecode,
    String icaoAircraftType,
    String operator,
    String operatorCallsign,
    String owner,
    String categoryDescription,
    String built,
    String engines) {

  /**
   * Display label with fallback order {@code manufacturer model -> typecode -> unknown}.
   */
  public String typeLabel() {
    if (model != null && !model.isBlank()) {
      return manufacturerName == null || manufacturerName.isBlank() ? model : manufacturerName + " " + model;
    }
    if (typecode != null && !typecode.isBlank()) {
      return typecode;
    }
    return "unknown";
  }
}
