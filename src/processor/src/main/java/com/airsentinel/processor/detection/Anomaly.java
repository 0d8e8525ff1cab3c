package com.airsentinel.processor.detection;

import com.airsentinel.ingester.geo.GeoPoint;

/**
 * One detected anomaly. Immutable; {@link #withAiAnalysis(String)} returns a copy.
 *
 * @param detectedAt ISO-8601 UTC timestamp
 * @param location aircraft position at detection, {@code null} when it had no fix
 * @param aiAnalysis free-text analysis attached after detection, usually {@code null}
 */
public record Anomaly(
    String id,
    String icao24,
    String callsign,
    AnomalyType type,
    Severity severity,
    String detectedAt,
    GeoPoint location,
    AnomalyDetails details,
    String aiAnalysis) {

  public Anomaly withAiAnalysis(String analysis) {
    return new Anomaly(id, icao24, callsign, type, severity, detectedAt, location, details, analysis);
  }
}
