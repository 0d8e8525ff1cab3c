package com.airsentinel.processor.service;

import com.airsentinel.processor.aircraft.EnrichedAircraft;
import com.airsentinel.processor.detection.Anomaly;
import com.airsentinel.processor.detection.AnomalyStats;
import java.time.Instant;
import java.util.List;

/**
 * Result of one airspace poll: the aircraft seen and the anomalies detected, critical first.
 */
public record AirspaceScan(
    Instant scannedAt, List<EnrichedAircraft> aircraft, List<Anomaly> anomalies, AnomalyStats stats) {

  public AirspaceScan {
    aircraft = List.copyOf(aircraft);
    anomalies = List.copyOf(anomalies);
  }
}
