package com.airsentinel.processor.service;

import com.airsentinel.processor.aircraft.EnrichedAircraft;
import com.airsentinel.processor.detection.Anomaly;
import java.util.List;

public record AircraftReport(EnrichedAircraft aircraft, List<Anomaly> anomalies) {
  public AircraftReport {
    anomalies = List.copyOf(anomalies);
  }
}
