package com.airsentinel.processor.service;

import com.airsentinel.ingester.opensky.FlightTrack;
import com.airsentinel.processor.detection.Anomaly;
import com.airsentinel.processor.detection.AnomalyStats;
import java.util.List;

/**
 * Anomalies found by replaying a historical track, in replay order.
 */
public record TrackAnalysis(FlightTrack track, List<Anomaly> anomalies, AnomalyStats stats) {
  public TrackAnalysis {
    anomalies = List.copyOf(anomalies);
  }
}
