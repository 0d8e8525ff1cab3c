package com.airsentinel.processor.detection;

import com.airsentinel.ingester.opensky.AircraftState;
import com.airsentinel.processor.config.ProcessorProperties;
import com.airsentinel.processor.history.HistoryEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ground speed above the upper bound (medium), or below the lower bound at altitude (low, since
 * slow aircraft classes also trip it). Aircraft on the ground are exempt.
 */
public class SpeedAnomalyDetector implements AnomalyDetector {
  private final AnomalyFactory factory;
  private final double fastKts;
  private final double slowKts;
  private final double slowMinAltitudeMeters;

  public SpeedAnomalyDetector(AnomalyFactory factory, ProcessorProperties.Detection thresholds) {
    this.factory = factory;
    this.fastKts = thresholds.getFastSpeedKts();
    this.slowKts = thresholds.getSlowSpeedKts();
    this.slowMinAltitudeMeters = thresholds.getSlowSpeedMinAltitudeMeters();
  }

  @Override
  public String name() {
    return "speed";
  }

  @Override
  public Optional<Anomaly> detect(AircraftState current, List<HistoryEntry> history) {
    if (current.onGround() || current.velocity() == null) {
      return Optional.empty();
    }
    double speedKts = Units.toKnots(current.velocity());

    if (speedKts > fastKts) {
      Map<String, Double> metrics = new LinkedHashMap<>();
      metrics.put("ground_speed_kts", speedKts);
      return Optional.of(factory.create(
          current,
          AnomalyType.UNUSUAL_SPEED,
          Severity.MEDIUM,
          new AnomalyDetails(
              "Unusually high ground speed: " + Math.round(speedKts) + " knots", metrics, null, speedKts)));
    }

    Double altitude = current.baroAltitude();
    if (speedKts < slowKts && altitude != null && altitude > slowMinAltitudeMeters) {
      double altitudeFt = Units.toFeet(altitude);
      Map<String, Double> metrics = new LinkedHashMap<>();
      metrics.put("ground_speed_kts", speedKts);
      metrics.put("altitude_ft", altitudeFt);
      return Optional.of(factory.create(
          current,
          AnomalyType.UNUSUAL_SPEED,
          Severity.LOW,
          new AnomalyDetails(
              "Unusually low ground speed at altitude: " + Math.round(speedKts) + " knots at "
                  + Math.round(altitudeFt) + " ft",
              metrics,
              null,
              speedKts)));
    }
    return Optional.empty();
  }
}
