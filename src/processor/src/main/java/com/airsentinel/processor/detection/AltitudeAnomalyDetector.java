package com.airsentinel.processor.detection;

import com.airsentinel.ingester.opensky.AircraftState;
import com.airsentinel.processor.config.ProcessorProperties;
import com.airsentinel.processor.history.HistoryEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Rapid descent from the reported vertical rate, otherwise a sudden altitude drop derived from the
 * last two observations. Airborne aircraft only.
 *
 * <p>The derived rate uses the observations' {@code lastContact} times, so a burst of polls that
 * return the same sample never produces a spurious rate.
 */
public class AltitudeAnomalyDetector implements AnomalyDetector {
  private final AnomalyFactory factory;
  private final double criticalVerticalRateFpm;
  private final double altitudeDropRateFpm;

  public AltitudeAnomalyDetector(AnomalyFactory factory, ProcessorProperties.Detection thresholds) {
    this.factory = factory;
    this.criticalVerticalRateFpm = thresholds.getCriticalVerticalRateFpm();
    this.altitudeDropRateFpm = thresholds.getAltitudeDropRateFpm();
  }

  @Override
  public String name() {
    return "altitude";
  }

  @Override
  public Optional<Anomaly> detect(AircraftState current, List<HistoryEntry> history) {
    if (current.onGround()) {
      return Optional.empty();
    }

    if (current.verticalRate() != null) {
      double verticalRateFpm = Units.toFeetPerMinute(current.verticalRate());
      if (verticalRateFpm < criticalVerticalRateFpm) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("vertical_rate_fpm", verticalRateFpm);
        if (current.baroAltitude() != null) {
          metrics.put("current_altitude_ft", Units.toFeet(current.baroAltitude()));
        }
        return Optional.of(factory.create(
            current,
            AnomalyType.RAPID_DESCENT,
            Severity.HIGH,
            new AnomalyDetails(
                "Rapid descent detected: " + Math.round(verticalRateFpm) + " ft/min",
                metrics,
                null,
                verticalRateFpm)));
      }
    }

    if (history.size() < 2 || current.baroAltitude() == null) {
      return Optional.empty();
    }
    AircraftState previous = history.get(history.size() - 2).state();
    if (previous.baroAltitude() == null) {
      return Optional.empty();
    }
    double minutes = (current.lastContact() - previous.lastContact()) / 60.0;
    if (minutes <= 0) {
      return Optional.empty();
    }
    double previousFt = Units.toFeet(previous.baroAltitude());
    double currentFt = Units.toFeet(current.baroAltitude());
    double changeFt = currentFt - previousFt;
    double rateFpm = changeFt / minutes;
    if (rateFpm >= altitudeDropRateFpm) {
      return Optional.empty();
    }

    Map<String, Double> metrics = new LinkedHashMap<>();
    metrics.put("altitude_change_ft", changeFt);
    metrics.put("rate_of_change_fpm", rateFpm);
    return Optional.of(factory.create(
        current,
        AnomalyType.ALTITUDE_DROP,
        Severity.HIGH,
        new AnomalyDetails(
            String.format(Locale.ROOT, "Sudden altitude drop: %d ft in %.1f minutes", Math.round(changeFt), minutes),
            metrics,
            previousFt,
            currentFt)));
  }
}
