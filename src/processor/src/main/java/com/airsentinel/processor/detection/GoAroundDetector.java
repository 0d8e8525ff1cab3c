package com.airsentinel.processor.detection;

import com.airsentinel.ingester.opensky.AircraftState;
import com.airsentinel.processor.config.ProcessorProperties;
import com.airsentinel.processor.history.HistoryEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Descent, then a low point under the approach altitude, then a climb, all inside the trailing
 * window, with the aircraft currently climbing. Recomputed from the window on every call.
 */
public class GoAroundDetector implements AnomalyDetector {
  private final AnomalyFactory factory;
  private final int minSamples;
  private final int window;
  private final double lowAltitudeFt;
  private final double minClimbRateMs;

  public GoAroundDetector(AnomalyFactory factory, ProcessorProperties.Detection thresholds) {
    this.factory = factory;
    this.minSamples = thresholds.getGoAroundMinSamples();
    this.window = thresholds.getGoAroundWindow();
    this.lowAltitudeFt = thresholds.getGoAroundLowAltitudeFt();
    this.minClimbRateMs = thresholds.getGoAroundMinClimbRateMs();
  }

  @Override
  public String name() {
    return "go_around";
  }

  @Override
  public Optional<Anomaly> detect(AircraftState current, List<HistoryEntry> history) {
    if (history.size() < minSamples) {
      return Optional.empty();
    }
    if (current.verticalRate() == null || current.verticalRate() <= minClimbRateMs) {
      return Optional.empty();
    }

    List<HistoryEntry> recent = history.subList(Math.max(0, history.size() - window), history.size());
    boolean descending = false;
    boolean reachedLow = false;
    boolean climbedAfterLow = false;
    double lowestFt = Double.POSITIVE_INFINITY;

    for (int i = 1; i < recent.size(); i++) {
      Double prev = recent.get(i - 1).state().baroAltitude();
      Double curr = recent.get(i).state().baroAltitude();
      if (prev == null || curr == null) {
        continue;
      }
      double currFt = Units.toFeet(curr);
      lowestFt = Math.min(lowestFt, currFt);
      if (curr < prev) {
        descending = true;
      }
      if (descending && currFt < lowAltitudeFt) {
        reachedLow = true;
      }
      if (reachedLow && curr > prev) {
        climbedAfterLow = true;
      }
    }

    if (!(descending && reachedLow && climbedAfterLow)) {
      return Optional.empty();
    }

    Map<String, Double> metrics = new LinkedHashMap<>();
    metrics.put("lowest_altitude_ft", lowestFt);
    metrics.put("current_vertical_rate_fpm", Units.toFeetPerMinute(current.verticalRate()));
    return Optional.of(factory.create(
        current,
        AnomalyType.GO_AROUND,
        Severity.MEDIUM,
        AnomalyDetails.of("Possible go-around detected. Lowest altitude: " + Math.round(lowestFt) + " ft", metrics)));
  }
}
