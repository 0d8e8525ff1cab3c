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
 * Accumulates signed heading changes over the trailing window and flags repeated full orbits.
 */
public class HoldingPatternDetector implements AnomalyDetector {
  private final AnomalyFactory factory;
  private final int minSamples;
  private final int window;
  private final double orbitsThreshold;
  private final double turnDegrees;

  public HoldingPatternDetector(AnomalyFactory factory, ProcessorProperties.Detection thresholds) {
    this.factory = factory;
    this.minSamples = thresholds.getHoldingMinSamples();
    this.window = thresholds.getHoldingWindow();
    this.orbitsThreshold = thresholds.getHoldingOrbits();
    this.turnDegrees = thresholds.getHoldingTurnDegrees();
  }

  @Override
  public String name() {
    return "holding_pattern";
  }

  @Override
  public Optional<Anomaly> detect(AircraftState current, List<HistoryEntry> history) {
    if (current.onGround() || history.size() < minSamples) {
      return Optional.empty();
    }

    List<HistoryEntry> recent = history.subList(Math.max(0, history.size() - window), history.size());
    double totalChange = 0;
    int turnCount = 0;
    Double lastHeading = recent.get(0).state().trueTrack();
    for (int i = 1; i < recent.size(); i++) {
      Double heading = recent.get(i).state().trueTrack();
      if (lastHeading != null && heading != null) {
        double delta = normalizeDelta(heading - lastHeading);
        totalChange += delta;
        if (Math.abs(delta) > turnDegrees) {
          turnCount++;
        }
      }
      lastHeading = heading;
    }

    double orbits = Math.abs(totalChange) / 360.0;
    if (orbits < orbitsThreshold) {
      return Optional.empty();
    }

    Map<String, Double> metrics = new LinkedHashMap<>();
    metrics.put("orbits_detected", orbits);
    metrics.put("turn_count", (double) turnCount);
    metrics.put("total_heading_change", totalChange);
    return Optional.of(factory.create(
        current,
        AnomalyType.HOLDING_PATTERN,
        Severity.MEDIUM,
        AnomalyDetails.of(
            String.format(Locale.ROOT, "Aircraft appears to be in holding pattern (%.1f orbits detected)", orbits),
            metrics)));
  }

  /** Maps a heading difference into (-180, 180]. */
  static double normalizeDelta(double delta) {
    double normalized = delta % 360.0;
    if (normalized > 180.0) {
      normalized -= 360.0;
    } else if (normalized <= -180.0) {
      normalized += 360.0;
    }
    return normalized;
  }
}
