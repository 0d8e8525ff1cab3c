package com.airsentinel.processor.detection;

import com.airsentinel.ingester.opensky.AircraftState;
import com.airsentinel.processor.history.HistoryEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags the reserved emergency transponder codes. Always critical; needs no history or fix.
 */
public class EmergencySquawkDetector implements AnomalyDetector {
  static final Map<String, String> EMERGENCY_SQUAWKS = Map.of(
      "7500", "Hijacking",
      "7600", "Radio Failure",
      "7700", "General Emergency");

  private final AnomalyFactory factory;

  public EmergencySquawkDetector(AnomalyFactory factory) {
    this.factory = factory;
  }

  @Override
  public String name() {
    return "emergency_squawk";
  }

  @Override
  public Optional<Anomaly> detect(AircraftState current, List<HistoryEntry> history) {
    String squawk = current.squawk() == null ? null : current.squawk().trim();
    if (squawk == null || !EMERGENCY_SQUAWKS.containsKey(squawk)) {
      return Optional.empty();
    }
    Map<String, Double> metrics = new LinkedHashMap<>();
    metrics.put("squawk_code", Double.parseDouble(squawk));
    return Optional.of(factory.create(
        current,
        AnomalyType.EMERGENCY_SQUAWK,
        Severity.CRITICAL,
        AnomalyDetails.of("Emergency squawk " + squawk + ": " + EMERGENCY_SQUAWKS.get(squawk), metrics)));
  }
}
