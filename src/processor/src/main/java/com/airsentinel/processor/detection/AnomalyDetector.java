package com.airsentinel.processor.detection;

import com.airsentinel.ingester.opensky.AircraftState;
import com.airsentinel.processor.history.HistoryEntry;
import java.util.List;
import java.util.Optional;

/**
 * One detection rule.
 *
 * <p>Implementations treat missing optional fields as "no anomaly" rather than failing.
 */
public interface AnomalyDetector {
  /** Short stable name used in logs and metric tags. */
  String name();

  /**
   * Evaluates the rule.
   *
   * @param current the state being evaluated
   * @param history the aircraft's window, most recent last, already including {@code current}
   * @return at most one anomaly
   */
  Optional<Anomaly> detect(AircraftState current, List<HistoryEntry> history);
}
