package com.airsentinel.ingester.opensky;

import java.util.List;

/**
 * Parsed result of one {@code /states/all} call.
 *
 * @param time upstream snapshot time (epoch seconds), {@code null} when absent
 * @param states parsed state vectors
 * @param discardedRecords rows that failed the positional schema and were skipped
 */
public record StatesSnapshot(Long time, List<AircraftState> states, int discardedRecords) {
  public StatesSnapshot {
    states = List.copyOf(states);
  }
}
