package com.airsentinel.processor.history;

import com.airsentinel.ingester.opensky.AircraftState;
import java.time.Instant;

/**
 * A state observation tagged with the time it was recorded.
 */
public record HistoryEntry(AircraftState state, Instant ingestedAt) {}
