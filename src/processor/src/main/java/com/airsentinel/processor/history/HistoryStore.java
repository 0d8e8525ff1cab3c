package com.airsentinel.processor.history;

import com.airsentinel.ingester.opensky.AircraftState;
import com.airsentinel.processor.config.ProcessorProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per-aircraft window of recent observations, bounded by count and age.
 *
 * <p>Windows are immutable lists replaced through {@link ConcurrentMap#compute}, so a reader
 * always sees either the window before an insert or the fully trimmed window after it.
 */
@Component
public class HistoryStore {
  private final ConcurrentMap<String, List<HistoryEntry>> windows = new ConcurrentHashMap<>();
  private final int maxEntries;
  private final Duration maxAge;
  private final Clock clock;

  @Autowired
  public HistoryStore(ProcessorProperties properties, Clock clock, MeterRegistry meterRegistry) {
    this(Math.max(1, properties.getHistory().getMaxEntries()),
        Duration.ofSeconds(properties.getHistory().getMaxAgeSeconds()),
        clock);
    Gauge.builder("processor.history.aircraft", windows, ConcurrentMap::size)
        .description("Aircraft with a live history window")
        .register(meterRegistry);
  }

  private HistoryStore(int maxEntries, Duration maxAge, Clock clock) {
    this.maxEntries = maxEntries;
    this.maxAge = maxAge;
    this.clock = clock;
  }

  /**
   * Empty store with the same retention limits, not registered with any meter registry.
   * Windows recorded into it never reach this store.
   */
  public HistoryStore detached() {
    return new HistoryStore(maxEntries, maxAge, clock);
  }

  /** Appends {@code state} to its aircraft's window and trims it. */
  public void record(AircraftState state) {
    recordAndWindow(state);
  }

  /**
   * Appends {@code state} and returns the resulting window in one atomic step.
   *
   * @return the trimmed window, most recent last
   */
  public List<HistoryEntry> recordAndWindow(AircraftState state) {
    Instant now = clock.instant();
    Instant cutoff = now.minus(maxAge);
    return windows.compute(state.icao24(), (icao24, existing) -> {
      List<HistoryEntry> next = new ArrayList<>(existing == null ? 1 : existing.size() + 1);
      if (existing != null) {
        for (HistoryEntry entry : existing) {
          if (entry.ingestedAt().isAfter(cutoff)) {
            next.add(entry);
          }
        }
      }
      next.add(new HistoryEntry(state, now));
      if (next.size() > maxEntries) {
        next = next.subList(next.size() - maxEntries, next.size());
      }
      return List.copyOf(next);
    });
  }

  /**
   * Current window for an aircraft.
   *
   * @return most recent last; empty when the aircraft has not been seen
   */
  public List<HistoryEntry> window(String icao24) {
    if (icao24 == null) {
      return List.of();
    }
    return windows.getOrDefault(icao24, List.of());
  }

  public int trackedAircraft() {
    return windows.size();
  }

  public void reset() {
    windows.clear();
  }
}
