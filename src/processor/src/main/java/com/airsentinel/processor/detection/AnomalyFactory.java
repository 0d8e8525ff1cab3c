package com.airsentinel.processor.detection;

import com.airsentinel.ingester.geo.GeoPoint;
import com.airsentinel.ingester.opensky.AircraftState;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stamps anomalies with an id, detection time and position snapshot.
 *
 * <p>Ids look like {@code ANO-<epochMillis>-<9 base-36 chars>}.
 */
public class AnomalyFactory {
  private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
  private static final int SUFFIX_LENGTH = 9;

  private final Clock clock;

  public AnomalyFactory(Clock clock) {
    this.clock = clock;
  }

  public Anomaly create(AircraftState state, AnomalyType type, Severity severity, AnomalyDetails details) {
    Instant now = clock.instant();
    GeoPoint location = state.hasPosition() ? new GeoPoint(state.latitude(), state.longitude()) : null;
    return new Anomaly(
        nextId(now.toEpochMilli()),
        state.icao24(),
        state.callsign(),
        type,
        severity,
        now.toString(),
        location,
        details,
        null);
  }

  private static String nextId(long epochMillis) {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    StringBuilder id = new StringBuilder("ANO-").append(epochMillis).append('-');
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return id.toString();
  }
}
