package com.airsentinel.ingester.opensky;

import java.util.List;

/**
 * Historical trajectory returned by {@code /tracks/all}.
 *
 * @param icao24 aircraft identifier
 * @param callsign callsign at track time, may be {@code null}
 * @param startTime first point time (epoch seconds)
 * @param endTime last point time (epoch seconds)
 * @param path ordered waypoints
 */
public record FlightTrack(
    String icao24,
    String callsign,
    long startTime,
    long endTime,
    List<TrackPoint> path) {
  public FlightTrack {
    path = List.copyOf(path);
  }
}
