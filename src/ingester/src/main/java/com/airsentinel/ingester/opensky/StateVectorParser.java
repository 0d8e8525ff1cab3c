package com.airsentinel.ingester.opensky;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps OpenSky positional arrays to typed records.
 *
 * <p>State rows (requested with {@code extended=1}) have 18 fixed positions:
 * <pre>
 *  0 icao24          6 latitude         12 sensors (ignored)
 *  1 callsign        7 baro_altitude    13 geo_altitude
 *  2 origin_country  8 on_ground        14 squawk
 *  3 time_position   9 velocity         15 spi
 *  4 last_contact   10 true_track       16 position_source
 *  5 longitude      11 vertical_rate    17 category
 * </pre>
 * Units are left as delivered (meters, m/s, degrees).
 */
@Component
public class StateVectorParser {
  private static final Logger log = LoggerFactory.getLogger(StateVectorParser.class);
  static final int STATE_FIELD_COUNT = 18;
  static final int TRACK_POINT_FIELD_COUNT = 6;

  private final Counter malformedCounter;

  public StateVectorParser(MeterRegistry meterRegistry) {
    this.malformedCounter = Counter.builder("ingester.opensky.states.malformed.total")
        .description("State rows discarded because they did not match the positional schema")
        .register(meterRegistry);
  }

  /**
   * Parses one positional state row.
   *
   * @param row JSON array from the {@code states} field
   * @return the parsed state
   * @throws MalformedRecordException when the field count or a field type does not match
   */
  public AircraftState parse(JsonNode row) {
    if (row == null || !row.isArray()) {
      throw new MalformedRecordException("state row is not an array");
    }
    if (row.size() != STATE_FIELD_COUNT) {
      throw new MalformedRecordException(
          "state row has " + row.size() + " fields, expected " + STATE_FIELD_COUNT);
    }
    String icao24 = requiredText(row, 0);
    if (icao24.isBlank()) {
      throw new MalformedRecordException("state row has a blank icao24");
    }
    optionalArray(row, 12);

    return new AircraftState(
        icao24.trim().toLowerCase(),
        callsign(row, 1),
        optionalText(row, 2),
        optionalLong(row, 3),
        requiredLong(row, 4),
        optionalNumber(row, 5),
        optionalNumber(row, 6),
        optionalNumber(row, 7),
        requiredBool(row, 8),
        optionalNumber(row, 9),
        optionalNumber(row, 10),
        optionalNumber(row, 11),
        optionalNumber(row, 13),
        optionalText(row, 14),
        requiredBool(row, 15),
        (int) requiredLong(row, 16),
        optionalInt(row, 17));
  }

  /**
   * Parses a full {@code /states/all} body, skipping rows that fail {@link #parse(JsonNode)}.
   *
   * @param root response root
   * @return snapshot with the discard count
   */
  public StatesSnapshot parseStates(JsonNode root) {
    Long time = root.path("time").isNumber() ? root.path("time").asLong() : null;
    JsonNode states = root.path("states");
    if (!states.isArray()) {
      // OpenSky answers "states": null when nothing matches.
      return new StatesSnapshot(time, List.of(), 0);
    }

    List<AircraftState> results = new ArrayList<>(states.size());
    int discarded = 0;
    for (JsonNode row : states) {
      try {
        results.add(parse(row));
      } catch (MalformedRecordException ex) {
        discarded++;
        malformedCounter.increment();
        log.debug("Discarding malformed state row: {}", ex.getMessage());
      }
    }
    if (discarded > 0) {
      log.warn("Discarded {} malformed state rows out of {}", discarded, states.size());
    }
    return new StatesSnapshot(time, results, discarded);
  }

  /**
   * Parses a {@code /tracks/all} body.
   *
   * @param root response root
   * @return the track; malformed path tuples are skipped
   */
  public FlightTrack parseTrack(JsonNode root) {
    String icao24 = root.path("icao24").asText(null);
    if (icao24 == null || icao24.isBlank()) {
      throw new MalformedRecordException("track has no icao24");
    }
    List<TrackPoint> path = new ArrayList<>();
    int discarded = 0;
    for (JsonNode point : root.path("path")) {
      try {
        path.add(parseTrackPoint(point));
      } catch (MalformedRecordException ex) {
        discarded++;
        log.debug("Discarding malformed track point for {}: {}", icao24, ex.getMessage());
      }
    }
    if (discarded > 0) {
      log.warn("Discarded {} malformed track points for {}", discarded, icao24);
    }
    return new FlightTrack(
        icao24.trim().toLowerCase(),
        callsign(root.get("callsign")),
        root.path("startTime").asLong(),
        root.path("endTime").asLong(),
        path);
  }

  /**
   * Parses one {@code [time, lat, lon, baro_altitude, true_track, on_ground]} tuple.
   */
  public TrackPoint parseTrackPoint(JsonNode point) {
    if (point == null || !point.isArray() || point.size() != TRACK_POINT_FIELD_COUNT) {
      throw new MalformedRecordException("track point must be an array of " + TRACK_POINT_FIELD_COUNT);
    }
    return new TrackPoint(
        requiredLong(point, 0),
        optionalNumber(point, 1),
        optionalNumber(point, 2),
        optionalNumber(point, 3),
        optionalNumber(point, 4),
        requiredBool(point, 5));
  }

  /**
   * Parses one element of {@code /flights/arrival} or {@code /flights/departure}.
   */
  public AirportFlight parseAirportFlight(JsonNode node) {
    String icao24 = node.path("icao24").asText(null);
    if (icao24 == null || icao24.isBlank()) {
      throw new MalformedRecordException("flight has no icao24");
    }
    return new AirportFlight(
        icao24.trim().toLowerCase(),
        callsign(node.get("callsign")),
        node.path("firstSeen").isNumber() ? node.path("firstSeen").asLong() : null,
        node.path("lastSeen").isNumber() ? node.path("lastSeen").asLong() : null,
        textOrNull(node.get("estDepartureAirport")),
        textOrNull(node.get("estArrivalAirport")));
  }

  private String callsign(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    if (node != null && !node.isNull() && !node.isTextual()) {
      throw mismatch(idx, "string");
    }
    return callsign(node);
  }

  private String callsign(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    String trimmed = node.asText().trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private String textOrNull(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText().trim();
  }

  private String requiredText(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    if (node == null || !node.isTextual()) {
      throw mismatch(idx, "string");
    }
    return node.asText();
  }

  private String optionalText(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isTextual()) {
      throw mismatch(idx, "string");
    }
    return node.asText();
  }

  private Double optionalNumber(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isNumber()) {
      throw mismatch(idx, "number");
    }
    return node.asDouble();
  }

  private Long optionalLong(JsonNode row, int idx) {
    Double value = optionalNumber(row, idx);
    return value == null ? null : value.longValue();
  }

  private Integer optionalInt(JsonNode row, int idx) {
    Double value = optionalNumber(row, idx);
    return value == null ? null : value.intValue();
  }

  private long requiredLong(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    if (node == null || !node.isNumber()) {
      throw mismatch(idx, "number");
    }
    return node.asLong();
  }

  private boolean requiredBool(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    if (node == null || !node.isBoolean()) {
      throw mismatch(idx, "boolean");
    }
    return node.asBoolean();
  }

  private void optionalArray(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    if (node != null && !node.isNull() && !node.isArray()) {
      throw mismatch(idx, "array");
    }
  }

  private MalformedRecordException mismatch(int idx, String expected) {
    return new MalformedRecordException("field " + idx + " is not a " + expected);
  }
}
