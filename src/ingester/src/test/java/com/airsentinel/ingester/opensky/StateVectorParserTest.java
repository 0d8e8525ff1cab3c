package com.airsentinel.ingester.opensky;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.airsentinel.ingester.TestFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class StateVectorParserTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final StateVectorParser parser = new StateVectorParser(meterRegistry);

  @Test
  void parsesAllEighteenPositionalFields() throws Exception {
    JsonNode row = objectMapper.readTree(
        "[\"ABC123\", \"AFR123  \", \"France\", 1700000001, 1700000002, 2.3522, 48.8566, 11000.0, false,"
            + " 230.5, 180.0, -1.5, [1, 2], 11300.0, \"7700\", true, 1, 3]");

    AircraftState state = parser.parse(row);

    assertThat(state.icao24()).isEqualTo("abc123");
    assertThat(state.callsign()).isEqualTo("AFR123");
    assertThat(state.originCountry()).isEqualTo("France");
    assertThat(state.timePosition()).isEqualTo(1700000001L);
    assertThat(state.lastContact()).isEqualTo(1700000002L);
    assertThat(state.longitude()).isEqualTo(2.3522);
    assertThat(state.latitude()).isEqualTo(48.8566);
    assertThat(state.baroAltitude()).isEqualTo(11000.0);
    assertThat(state.onGround()).isFalse();
    assertThat(state.velocity()).isEqualTo(230.5);
    assertThat(state.trueTrack()).isEqualTo(180.0);
    assertThat(state.verticalRate()).isEqualTo(-1.5);
    assertThat(state.geoAltitude()).isEqualTo(11300.0);
    assertThat(state.squawk()).isEqualTo("7700");
    assertThat(state.spi()).isTrue();
    assertThat(state.positionSource()).isEqualTo(1);
    assertThat(state.category()).isEqualTo(3);
  }

  @Test
  void keepsUnknownValuesAsNullAndBlankCallsignAsNull() throws Exception {
    JsonNode row = objectMapper.readTree(
        "[\"abc123\", \"   \", \"France\", null, 1700000002, null, null, null, true,"
            + " null, null, null, null, null, null, false, 0, null]");

    AircraftState state = parser.parse(row);

    assertThat(state.callsign()).isNull();
    assertThat(state.timePosition()).isNull();
    assertThat(state.hasPosition()).isFalse();
    assertThat(state.velocity()).isNull();
    assertThat(state.category()).isNull();
  }

  @Test
  void rejectsWrongFieldCount() throws Exception {
    JsonNode row = objectMapper.readTree(
        "[\"abc123\", \"AFR123\", \"France\", 1, 2, 2.0, 48.0, 1000.0, false, 200.0, 90.0, 0.0, null,"
            + " 1100.0, null, false, 0]");

    assertThatThrownBy(() -> parser.parse(row))
        .isInstanceOf(MalformedRecordException.class)
        .hasMessageContaining("17 fields");
  }

  @Test
  void rejectsTypeMismatchInsteadOfCoercing() throws Exception {
    JsonNode row = objectMapper.readTree(
        "[\"abc123\", \"AFR123\", \"France\", 1, 2, 2.0, \"48.0\", 1000.0, false, 200.0, 90.0, 0.0, null,"
            + " 1100.0, null, false, 0, 1]");

    assertThatThrownBy(() -> parser.parse(row))
        .isInstanceOf(MalformedRecordException.class)
        .hasMessageContaining("field 6");
  }

  @Test
  void parseStatesSkipsAndCountsMalformedRows() throws Exception {
    JsonNode root = objectMapper.readTree(TestFixtures.statesBody(
        TestFixtures.stateRow("aaa111", 48.0, 2.0),
        "[\"broken\", null]",
        TestFixtures.stateRow("bbb222", 49.0, 3.0)));

    StatesSnapshot snapshot = parser.parseStates(root);

    assertThat(snapshot.time()).isEqualTo(1700000005L);
    assertThat(snapshot.states()).extracting(AircraftState::icao24).containsExactly("aaa111", "bbb222");
    assertThat(snapshot.discardedRecords()).isEqualTo(1);
    assertThat(meterRegistry.get("ingester.opensky.states.malformed.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void parseStatesTreatsNullStatesAsEmpty() throws Exception {
    StatesSnapshot snapshot = parser.parseStates(objectMapper.readTree("{\"time\": 1, \"states\": null}"));

    assertThat(snapshot.states()).isEmpty();
    assertThat(snapshot.discardedRecords()).isZero();
  }

  @Test
  void parseTrackReadsPathTuples() throws Exception {
    JsonNode root = objectMapper.readTree(
        "{\"icao24\": \"ABC123\", \"callsign\": \"AFR123 \", \"startTime\": 100, \"endTime\": 200,"
            + " \"path\": [[100, 48.0, 2.0, 1000.0, 90.0, false], [150, null, null, null, null, false], [1, 2]]}");

    FlightTrack track = parser.parseTrack(root);

    assertThat(track.icao24()).isEqualTo("abc123");
    assertThat(track.callsign()).isEqualTo("AFR123");
    assertThat(track.path()).hasSize(2);
    assertThat(track.path().get(0).baroAltitude()).isEqualTo(1000.0);
    assertThat(track.path().get(1).latitude()).isNull();
  }
}
