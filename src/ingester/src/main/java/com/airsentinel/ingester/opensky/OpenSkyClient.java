package com.airsentinel.ingester.opensky;

import com.airsentinel.ingester.fetch.FetchGate;
import com.airsentinel.ingester.fetch.ResponseCache;
import com.airsentinel.ingester.fetch.UpstreamRequest;
import com.airsentinel.ingester.geo.BoundingBox;
import com.airsentinel.ingester.geo.GeoCircle;
import com.airsentinel.ingester.geo.GeoUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Acquisition API over the OpenSky REST feed.
 *
 * <p>Area state reads are best-effort: a fresh cache entry is served without a call; when the feed
 * throttles, the stale entry (or an empty list) is returned; when it is unavailable, the stale
 * entry is returned and the failure only propagates if there is none. ICAO24, track and airport
 * lookups are precise and let unavailability propagate.
 */
@Component
public class OpenSkyClient {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyClient.class);

  private final FetchGate fetchGate;
  private final OpenSkyEndpointProvider endpoints;
  private final StateVectorParser parser;
  private final ObjectMapper objectMapper;
  private final ResponseCache<StatesSnapshot> statesCache;
  private final ResponseCache<FlightTrack> trackCache;
  private final MeterRegistry meterRegistry;

  public OpenSkyClient(
      FetchGate fetchGate,
      OpenSkyEndpointProvider endpoints,
      StateVectorParser parser,
      ObjectMapper objectMapper,
      ResponseCache<StatesSnapshot> statesCache,
      ResponseCache<FlightTrack> trackCache,
      MeterRegistry meterRegistry) {
    this.fetchGate = fetchGate;
    this.endpoints = endpoints;
    this.parser = parser;
    this.objectMapper = objectMapper;
    this.statesCache = statesCache;
    this.trackCache = trackCache;
    this.meterRegistry = meterRegistry;
  }

  public List<AircraftState> getAllStates() {
    return readStates(endpoints.allStates());
  }

  public List<AircraftState> getStatesInBoundingBox(BoundingBox box) {
    return readStates(endpoints.statesInBox(box));
  }

  /**
   * States within {@code circle}: each enclosing box is queried, then filtered by exact distance.
   * A circle crossing the antimeridian costs two upstream queries.
   */
  public List<AircraftState> getStatesInRadius(GeoCircle circle) {
    Map<String, AircraftState> merged = new LinkedHashMap<>();
    for (BoundingBox box : GeoUtils.enclosingBoxes(circle)) {
      for (AircraftState state : getStatesInBoundingBox(box)) {
        if (box.contains(state.latitude(), state.longitude())
            && GeoUtils.withinRadius(circle, state.latitude(), state.longitude())) {
          merged.putIfAbsent(state.icao24(), state);
        }
      }
    }
    return List.copyOf(merged.values());
  }

  /**
   * Current states of specific aircraft.
   *
   * <p>Unlike the area reads, this never substitutes stale or empty data for a failed call, so
   * an empty result means OpenSky answered and reports none of the aircraft.
   *
   * @throws ThrottledException when the feed throttles and nothing fresh is cached
   * @throws UpstreamUnavailableException when the feed cannot be reached
   */
  public List<AircraftState> getStatesByIcao24(Collection<String> icao24s) {
    UpstreamRequest request = endpoints.statesByIcao24(icao24s);
    Optional<ResponseCache.Lookup<StatesSnapshot>> cached = lookup(statesCache, request.key());
    if (cached.isPresent() && cached.get().fresh()) {
      return cached.get().data().states();
    }
    try {
      return fetchGate.fetch(request, this::parseStatesBody, statesCache).states();
    } catch (NotFoundException ex) {
      log.debug("OpenSky returned 404 for {}", request.key());
      return List.of();
    }
  }

  /**
   * Flight track for one aircraft.
   *
   * @param time any epoch second within the flight, or {@code null} for the live track
   * @return the track, or empty when OpenSky has none (404) or is throttling with nothing cached
   * @throws UpstreamUnavailableException when the feed cannot be reached
   */
  public Optional<FlightTrack> getTrack(String icao24, Long time) {
    UpstreamRequest request = endpoints.track(icao24, time);
    Optional<ResponseCache.Lookup<FlightTrack>> cached = lookup(trackCache, request.key());
    if (cached.isPresent() && cached.get().fresh()) {
      return Optional.of(cached.get().data());
    }
    try {
      return Optional.of(fetchGate.fetch(request, this::parseTrackBody, trackCache));
    } catch (NotFoundException ex) {
      log.debug("No track available for {}", request.key());
      return Optional.empty();
    } catch (ThrottledException ex) {
      Optional<FlightTrack> stale = trackCache.lookup(request.key()).map(ResponseCache.Lookup::data);
      log.warn("OpenSky throttled track lookup {} (stale available: {})", request.key(), stale.isPresent());
      return stale;
    }
  }

  public List<AirportFlight> getArrivals(String airportIcao, long begin, long end) {
    return readAirportFlights(endpoints.arrivals(airportIcao, begin, end));
  }

  public List<AirportFlight> getDepartures(String airportIcao, long begin, long end) {
    return readAirportFlights(endpoints.departures(airportIcao, begin, end));
  }

  private List<AircraftState> readStates(UpstreamRequest request) {
    Optional<ResponseCache.Lookup<StatesSnapshot>> cached = lookup(statesCache, request.key());
    if (cached.isPresent() && cached.get().fresh()) {
      return cached.get().data().states();
    }
    try {
      return fetchGate.fetch(request, this::parseStatesBody, statesCache).states();
    } catch (ThrottledException ex) {
      Optional<StatesSnapshot> stale = statesCache.lookup(request.key()).map(ResponseCache.Lookup::data);
      if (stale.isPresent()) {
        log.warn("OpenSky throttled {}, serving stale states", request.key());
        return stale.get().states();
      }
      log.warn("OpenSky throttled {} with nothing cached, returning no states", request.key());
      return List.of();
    } catch (UpstreamUnavailableException ex) {
      Optional<StatesSnapshot> stale = statesCache.lookup(request.key()).map(ResponseCache.Lookup::data);
      if (stale.isPresent()) {
        log.warn("OpenSky unavailable for {} ({}), serving stale states", request.key(), ex.getMessage());
        return stale.get().states();
      }
      throw ex;
    } catch (NotFoundException ex) {
      log.debug("OpenSky returned 404 for {}", request.key());
      return List.of();
    }
  }

  private List<AirportFlight> readAirportFlights(UpstreamRequest request) {
    try {
      return fetchGate.fetch(request, this::parseAirportFlightsBody, null);
    } catch (NotFoundException ex) {
      return List.of();
    } catch (ThrottledException ex) {
      log.warn("OpenSky throttled {}, returning no flights", request.key());
      return List.of();
    }
  }

  private StatesSnapshot parseStatesBody(HttpResponse<String> response) {
    return parser.parseStates(readBody(response));
  }

  private FlightTrack parseTrackBody(HttpResponse<String> response) {
    return parser.parseTrack(readBody(response));
  }

  private List<AirportFlight> parseAirportFlightsBody(HttpResponse<String> response) {
    JsonNode root = readBody(response);
    List<AirportFlight> flights = new ArrayList<>();
    for (JsonNode node : root) {
      try {
        flights.add(parser.parseAirportFlight(node));
      } catch (MalformedRecordException ex) {
        log.debug("Discarding malformed flight record: {}", ex.getMessage());
      }
    }
    return flights;
  }

  private JsonNode readBody(HttpResponse<String> response) {
    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException ex) {
      throw new UpstreamUnavailableException("OpenSky returned an unreadable body", ex);
    }
  }

  private <T> Optional<ResponseCache.Lookup<T>> lookup(ResponseCache<T> cache, String key) {
    Optional<ResponseCache.Lookup<T>> result = cache.lookup(key);
    String outcome = result.map(hit -> hit.fresh() ? "fresh" : "stale").orElse("miss");
    Counter.builder("ingester.cache.lookups.total")
        .description("Response cache lookups (by cache and outcome)")
        .tag("cache", cache.name())
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
    return result;
  }
}
