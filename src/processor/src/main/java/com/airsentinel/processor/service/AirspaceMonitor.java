package com.airsentinel.processor.service;

import com.airsentinel.ingester.geo.BoundingBox;
import com.airsentinel.ingester.geo.GeoCircle;
import com.airsentinel.ingester.opensky.AircraftState;
import com.airsentinel.ingester.opensky.NotFoundException;
import com.airsentinel.ingester.opensky.OpenSkyClient;
import com.airsentinel.ingester.opensky.ThrottledException;
import com.airsentinel.ingester.opensky.UpstreamUnavailableException;
import com.airsentinel.processor.aircraft.AircraftEnricher;
import com.airsentinel.processor.detection.Anomaly;
import com.airsentinel.processor.detection.AnomalyDetectionService;
import com.airsentinel.processor.detection.AnomalyRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers that want acquisition and detection in one step.
 *
 * <p>Every scan records its anomalies in the {@link AnomalyRegistry}; track replays do not, since
 * they describe past flights.
 */
@Service
public class AirspaceMonitor {
  private static final Logger log = LoggerFactory.getLogger(AirspaceMonitor.class);

  private final OpenSkyClient openSkyClient;
  private final AnomalyDetectionService detectionService;
  private final AnomalyRegistry registry;
  private final AircraftEnricher enricher;
  private final Clock clock;

  public AirspaceMonitor(
      OpenSkyClient openSkyClient,
      AnomalyDetectionService detectionService,
      AnomalyRegistry registry,
      AircraftEnricher enricher,
      Clock clock) {
    this.openSkyClient = openSkyClient;
    this.detectionService = detectionService;
    this.registry = registry;
    this.enricher = enricher;
    this.clock = clock;
  }

  /**
   * Scans all current states.
   *
   * @param limit maximum aircraft to evaluate, in feed order; non-positive means all
   */
  public AirspaceScan scanAll(int limit) {
    List<AircraftState> states = openSkyClient.getAllStates();
    if (limit > 0 && states.size() > limit) {
      states = states.subList(0, limit);
    }
    return scan(states);
  }

  public AirspaceScan scanBoundingBox(BoundingBox box) {
    return scan(openSkyClient.getStatesInBoundingBox(box));
  }

  public AirspaceScan scanRadius(GeoCircle circle) {
    return scan(openSkyClient.getStatesInRadius(circle));
  }

  /**
   * Current state and anomalies for one aircraft.
   *
   * @throws NotFoundException when the feed answers without a state for {@code icao24}
   * @throws ThrottledException when the feed throttles and nothing fresh is cached
   * @throws UpstreamUnavailableException when the feed cannot be reached
   */
  public AircraftReport lookupAircraft(String icao24) {
    List<AircraftState> states = openSkyClient.getStatesByIcao24(List.of(icao24));
    if (states.isEmpty()) {
      throw new NotFoundException("Aircraft " + icao24 + " not found");
    }
    AircraftState state = states.get(0);
    List<Anomaly> anomalies = detectionService.detect(state);
    registry.record(anomalies);
    return new AircraftReport(enricher.enrich(state), anomalies);
  }

  /**
   * Replays the aircraft's track through the detectors.
   *
   * @param time any epoch second within the flight, or {@code null} for the live track
   * @return empty when no track is available
   */
  public Optional<TrackAnalysis> analyzeTrack(String icao24, Long time) {
    return openSkyClient.getTrack(icao24, time).map(track -> {
      List<Anomaly> anomalies = detectionService.detectOnTrack(track);
      return new TrackAnalysis(track, anomalies, detectionService.stats(anomalies));
    });
  }

  private AirspaceScan scan(List<AircraftState> states) {
    List<Anomaly> anomalies = detectionService.detectBatch(states);
    registry.record(anomalies);
    if (!anomalies.isEmpty()) {
      log.info("Scanned {} aircraft, {} anomalies", states.size(), anomalies.size());
    } else {
      log.debug("Scanned {} aircraft, no anomalies", states.size());
    }
    return new AirspaceScan(
        clock.instant(), enricher.enrichAll(states), anomalies, detectionService.stats(anomalies));
  }
}
