package com.airsentinel.processor.detection;

import com.airsentinel.ingester.opensky.AircraftState;
import com.airsentinel.ingester.opensky.FlightTrack;
import com.airsentinel.ingester.opensky.TrackPoint;
import com.airsentinel.processor.history.HistoryEntry;
import com.airsentinel.processor.history.HistoryStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records observations into the history store and runs the detector pipeline over them.
 *
 * <p>Aircraft without a position fix are skipped entirely. A detector that throws is logged and
 * counted; the remaining detectors still run for that aircraft.
 */
@Service
public class AnomalyDetectionService {
  private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);
  private static final Comparator<Anomaly> BY_SEVERITY = Comparator.comparing(Anomaly::severity);

  private final HistoryStore historyStore;
  private final AnomalyPipeline pipeline;
  private final MeterRegistry meterRegistry;
  private final ConcurrentHashMap<String, Counter> detectedCounters = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

  public AnomalyDetectionService(HistoryStore historyStore, AnomalyPipeline pipeline, MeterRegistry meterRegistry) {
    this.historyStore = historyStore;
    this.pipeline = pipeline;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Evaluates one aircraft.
   *
   * @return anomalies in pipeline order; empty when the state has no position
   */
  public List<Anomaly> detect(AircraftState state) {
    return evaluate(state, historyStore);
  }

  private List<Anomaly> evaluate(AircraftState state, HistoryStore store) {
    if (state == null || !state.hasPosition()) {
      return List.of();
    }
    List<HistoryEntry> window = store.recordAndWindow(state);

    List<Anomaly> anomalies = new ArrayList<>();
    for (AnomalyDetector detector : pipeline.detectors()) {
      try {
        Optional<Anomaly> anomaly = detector.detect(state, window);
        anomaly.ifPresent(found -> {
          anomalies.add(found);
          countDetected(found);
        });
      } catch (RuntimeException ex) {
        errorCounter(detector.name()).increment();
        log.warn("Detector {} failed for {}", detector.name(), state.icao24(), ex);
      }
    }
    return anomalies;
  }

  /**
   * Evaluates every aircraft and orders the result critical first, keeping insertion order within
   * a severity.
   */
  public List<Anomaly> detectBatch(List<AircraftState> states) {
    List<Anomaly> anomalies = new ArrayList<>();
    for (AircraftState state : states) {
      anomalies.addAll(detect(state));
    }
    anomalies.sort(BY_SEVERITY);
    return anomalies;
  }

  /**
   * Replays a historical track through the pipeline, one synthetic state per positioned point.
   *
   * <p>Track points carry no speed, vertical rate or squawk, so only the history-based rules can
   * fire. The replay builds its own window and leaves the live history untouched, so replaying the
   * same track twice gives the same result.
   */
  public List<Anomaly> detectOnTrack(FlightTrack track) {
    HistoryStore replay = historyStore.detached();
    List<Anomaly> anomalies = new ArrayList<>();
    for (TrackPoint point : track.path()) {
      if (point.latitude() == null || point.longitude() == null) {
        continue;
      }
      anomalies.addAll(evaluate(toState(track, point), replay));
    }
    return anomalies;
  }

  public AnomalyStats stats(List<Anomaly> anomalies) {
    return AnomalyStats.of(anomalies);
  }

  static AircraftState toState(FlightTrack track, TrackPoint point) {
    return new AircraftState(
        track.icao24(),
        track.callsign(),
        null,
        point.time(),
        point.time(),
        point.longitude(),
        point.latitude(),
        point.baroAltitude(),
        point.onGround(),
        null,
        point.trueTrack(),
        null,
        null,
        null,
        false,
        0,
        null);
  }

  private void countDetected(Anomaly anomaly) {
    String key = anomaly.type().wireName() + ":" + anomaly.severity().wireName();
    detectedCounters.computeIfAbsent(key, ignored -> Counter.builder("processor.anomalies.detected.total")
        .description("Anomalies emitted by the detector pipeline")
        .tag("type", anomaly.type().wireName())
        .tag("severity", anomaly.severity().wireName())
        .register(meterRegistry)).increment();
  }

  private Counter errorCounter(String detector) {
    return errorCounters.computeIfAbsent(detector, name -> Counter.builder("processor.detector.errors.total")
        .description("Detector evaluations that threw")
        .tag("detector", name)
        .register(meterRegistry));
  }
}
