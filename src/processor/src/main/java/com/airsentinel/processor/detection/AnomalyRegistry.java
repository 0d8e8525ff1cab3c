package com.airsentinel.processor.detection;

import com.airsentinel.processor.config.ProcessorProperties;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Bounded, newest-first store of recently detected anomalies.
 */
@Component
public class AnomalyRegistry {
  private final Deque<Anomaly> anomalies = new ArrayDeque<>();
  private final int maxAnomalies;

  public AnomalyRegistry(ProcessorProperties properties) {
    this.maxAnomalies = Math.max(1, properties.getRegistry().getMaxAnomalies());
  }

  /** Adds anomalies as the newest entries, evicting the oldest beyond capacity. */
  public synchronized void record(Collection<Anomaly> detected) {
    for (Anomaly anomaly : detected) {
      anomalies.addFirst(anomaly);
    }
    while (anomalies.size() > maxAnomalies) {
      anomalies.removeLast();
    }
  }

  /**
   * Newest-first anomalies matching the optional filters.
   *
   * @param severity filter, or {@code null} for any
   * @param type filter, or {@code null} for any
   * @param limit maximum results; non-positive means no limit
   */
  public synchronized List<Anomaly> recent(Severity severity, AnomalyType type, int limit) {
    List<Anomaly> result = new ArrayList<>();
    for (Anomaly anomaly : anomalies) {
      if (limit > 0 && result.size() >= limit) {
        break;
      }
      if (severity != null && anomaly.severity() != severity) {
        continue;
      }
      if (type != null && anomaly.type() != type) {
        continue;
      }
      result.add(anomaly);
    }
    return result;
  }

  public synchronized Optional<Anomaly> findById(String id) {
    return anomalies.stream().filter(anomaly -> anomaly.id().equals(id)).findFirst();
  }

  /**
   * Replaces the stored anomaly with a copy carrying {@code analysis}, keeping its position.
   *
   * @return the updated anomaly, or empty when the id is unknown
   */
  public synchronized Optional<Anomaly> attachAnalysis(String id, String analysis) {
    List<Anomaly> rebuilt = new ArrayList<>(anomalies.size());
    Anomaly updated = null;
    Iterator<Anomaly> iterator = anomalies.iterator();
    while (iterator.hasNext()) {
      Anomaly anomaly = iterator.next();
      if (updated == null && anomaly.id().equals(id)) {
        anomaly = anomaly.withAiAnalysis(analysis);
        updated = anomaly;
      }
      rebuilt.add(anomaly);
    }
    if (updated == null) {
      return Optional.empty();
    }
    anomalies.clear();
    anomalies.addAll(rebuilt);
    return Optional.of(updated);
  }

  public synchronized AnomalyStats stats() {
    return AnomalyStats.of(anomalies);
  }

  public synchronized int size() {
    return anomalies.size();
  }

  public synchronized void clear() {
    anomalies.clear();
  }
}
