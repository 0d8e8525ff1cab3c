package com.airsentinel.processor.detection;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of anomalies by severity and by type.
 *
 * <p>{@code bySeverity} always carries all four severities; {@code byType} only the types seen.
 */
public record AnomalyStats(int total, Map<Severity, Long> bySeverity, Map<AnomalyType, Long> byType) {

  public AnomalyStats {
    bySeverity = Collections.unmodifiableMap(new EnumMap<>(bySeverity));
    byType = byType.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(byType));
  }

  public static AnomalyStats of(Collection<Anomaly> anomalies) {
    Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
    for (Severity severity : Severity.values()) {
      bySeverity.put(severity, 0L);
    }
    Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
    for (Anomaly anomaly : anomalies) {
      bySeverity.merge(anomaly.severity(), 1L, Long::sum);
      byType.merge(anomaly.type(), 1L, Long::sum);
    }
    return new AnomalyStats(anomalies.size(), bySeverity, byType);
  }

  public long count(Severity severity) {
    return bySeverity.getOrDefault(severity, 0L);
  }

  public long count(AnomalyType type) {
    return byType.getOrDefault(type, 0L);
  }
}
