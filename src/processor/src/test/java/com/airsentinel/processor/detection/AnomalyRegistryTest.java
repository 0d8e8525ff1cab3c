package com.airsentinel.processor.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.airsentinel.processor.config.ProcessorProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnomalyRegistryTest {
  private AnomalyRegistry registry;

  @BeforeEach
  void setUp() {
    ProcessorProperties properties = new ProcessorProperties();
    properties.getRegistry().setMaxAnomalies(3);
    registry = new AnomalyRegistry(properties);
  }

  @Test
  void keepsNewestFirstAndEvictsOldest() {
    registry.record(List.of(anomaly("a1", Severity.LOW, AnomalyType.UNUSUAL_SPEED)));
    registry.record(List.of(
        anomaly("a2", Severity.CRITICAL, AnomalyType.EMERGENCY_SQUAWK),
        anomaly("a3", Severity.HIGH, AnomalyType.RAPID_DESCENT),
        anomaly("a4", Severity.MEDIUM, AnomalyType.GO_AROUND)));

    assertThat(registry.size()).isEqualTo(3);
    assertThat(registry.recent(null, null, 0)).extracting(Anomaly::id).containsExactly("a4", "a3", "a2");
    assertThat(registry.findById("a1")).isEmpty();
  }

  @Test
  void filtersBySeverityTypeAndLimit() {
    registry.record(List.of(
        anomaly("a1", Severity.MEDIUM, AnomalyType.UNUSUAL_SPEED),
        anomaly("a2", Severity.LOW, AnomalyType.UNUSUAL_SPEED),
        anomaly("a3", Severity.MEDIUM, AnomalyType.HOLDING_PATTERN)));

    assertThat(registry.recent(Severity.MEDIUM, null, 0)).extracting(Anomaly::id).containsExactly("a3", "a1");
    assertThat(registry.recent(null, AnomalyType.UNUSUAL_SPEED, 0)).extracting(Anomaly::id)
        .containsExactly("a2", "a1");
    assertThat(registry.recent(Severity.MEDIUM, AnomalyType.UNUSUAL_SPEED, 0)).extracting(Anomaly::id)
        .containsExactly("a1");
    assertThat(registry.recent(null, null, 1)).extracting(Anomaly::id).containsExactly("a3");
  }

  @Test
  void attachAnalysisKeepsPosition() {
    registry.record(List.of(
        anomaly("a1", Severity.LOW, AnomalyType.UNUSUAL_SPEED),
        anomaly("a2", Severity.HIGH, AnomalyType.ALTITUDE_DROP)));

    Anomaly updated = registry.attachAnalysis("a1", "Likely a slow turboprop.").orElseThrow();

    assertThat(updated.aiAnalysis()).isEqualTo("Likely a slow turboprop.");
    assertThat(registry.recent(null, null, 0)).extracting(Anomaly::id).containsExactly("a2", "a1");
    assertThat(registry.findById("a1")).contains(updated);
    assertThat(registry.attachAnalysis("missing", "text")).isEmpty();
  }

  @Test
  void statsAndClear() {
    registry.record(List.of(
        anomaly("a1", Severity.CRITICAL, AnomalyType.EMERGENCY_SQUAWK),
        anomaly("a2", Severity.CRITICAL, AnomalyType.EMERGENCY_SQUAWK)));

    assertThat(registry.stats().count(Severity.CRITICAL)).isEqualTo(2);
    assertThat(registry.stats().count(AnomalyType.EMERGENCY_SQUAWK)).isEqualTo(2);

    registry.clear();

    assertThat(registry.size()).isZero();
    assertThat(registry.stats().total()).isZero();
  }

  private static Anomaly anomaly(String id, Severity severity, AnomalyType type) {
    return new Anomaly(id, "abc123", "AFR123", type, severity, "2024-01-01T12:00:00Z", null,
        AnomalyDetails.of("test", null), null);
  }
}
