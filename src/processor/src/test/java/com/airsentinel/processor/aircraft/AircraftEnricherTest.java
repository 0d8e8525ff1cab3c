package com.airsentinel.processor.aircraft;

import static com.airsentinel.processor.StateBuilder.aircraft;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AircraftEnricherTest {
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  @Test
  void withoutRepositoryStatesPassThroughBare() {
    AircraftEnricher enricher = new AircraftEnricher(Optional.empty(), meterRegistry);

    EnrichedAircraft enriched = enricher.enrich(aircraft().build());

    assertThat(enricher.isEnabled()).isFalse();
    assertThat(enriched.metadata()).isNull();
    assertThat(enriched.state().icao24()).isEqualTo("abc123");
  }

  @Test
  void attachesMetadataAndCountsHitsAndMisses() {
    AircraftMetadataRepository repository = mock(AircraftMetadataRepository.class);
    AircraftMetadata metadata = new AircraftMetadata("abc123", "F-GKXA", null, "Airbus", "A320", "A320",
        null, "Air France", null, null, null, null, null);
    when(repository.findByIcao24("abc123")).thenReturn(Optional.of(metadata));
    when(repository.findByIcao24("def456")).thenReturn(Optional.empty());
    AircraftEnricher enricher = new AircraftEnricher(Optional.of(repository), meterRegistry);

    List<EnrichedAircraft> enriched = enricher.enrichAll(List.of(aircraft("abc123").build(), aircraft("def456").build()));

    assertThat(enricher.isEnabled()).isTrue();
    assertThat(enriched).extracting(EnrichedAircraft::metadata).containsExactly(metadata, null);
    assertThat(meterRegistry.get("processor.enrichment.lookups.total").tag("outcome", "hit").counter().count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.get("processor.enrichment.lookups.total").tag("outcome", "miss").counter().count())
        .isEqualTo(1.0);
  }
}
