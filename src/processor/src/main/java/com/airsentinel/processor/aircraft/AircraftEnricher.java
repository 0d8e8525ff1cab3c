package com.airsentinel.processor.aircraft;

import com.airsentinel.ingester.opensky.AircraftState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Attaches registry metadata to live states when the aircraft DB is enabled.
 */
@Component
public class AircraftEnricher {
  private final Optional<AircraftMetadataRepository> repository;
  private final Counter hitCounter;
  private final Counter missCounter;

  public AircraftEnricher(Optional<AircraftMetadataRepository> repository, MeterRegistry meterRegistry) {
    this.repository = repository;
    this.hitCounter = Counter.builder("processor.enrichment.lookups.total")
        .tag("outcome", "hit")
        .register(meterRegistry);
    this.missCounter = Counter.builder("processor.enrichment.lookups.total")
        .tag("outcome", "miss")
        .register(meterRegistry);
  }

  public EnrichedAircraft enrich(AircraftState state) {
    if (repository.isEmpty()) {
      return new EnrichedAircraft(state, null);
    }
    Optional<AircraftMetadata> metadata = repository.get().findByIcao24(state.icao24());
    (metadata.isPresent() ? hitCounter : missCounter).increment();
    return new EnrichedAircraft(state, metadata.orElse(null));
  }

  public List<EnrichedAircraft> enrichAll(List<AircraftState> states) {
    return states.stream().map(this::enrich).toList();
  }

  public boolean isEnabled() {
    return repository.isPresent();
  }
}
