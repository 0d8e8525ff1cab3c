package com.airsentinel.processor.aircraft;

import java.util.Optional;

/** Lookups of aircraft reference metadata. */
public interface AircraftMetadataRepository {
  /**
   * @param icao24 aircraft ICAO24 (hex, case-insensitive)
   * @return matching metadata when found
   */
  Optional<AircraftMetadata> findByIcao24(String icao24);
}
