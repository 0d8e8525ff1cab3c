package com.airsentinel.processor.aircraft;

import com.airsentinel.ingester.opensky.AircraftState;

/**
 * A live state paired with its registry metadata, {@code null} when unknown.
 */
public record EnrichedAircraft(AircraftState state, AircraftMetadata metadata) {}
