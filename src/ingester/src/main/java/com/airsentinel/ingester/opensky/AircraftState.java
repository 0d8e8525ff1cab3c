package com.airsentinel.ingester.opensky;

/**
 * One state vector as reported by OpenSky, in the upstream's native SI units.
 *
 * <p>Every boxed field may be {@code null}; consumers treat {@code null} as unknown, never zero.
 */
public record AircraftState(
    String icao24,
    String callsign,
    String originCountry,
    Long timePosition,
    long lastContact,
    Double longitude,
    Double latitude,
    Double baroAltitude,
    boolean onGround,
    Double velocity,
    Double trueTrack,
    Double verticalRate,
    Double geoAltitude,
    String squawk,
    boolean spi,
    int positionSource,
    Integer category) {

  public boolean hasPosition() {
    return latitude != null && longitude != null;
  }
}
