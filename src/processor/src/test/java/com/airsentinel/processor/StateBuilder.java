package com.airsentinel.processor;

import com.airsentinel.ingester.opensky.AircraftState;

/** Airborne cruise state with sensible defaults; override only what a test cares about. */
public final class StateBuilder {
  private String icao24 = "abc123";
  private String callsign = "AFR123";
  private Double latitude = 48.0;
  private Double longitude = 2.0;
  private Double baroAltitude = 10_000.0;
  private boolean onGround = false;
  private Double velocity = 230.0;
  private Double trueTrack = 90.0;
  private Double verticalRate = 0.0;
  private String squawk = "1000";
  private long lastContact = 1_700_000_000L;

  public static StateBuilder aircraft() {
    return new StateBuilder();
  }

  public static StateBuilder aircraft(String icao24) {
    return new StateBuilder().icao24(icao24);
  }

  public StateBuilder icao24(String value) {
    this.icao24 = value;
    return this;
  }

  public StateBuilder position(Double lat, Double lon) {
    this.latitude = lat;
    this.longitude = lon;
    return this;
  }

  public StateBuilder baroAltitude(Double value) {
    this.baroAltitude = value;
    return this;
  }

  public StateBuilder onGround() {
    this.onGround = true;
    return this;
  }

  public StateBuilder velocity(Double value) {
    this.velocity = value;
    return this;
  }

  public StateBuilder trueTrack(Double value) {
    this.trueTrack = value;
    return this;
  }

  public StateBuilder verticalRate(Double value) {
    this.verticalRate = value;
    return this;
  }

  public StateBuilder squawk(String value) {
    this.squawk = value;
    return this;
  }

  public StateBuilder lastContact(long value) {
    this.lastContact = value;
    return this;
  }

  public AircraftState build() {
    return new AircraftState(
        icao24, callsign, "France", lastContact, lastContact, longitude, latitude, baroAltitude, onGround,
        velocity, trueTrack, verticalRate, baroAltitude, squawk, false, 0, null);
  }
}
