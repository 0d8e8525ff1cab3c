package com.airsentinel.ingester.opensky;

public record TrackPoint(
    long time,
    Double latitude,
    Double longitude,
    Double baroAltitude,
    Double trueTrack,
    boolean onGround) {}
