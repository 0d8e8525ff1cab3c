package com.airsentinel.ingester.geo;

public record GeoPoint(double latitude, double longitude) {}
