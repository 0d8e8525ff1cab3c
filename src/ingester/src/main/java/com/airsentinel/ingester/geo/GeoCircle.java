package com.airsentinel.ingester.geo;

/**
 * Circular search area.
 *
 * @param latitude center latitude in degrees
 * @param longitude center longitude in degrees
 * @param radiusNm radius in nautical miles
 */
public record GeoCircle(double latitude, double longitude, double radiusNm) {
  public GeoCircle {
    if (radiusNm < 0) {
      throw new IllegalArgumentException("radiusNm must be >= 0");
    }
  }
}
