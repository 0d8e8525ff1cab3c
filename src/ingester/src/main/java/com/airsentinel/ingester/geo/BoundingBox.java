package com.airsentinel.ingester.geo;

/**
 * Lat/lon box in degrees, borders inclusive.
 *
 * @param minLat southern edge
 * @param maxLat northern edge
 * @param minLon western edge
 * @param maxLon eastern edge
 */
public record BoundingBox(double minLat, double maxLat, double minLon, double maxLon) {

  public BoundingBox {
    if (minLat > maxLat || minLon > maxLon) {
      throw new IllegalArgumentException("Invalid bounding box: min must not exceed max");
    }
    if (minLat < -90.0 || maxLat > 90.0 || minLon < -180.0 || maxLon > 180.0) {
      throw new IllegalArgumentException("Invalid bounding box: coordinates out of range");
    }
  }

  /**
   * @return {@code true} when the point is inside or on the border; {@code false} without a fix
   */
  public boolean contains(Double lat, Double lon) {
    if (lat == null || lon == null) {
      return false;
    }
    return lat >= minLat && lat <= maxLat && lon >= minLon && lon <= maxLon;
  }
}
