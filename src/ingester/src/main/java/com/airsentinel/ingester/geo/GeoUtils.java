package com.airsentinel.ingester.geo;

import java.util.List;

/**
 * Great-circle helpers shared by the radius lookup and the detectors.
 */
public final class GeoUtils {
  public static final double EARTH_RADIUS_NM = 3440.065;
  private static final double NM_PER_DEGREE_LAT = 60.0;

  private GeoUtils() {}

  /**
   * Haversine distance between two points.
   *
   * @return distance in nautical miles
   */
  public static double distanceNm(double lat1, double lon1, double lat2, double lon2) {
    double dLat = Math.toRadians(lat2 - lat1);
    double dLon = Math.toRadians(lon2 - lon1);
    double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
        + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
        * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_NM * c;
  }

  /**
   * Smallest lat/lon boxes that together enclose the circle.
   *
   * <p>One box normally; two when the longitude span crosses the antimeridian, split at +/-180.
   * A circle reaching a pole gets the whole longitude band. Used to narrow the upstream query
   * before the exact distance filter.
   */
  public static List<BoundingBox> enclosingBoxes(GeoCircle circle) {
    double dLat = circle.radiusNm() / NM_PER_DEGREE_LAT;
    double minLat = clamp(circle.latitude() - dLat, -90.0, 90.0);
    double maxLat = clamp(circle.latitude() + dLat, -90.0, 90.0);
    double cosLat = Math.cos(Math.toRadians(circle.latitude()));
    double dLon = cosLat < 1e-6 ? 180.0 : circle.radiusNm() / (NM_PER_DEGREE_LAT * cosLat);
    if (dLon >= 180.0 || minLat <= -90.0 || maxLat >= 90.0) {
      return List.of(new BoundingBox(minLat, maxLat, -180.0, 180.0));
    }
    double west = circle.longitude() - dLon;
    double east = circle.longitude() + dLon;
    if (west < -180.0) {
      return List.of(
          new BoundingBox(minLat, maxLat, west + 360.0, 180.0),
          new BoundingBox(minLat, maxLat, -180.0, east));
    }
    if (east > 180.0) {
      return List.of(
          new BoundingBox(minLat, maxLat, west, 180.0),
          new BoundingBox(minLat, maxLat, -180.0, east - 360.0));
    }
    return List.of(new BoundingBox(minLat, maxLat, west, east));
  }

  public static boolean withinRadius(GeoCircle circle, Double lat, Double lon) {
    if (lat == null || lon == null) {
      return false;
    }
    return distanceNm(circle.latitude(), circle.longitude(), lat, lon) <= circle.radiusNm();
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
