package com.atlas.journal.algorithm.util;

import java.time.Duration;
import java.time.Instant;

import com.atlas.journal.dto.GeoPoint;

/**
 * Distance and speed on a spherical Earth.
 *
 * <p>Mathematical Foundation: the haversine formula
 *
 * <pre>
 *   a = sin²(Δφ/2) + cos φ1 · cos φ2 · sin²(Δλ/2)
 *   c = 2 · atan2(√a, √(1−a))
 *   d = R · c
 * </pre>
 *
 * where φ is latitude, λ is longitude and R the mean Earth radius. Rounding can push {@code a}
 * marginally outside [0, 1] for coincident or antipodal points, so it is clamped before the square
 * roots.
 *
 * <p>All methods are pure. Coordinates are validated when a {@link GeoPoint} is built.
 */
public final class GeoMath {

  /** Earth's mean radius in meters (WGS84 mean radius). */
  public static final double EARTH_RADIUS_METERS = 6_371_000.0;

  private static final double MILLIS_PER_SECOND = 1000.0;

  private GeoMath() {}

  /**
   * Great-circle distance between two points.
   *
   * @return distance in meters, symmetric and zero for identical points
   */
  public static double distanceMeters(GeoPoint a, GeoPoint b) {
    double lat1Rad = Math.toRadians(a.latitude());
    double lat2Rad = Math.toRadians(b.latitude());
    double dlat = Math.toRadians(b.latitude() - a.latitude());
    double dlon = Math.toRadians(b.longitude() - a.longitude());

    double sinHalfDlat = Math.sin(dlat / 2);
    double sinHalfDlon = Math.sin(dlon / 2);
    double h =
        sinHalfDlat * sinHalfDlat
            + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfDlon * sinHalfDlon;
    h = Math.min(1.0, Math.max(0.0, h));

    double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    return EARTH_RADIUS_METERS * c;
  }

  /**
   * Average speed needed to travel from {@code a} at {@code tA} to {@code b} at {@code tB}.
   *
   * @return meters per second, or 0 when {@code tB} is not after {@code tA}
   */
  public static double speedMps(GeoPoint a, GeoPoint b, Instant tA, Instant tB) {
    if (!tB.isAfter(tA)) {
      return 0.0;
    }
    double seconds = Duration.between(tA, tB).toMillis() / MILLIS_PER_SECOND;
    if (seconds <= 0) {
      return 0.0;
    }
    return distanceMeters(a, b) / seconds;
  }
}
