package com.atlas.journal.dto;

import com.atlas.journal.exception.InvalidCoordinateException;

/**
 * Immutable position in decimal degrees.
 *
 * <p>Construction validates the ranges, so every {@code GeoPoint} reaching the geo math is valid:
 * latitude in [-90, 90], longitude in [-180, 180], neither NaN.
 */
public record GeoPoint(double latitude, double longitude) {

  /** Fallback center for clusters that carry no geotagged photo. */
  public static final GeoPoint ORIGIN = new GeoPoint(0.0, 0.0);

  public GeoPoint {
    if (!isValidLatitude(latitude) || !isValidLongitude(longitude)) {
      throw new InvalidCoordinateException(latitude, longitude);
    }
  }

  public static GeoPoint of(double latitude, double longitude) {
    return new GeoPoint(latitude, longitude);
  }

  public static boolean isValidLatitude(double latitude) {
    return latitude >= -90 && latitude <= 90;
  }

  public static boolean isValidLongitude(double longitude) {
    return longitude >= -180 && longitude <= 180;
  }
}
