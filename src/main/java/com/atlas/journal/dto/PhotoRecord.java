package com.atlas.journal.dto;

import java.time.Instant;

/**
 * Read-only photo metadata used as clustering input.
 *
 * @param id native photo identifier on the device
 * @param timestamp capture time
 * @param location geotag, or {@code null} when the photo carries none
 * @param qualityScore 0.0 - 1.0
 * @param junk screenshot, receipt, blur and similar non-memory content
 */
public record PhotoRecord(
    String id,
    Instant timestamp,
    GeoPoint location,
    double qualityScore,
    boolean junk,
    int width,
    int height) {

  public boolean hasLocation() {
    return location != null;
  }
}
