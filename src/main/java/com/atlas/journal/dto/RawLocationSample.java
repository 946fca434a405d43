package com.atlas.journal.dto;

import java.time.Instant;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * A position sample as reported by the device location capability, before classification.
 *
 * <p>Coordinates are deliberately not range-checked here: the ingest pipeline rejects invalid
 * coordinates and counts them.
 */
public record RawLocationSample(
    double latitude,
    double longitude,
    @NotNull(message = "Timestamp is required") Instant timestamp,
    Double accuracy,
    Double altitude,
    Double speed,
    Double heading,
    @DecimalMin(value = "0.0", message = "Battery level must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Battery level cannot exceed 1.0")
        Double batteryLevel) {

  public static RawLocationSample of(double latitude, double longitude, Instant timestamp) {
    return new RawLocationSample(latitude, longitude, timestamp, null, null, null, null, null);
  }

  public RawLocationSample withBatteryLevel(Double level) {
    return new RawLocationSample(
        latitude, longitude, timestamp, accuracy, altitude, speed, heading, level);
  }
}
