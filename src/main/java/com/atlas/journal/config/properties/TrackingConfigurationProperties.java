package com.atlas.journal.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for adaptive location sampling and dwell detection.
 *
 * <p>Intervals are in milliseconds and distances in meters. The battery saver threshold is a
 * fraction of full charge.
 */
@ConfigurationProperties(prefix = "journal.tracking")
@Validated
public record TrackingConfigurationProperties(

    // Sampling cadence
    @Min(value = 1000, message = "Active interval must be at least 1 second")
        @NotNull(message = "Active interval is required")
        Long activeIntervalMs,
    @Min(value = 1000, message = "Stationary interval must be at least 1 second")
        @NotNull(message = "Stationary interval is required")
        Long stationaryIntervalMs,

    // Distance filters handed to the location capability
    @DecimalMin(value = "0.0", message = "Min displacement cannot be negative")
        @NotNull(message = "Min displacement is required")
        Double minDisplacementM,
    @DecimalMin(value = "0.0", message = "Stationary radius cannot be negative")
        @NotNull(message = "Stationary radius is required")
        Double stationaryRadiusM,

    // Dwell detection
    @Min(value = 0, message = "Min dwell time cannot be negative")
        @NotNull(message = "Min dwell time is required")
        Long minDwellMs,
    @Min(value = 0, message = "Short stop time cannot be negative")
        @NotNull(message = "Short stop time is required")
        Long shortStopMs,

    // Battery optimization
    @DecimalMin(value = "0.0", message = "Battery saver threshold must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Battery saver threshold cannot exceed 1.0")
        @NotNull(message = "Battery saver threshold is required")
        Double batterySaverThreshold,

    // Pending fix buffer and sync loop
    @Min(value = 1, message = "Pending buffer capacity must be at least 1")
        @NotNull(message = "Pending buffer capacity is required")
        Integer pendingBufferCapacity,
    @Min(value = 1000, message = "Sync interval must be at least 1 second")
        @NotNull(message = "Sync interval is required")
        Long syncIntervalMs,
    @Min(value = 0, message = "Flush timeout cannot be negative")
        @NotNull(message = "Flush timeout is required")
        Long flushTimeoutMs) {

  /** Values used by the mobile tracker out of the box. */
  public static TrackingConfigurationProperties defaults() {
    return new TrackingConfigurationProperties(
        30_000L, 600_000L, 10.0, 50.0, 1_800_000L, 300_000L, 0.2, 1000, 300_000L, 15_000L);
  }
}
