package com.atlas.journal.dto;

import java.time.Instant;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Photo metadata and scores as produced by the on-device scoring capability.
 *
 * <p>{@code junk} is the scorer's verdict when it gives one; otherwise the verdict is derived from
 * {@code junkScore} against the configured junk threshold.
 */
public record PhotoAnalysis(
    @NotBlank(message = "Photo id is required") String id,
    @NotNull(message = "Photo timestamp is required") Instant timestamp,
    @Valid GeoPoint location,
    @DecimalMin(value = "0.0", message = "Quality score must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Quality score cannot exceed 1.0")
        double qualityScore,
    @DecimalMin(value = "0.0", message = "Junk score must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Junk score cannot exceed 1.0")
        Double junkScore,
    Boolean junk,
    @Min(value = 0, message = "Width cannot be negative") int width,
    @Min(value = 0, message = "Height cannot be negative") int height) {}
