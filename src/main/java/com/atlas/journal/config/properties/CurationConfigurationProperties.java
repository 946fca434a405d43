package com.atlas.journal.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for photo quality gating and time/location clustering.
 *
 * <p>Scores are on the 0.0 - 1.0 scale produced by the photo scoring capability.
 */
@ConfigurationProperties(prefix = "journal.curation")
@Validated
public record CurationConfigurationProperties(

    // Quality thresholds
    @DecimalMin(value = "0.0", message = "Min quality score must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Min quality score cannot exceed 1.0")
        @NotNull(message = "Min quality score is required")
        Double minQualityScore,
    @DecimalMin(value = "0.0", message = "Featured threshold must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Featured threshold cannot exceed 1.0")
        @NotNull(message = "Featured threshold is required")
        Double featuredThreshold,
    @DecimalMin(value = "0.0", message = "Junk threshold must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Junk threshold cannot exceed 1.0")
        @NotNull(message = "Junk threshold is required")
        Double junkThreshold,

    // Photo limits
    @Min(value = 0, message = "Max photos per step cannot be negative")
        @NotNull(message = "Max photos per step is required")
        Integer maxPhotosPerStep,
    @Min(value = 0, message = "Featured photos per step cannot be negative")
        @NotNull(message = "Featured photos per step is required")
        Integer featuredPerStep,

    // Clustering
    @Min(value = 0, message = "Time cluster window cannot be negative")
        @NotNull(message = "Time cluster window is required")
        Long timeClusterWindowMs,
    @DecimalMin(value = "0.0", message = "Location cluster radius cannot be negative")
        @NotNull(message = "Location cluster radius is required")
        Double locationClusterRadiusM) {

  public static CurationConfigurationProperties defaults() {
    return new CurationConfigurationProperties(0.5, 0.8, 0.7, 10, 3, 3_600_000L, 200.0);
  }
}
