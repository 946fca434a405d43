package com.atlas.journal.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/** Retry limits for deliveries to the persistence/sync sink. */
@ConfigurationProperties(prefix = "journal.retry")
@Validated
public record RetryConfigurationProperties(
    @Min(value = 0, message = "Max retries cannot be negative")
        @Max(value = 10, message = "Max retries cannot exceed 10")
        @NotNull(message = "Max retries is required")
        Integer maxRetries,
    @Min(value = 0, message = "Retry base delay cannot be negative")
        @NotNull(message = "Retry base delay is required")
        Long retryBaseDelayMs) {

  public static RetryConfigurationProperties defaults() {
    return new RetryConfigurationProperties(3, 1000L);
  }
}
