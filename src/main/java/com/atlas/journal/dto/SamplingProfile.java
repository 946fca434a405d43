package com.atlas.journal.dto;

/**
 * Sampling parameters pushed to the location capability whenever the sampler changes cadence.
 *
 * @param intervalMs time between captures
 * @param distanceFilterM minimum movement before the platform reports a new position
 * @param stationaryRadiusM radius within which the device is considered not to have moved
 * @param stopTimeoutMs stationary time after which a stop counts as a visit
 * @param batterySaver whether the interval was forced down by the battery saver
 */
public record SamplingProfile(
    long intervalMs,
    double distanceFilterM,
    double stationaryRadiusM,
    long stopTimeoutMs,
    boolean batterySaver) {}
