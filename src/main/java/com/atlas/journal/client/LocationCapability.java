package com.atlas.journal.client;

import java.util.Optional;

import com.atlas.journal.dto.RawLocationSample;
import com.atlas.journal.dto.SamplingProfile;

/**
 * Platform location access used by the adaptive sampler.
 *
 * <p>The sampler pulls one sample per tick and never talks to the platform in any other way.
 */
public interface LocationCapability {

    /**
     * Returns the current position, or empty when the platform has nothing to report yet.
     */
    Optional<RawLocationSample> getCurrentFix();

    boolean hasPermission();

    /**
     * Called whenever the sampler changes its cadence, so the platform can match its own
     * distance filter and update interval.
     */
    default void applyProfile(SamplingProfile profile) {
    }
}
