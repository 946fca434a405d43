package com.atlas.journal.dto;

import java.time.Instant;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A classified, timestamped position sample belonging to a trip.
 *
 * <p>Created once per sample by the ingest pipeline and never modified afterwards. {@code speed}
 * is what the sensor reported; {@code derivedSpeedMps} is the speed computed against the previous
 * fix and is the value the activity classification was based on.
 */
@Value
@Builder
public class LocationFix {
    @NonNull String id;
    @NonNull String tripId;
    @NonNull GeoPoint point;
    @NonNull Instant timestamp;
    Double accuracy;
    Double altitude;
    Double speed;
    Double heading;
    @NonNull MotionState activity;
    Double batteryLevel;
    double derivedSpeedMps;
}
