package com.atlas.journal.dto;

import java.time.Instant;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A contiguous, time-ordered run of photos grouped by chained time/space proximity.
 *
 * <p>{@code startTime} and {@code endTime} are the timestamps of the first and last photo. Every
 * field is fixed at creation except the assigned step, which the step assignment collaborator may
 * set or change.
 */
@Getter
@ToString
public class PhotoCluster {

    private final String id;
    private final String tripId;
    private final List<PhotoRecord> photos;
    private final GeoPoint centerLocation;
    private final Instant startTime;
    private final Instant endTime;
    private volatile String assignedStepId;

    public PhotoCluster(String id, String tripId, List<PhotoRecord> photos, GeoPoint centerLocation) {
        if (photos == null || photos.isEmpty()) {
            throw new IllegalArgumentException("A photo cluster needs at least one photo");
        }
        this.id = id;
        this.tripId = tripId;
        this.photos = List.copyOf(photos);
        this.centerLocation = centerLocation;
        this.startTime = this.photos.get(0).timestamp();
        this.endTime = this.photos.get(this.photos.size() - 1).timestamp();
    }

    public void assignToStep(String stepId) {
        this.assignedStepId = stepId;
    }

    public int size() {
        return photos.size();
    }
}
