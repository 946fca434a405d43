package com.atlas.journal.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.atlas.journal.dto.TrackingStatus;
import com.atlas.journal.service.AdaptiveSampler;
import com.atlas.journal.service.BatchRetryScheduler;
import com.atlas.journal.service.LocationIngestPipeline;

import lombok.extern.slf4j.Slf4j;

/**
 * Health of the tracking engine.
 *
 * <p>Reports DOWN when the pending fix buffer is full: at that point every new sample depends on
 * the sink accepting the oldest queued fix. Otherwise UP, with the session state as details.
 */
@Component("trackingSession")
@Slf4j
public class TrackingSessionHealthIndicator implements HealthIndicator {

    private static final String LIFECYCLE_KEY = "lifecycle";
    private static final String TRIP_ID_KEY = "tripId";
    private static final String ACTIVITY_KEY = "currentActivity";
    private static final String INTERVAL_KEY = "currentIntervalMs";
    private static final String PENDING_KEY = "pendingFixes";
    private static final String CAPACITY_KEY = "pendingCapacity";
    private static final String EXHAUSTED_KEY = "exhaustedDeliveries";
    private static final String REASON_KEY = "reason";

    private final AdaptiveSampler adaptiveSampler;
    private final LocationIngestPipeline ingestPipeline;
    private final BatchRetryScheduler retryScheduler;

    public TrackingSessionHealthIndicator(
            AdaptiveSampler adaptiveSampler,
            LocationIngestPipeline ingestPipeline,
            BatchRetryScheduler retryScheduler) {
        this.adaptiveSampler = adaptiveSampler;
        this.ingestPipeline = ingestPipeline;
        this.retryScheduler = retryScheduler;
    }

    @Override
    public Health health() {
        TrackingStatus status = adaptiveSampler.getStatus();
        boolean bufferFull = ingestPipeline.isPendingBufferFull();

        Health.Builder builder = bufferFull ? Health.down() : Health.up();
        builder.withDetail(LIFECYCLE_KEY, status.lifecycle())
                .withDetail(PENDING_KEY, status.pendingFixes())
                .withDetail(CAPACITY_KEY, ingestPipeline.getPendingCapacity())
                .withDetail(EXHAUSTED_KEY, retryScheduler.getRetryMetrics().getExhaustedDeliveries());

        if (status.tripId() != null) {
            builder.withDetail(TRIP_ID_KEY, status.tripId())
                    .withDetail(ACTIVITY_KEY, status.currentActivity())
                    .withDetail(INTERVAL_KEY, status.currentIntervalMs());
        }

        if (bufferFull) {
            log.warn("Tracking health DOWN: pending buffer full ({} fixes)", status.pendingFixes());
            builder.withDetail(REASON_KEY, "Pending fix buffer is full, journal sink is not keeping up");
        } else {
            builder.withDetail(REASON_KEY, "Pending fix buffer has room");
        }
        return builder.build();
    }
}
