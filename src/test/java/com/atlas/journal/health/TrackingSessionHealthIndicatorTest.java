package com.atlas.journal.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.atlas.journal.dto.DwellStage;
import com.atlas.journal.dto.MotionState;
import com.atlas.journal.dto.TrackingLifecycle;
import com.atlas.journal.dto.TrackingStatus;
import com.atlas.journal.service.AdaptiveSampler;
import com.atlas.journal.service.BatchRetryScheduler;
import com.atlas.journal.service.LocationIngestPipeline;

@ExtendWith(MockitoExtension.class)
@DisplayName("Tracking Session Health Indicator Tests")
class TrackingSessionHealthIndicatorTest {

    @Mock private AdaptiveSampler adaptiveSampler;
    @Mock private LocationIngestPipeline ingestPipeline;
    @Mock private BatchRetryScheduler retryScheduler;

    private TrackingSessionHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new TrackingSessionHealthIndicator(adaptiveSampler, ingestPipeline, retryScheduler);
        when(retryScheduler.getRetryMetrics()).thenReturn(new BatchRetryScheduler.RetryMetrics(10, 2, 8, 1));
        when(ingestPipeline.getPendingCapacity()).thenReturn(1000);
    }

    @Test
    @DisplayName("Should report UP with session details while tracking")
    void upWhileTracking() {
        when(adaptiveSampler.getStatus()).thenReturn(new TrackingStatus(
                TrackingLifecycle.ACTIVE, "trip-1", MotionState.WALKING, DwellStage.NONE, null,
                Instant.parse("2024-06-01T10:00:00Z"), 12, 30_000L, false, 3));
        when(ingestPipeline.isPendingBufferFull()).thenReturn(false);

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("lifecycle", TrackingLifecycle.ACTIVE)
                .containsEntry("tripId", "trip-1")
                .containsEntry("currentActivity", MotionState.WALKING)
                .containsEntry("currentIntervalMs", 30_000L)
                .containsEntry("pendingFixes", 3)
                .containsEntry("pendingCapacity", 1000)
                .containsEntry("exhaustedDeliveries", 1L);
    }

    @Test
    @DisplayName("Should report UP without session details when stopped")
    void upWhenStopped() {
        when(adaptiveSampler.getStatus()).thenReturn(TrackingStatus.stopped(0));
        when(ingestPipeline.isPendingBufferFull()).thenReturn(false);

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("lifecycle", TrackingLifecycle.STOPPED);
        assertThat(health.getDetails()).doesNotContainKey("tripId");
    }

    @Test
    @DisplayName("Should report DOWN when the pending buffer is full")
    void downWhenBufferFull() {
        when(adaptiveSampler.getStatus()).thenReturn(TrackingStatus.stopped(1000));
        when(ingestPipeline.isPendingBufferFull()).thenReturn(true);

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("pendingFixes", 1000);
        assertThat((String) health.getDetails().get("reason")).contains("full");
    }
}
