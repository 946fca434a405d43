package com.atlas.journal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.atlas.journal.algorithm.ActivityClassifier;
import com.atlas.journal.config.properties.RetryConfigurationProperties;
import com.atlas.journal.config.properties.TrackingConfigurationProperties;
import com.atlas.journal.dto.FlushReport;
import com.atlas.journal.dto.LocationFix;
import com.atlas.journal.dto.MotionState;
import com.atlas.journal.dto.PhotoCluster;
import com.atlas.journal.dto.RawLocationSample;
import com.atlas.journal.exception.InvalidCoordinateException;
import com.atlas.journal.exception.RetryExhaustedException;
import com.atlas.journal.repository.JournalSink;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("Location Ingest Pipeline Tests")
class LocationIngestPipelineTest {

  private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");
  private static final double LAT = 52.3676;
  private static final double LON = 4.9041;

  // ~100 m of latitude
  private static final double HUNDRED_METERS_LAT = 0.0009;

  private RecordingSink sink;
  private SimpleMeterRegistry meterRegistry;
  private LocationIngestPipeline pipeline;
  private TrackingSession session;

  /** Sink that records deliveries and fails while {@code failing} is set. */
  static class RecordingSink implements JournalSink {
    final List<LocationFix> delivered = new ArrayList<>();
    final AtomicBoolean failing = new AtomicBoolean(false);

    @Override
    public void append(LocationFix fix) {
      if (failing.get()) {
        throw new IllegalStateException("sink offline");
      }
      delivered.add(fix);
    }

    @Override
    public void appendCluster(PhotoCluster cluster) {
      throw new UnsupportedOperationException();
    }
  }

  @BeforeEach
  void setUp() {
    sink = new RecordingSink();
    meterRegistry = new SimpleMeterRegistry();
    pipeline = pipelineWithCapacity(1000);
    session = new TrackingSession("trip-1", 30_000L);
  }

  private LocationIngestPipeline pipelineWithCapacity(int capacity) {
    TrackingConfigurationProperties config =
        new TrackingConfigurationProperties(
            30_000L, 600_000L, 10.0, 50.0, 1_800_000L, 300_000L, 0.2, capacity, 300_000L, 15_000L);
    BatchRetryScheduler retryScheduler =
        new BatchRetryScheduler(RetryConfigurationProperties.defaults(), millis -> {});
    return new LocationIngestPipeline(
        new ActivityClassifier(), retryScheduler, sink, config, meterRegistry);
  }

  private static RawLocationSample sample(double latitude, long secondsAfterStart) {
    return RawLocationSample.of(latitude, LON, T0.plusSeconds(secondsAfterStart));
  }

  @Nested
  @DisplayName("Ingest")
  class IngestTests {

    @Test
    @DisplayName("should keep the session activity for the first fix")
    void firstFixKeepsActivity() {
      LocationFix fix = pipeline.ingest(session, sample(LAT, 0));

      assertThat(fix.getActivity()).isEqualTo(MotionState.STATIONARY);
      assertThat(fix.getDerivedSpeedMps()).isZero();
      assertThat(fix.getTripId()).isEqualTo("trip-1");
      assertThat(session.getLastFix()).isSameAs(fix);
      assertThat(session.getFixesCaptured()).isEqualTo(1);
      assertThat(pipeline.getPendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should classify later fixes from the speed since the last fix")
    void classifiesFromDerivedSpeed() {
      pipeline.ingest(session, sample(LAT, 0));

      LocationFix fix = pipeline.ingest(session, sample(LAT + HUNDRED_METERS_LAT, 10));

      assertThat(fix.getDerivedSpeedMps()).isBetween(9.5, 10.5);
      assertThat(fix.getActivity()).isEqualTo(MotionState.DRIVING);
      assertThat(session.getCurrentActivity()).isEqualTo(MotionState.DRIVING);
    }

    @Test
    @DisplayName("should carry the sensor readings onto the fix")
    void carriesSensorReadings() {
      RawLocationSample raw =
          new RawLocationSample(LAT, LON, T0, 8.0, 12.5, 1.2, 270.0, 0.64);

      LocationFix fix = pipeline.ingest(session, raw);

      assertThat(fix.getAccuracy()).isEqualTo(8.0);
      assertThat(fix.getAltitude()).isEqualTo(12.5);
      assertThat(fix.getSpeed()).isEqualTo(1.2);
      assertThat(fix.getHeading()).isEqualTo(270.0);
      assertThat(fix.getBatteryLevel()).isEqualTo(0.64);
    }

    @Test
    @DisplayName("should reject invalid coordinates without touching the session")
    void rejectsInvalidCoordinates() {
      assertThatThrownBy(() -> pipeline.ingest(session, sample(123.0, 0)))
          .isInstanceOf(InvalidCoordinateException.class);

      assertThat(session.getFixesCaptured()).isZero();
      assertThat(session.getLastFix()).isNull();
      assertThat(pipeline.getPendingCount()).isZero();
      assertThat(
              meterRegistry
                  .get("journal.fixes.rejected")
                  .tag("reason", "invalid_coordinate")
                  .counter()
                  .count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Backpressure")
  class BackpressureTests {

    @BeforeEach
    void smallBuffer() {
      pipeline = pipelineWithCapacity(2);
    }

    @Test
    @DisplayName("should deliver the oldest fix to make room when the buffer is full")
    void deliversOldestWhenFull() {
      LocationFix first = pipeline.ingest(session, sample(LAT, 0));
      pipeline.ingest(session, sample(LAT, 30));

      pipeline.ingest(session, sample(LAT, 60));

      assertThat(sink.delivered).containsExactly(first);
      assertThat(pipeline.getPendingCount()).isEqualTo(2);
      assertThat(session.getFixesCaptured()).isEqualTo(3);
    }

    @Test
    @DisplayName("should reject the new sample before any session change when the sink is down")
    void rejectsWhenSinkDown() {
      pipeline.ingest(session, sample(LAT, 0));
      LocationFix second = pipeline.ingest(session, sample(LAT, 30));
      sink.failing.set(true);

      assertThatThrownBy(() -> pipeline.ingest(session, sample(LAT, 60)))
          .isInstanceOf(RetryExhaustedException.class);

      assertThat(session.getLastFix()).isSameAs(second);
      assertThat(session.getFixesCaptured()).isEqualTo(2);
      assertThat(pipeline.getPendingCount()).isEqualTo(2);
      assertThat(pipeline.isPendingBufferFull()).isTrue();
      assertThat(
              meterRegistry.get("journal.fixes.rejected").tag("reason", "backpressure").counter().count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Flush")
  class FlushTests {

    @Test
    @DisplayName("should deliver every pending fix in arrival order")
    void flushesInOrder() {
      LocationFix first = pipeline.ingest(session, sample(LAT, 0));
      LocationFix second = pipeline.ingest(session, sample(LAT, 30));
      LocationFix third = pipeline.ingest(session, sample(LAT, 60));

      FlushReport report = pipeline.flushPending();

      assertThat(report.delivered()).isEqualTo(3);
      assertThat(report.isComplete()).isTrue();
      assertThat(sink.delivered).containsExactly(first, second, third);
      assertThat(meterRegistry.get("journal.fixes.synced").counter().count()).isEqualTo(3.0);
      assertThat(meterRegistry.get("journal.fixes.pending").gauge().value()).isZero();
    }

    @Test
    @DisplayName("should stop at an exhausted delivery and resume in order later")
    void stopsAndResumesInOrder() {
      LocationFix first = pipeline.ingest(session, sample(LAT, 0));
      LocationFix second = pipeline.ingest(session, sample(LAT, 30));
      sink.failing.set(true);

      FlushReport failed = pipeline.flushPending();

      assertThat(failed.delivered()).isZero();
      assertThat(failed.remaining()).isEqualTo(2);
      assertThat(failed.isComplete()).isFalse();
      assertThat(failed.interrupted()).isFalse();

      sink.failing.set(false);
      LocationFix third = pipeline.ingest(session, sample(LAT, 60));
      FlushReport recovered = pipeline.flushPending();

      assertThat(recovered.isComplete()).isTrue();
      assertThat(sink.delivered).containsExactly(first, second, third);
    }

    @Test
    @DisplayName("should report an interrupted flush without delivering")
    void interruptedFlush() {
      pipeline.ingest(session, sample(LAT, 0));

      Thread.currentThread().interrupt();
      FlushReport report;
      try {
        report = pipeline.flushPending();
      } finally {
        Thread.interrupted();
      }

      assertThat(report.interrupted()).isTrue();
      assertThat(report.remaining()).isEqualTo(1);
      assertThat(sink.delivered).isEmpty();
    }

    @Test
    @DisplayName("should report an empty flush as complete")
    void emptyFlush() {
      assertThat(pipeline.flushPending()).isEqualTo(new FlushReport(0, 0, false));
    }
  }
}
