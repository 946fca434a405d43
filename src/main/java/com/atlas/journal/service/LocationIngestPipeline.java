package com.atlas.journal.service;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.atlas.journal.algorithm.ActivityClassifier;
import com.atlas.journal.algorithm.util.GeoMath;
import com.atlas.journal.config.properties.TrackingConfigurationProperties;
import com.atlas.journal.dto.FlushReport;
import com.atlas.journal.dto.GeoPoint;
import com.atlas.journal.dto.LocationFix;
import com.atlas.journal.dto.MotionState;
import com.atlas.journal.dto.RawLocationSample;
import com.atlas.journal.exception.InvalidCoordinateException;
import com.atlas.journal.exception.RetryExhaustedException;
import com.atlas.journal.repository.JournalSink;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Turns raw location samples into classified fixes and queues them for the journal sink.
 *
 * <p><strong>Ingest steps:</strong>
 *
 * <ol>
 *   <li>Coordinates are validated by building a {@link GeoPoint}; invalid samples are counted and
 *       rejected with {@link InvalidCoordinateException}.
 *   <li>Speed is derived against the session's last fix and classified. The first fix of a
 *       session keeps the session's current activity.
 *   <li>When the pending buffer is full, the oldest fix is delivered first. If that delivery
 *       exhausts its retries the new sample is rejected before the session is touched, so no fix
 *       is dropped silently.
 *   <li>The fix is recorded on the session and appended to the buffer.
 * </ol>
 *
 * <p>Fixes reach the sink strictly in arrival order: deliveries always take the buffer head, and
 * only one thread delivers at a time.
 */
@Service
public class LocationIngestPipeline {

  private static final Logger logger = LoggerFactory.getLogger(LocationIngestPipeline.class);

  static final String REJECT_INVALID_COORDINATE = "invalid_coordinate";
  static final String REJECT_BACKPRESSURE = "backpressure";

  private final ActivityClassifier activityClassifier;
  private final BatchRetryScheduler retryScheduler;
  private final JournalSink journalSink;
  private final PendingFixBuffer pendingBuffer;

  // Serializes deliveries so the buffer has a single consumer
  private final ReentrantLock flushLock = new ReentrantLock();

  private final Counter fixesIngestedCounter;
  private final Counter invalidCoordinateCounter;
  private final Counter backpressureRejectedCounter;
  private final Counter fixesSyncedCounter;

  public LocationIngestPipeline(
      ActivityClassifier activityClassifier,
      BatchRetryScheduler retryScheduler,
      JournalSink journalSink,
      TrackingConfigurationProperties trackingConfig,
      MeterRegistry meterRegistry) {
    this.activityClassifier = activityClassifier;
    this.retryScheduler = retryScheduler;
    this.journalSink = journalSink;
    this.pendingBuffer = new PendingFixBuffer(trackingConfig.pendingBufferCapacity());

    this.fixesIngestedCounter =
        Counter.builder("journal.fixes.ingested")
            .description("Number of location fixes accepted into the pending buffer")
            .register(meterRegistry);
    this.invalidCoordinateCounter =
        Counter.builder("journal.fixes.rejected")
            .description("Number of location samples rejected")
            .tag("reason", REJECT_INVALID_COORDINATE)
            .register(meterRegistry);
    this.backpressureRejectedCounter =
        Counter.builder("journal.fixes.rejected")
            .description("Number of location samples rejected")
            .tag("reason", REJECT_BACKPRESSURE)
            .register(meterRegistry);
    this.fixesSyncedCounter =
        Counter.builder("journal.fixes.synced")
            .description("Number of location fixes delivered to the journal sink")
            .register(meterRegistry);
    Gauge.builder("journal.fixes.pending", pendingBuffer, PendingFixBuffer::size)
        .description("Number of location fixes waiting for delivery")
        .register(meterRegistry);

    logger.info(
        "Location ingest pipeline initialized with pending buffer capacity {}",
        pendingBuffer.capacity());
  }

  /**
   * Ingests one raw sample into the session.
   *
   * @return the fix that was recorded and queued
   * @throws InvalidCoordinateException when the sample's coordinates are out of range
   * @throws RetryExhaustedException when the buffer is full and its oldest fix cannot be delivered
   */
  public LocationFix ingest(TrackingSession session, RawLocationSample raw) {
    GeoPoint point;
    try {
      point = new GeoPoint(raw.latitude(), raw.longitude());
    } catch (InvalidCoordinateException e) {
      invalidCoordinateCounter.increment();
      throw e;
    }

    LocationFix previous = session.getLastFix();
    double derivedSpeed = 0.0;
    MotionState activity = session.getCurrentActivity();
    if (previous != null) {
      derivedSpeed =
          GeoMath.speedMps(previous.getPoint(), point, previous.getTimestamp(), raw.timestamp());
      activity = activityClassifier.classify(derivedSpeed);
    }

    if (pendingBuffer.isFull()) {
      makeRoom();
    }

    LocationFix fix =
        LocationFix.builder()
            .id(UUID.randomUUID().toString())
            .tripId(session.getTripId())
            .point(point)
            .timestamp(raw.timestamp())
            .accuracy(raw.accuracy())
            .altitude(raw.altitude())
            .speed(raw.speed())
            .heading(raw.heading())
            .activity(activity)
            .batteryLevel(raw.batteryLevel())
            .derivedSpeedMps(derivedSpeed)
            .build();

    session.recordFix(fix);
    if (!pendingBuffer.offer(fix)) {
      // The sampler is the only producer, so room made above cannot have been taken
      throw new IllegalStateException("Pending buffer refused fix after room was made");
    }
    fixesIngestedCounter.increment();

    logger.debug(
        "Ingested fix {} for trip {}: {} at {} m/s",
        fix.getId(),
        fix.getTripId(),
        activity,
        String.format("%.2f", derivedSpeed));
    return fix;
  }

  private void makeRoom() {
    flushLock.lock();
    try {
      if (!pendingBuffer.isFull()) {
        return;
      }
      try {
        deliverHead();
      } catch (RetryExhaustedException e) {
        backpressureRejectedCounter.increment();
        logger.error(
            "Pending buffer full ({} fixes) and oldest fix could not be delivered; rejecting sample",
            pendingBuffer.size());
        throw e;
      }
    } finally {
      flushLock.unlock();
    }
  }

  /**
   * Drains the pending buffer into the sink, oldest first.
   *
   * <p>Stops at the first delivery that exhausts its retries, leaving that fix and everything
   * after it queued in order, or when the calling thread is interrupted.
   */
  public FlushReport flushPending() {
    flushLock.lock();
    try {
      int delivered = 0;
      while (pendingBuffer.size() > 0) {
        if (Thread.currentThread().isInterrupted()) {
          logger.warn("Flush interrupted with {} fixes pending", pendingBuffer.size());
          return new FlushReport(delivered, pendingBuffer.size(), true);
        }
        try {
          deliverHead();
          delivered++;
        } catch (RetryExhaustedException e) {
          boolean interrupted = Thread.currentThread().isInterrupted();
          logger.warn(
              "Flush stopped after {} deliveries, {} fixes remain pending: {}",
              delivered,
              pendingBuffer.size(),
              e.getMessage());
          return new FlushReport(delivered, pendingBuffer.size(), interrupted);
        }
      }
      if (delivered > 0) {
        logger.info("Flushed {} fixes to the journal sink", delivered);
      }
      return new FlushReport(delivered, 0, false);
    } finally {
      flushLock.unlock();
    }
  }

  private void deliverHead() {
    LocationFix head = pendingBuffer.peekOldest();
    if (head == null) {
      return;
    }
    retryScheduler.execute("fix delivery", head, journalSink::append);
    pendingBuffer.removeOldest(head);
    fixesSyncedCounter.increment();
  }

  public int getPendingCount() {
    return pendingBuffer.size();
  }

  public int getPendingCapacity() {
    return pendingBuffer.capacity();
  }

  public boolean isPendingBufferFull() {
    return pendingBuffer.isFull();
  }
}
