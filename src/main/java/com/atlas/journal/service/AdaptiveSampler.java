package com.atlas.journal.service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import com.atlas.journal.client.LocationCapability;
import com.atlas.journal.client.StepAssignmentClient;
import com.atlas.journal.config.properties.TrackingConfigurationProperties;
import com.atlas.journal.dto.DwellEvent;
import com.atlas.journal.dto.FlushReport;
import com.atlas.journal.dto.LocationFix;
import com.atlas.journal.dto.MotionState;
import com.atlas.journal.dto.RawLocationSample;
import com.atlas.journal.dto.SamplingProfile;
import com.atlas.journal.dto.StopResult;
import com.atlas.journal.dto.TrackingLifecycle;
import com.atlas.journal.dto.TrackingStatus;
import com.atlas.journal.exception.InvalidCoordinateException;
import com.atlas.journal.exception.NoActiveSessionException;
import com.atlas.journal.exception.PermissionDeniedException;
import com.atlas.journal.exception.RetryExhaustedException;
import com.atlas.journal.exception.SessionAlreadyActiveException;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracking lifecycle state machine and sampling cadence.
 *
 * <pre>
 *   STOPPED --start--> ACTIVE --pause--> PAUSED --resume--> ACTIVE
 *   ACTIVE | PAUSED --stop--> STOPPED
 * </pre>
 *
 * <p><strong>Sampling:</strong> every wake-up runs one capture, ingest, dwell and cadence cycle,
 * and the next wake-up is scheduled only when that cycle has finished. Moving activities are
 * sampled every {@code activeIntervalMs}, STATIONARY every {@code stationaryIntervalMs}; a battery
 * level below {@code batterySaverThreshold} forces the stationary interval regardless of activity.
 *
 * <p><strong>Concurrency:</strong> ticks run on a single-thread scheduler and hold the lifecycle
 * lock for the whole cycle. Lifecycle calls take the same lock, cancel the pending tick and bump a
 * tick generation, so a tick that was already queued when the session was paused or stopped sees a
 * stale generation and does nothing. The session has a single writer.
 *
 * <p><strong>Backpressure:</strong> a sample refused because the pending buffer is full and the
 * sink is down is held in a single slot. The held sample is re-ingested before any new sample is
 * taken from the device, on the next tick, sync or stop, so arrival order is kept and nothing is
 * dropped.
 *
 * <p><strong>Sync:</strong> while a session exists the pending buffer is flushed every
 * {@code syncIntervalMs}. {@link #stop()} interrupts a tick stuck in a sink backoff, makes a final
 * flush on the flush executor and spends at most {@code flushTimeoutMs} in total waiting for the
 * lock and the flush.
 */
@Slf4j
@Service
public class AdaptiveSampler {

    private final LocationCapability locationCapability;
    private final LocationIngestPipeline ingestPipeline;
    private final DwellDetector dwellDetector;
    private final StepAssignmentClient stepAssignmentClient;
    private final TrackingConfigurationProperties config;
    private final TaskScheduler taskScheduler;
    private final AsyncTaskExecutor flushExecutor;
    private final Clock clock;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicLong tickGeneration = new AtomicLong();
    private final AtomicReference<HeldSample> heldSample = new AtomicReference<>();

    private volatile TrackingSession session;
    private volatile Thread tickThread;
    private volatile ScheduledFuture<?> tickFuture;
    private volatile ScheduledFuture<?> syncFuture;

    /** A sample refused under backpressure, kept with the session it was captured for. */
    private record HeldSample(TrackingSession session, RawLocationSample sample) {}

    public AdaptiveSampler(
            LocationCapability locationCapability,
            LocationIngestPipeline ingestPipeline,
            DwellDetector dwellDetector,
            StepAssignmentClient stepAssignmentClient,
            TrackingConfigurationProperties config,
            @Qualifier("trackingTaskScheduler") TaskScheduler taskScheduler,
            @Qualifier("journalFlushExecutor") AsyncTaskExecutor flushExecutor,
            Clock clock) {
        this.locationCapability = locationCapability;
        this.ingestPipeline = ingestPipeline;
        this.dwellDetector = dwellDetector;
        this.stepAssignmentClient = stepAssignmentClient;
        this.config = config;
        this.taskScheduler = taskScheduler;
        this.flushExecutor = flushExecutor;
        this.clock = clock;
    }

    // ==================== Lifecycle ====================

    /**
     * Starts tracking a trip: captures a first fix immediately and starts the periodic sync.
     *
     * @throws PermissionDeniedException when location permission is not granted
     * @throws SessionAlreadyActiveException when a session is already running
     */
    public TrackingStatus start(String tripId) {
        lifecycleLock.lock();
        try {
            if (session != null) {
                throw new SessionAlreadyActiveException(session.getTripId(), session.getLifecycle());
            }
            if (!locationCapability.hasPermission()) {
                log.warn("Cannot start tracking for trip {}: location permission not granted", tripId);
                throw new PermissionDeniedException("Location permission not granted");
            }

            // A new session has no fix yet, so it starts on the stationary cadence
            TrackingSession started =
                    new TrackingSession(tripId, computeInterval(MotionState.STATIONARY, null));
            session = started;
            tickGeneration.incrementAndGet();
            applyProfile(started);
            log.info("Tracking started for trip {}", tripId);

            captureCycle(started);
            scheduleNextTick(started);
            cancelSync();
            syncFuture = taskScheduler.scheduleWithFixedDelay(
                    this::syncPending,
                    clock.instant().plusMillis(config.syncIntervalMs()),
                    Duration.ofMillis(config.syncIntervalMs()));

            return started.toStatus(pendingBacklog());
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Suspends sampling. The session keeps its last fix and activity; pausing twice is a no-op.
     *
     * @throws NoActiveSessionException when nothing is being tracked
     */
    public TrackingStatus pause() {
        lifecycleLock.lock();
        try {
            TrackingSession current = requireSession("pause");
            if (current.getLifecycle() == TrackingLifecycle.PAUSED) {
                return current.toStatus(pendingBacklog());
            }
            cancelTick();
            current.setLifecycle(TrackingLifecycle.PAUSED);
            log.info("Tracking paused for trip {}", current.getTripId());
            return current.toStatus(pendingBacklog());
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Resumes sampling with an immediate capture. Resuming an active session is a no-op.
     *
     * @throws NoActiveSessionException when nothing is being tracked
     */
    public TrackingStatus resume() {
        lifecycleLock.lock();
        try {
            TrackingSession current = requireSession("resume");
            if (current.getLifecycle() == TrackingLifecycle.ACTIVE) {
                return current.toStatus(pendingBacklog());
            }
            current.setLifecycle(TrackingLifecycle.ACTIVE);
            tickGeneration.incrementAndGet();
            log.info("Tracking resumed for trip {}", current.getTripId());

            captureCycle(current);
            scheduleNextTick(current);
            return current.toStatus(pendingBacklog());
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops tracking: cancels the timers, flushes the pending buffer and discards the session.
     *
     * <p>The session ends even when the flush cannot drain the buffer; in that case the result is
     * flagged {@code flushIncomplete} and the remaining fixes stay queued for the next flush. The
     * whole call waits at most {@code flushTimeoutMs} for the lifecycle lock and the flush
     * together. A tick blocked in a sink backoff is interrupted; its sample is held, not lost.
     *
     * @throws NoActiveSessionException when nothing is being tracked
     */
    public StopResult stop() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.flushTimeoutMs());
        interruptInFlightTick();

        if (!acquireLifecycleLock(deadline)) {
            return stopWithoutFlush();
        }
        try {
            TrackingSession current = requireSession("stop");
            cancelTick();
            cancelSync();

            int backlogBefore = pendingBacklog();
            FlushReport report = flushWithTimeout(current.getTripId(), deadline);
            int remaining = pendingBacklog();
            boolean incomplete = report == null || !report.isComplete() || remaining > 0;
            int flushed = Math.max(0, backlogBefore - remaining);

            current.setLifecycle(TrackingLifecycle.STOPPED);
            session = null;

            if (incomplete) {
                log.warn("Tracking stopped for trip {} with incomplete flush: {} fixes still pending",
                        current.getTripId(), remaining);
            } else {
                log.info("Tracking stopped for trip {}: {} fixes flushed", current.getTripId(), flushed);
            }
            return new StopResult(current.getTripId(), flushed, remaining, incomplete);
        } finally {
            lifecycleLock.unlock();
        }
    }

    public TrackingStatus getStatus() {
        TrackingSession current = session;
        if (current == null) {
            return TrackingStatus.stopped(pendingBacklog());
        }
        return current.toStatus(pendingBacklog());
    }

    public Optional<TrackingSession> getCurrentSession() {
        return Optional.ofNullable(session);
    }

    /**
     * Sampling interval for the given activity and battery level.
     */
    public long computeInterval(MotionState activity, Double batteryLevel) {
        if (isBatterySaver(batteryLevel)) {
            return config.stationaryIntervalMs();
        }
        return activity.isMoving() ? config.activeIntervalMs() : config.stationaryIntervalMs();
    }

    @PreDestroy
    public void shutdown() {
        if (session != null) {
            log.info("Stopping tracking for trip {} on shutdown", session.getTripId());
            stop();
        }
    }

    /**
     * Fixes waiting for the sink: the pending buffer plus a held sample, if any.
     */
    public int pendingBacklog() {
        return ingestPipeline.getPendingCount() + (heldSample.get() != null ? 1 : 0);
    }

    // ==================== Sampling cycle ====================

    private void onTick(long generation) {
        lifecycleLock.lock();
        tickThread = Thread.currentThread();
        TrackingSession current = session;
        try {
            if (generation != tickGeneration.get() || current == null || !current.isActive()) {
                log.debug("Skipping stale tick (generation {})", generation);
                return;
            }
            captureCycle(current);
            scheduleNextTickIfCurrent(generation, current);
        } catch (RuntimeException e) {
            log.error("Tracking tick failed for generation {}", generation, e);
            scheduleNextTickIfCurrent(generation, current);
        } finally {
            tickThread = null;
            if (generation != tickGeneration.get()) {
                // An interrupt from stop() was meant for this tick only
                Thread.interrupted();
            }
            lifecycleLock.unlock();
        }
    }

    private void scheduleNextTickIfCurrent(long generation, TrackingSession current) {
        if (current != null && current == session && current.isActive()
                && generation == tickGeneration.get()) {
            scheduleNextTick(current);
        }
    }

    private void captureCycle(TrackingSession current) {
        if (!ingestHeldSample(true)) {
            log.debug("Held sample for trip {} still waiting for the sink, skipping capture",
                    current.getTripId());
            return;
        }

        Optional<RawLocationSample> sample = locationCapability.getCurrentFix();
        if (sample.isEmpty()) {
            log.debug("No location available for trip {}", current.getTripId());
            return;
        }

        LocationFix fix = ingestOrHold(current, sample.get());
        if (fix != null) {
            onFixRecorded(current, fix);
        }
    }

    private LocationFix ingestOrHold(TrackingSession current, RawLocationSample sample) {
        try {
            return ingestPipeline.ingest(current, sample);
        } catch (InvalidCoordinateException e) {
            log.warn("Discarding fix for trip {}: {}", current.getTripId(), e.getMessage());
            return null;
        } catch (RetryExhaustedException e) {
            heldSample.set(new HeldSample(current, sample));
            log.warn("Holding fix from {} for trip {}: pending buffer full and sink unavailable",
                    sample.timestamp(), current.getTripId());
            return null;
        }
    }

    /**
     * Re-ingests the held sample, if any.
     *
     * @param process run dwell detection and cadence for the fix when its session is still active
     * @return {@code true} when no sample is held any more
     */
    private boolean ingestHeldSample(boolean process) {
        HeldSample held = heldSample.get();
        if (held == null) {
            return true;
        }
        LocationFix fix;
        try {
            fix = ingestPipeline.ingest(held.session(), held.sample());
        } catch (RetryExhaustedException e) {
            log.debug("Held fix for trip {} still refused: {}", held.session().getTripId(), e.getMessage());
            return false;
        }
        heldSample.compareAndSet(held, null);
        log.info("Held fix from {} accepted for trip {}", held.sample().timestamp(), held.session().getTripId());

        if (process && held.session() == session && held.session().isActive()) {
            onFixRecorded(held.session(), fix);
        }
        return true;
    }

    private void onFixRecorded(TrackingSession current, LocationFix fix) {
        dwellDetector.evaluate(current, fix).ifPresent(this::publishDwellEvent);
        adjustCadence(current, fix);
    }

    private void adjustCadence(TrackingSession current, LocationFix fix) {
        long interval = computeInterval(fix.getActivity(), fix.getBatteryLevel());
        boolean batterySaver = isBatterySaver(fix.getBatteryLevel());
        if (interval == current.getCurrentIntervalMs() && batterySaver == current.isBatterySaverActive()) {
            return;
        }
        current.updateInterval(interval, batterySaver);
        log.info("Sampling interval for trip {} now {}ms ({}, batterySaver={})",
                current.getTripId(), interval, fix.getActivity(), batterySaver);
        applyProfile(current);
    }

    private boolean isBatterySaver(Double batteryLevel) {
        return batteryLevel != null && batteryLevel < config.batterySaverThreshold();
    }

    private void applyProfile(TrackingSession current) {
        locationCapability.applyProfile(new SamplingProfile(
                current.getCurrentIntervalMs(),
                config.minDisplacementM(),
                config.stationaryRadiusM(),
                config.shortStopMs(),
                current.isBatterySaverActive()));
    }

    private void publishDwellEvent(DwellEvent event) {
        try {
            stepAssignmentClient.onDwellEvent(event);
        } catch (RuntimeException e) {
            log.warn("Step assignment rejected dwell event {} for trip {}: {}",
                    event.kind(), event.tripId(), e.getMessage());
        }
    }

    private void scheduleNextTick(TrackingSession current) {
        long generation = tickGeneration.get();
        tickFuture = taskScheduler.schedule(
                () -> onTick(generation),
                clock.instant().plusMillis(current.getCurrentIntervalMs()));
    }

    private void cancelTick() {
        tickGeneration.incrementAndGet();
        ScheduledFuture<?> future = tickFuture;
        if (future != null) {
            future.cancel(false);
            tickFuture = null;
        }
    }

    private void cancelSync() {
        ScheduledFuture<?> future = syncFuture;
        if (future != null) {
            future.cancel(false);
            syncFuture = null;
        }
    }

    // ==================== Stop ====================

    private void interruptInFlightTick() {
        tickGeneration.incrementAndGet();
        Thread inFlight = tickThread;
        if (inFlight != null && inFlight != Thread.currentThread()) {
            log.debug("Interrupting in-flight tick on {}", inFlight.getName());
            inFlight.interrupt();
        }
    }

    private boolean acquireLifecycleLock(long deadline) {
        try {
            return lifecycleLock.tryLock(remainingNanos(deadline), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Ends the session when the lifecycle lock could not be taken in time. Nothing is flushed; the
     * pending fixes stay queued for the next flush.
     */
    private StopResult stopWithoutFlush() {
        TrackingSession current = requireSession("stop");
        cancelTick();
        cancelSync();
        current.setLifecycle(TrackingLifecycle.STOPPED);
        session = null;

        int remaining = pendingBacklog();
        log.warn("Tracking stopped for trip {} without a flush: lifecycle busy for more than {}ms, "
                + "{} fixes still pending", current.getTripId(), config.flushTimeoutMs(), remaining);
        return new StopResult(current.getTripId(), 0, remaining, true);
    }

    private static long remainingNanos(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    // ==================== Sync ====================

    private void syncPending() {
        if (session == null) {
            return;
        }
        if (heldSample.get() != null && lifecycleLock.tryLock()) {
            try {
                ingestHeldSample(true);
            } finally {
                lifecycleLock.unlock();
            }
        }
        if (ingestPipeline.getPendingCount() == 0) {
            return;
        }
        FlushReport report = ingestPipeline.flushPending();
        log.debug("Periodic sync delivered {} fixes, {} remaining", report.delivered(), report.remaining());
    }

    private FlushReport flushWithTimeout(String tripId, long deadline) {
        Future<FlushReport> flush;
        try {
            flush = flushExecutor.submit(() -> {
                ingestHeldSample(false);
                return ingestPipeline.flushPending();
            });
        } catch (RejectedExecutionException e) {
            log.warn("Flush for trip {} could not be scheduled: {}", tripId, e.getMessage());
            return null;
        }

        try {
            return flush.get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            flush.cancel(true);
            log.warn("Flush for trip {} did not finish within {}ms and was cancelled",
                    tripId, config.flushTimeoutMs());
        } catch (ExecutionException e) {
            log.warn("Flush for trip {} failed: {}", tripId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            flush.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for flush of trip {}", tripId);
        }
        return null;
    }

    private TrackingSession requireSession(String operation) {
        TrackingSession current = session;
        if (current == null) {
            throw new NoActiveSessionException("Cannot " + operation + ": no tracking session");
        }
        return current;
    }
}
