package com.atlas.journal.service;

import java.time.Instant;

import com.atlas.journal.dto.DwellStage;
import com.atlas.journal.dto.GeoPoint;
import com.atlas.journal.dto.LocationFix;
import com.atlas.journal.dto.MotionState;
import com.atlas.journal.dto.TrackingLifecycle;
import com.atlas.journal.dto.TrackingStatus;

/**
 * State of one tracking engagement, from {@code start} to {@code stop}.
 *
 * <p>Only the sampler writes to a session (through the ingest pipeline and dwell detector, all in
 * this package); fields are volatile so that status readers on other threads see the latest
 * values.
 */
public class TrackingSession {

    private final String tripId;

    private volatile TrackingLifecycle lifecycle = TrackingLifecycle.ACTIVE;
    private volatile MotionState currentActivity = MotionState.STATIONARY;
    private volatile LocationFix lastFix;
    private volatile long fixesCaptured;
    private volatile long currentIntervalMs;
    private volatile boolean batterySaverActive;

    // Dwell tracking
    private volatile DwellStage dwellStage = DwellStage.NONE;
    private volatile Instant dwellStartedAt;
    private volatile GeoPoint dwellAnchor;

    TrackingSession(String tripId, long initialIntervalMs) {
        this.tripId = tripId;
        this.currentIntervalMs = initialIntervalMs;
    }

    public String getTripId() { return tripId; }
    public TrackingLifecycle getLifecycle() { return lifecycle; }
    public MotionState getCurrentActivity() { return currentActivity; }
    public LocationFix getLastFix() { return lastFix; }
    public long getFixesCaptured() { return fixesCaptured; }
    public long getCurrentIntervalMs() { return currentIntervalMs; }
    public boolean isBatterySaverActive() { return batterySaverActive; }
    public DwellStage getDwellStage() { return dwellStage; }
    public Instant getDwellStartedAt() { return dwellStartedAt; }
    public GeoPoint getDwellAnchor() { return dwellAnchor; }

    public boolean isActive() {
        return lifecycle == TrackingLifecycle.ACTIVE;
    }

    void setLifecycle(TrackingLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    void recordFix(LocationFix fix) {
        this.lastFix = fix;
        this.currentActivity = fix.getActivity();
        this.fixesCaptured++;
    }

    void updateInterval(long intervalMs, boolean batterySaver) {
        this.currentIntervalMs = intervalMs;
        this.batterySaverActive = batterySaver;
    }

    void beginDwell(Instant startedAt, GeoPoint anchor) {
        this.dwellStartedAt = startedAt;
        this.dwellAnchor = anchor;
        this.dwellStage = DwellStage.NONE;
    }

    void advanceDwell(DwellStage stage) {
        this.dwellStage = stage;
    }

    void resetDwell() {
        this.dwellStage = DwellStage.NONE;
        this.dwellStartedAt = null;
        this.dwellAnchor = null;
    }

    TrackingStatus toStatus(int pendingFixes) {
        LocationFix fix = lastFix;
        return new TrackingStatus(
                lifecycle,
                tripId,
                currentActivity,
                dwellStage,
                dwellStartedAt,
                fix != null ? fix.getTimestamp() : null,
                fixesCaptured,
                currentIntervalMs,
                batterySaverActive,
                pendingFixes);
    }
}
