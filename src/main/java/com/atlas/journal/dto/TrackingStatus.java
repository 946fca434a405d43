package com.atlas.journal.dto;

import java.time.Instant;

/**
 * Read-only snapshot of the tracking session.
 */
public record TrackingStatus(
    TrackingLifecycle lifecycle,
    String tripId,
    MotionState currentActivity,
    DwellStage dwellStage,
    Instant dwellStartedAt,
    Instant lastFixAt,
    long fixesCaptured,
    long currentIntervalMs,
    boolean batterySaverActive,
    int pendingFixes) {

  public static TrackingStatus stopped(int pendingFixes) {
    return new TrackingStatus(
        TrackingLifecycle.STOPPED, null, null, DwellStage.NONE, null, null, 0, 0, false,
        pendingFixes);
  }
}
