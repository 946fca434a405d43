package com.atlas.journal.dto;

import java.time.Duration;
import java.time.Instant;

/**
 * Notification of a dwell transition, published to the step assignment collaborator so it can
 * infer step boundaries.
 *
 * @param tripId trip the session belongs to
 * @param kind transition that occurred
 * @param stageReached furthest stage the stationary period reached
 * @param startedAt timestamp of the first stationary fix of the period
 * @param observedAt timestamp of the fix that triggered the transition
 * @param location position of the first stationary fix
 */
public record DwellEvent(
    String tripId,
    Kind kind,
    DwellStage stageReached,
    Instant startedAt,
    Instant observedAt,
    GeoPoint location) {

  public enum Kind {
    VISIT_CANDIDATE,
    VISIT_CONFIRMED,
    VISIT_ENDED
  }

  public Duration duration() {
    return Duration.between(startedAt, observedAt);
  }
}
