package com.atlas.journal.algorithm;

import org.springframework.stereotype.Component;

import com.atlas.journal.dto.MotionState;

/**
 * Maps an instantaneous speed to a motion state using fixed, non-overlapping bands.
 *
 * <pre>
 *   [0, 1.0)     STATIONARY
 *   [1.0, 2.0)   WALKING   (~7 km/h)
 *   [2.0, 20.0)  DRIVING   (~72 km/h)
 *   [20.0, 55.0) TRAIN     (~200 km/h)
 *   [55.0, ∞)    FLYING
 * </pre>
 *
 * <p>Each sample is classified on its own, without hysteresis, so noisy GPS near a band edge can
 * make consecutive fixes alternate between two states.
 */
@Component
public class ActivityClassifier {

  /** Speeds below this are treated as not moving (m/s). */
  public static final double STATIONARY_SPEED = 1.0;

  public static final double WALKING_SPEED = 2.0;
  public static final double DRIVING_SPEED = 20.0;
  public static final double FLYING_SPEED = 55.0;

  public MotionState classify(double speedMps) {
    if (speedMps < STATIONARY_SPEED) {
      return MotionState.STATIONARY;
    }
    if (speedMps < WALKING_SPEED) {
      return MotionState.WALKING;
    }
    if (speedMps < DRIVING_SPEED) {
      return MotionState.DRIVING;
    }
    if (speedMps < FLYING_SPEED) {
      return MotionState.TRAIN;
    }
    return MotionState.FLYING;
  }
}
