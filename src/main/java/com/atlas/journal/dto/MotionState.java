package com.atlas.journal.dto;

/**
 * Discrete motion classification derived from the speed between two consecutive fixes.
 */
public enum MotionState {
    STATIONARY,
    WALKING,
    DRIVING,
    TRAIN,
    FLYING;

    public boolean isMoving() {
        return this != STATIONARY;
    }
}
