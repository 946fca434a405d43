package com.atlas.journal.dto;

/**
 * How far a stationary period has progressed towards a visit.
 *
 * <ul>
 *   <li>{@link #NONE}: not stationary, or stationary for less than the short-stop threshold
 *   <li>{@link #CANDIDATE}: stationary for at least the short-stop threshold
 *   <li>{@link #CONFIRMED}: stationary for at least the minimum dwell time
 * </ul>
 */
public enum DwellStage {
    NONE,
    CANDIDATE,
    CONFIRMED
}
