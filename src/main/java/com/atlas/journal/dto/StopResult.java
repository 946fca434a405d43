package com.atlas.journal.dto;

/**
 * Result of stopping a tracking session.
 *
 * <p>{@code flushIncomplete} is a warning, not an error: the session is stopped either way and
 * the remaining fixes stay buffered for the next flush.
 */
public record StopResult(
    String tripId, int fixesFlushed, int fixesRemaining, boolean flushIncomplete) {}
