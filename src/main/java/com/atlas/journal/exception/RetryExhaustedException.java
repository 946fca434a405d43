package com.atlas.journal.exception;

/**
 * Thrown when a sink delivery still fails after every permitted retry. The last failure is
 * available as the cause.
 */
public class RetryExhaustedException extends JournalEngineException {

    private final int attempts;

    public RetryExhaustedException(String message, int attempts, Throwable lastError) {
        super(message, lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public Throwable getLastError() {
        return getCause();
    }
}
