package com.atlas.journal.exception;

/**
 * Thrown when tracking is started without the location permission. Recoverable by requesting
 * the permission again and retrying the start.
 */
public class PermissionDeniedException extends JournalEngineException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
