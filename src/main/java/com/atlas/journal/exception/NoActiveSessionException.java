package com.atlas.journal.exception;

/**
 * Thrown when a lifecycle transition needs a tracking session and none exists.
 */
public class NoActiveSessionException extends JournalEngineException {

    public NoActiveSessionException(String message) {
        super(message);
    }
}
