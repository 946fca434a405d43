package com.atlas.journal.exception;

/**
 * Base class for errors raised by the tracking and curation engines.
 */
public class JournalEngineException extends RuntimeException {

    public JournalEngineException(String message) {
        super(message);
    }

    public JournalEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
