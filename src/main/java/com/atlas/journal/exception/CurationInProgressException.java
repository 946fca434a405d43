package com.atlas.journal.exception;

/**
 * Thrown when a curation run is requested for a trip that is already being curated.
 */
public class CurationInProgressException extends JournalEngineException {

    public CurationInProgressException(String tripId) {
        super("Curation already in progress for trip " + tripId);
    }
}
