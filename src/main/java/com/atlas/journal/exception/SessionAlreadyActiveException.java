package com.atlas.journal.exception;

import com.atlas.journal.dto.TrackingLifecycle;

/**
 * Thrown when tracking is started while a session is already active or paused.
 */
public class SessionAlreadyActiveException extends JournalEngineException {

    private final String tripId;

    public SessionAlreadyActiveException(String tripId, TrackingLifecycle lifecycle) {
        super("Tracking already " + lifecycle + " for trip " + tripId);
        this.tripId = tripId;
    }

    public String getTripId() {
        return tripId;
    }
}
