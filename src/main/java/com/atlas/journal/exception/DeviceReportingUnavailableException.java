package com.atlas.journal.exception;

/**
 * Thrown when the device reports location or permission over REST but the tracker reads from a
 * different location capability.
 */
public class DeviceReportingUnavailableException extends JournalEngineException {

    public DeviceReportingUnavailableException(String message) {
        super(message);
    }
}
