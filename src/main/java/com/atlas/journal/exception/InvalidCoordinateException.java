package com.atlas.journal.exception;

/**
 * Thrown when a latitude or longitude falls outside its valid range.
 */
public class InvalidCoordinateException extends JournalEngineException {

    private final double latitude;
    private final double longitude;

    public InvalidCoordinateException(double latitude, double longitude) {
        super(String.format("Invalid coordinate: latitude=%s, longitude=%s", latitude, longitude));
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }
}
