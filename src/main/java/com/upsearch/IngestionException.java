package com.upsearch;

/**
 * Base exception for failures on the ingestion path (fetch, archive, load, sync).
 * Each subclass carries the source location it was processing.
 */
public class IngestionException extends RuntimeException {

    private final String location;

    public IngestionException(String location, String message) {
        super(message);
        this.location = location;
    }

    public IngestionException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
