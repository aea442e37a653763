package com.upsearch.source;

import com.upsearch.IngestionException;

/**
 * Thrown when a source archive cannot be retrieved or read.
 * Wraps the underlying transport or I/O exception.
 */
public class FetchFailedException extends IngestionException {

    public FetchFailedException(String location, String message) {
        super(location, message);
    }

    public FetchFailedException(String location, String message, Throwable cause) {
        super(location, message, cause);
    }
}
