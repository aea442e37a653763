package com.upsearch.store;

/**
 * Exception thrown when a record store operation fails.
 * Wraps the underlying SQL exception.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
