package com.upsearch.search;

/**
 * Exception thrown when a search or lookup fails.
 * Wraps underlying SQL exceptions; subclasses report caller-input problems.
 */
public class SearchException extends RuntimeException {

    public SearchException(String message) {
        super(message);
    }

    public SearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
