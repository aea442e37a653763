package com.upsearch.search;

public class QueryTooShortException extends SearchException {

    private final int minimumLength;

    public QueryTooShortException(String query, int minimumLength) {
        super("Query too short: '" + query + "' (minimum " + minimumLength + " characters)");
        this.minimumLength = minimumLength;
    }

    public int getMinimumLength() {
        return minimumLength;
    }
}
