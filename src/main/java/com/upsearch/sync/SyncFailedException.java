package com.upsearch.sync;

import com.upsearch.IngestionException;

/**
 * Thrown when an ingestion run aborts. Carries the failing location and everything
 * committed before the failure, so the run can be retried safely with the same locations.
 */
public class SyncFailedException extends IngestionException {

    private final SyncSummary committedSoFar;

    public SyncFailedException(String location, SyncSummary committedSoFar, Throwable cause) {
        super(location, "Sync failed at " + location + " after " + committedSoFar.getInserted()
            + " inserted / " + committedSoFar.getSkipped() + " skipped: " + cause.getMessage(), cause);
        this.committedSoFar = committedSoFar;
    }

    public SyncSummary getCommittedSoFar() {
        return committedSoFar;
    }
}
