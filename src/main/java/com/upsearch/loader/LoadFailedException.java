package com.upsearch.loader;

import com.upsearch.IngestionException;

/**
 * Thrown when a chunk cannot be committed. The store and index are left as they were at
 * the end of the last committed chunk, except that an {@link Phase#INDEX} failure leaves
 * the failing chunk's rows committed but unindexed until the next extension.
 */
public class LoadFailedException extends IngestionException {

    public enum Phase {
        /** Store insert rolled back; nothing from the chunk is visible. */
        STORE,
        /** Store insert committed; index extension rolled back. */
        INDEX
    }

    private final Phase phase;
    private final long chunkOffset;
    private final long insertedSoFar;
    private final long skippedSoFar;

    public LoadFailedException(String location, Phase phase, long chunkOffset,
                               long insertedSoFar, long skippedSoFar, Throwable cause) {
        super(location, String.format(
            "Load failed for %s in %s phase at chunk offset %,d (committed so far: %,d inserted, %,d skipped): %s",
            location, phase, chunkOffset, insertedSoFar, skippedSoFar, cause.getMessage()), cause);
        this.phase = phase;
        this.chunkOffset = chunkOffset;
        this.insertedSoFar = insertedSoFar;
        this.skippedSoFar = skippedSoFar;
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * @return number of records of this location consumed before the failing chunk
     */
    public long getChunkOffset() {
        return chunkOffset;
    }

    public long getInsertedSoFar() {
        return insertedSoFar;
    }

    public long getSkippedSoFar() {
        return skippedSoFar;
    }
}
