package com.upsearch.loader;

/**
 * Outcome of one committed chunk.
 *
 * @param inserted records newly added to the store
 * @param skipped  records whose id was already present
 * @param indexed  store rows added to the search index by this chunk's extension
 */
public record ChunkResult(int inserted, int skipped, int indexed) {

    public int size() {
        return inserted + skipped;
    }
}
