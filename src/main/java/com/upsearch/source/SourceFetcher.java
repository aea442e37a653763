package com.upsearch.source;

/**
 * Retrieves a named source archive as raw bytes.
 * Implementations do not retry; a failed fetch surfaces immediately.
 */
public interface SourceFetcher {

    /**
     * @param location archive location, relative to the fetcher's base or absolute
     * @return the archive bytes
     * @throws FetchFailedException if the archive cannot be retrieved
     */
    byte[] fetch(String location);
}
