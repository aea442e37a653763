package com.upsearch.source;

import com.upsearch.IngestionException;

/**
 * Thrown when an archive holds no table to read.
 */
public class ArchiveEmptyException extends IngestionException {

    public ArchiveEmptyException(String location) {
        super(location, "Archive contains no table: " + location);
    }
}
