package com.upsearch.source;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single-pass, forward-only sequence of raw rows from one archive table.
 * It cannot be rewound; re-reading requires opening the archive again.
 */
public class RowSource implements Iterator<RawRow>, AutoCloseable {

    private final String location;
    private final String tableName;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;

    RowSource(String location, String tableName, CSVParser parser) {
        this.location = location;
        this.tableName = tableName;
        this.parser = parser;
        this.records = parser.iterator();
    }

    @Override
    public boolean hasNext() {
        try {
            return records.hasNext();
        } catch (UncheckedIOException | IllegalStateException e) {
            throw readFailure(e);
        }
    }

    @Override
    public RawRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows in " + tableName);
        }
        try {
            CSVRecord record = records.next();
            return new RawRow(record.getRecordNumber(), record.toMap());
        } catch (UncheckedIOException | IllegalStateException e) {
            throw readFailure(e);
        }
    }

    private FetchFailedException readFailure(RuntimeException e) {
        return new FetchFailedException(location,
            "Failed reading " + tableName + " after record " + parser.getRecordNumber() + ": " + e.getMessage(), e);
    }

    public String getLocation() {
        return location;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close " + tableName, e);
        }
    }
}
