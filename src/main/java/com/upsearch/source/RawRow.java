package com.upsearch.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One untyped source row: header name to cell value, in header order.
 */
public final class RawRow {

    private final long recordNumber;
    private final Map<String, String> values;

    public RawRow(long recordNumber, Map<String, String> values) {
        this.recordNumber = recordNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @return the cell under {@code header}, or null when the header is absent
     */
    public String get(String header) {
        return values.get(header);
    }

    public long getRecordNumber() {
        return recordNumber;
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "RawRow{recordNumber=" + recordNumber + ", values=" + values + '}';
    }
}
