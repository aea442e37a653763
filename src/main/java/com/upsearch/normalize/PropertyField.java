package com.upsearch.normalize;

import com.upsearch.source.RawRow;

import java.util.List;

/**
 * Logical fields of a source row, each with the header spellings it has been
 * published under. Aliases are tried in order and the first non-blank value wins.
 */
public enum PropertyField {
    PROPERTY_ID("PROPERTY_ID", "Property ID"),
    OWNER_NAME("OWNER_NAME", "Owner Name"),
    OWNER_FIRST_NAME("OWNER_FIRST_NAME", "Owner First Name"),
    OWNER_ADDRESS("OWNER_ADDRESS", "Owner Address"),
    OWNER_CITY("OWNER_CITY", "Owner City"),
    OWNER_STATE("OWNER_STATE", "Owner State"),
    OWNER_ZIP("OWNER_ZIP", "Owner Zip"),
    AMOUNT_REPORTED("AMOUNT_REPORTED", "Amount Reported"),
    CASH_REPORTED("CASH_REPORTED", "Cash Reported"),
    PROPERTY_TYPE("PROPERTY_TYPE", "Property Type"),
    HOLDER_NAME("HOLDER_NAME", "Holder Name"),
    HOLDER_ADDRESS("HOLDER_ADDRESS", "Holder Address"),
    REPORTED_DATE("REPORTED_DATE", "Reported Date");

    private final List<String> headers;

    PropertyField(String... headers) {
        this.headers = List.of(headers);
    }

    public List<String> getHeaders() {
        return headers;
    }

    /**
     * @return the trimmed value of the first alias present with a non-blank value, or ""
     */
    public String extract(RawRow row) {
        for (String header : headers) {
            String value = row.get(header);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }
}
