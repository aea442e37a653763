package com.upsearch.search;

public class PropertyNotFoundException extends SearchException {

    private final String propertyId;

    public PropertyNotFoundException(String propertyId) {
        super("Property not found: " + propertyId);
        this.propertyId = propertyId;
    }

    public String getPropertyId() {
        return propertyId;
    }
}
