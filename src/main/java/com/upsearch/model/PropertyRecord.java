package com.upsearch.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One unclaimed-property entry in canonical form.
 *
 * <p>{@code propertyId} is the sole identity. All other text fields default to the
 * empty string, and {@code amountReported} defaults to zero.
 */
public final class PropertyRecord {

    private final String propertyId;
    private final String ownerName;
    private final String ownerAddress;
    private final String ownerCity;
    private final String ownerState;
    private final String ownerZip;
    private final BigDecimal amountReported;
    private final String cashReported;
    private final String propertyType;
    private final String holderName;
    private final String holderAddress;
    private final String reportedDate;
    private final String rawPayload;

    private PropertyRecord(Builder builder) {
        if (builder.propertyId == null || builder.propertyId.isBlank()) {
            throw new IllegalArgumentException("Property ID cannot be blank");
        }
        this.propertyId = builder.propertyId;
        this.ownerName = nullToEmpty(builder.ownerName);
        this.ownerAddress = nullToEmpty(builder.ownerAddress);
        this.ownerCity = nullToEmpty(builder.ownerCity);
        this.ownerState = nullToEmpty(builder.ownerState);
        this.ownerZip = nullToEmpty(builder.ownerZip);
        this.amountReported = builder.amountReported != null ? builder.amountReported : BigDecimal.ZERO;
        this.cashReported = nullToEmpty(builder.cashReported);
        this.propertyType = nullToEmpty(builder.propertyType);
        this.holderName = nullToEmpty(builder.holderName);
        this.holderAddress = nullToEmpty(builder.holderAddress);
        this.reportedDate = nullToEmpty(builder.reportedDate);
        this.rawPayload = nullToEmpty(builder.rawPayload);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    public static Builder builder(String propertyId) {
        return new Builder().propertyId(propertyId);
    }

    public String getPropertyId() {
        return propertyId;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public String getOwnerAddress() {
        return ownerAddress;
    }

    public String getOwnerCity() {
        return ownerCity;
    }

    public String getOwnerState() {
        return ownerState;
    }

    public String getOwnerZip() {
        return ownerZip;
    }

    public BigDecimal getAmountReported() {
        return amountReported;
    }

    public String getCashReported() {
        return cashReported;
    }

    public String getPropertyType() {
        return propertyType;
    }

    public String getHolderName() {
        return holderName;
    }

    public String getHolderAddress() {
        return holderAddress;
    }

    public String getReportedDate() {
        return reportedDate;
    }

    public String getRawPayload() {
        return rawPayload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyRecord)) return false;
        PropertyRecord that = (PropertyRecord) o;
        return propertyId.equals(that.propertyId)
            && ownerName.equals(that.ownerName)
            && ownerAddress.equals(that.ownerAddress)
            && ownerCity.equals(that.ownerCity)
            && ownerState.equals(that.ownerState)
            && ownerZip.equals(that.ownerZip)
            && amountReported.compareTo(that.amountReported) == 0
            && cashReported.equals(that.cashReported)
            && propertyType.equals(that.propertyType)
            && holderName.equals(that.holderName)
            && holderAddress.equals(that.holderAddress)
            && reportedDate.equals(that.reportedDate)
            && rawPayload.equals(that.rawPayload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propertyId, ownerName, ownerAddress, ownerCity, ownerState, ownerZip,
            amountReported.stripTrailingZeros(), cashReported, propertyType, holderName,
            holderAddress, reportedDate, rawPayload);
    }

    @Override
    public String toString() {
        return "PropertyRecord{" +
                "propertyId='" + propertyId + '\'' +
                ", ownerName='" + ownerName + '\'' +
                ", ownerCity='" + ownerCity + '\'' +
                ", amountReported=" + amountReported +
                ", holderName='" + holderName + '\'' +
                '}';
    }

    public static final class Builder {
        private String propertyId;
        private String ownerName;
        private String ownerAddress;
        private String ownerCity;
        private String ownerState;
        private String ownerZip;
        private BigDecimal amountReported;
        private String cashReported;
        private String propertyType;
        private String holderName;
        private String holderAddress;
        private String reportedDate;
        private String rawPayload;

        private Builder() {
        }

        public Builder propertyId(String propertyId) {
            this.propertyId = propertyId;
            return this;
        }

        public Builder ownerName(String ownerName) {
            this.ownerName = ownerName;
            return this;
        }

        public Builder ownerAddress(String ownerAddress) {
            this.ownerAddress = ownerAddress;
            return this;
        }

        public Builder ownerCity(String ownerCity) {
            this.ownerCity = ownerCity;
            return this;
        }

        public Builder ownerState(String ownerState) {
            this.ownerState = ownerState;
            return this;
        }

        public Builder ownerZip(String ownerZip) {
            this.ownerZip = ownerZip;
            return this;
        }

        public Builder amountReported(BigDecimal amountReported) {
            this.amountReported = amountReported;
            return this;
        }

        public Builder cashReported(String cashReported) {
            this.cashReported = cashReported;
            return this;
        }

        public Builder propertyType(String propertyType) {
            this.propertyType = propertyType;
            return this;
        }

        public Builder holderName(String holderName) {
            this.holderName = holderName;
            return this;
        }

        public Builder holderAddress(String holderAddress) {
            this.holderAddress = holderAddress;
            return this;
        }

        public Builder reportedDate(String reportedDate) {
            this.reportedDate = reportedDate;
            return this;
        }

        public Builder rawPayload(String rawPayload) {
            this.rawPayload = rawPayload;
            return this;
        }

        public PropertyRecord build() {
            return new PropertyRecord(this);
        }
    }
}
