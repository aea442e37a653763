package com.upsearch.normalize;

import com.upsearch.model.PropertyRecord;
import com.upsearch.source.RawRow;
import org.bson.Document;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Maps raw source rows to canonical {@link PropertyRecord}s.
 *
 * <p>Normalization never fails a row: missing text fields become empty, and an amount
 * that does not parse becomes zero. A row without any id-bearing value yields
 * {@link Optional#empty()} and is dropped by the caller. The mapping is stateless, so a
 * single instance may be shared.
 */
public class RecordNormalizer {

    // widest amount kept: 30 integer digits, 100 fractional digits
    private static final int MAX_INTEGER_DIGITS = 30;
    private static final int MAX_SCALE = 100;

    public Optional<PropertyRecord> normalize(RawRow row) {
        String propertyId = PropertyField.PROPERTY_ID.extract(row);
        if (propertyId.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(PropertyRecord.builder(propertyId)
            .ownerName(ownerName(row))
            .ownerAddress(PropertyField.OWNER_ADDRESS.extract(row))
            .ownerCity(PropertyField.OWNER_CITY.extract(row))
            .ownerState(PropertyField.OWNER_STATE.extract(row))
            .ownerZip(PropertyField.OWNER_ZIP.extract(row))
            .amountReported(parseAmount(PropertyField.AMOUNT_REPORTED.extract(row)))
            .cashReported(PropertyField.CASH_REPORTED.extract(row))
            .propertyType(PropertyField.PROPERTY_TYPE.extract(row))
            .holderName(PropertyField.HOLDER_NAME.extract(row))
            .holderAddress(PropertyField.HOLDER_ADDRESS.extract(row))
            .reportedDate(PropertyField.REPORTED_DATE.extract(row))
            .rawPayload(new Document(row.asMap()).toJson())
            .build());
    }

    /**
     * The source publishes the owner's last (or business) name and first name in
     * separate columns; they are indexed together as one name.
     */
    private static String ownerName(RawRow row) {
        String name = PropertyField.OWNER_NAME.extract(row);
        String firstName = PropertyField.OWNER_FIRST_NAME.extract(row);
        if (firstName.isEmpty()) {
            return name;
        }
        return name.isEmpty() ? firstName : name + " " + firstName;
    }

    /**
     * Parses a reported amount; anything blank, unparsable or out of range becomes zero.
     */
    static BigDecimal parseAmount(String value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        String cleaned = value.replaceAll("[$,\\s]", "");
        if (cleaned.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
        if (amount.scale() > MAX_SCALE || (long) amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            return BigDecimal.ZERO;
        }
        return amount;
    }
}
