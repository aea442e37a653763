package com.upsearch.store;

import com.upsearch.model.PropertyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary store of property records, keyed by {@code property_id}.
 *
 * <p>Records are only ever inserted, never updated or deleted. Inserts use
 * insert-if-absent semantics so the first committed version of an id wins.
 * Reads each borrow their own pooled connection and commit independently.
 */
public class PropertyStore {

    private static final Logger log = LoggerFactory.getLogger(PropertyStore.class);

    private static final String INSERT_SQL = """
        INSERT OR IGNORE INTO properties (
            property_id, owner_name, owner_address, owner_city, owner_state, owner_zip,
            amount_reported, cash_reported, property_type, holder_name, holder_address,
            reported_date, raw_payload)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String SELECT_COLUMNS = """
        SELECT property_id, owner_name, owner_address, owner_city, owner_state, owner_zip,
               amount_reported, cash_reported, property_type, holder_name, holder_address,
               reported_date, raw_payload
        FROM properties
        """;

    // SQLite's default host parameter limit is 999
    private static final int MAX_IN_CLAUSE = 500;

    private final DataSource dataSource;

    public PropertyStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Inserts every record whose id is not already present, on the caller's connection
     * and inside the caller's transaction. Duplicates, including duplicates within
     * {@code records}, are ignored in favour of the earlier row.
     *
     * @return number of rows newly inserted
     */
    public int insertIfAbsent(Connection conn, List<PropertyRecord> records) throws SQLException {
        if (records.isEmpty()) {
            return 0;
        }
        long seqBefore = maxSeq(conn);

        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            for (PropertyRecord record : records) {
                stmt.setString(1, record.getPropertyId());
                stmt.setString(2, record.getOwnerName());
                stmt.setString(3, record.getOwnerAddress());
                stmt.setString(4, record.getOwnerCity());
                stmt.setString(5, record.getOwnerState());
                stmt.setString(6, record.getOwnerZip());
                stmt.setString(7, record.getAmountReported().toPlainString());
                stmt.setString(8, record.getCashReported());
                stmt.setString(9, record.getPropertyType());
                stmt.setString(10, record.getHolderName());
                stmt.setString(11, record.getHolderAddress());
                stmt.setString(12, record.getReportedDate());
                stmt.setString(13, record.getRawPayload());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }

        // seq is AUTOINCREMENT and there is a single writer, so new rows are exactly those above seqBefore
        try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM properties WHERE seq > ?")) {
            stmt.setLong(1, seqBefore);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    public Optional<PropertyRecord> findById(String propertyId) {
        String sql = SELECT_COLUMNS + " WHERE property_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, propertyId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Lookup failed for property " + propertyId, e);
        }
    }

    /**
     * Fetches several records at once. The result follows the order of {@code propertyIds};
     * ids with no stored record are left out.
     */
    public List<PropertyRecord> findByIds(List<String> propertyIds) {
        if (propertyIds.isEmpty()) {
            return Collections.emptyList();
        }

        Map<String, PropertyRecord> found = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection()) {
            for (int from = 0; from < propertyIds.size(); from += MAX_IN_CLAUSE) {
                List<String> slice = propertyIds.subList(from, Math.min(from + MAX_IN_CLAUSE, propertyIds.size()));
                String placeholders = String.join(", ", Collections.nCopies(slice.size(), "?"));
                String sql = SELECT_COLUMNS + " WHERE property_id IN (" + placeholders + ")";

                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    for (int i = 0; i < slice.size(); i++) {
                        stmt.setString(i + 1, slice.get(i));
                    }
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            PropertyRecord record = mapRow(rs);
                            found.put(record.getPropertyId(), record);
                        }
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Batch lookup failed for " + propertyIds.size() + " properties", e);
        }

        List<PropertyRecord> ordered = new ArrayList<>(propertyIds.size());
        for (String id : propertyIds) {
            PropertyRecord record = found.get(id);
            if (record != null) {
                ordered.add(record);
            }
        }
        log.debug("Hydrated {} of {} properties", ordered.size(), propertyIds.size());
        return ordered;
    }

    public long count() {
        return queryLong("SELECT COUNT(*) FROM properties");
    }

    public long maxSeq() {
        return queryLong("SELECT IFNULL(MAX(seq), 0) FROM properties");
    }

    public long maxSeq(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT IFNULL(MAX(seq), 0) FROM properties")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private long queryLong(String sql) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + sql, e);
        }
    }

    private static PropertyRecord mapRow(ResultSet rs) throws SQLException {
        return PropertyRecord.builder(rs.getString("property_id"))
            .ownerName(rs.getString("owner_name"))
            .ownerAddress(rs.getString("owner_address"))
            .ownerCity(rs.getString("owner_city"))
            .ownerState(rs.getString("owner_state"))
            .ownerZip(rs.getString("owner_zip"))
            .amountReported(new BigDecimal(rs.getString("amount_reported")))
            .cashReported(rs.getString("cash_reported"))
            .propertyType(rs.getString("property_type"))
            .holderName(rs.getString("holder_name"))
            .holderAddress(rs.getString("holder_address"))
            .reportedDate(rs.getString("reported_date"))
            .rawPayload(rs.getString("raw_payload"))
            .build();
    }

    public DataSource getDataSource() {
        return dataSource;
    }
}
