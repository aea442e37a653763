package com.upsearch.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the record store table and its full-text index table.
 *
 * <p>{@code properties.seq} is the store-assigned row sequence; {@code properties_fts}
 * keeps its own copy of the searchable columns under {@code rowid = seq}, so its highest
 * rowid is the index watermark. All statements are idempotent.
 */
public class SchemaManager {

    private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

    static final String CREATE_PROPERTIES = """
        CREATE TABLE IF NOT EXISTS properties (
            seq             INTEGER PRIMARY KEY AUTOINCREMENT,
            property_id     TEXT NOT NULL UNIQUE,
            owner_name      TEXT NOT NULL DEFAULT '',
            owner_address   TEXT NOT NULL DEFAULT '',
            owner_city      TEXT NOT NULL DEFAULT '',
            owner_state     TEXT NOT NULL DEFAULT '',
            owner_zip       TEXT NOT NULL DEFAULT '',
            amount_reported TEXT NOT NULL DEFAULT '0',
            cash_reported   TEXT NOT NULL DEFAULT '',
            property_type   TEXT NOT NULL DEFAULT '',
            holder_name     TEXT NOT NULL DEFAULT '',
            holder_address  TEXT NOT NULL DEFAULT '',
            reported_date   TEXT NOT NULL DEFAULT '',
            raw_payload     TEXT NOT NULL DEFAULT ''
        )
        """;

    static final String CREATE_PROPERTIES_FTS = """
        CREATE VIRTUAL TABLE IF NOT EXISTS properties_fts USING fts5(
            owner_name, owner_address, owner_city, holder_name
        )
        """;

    private final DataSource dataSource;

    public SchemaManager(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void createSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {

            // WAL lets readers run alongside the single ingestion writer
            try (ResultSet rs = stmt.executeQuery("PRAGMA journal_mode = WAL")) {
                if (rs.next()) {
                    log.debug("Journal mode: {}", rs.getString(1));
                }
            }
            stmt.executeUpdate(CREATE_PROPERTIES);
            stmt.executeUpdate(CREATE_PROPERTIES_FTS);
            log.info("Schema ready (properties, properties_fts)");
        } catch (SQLException e) {
            throw new StoreException("Failed to create schema: " + e.getMessage(), e);
        }
    }
}
