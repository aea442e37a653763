package com.upsearch.support;

import com.upsearch.PropertyDatabase;
import com.upsearch.config.ConnectionConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Opens a file-backed property database under a JUnit temp directory.
 */
public final class TestDatabase {

    private TestDatabase() {
    }

    public static PropertyDatabase open(Path directory) {
        ConnectionConfig config = new ConnectionConfig(directory.resolve("unclaimed.db").toString());
        config.setBusyTimeoutMs(2000);
        return PropertyDatabase.open(config);
    }

    public static long indexRowCount(PropertyDatabase database) {
        return queryLong(database, "SELECT COUNT(*) FROM properties_fts");
    }

    public static long indexRowCount(PropertyDatabase database, long seq) {
        return queryLong(database, "SELECT COUNT(*) FROM properties_fts WHERE rowid = " + seq);
    }

    public static long seqOf(PropertyDatabase database, String propertyId) {
        return queryLong(database, "SELECT seq FROM properties WHERE property_id = '" + propertyId + "'");
    }

    private static long queryLong(PropertyDatabase database, String sql) {
        try (Connection conn = database.getDataSource().getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new IllegalStateException(sql, e);
        }
    }
}
