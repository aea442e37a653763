package com.upsearch.search;

import com.upsearch.store.PropertyStore;
import com.upsearch.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Full-text index over owner name, owner address, owner city and holder name,
 * backed by the SQLite FTS5 table {@code properties_fts}.
 *
 * <p>Index rows share their rowid with {@code properties.seq}. The watermark is the highest
 * indexed rowid, and {@link #extend(Connection)} appends every store row above it. Running
 * the extension twice therefore indexes nothing the second time, and running it after a
 * crash indexes exactly the rows the crash left behind.
 *
 * <p>Queries are tokenized into alphanumeric terms. Each term is quoted and the terms are
 * ANDed, so user input never reaches FTS5 query syntax. Results are ordered by bm25 rank,
 * then by store insertion order.
 */
public class SearchIndex {

    private static final Logger log = LoggerFactory.getLogger(SearchIndex.class);

    public static final int MIN_QUERY_LENGTH = 2;

    private static final String WATERMARK_SQL =
        "SELECT rowid FROM properties_fts ORDER BY rowid DESC LIMIT 1";

    private static final String EXTEND_SQL = """
        INSERT INTO properties_fts (rowid, owner_name, owner_address, owner_city, holder_name)
        SELECT seq, owner_name, owner_address, owner_city, holder_name
        FROM properties
        WHERE seq > ?
        ORDER BY seq
        """;

    private static final String QUERY_SQL = """
        SELECT p.property_id
        FROM (
            SELECT rowid AS seq, rank AS score
            FROM properties_fts
            WHERE properties_fts MATCH ?
            ORDER BY rank, rowid
            LIMIT ?
        ) m
        JOIN properties p ON p.seq = m.seq
        ORDER BY m.score, m.seq
        """;

    private final DataSource dataSource;
    private final PropertyStore store;

    public SearchIndex(DataSource dataSource, PropertyStore store) {
        this.dataSource = dataSource;
        this.store = store;
    }

    /**
     * Search the index.
     *
     * @param text free text; at least {@value #MIN_QUERY_LENGTH} characters after trimming
     * @param limit maximum number of ids to return
     * @return matching property ids, best match first; empty when nothing matches
     * @throws QueryTooShortException if the text is shorter than the minimum
     */
    public List<String> query(String text, int limit) {
        validateQueryParams(text, limit);

        String matchExpression = toMatchExpression(text);
        if (matchExpression.isEmpty()) {
            log.debug("Query '{}' has no searchable terms", text);
            return List.of();
        }

        log.debug("Executing index query: text='{}', match='{}', limit={}", text, matchExpression, limit);

        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(QUERY_SQL)) {
            stmt.setString(1, matchExpression);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            log.error("Index query failed: {}", e.getMessage(), e);
            throw new SearchException("Index query failed", e);
        }

        log.debug("Index query returned {} ids", ids.size());
        return ids;
    }

    /**
     * Appends all store rows above the watermark to the index, on the caller's connection
     * and inside the caller's transaction.
     *
     * @return number of rows indexed
     */
    public int extend(Connection conn) throws SQLException {
        long watermark = watermark(conn);
        try (PreparedStatement stmt = conn.prepareStatement(EXTEND_SQL)) {
            stmt.setLong(1, watermark);
            int indexed = stmt.executeUpdate();
            log.debug("Indexed {} rows above watermark {}", indexed, watermark);
            return indexed;
        }
    }

    /**
     * Runs {@link #extend(Connection)} in its own transaction.
     */
    public int extend() {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int indexed = extend(conn);
                conn.commit();
                return indexed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Index extension failed: " + e.getMessage(), e);
        }
    }

    /**
     * Brings the index level with the store. Called before ingestion so rows committed
     * by an interrupted earlier run do not stay unindexed.
     *
     * @return number of rows that were missing from the index
     */
    public int catchUp() {
        int indexed = extend();
        if (indexed > 0) {
            log.warn("Index was {} rows behind the store; caught up", indexed);
        }
        return indexed;
    }

    public long watermark() {
        try (Connection conn = dataSource.getConnection()) {
            return watermark(conn);
        } catch (SQLException e) {
            throw new StoreException("Failed to read index watermark", e);
        }
    }

    public long watermark(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(WATERMARK_SQL)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * @return number of store rows not yet covered by the index
     */
    public long lag() {
        return store.maxSeq() - watermark();
    }

    /**
     * Build an FTS5 MATCH expression from free text.
     * Example: {@code "O'Brien, Sacramento"} becomes {@code "O" "Brien" "Sacramento"}.
     */
    static String toMatchExpression(String text) {
        String[] terms = text.trim().split("[^\\p{L}\\p{N}]+");
        StringBuilder expression = new StringBuilder();
        for (String term : terms) {
            if (term.isEmpty()) {
                continue;
            }
            if (expression.length() > 0) {
                expression.append(' ');
            }
            expression.append('"').append(term).append('"');
        }
        return expression.toString();
    }

    private void validateQueryParams(String text, int limit) {
        if (text == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        if (text.trim().length() < MIN_QUERY_LENGTH) {
            throw new QueryTooShortException(text, MIN_QUERY_LENGTH);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
    }
}
