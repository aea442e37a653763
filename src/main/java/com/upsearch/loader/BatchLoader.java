package com.upsearch.loader;

import com.upsearch.model.PropertyRecord;
import com.upsearch.search.SearchIndex;
import com.upsearch.store.PropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Writes canonical records to the store in fixed-size chunks and keeps the search
 * index level with each committed chunk.
 *
 * <p>Per chunk, on one connection:
 * <ol>
 *   <li>insert-if-absent all records and commit;</li>
 *   <li>extend the index over every store row above its watermark and commit.</li>
 * </ol>
 * Chunks run strictly in sequence because step 2 reads the watermark left by the previous
 * chunk. Step 2 is derived from store state alone, so repeating a chunk after a failure in
 * either step converges on the same store and index contents.
 */
public class BatchLoader {

    private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

    public static final int DEFAULT_BATCH_SIZE = 10_000;

    private final DataSource dataSource;
    private final PropertyStore store;
    private final SearchIndex searchIndex;
    private final int batchSize;
    private final ProgressCallback progressCallback;

    public interface ProgressCallback {
        void onChunk(String location, ChunkResult result, LoadMetrics metrics);
    }

    public BatchLoader(DataSource dataSource, PropertyStore store, SearchIndex searchIndex, int batchSize) {
        this(dataSource, store, searchIndex, batchSize, null);
    }

    public BatchLoader(DataSource dataSource,
                       PropertyStore store,
                       SearchIndex searchIndex,
                       int batchSize,
                       ProgressCallback progressCallback) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        this.dataSource = dataSource;
        this.store = store;
        this.searchIndex = searchIndex;
        this.batchSize = batchSize;
        this.progressCallback = progressCallback;
    }

    /**
     * Load one chunk.
     *
     * @throws LoadFailedException if either the store commit or the index extension fails
     */
    public ChunkResult loadBatch(List<PropertyRecord> records) {
        return writeChunk("(batch)", 0, records, 0, 0);
    }

    /**
     * Load a whole record stream, consuming it lazily {@code batchSize} records at a time.
     *
     * @param location source name, for metrics and failure context
     * @param records  single-pass record stream
     * @return metrics for this location
     * @throws LoadFailedException if a chunk fails; earlier chunks stay committed
     */
    public LoadMetrics load(String location, Iterator<PropertyRecord> records) {
        LoadMetrics metrics = new LoadMetrics(location);
        load(location, records, metrics);
        return metrics;
    }

    /**
     * Variant of {@link #load(String, Iterator)} that records into caller-owned metrics, so
     * counts already committed are still visible to the caller when a chunk fails.
     */
    public void load(String location, Iterator<PropertyRecord> records, LoadMetrics metrics) {
        log.info("Loading {} in chunks of {}", location, batchSize);
        metrics.start();

        List<PropertyRecord> chunk = new ArrayList<>(batchSize);
        long offset = 0;
        try {
            while (records.hasNext()) {
                chunk.add(records.next());
                if (chunk.size() >= batchSize) {
                    loadChunk(location, offset, chunk, metrics);
                    offset += chunk.size();
                    chunk = new ArrayList<>(batchSize);
                }
            }

            // Write any remaining records
            if (!chunk.isEmpty()) {
                loadChunk(location, offset, chunk, metrics);
            }
        } finally {
            metrics.complete();
        }

        log.info("Completed loading {}: {} inserted, {} skipped, {} indexed in {}ms",
            location, metrics.getInserted(), metrics.getSkipped(), metrics.getIndexed(),
            metrics.getElapsedTimeMs());
    }

    private void loadChunk(String location, long offset, List<PropertyRecord> chunk, LoadMetrics metrics) {
        long startNanos = System.nanoTime();
        ChunkResult result = writeChunk(location, offset, chunk, metrics.getInserted(), metrics.getSkipped());
        long latencyMicros = (System.nanoTime() - startNanos) / 1000;
        metrics.recordChunk(result, latencyMicros);

        log.debug("Chunk at offset {} of {}: {} inserted, {} skipped, {} indexed ({} us)",
            offset, location, result.inserted(), result.skipped(), result.indexed(), latencyMicros);

        if (progressCallback != null) {
            progressCallback.onChunk(location, result, metrics);
        }
    }

    private ChunkResult writeChunk(String location, long offset, List<PropertyRecord> records,
                                   long insertedSoFar, long skippedSoFar) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);

            int inserted;
            try {
                inserted = store.insertIfAbsent(conn, records);
                conn.commit();
            } catch (SQLException e) {
                rollback(conn, e);
                log.error("Store commit failed for chunk at offset {} of {}: {}", offset, location, e.getMessage());
                throw new LoadFailedException(location, LoadFailedException.Phase.STORE, offset,
                    insertedSoFar, skippedSoFar, e);
            }

            int indexed;
            try {
                indexed = searchIndex.extend(conn);
                conn.commit();
            } catch (SQLException e) {
                rollback(conn, e);
                log.error("Index extension failed after committing chunk at offset {} of {}: {}",
                    offset, location, e.getMessage());
                throw new LoadFailedException(location, LoadFailedException.Phase.INDEX, offset,
                    insertedSoFar + inserted, skippedSoFar + records.size() - inserted, e);
            }

            return new ChunkResult(inserted, records.size() - inserted, indexed);
        } catch (SQLException e) {
            throw new LoadFailedException(location, LoadFailedException.Phase.STORE, offset,
                insertedSoFar, skippedSoFar, e);
        }
    }

    private static void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    public int getBatchSize() {
        return batchSize;
    }
}
