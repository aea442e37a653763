package com.upsearch.sync;

import com.upsearch.IngestionException;
import com.upsearch.loader.BatchLoader;
import com.upsearch.loader.LoadFailedException;
import com.upsearch.loader.LoadMetrics;
import com.upsearch.model.PropertyRecord;
import com.upsearch.normalize.RecordNormalizer;
import com.upsearch.search.SearchIndex;
import com.upsearch.source.ArchiveReader;
import com.upsearch.source.RawRow;
import com.upsearch.source.RowSource;
import com.upsearch.source.SourceFetcher;
import com.upsearch.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one ingestion run: fetch each location, stream its table through the
 * normalizer, and load it chunk by chunk.
 *
 * <p>A run may be repeated any number of times, including after a failure part way
 * through: already stored ids are skipped and the index is first caught up with the
 * store. Runs are serialized; a second concurrent {@link #run} fails fast.
 */
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final SourceFetcher fetcher;
    private final ArchiveReader archiveReader;
    private final RecordNormalizer normalizer;
    private final BatchLoader batchLoader;
    private final SearchIndex searchIndex;
    private final ReentrantLock runLock = new ReentrantLock();

    public SyncOrchestrator(SourceFetcher fetcher,
                            ArchiveReader archiveReader,
                            RecordNormalizer normalizer,
                            BatchLoader batchLoader,
                            SearchIndex searchIndex) {
        this.fetcher = fetcher;
        this.archiveReader = archiveReader;
        this.normalizer = normalizer;
        this.batchLoader = batchLoader;
        this.searchIndex = searchIndex;
    }

    /**
     * Ingest the given locations in order, each one fully before the next.
     *
     * @throws SyncFailedException if any location fails; earlier chunks stay committed
     * @throws IllegalStateException if another run is in progress
     */
    public SyncSummary run(List<String> locations) {
        if (!runLock.tryLock()) {
            throw new IllegalStateException("An ingestion run is already in progress");
        }
        try {
            return doRun(locations);
        } finally {
            runLock.unlock();
        }
    }

    private SyncSummary doRun(List<String> locations) {
        SyncSummary summary = new SyncSummary();
        log.info("Starting sync of {} location(s): {}", locations.size(), locations);

        try {
            summary.setHealed(searchIndex.catchUp());
        } catch (StoreException e) {
            log.error("Index catch-up failed: {}", e.getMessage(), e);
            throw new SyncFailedException("(index catch-up)", summary, e);
        }

        for (String location : locations) {
            LoadMetrics metrics = new LoadMetrics(location);
            try {
                syncLocation(location, metrics);
                summary.addLocation(metrics);
            } catch (LoadFailedException e) {
                summary.addFailedLocation(metrics, e);
                log.error("Sync aborted at {}: {}", location, e.getMessage());
                throw new SyncFailedException(location, summary, e);
            } catch (IngestionException e) {
                summary.addLocation(metrics);
                log.error("Sync aborted at {}: {}", location, e.getMessage());
                throw new SyncFailedException(location, summary, e);
            }
        }

        log.info("Sync complete: {}", summary);
        return summary;
    }

    private void syncLocation(String location, LoadMetrics metrics) {
        byte[] archive = fetcher.fetch(location);
        try (RowSource rows = archiveReader.openFirstTable(location, archive)) {
            batchLoader.load(location, new NormalizingIterator(rows, normalizer, metrics), metrics);
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    /**
     * Lazily normalizes rows, dropping those without a property id.
     */
    private static final class NormalizingIterator implements Iterator<PropertyRecord> {

        private final RowSource rows;
        private final RecordNormalizer normalizer;
        private final LoadMetrics metrics;
        private PropertyRecord next;

        NormalizingIterator(RowSource rows, RecordNormalizer normalizer, LoadMetrics metrics) {
            this.rows = rows;
            this.normalizer = normalizer;
            this.metrics = metrics;
        }

        @Override
        public boolean hasNext() {
            while (next == null && rows.hasNext()) {
                RawRow row = rows.next();
                Optional<PropertyRecord> record = normalizer.normalize(row);
                if (record.isPresent()) {
                    next = record.get();
                } else {
                    metrics.recordDropped();
                    log.debug("Dropped record {} of {}: no property id", row.getRecordNumber(), rows.getLocation());
                }
            }
            return next != null;
        }

        @Override
        public PropertyRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            PropertyRecord record = next;
            next = null;
            return record;
        }
    }
}
