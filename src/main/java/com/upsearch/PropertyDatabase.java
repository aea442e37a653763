package com.upsearch;

import com.upsearch.config.ConnectionConfig;
import com.upsearch.config.SyncConfig;
import com.upsearch.loader.BatchLoader;
import com.upsearch.normalize.RecordNormalizer;
import com.upsearch.search.PropertySearchService;
import com.upsearch.search.SearchIndex;
import com.upsearch.source.ArchiveReader;
import com.upsearch.source.FileSourceFetcher;
import com.upsearch.source.HttpSourceFetcher;
import com.upsearch.source.SourceFetcher;
import com.upsearch.store.PropertyStore;
import com.upsearch.store.SchemaManager;
import com.upsearch.sync.SyncOrchestrator;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Open handle on one property database: the connection pool, the record store and its
 * search index. Every pipeline component is built from this handle; nothing is global.
 */
public class PropertyDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PropertyDatabase.class);

    private final HikariDataSource dataSource;
    private final PropertyStore store;
    private final SearchIndex searchIndex;

    private PropertyDatabase(HikariDataSource dataSource) {
        this.dataSource = dataSource;
        this.store = new PropertyStore(dataSource);
        this.searchIndex = new SearchIndex(dataSource, store);
    }

    /**
     * Opens the pool and creates the schema if it does not exist yet.
     */
    public static PropertyDatabase open(ConnectionConfig config) {
        log.info("Opening property database {}", config.getDatabasePath());
        HikariDataSource dataSource = config.createDataSource();
        try {
            new SchemaManager(dataSource).createSchema();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
        return new PropertyDatabase(dataSource);
    }

    /**
     * Opens a database that must already exist, for query-only callers.
     *
     * @throws IllegalArgumentException if there is no database file at the configured path
     */
    public static PropertyDatabase openExisting(ConnectionConfig config) {
        if (!Files.isRegularFile(Path.of(config.getDatabasePath()))) {
            throw new IllegalArgumentException("Database not found: " + config.getDatabasePath());
        }
        return open(config);
    }

    public static SourceFetcher createFetcher(SyncConfig config) {
        if (config.getSourceDirectory() != null) {
            return new FileSourceFetcher(Path.of(config.getSourceDirectory()));
        }
        return new HttpSourceFetcher(config.getBaseUrl(), Duration.ofSeconds(config.getFetchTimeoutSeconds()));
    }

    public BatchLoader createBatchLoader(int batchSize, BatchLoader.ProgressCallback progressCallback) {
        return new BatchLoader(dataSource, store, searchIndex, batchSize, progressCallback);
    }

    public SyncOrchestrator createOrchestrator(SourceFetcher fetcher, BatchLoader batchLoader) {
        return new SyncOrchestrator(fetcher, new ArchiveReader(), new RecordNormalizer(), batchLoader, searchIndex);
    }

    /**
     * Search service for query-only callers; it cannot trigger ingestion.
     */
    public PropertySearchService createReadOnlySearchService() {
        return new PropertySearchService(searchIndex, store);
    }

    public PropertySearchService createSearchService(SyncOrchestrator orchestrator) {
        return new PropertySearchService(searchIndex, store, orchestrator);
    }

    /**
     * Search service backed by HTTP or directory fetching as configured.
     */
    public PropertySearchService createSearchService(SyncConfig config, BatchLoader.ProgressCallback progressCallback) {
        BatchLoader loader = createBatchLoader(config.getBatchSize(), progressCallback);
        return createSearchService(createOrchestrator(createFetcher(config), loader));
    }

    public PropertyStore getStore() {
        return store;
    }

    public SearchIndex getSearchIndex() {
        return searchIndex;
    }

    public HikariDataSource getDataSource() {
        return dataSource;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
