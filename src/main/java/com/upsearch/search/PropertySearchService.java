package com.upsearch.search;

import com.upsearch.model.PropertyRecord;
import com.upsearch.store.PropertyStore;
import com.upsearch.store.StoreException;
import com.upsearch.sync.SyncOrchestrator;
import com.upsearch.sync.SyncSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Query contract for request-handling layers: text search, lookup by id,
 * and triggering an ingestion run.
 *
 * <p>Reads are independent short transactions and may run while ingestion is in progress.
 */
public class PropertySearchService {

    private static final Logger log = LoggerFactory.getLogger(PropertySearchService.class);

    private final SearchIndex searchIndex;
    private final PropertyStore store;
    private final SyncOrchestrator orchestrator;

    public PropertySearchService(SearchIndex searchIndex, PropertyStore store) {
        this(searchIndex, store, null);
    }

    public PropertySearchService(SearchIndex searchIndex, PropertyStore store, SyncOrchestrator orchestrator) {
        this.searchIndex = searchIndex;
        this.store = store;
        this.orchestrator = orchestrator;
    }

    /**
     * @return matching records in relevance order; empty when nothing matches
     * @throws QueryTooShortException if the query is under two characters
     */
    public List<PropertyRecord> search(String query, int limit) {
        List<String> ids = searchIndex.query(query, limit);
        if (ids.isEmpty()) {
            return List.of();
        }
        try {
            return store.findByIds(ids);
        } catch (StoreException e) {
            throw new SearchException("Failed to load search results for '" + query + "'", e);
        }
    }

    /**
     * @throws PropertyNotFoundException if no record has this id
     */
    public PropertyRecord getById(String propertyId) {
        if (propertyId == null || propertyId.isBlank()) {
            throw new IllegalArgumentException("Property ID cannot be blank");
        }
        try {
            return store.findById(propertyId)
                .orElseThrow(() -> new PropertyNotFoundException(propertyId));
        } catch (StoreException e) {
            throw new SearchException("Lookup failed for property " + propertyId, e);
        }
    }

    /**
     * @throws com.upsearch.sync.SyncFailedException if the run aborts
     * @throws IllegalStateException if this service is read-only or a run is already in progress
     */
    public SyncSummary triggerIngestion(List<String> locations) {
        if (orchestrator == null) {
            throw new IllegalStateException("Ingestion is not available from a read-only search service");
        }
        log.info("Ingestion triggered for {}", locations);
        return orchestrator.run(locations);
    }
}
