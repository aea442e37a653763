package com.upsearch.sync;

import com.upsearch.loader.LoadFailedException;
import com.upsearch.loader.LoadMetrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Totals of one ingestion run. {@code processed} counts every source row read,
 * so {@code processed == inserted + skipped + dropped}.
 */
public class SyncSummary {

    private final List<LoadMetrics> locations = new ArrayList<>();
    private long inserted;
    private long skipped;
    private long dropped;
    private long healed;

    void addLocation(LoadMetrics metrics) {
        locations.add(metrics);
        inserted += metrics.getInserted();
        skipped += metrics.getSkipped();
        dropped += metrics.getDropped();
    }

    /**
     * Adds a location whose load stopped part way. The failure knows about a chunk that
     * reached the store before its index step failed; the metrics do not.
     */
    void addFailedLocation(LoadMetrics metrics, LoadFailedException failure) {
        locations.add(metrics);
        inserted += failure.getInsertedSoFar();
        skipped += failure.getSkippedSoFar();
        dropped += metrics.getDropped();
    }

    void setHealed(long healed) {
        this.healed = healed;
    }

    public long getProcessed() {
        return inserted + skipped + dropped;
    }

    public long getInserted() {
        return inserted;
    }

    public long getSkipped() {
        return skipped;
    }

    public long getDropped() {
        return dropped;
    }

    /**
     * @return rows left unindexed by an earlier interrupted run and indexed at the start of this one
     */
    public long getHealed() {
        return healed;
    }

    public List<LoadMetrics> getLocations() {
        return Collections.unmodifiableList(locations);
    }

    @Override
    public String toString() {
        return "SyncSummary{" +
                "processed=" + getProcessed() +
                ", inserted=" + inserted +
                ", skipped=" + skipped +
                ", dropped=" + dropped +
                ", healed=" + healed +
                ", locations=" + locations.size() +
                '}';
    }
}
