package com.upsearch.loader;

import org.HdrHistogram.Histogram;

import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collection for loading one source location.
 * Counters are safe to read from a progress thread while the loader writes.
 */
public class LoadMetrics {

    private final String location;
    private final LongAdder inserted = new LongAdder();
    private final LongAdder skipped = new LongAdder();
    private final LongAdder indexed = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final LongAdder chunksCompleted = new LongAdder();
    private final Histogram chunkLatencyHistogram;

    private volatile long startTimeNanos;
    private volatile long endTimeNanos;

    public LoadMetrics(String location) {
        this.location = location;
        // Histogram for latencies from 1 microsecond to 10 minutes with 3 significant digits
        this.chunkLatencyHistogram = new Histogram(1, 600_000_000, 3);
    }

    public void start() {
        this.startTimeNanos = System.nanoTime();
    }

    public void complete() {
        this.endTimeNanos = System.nanoTime();
    }

    public void recordChunk(ChunkResult result, long latencyMicros) {
        inserted.add(result.inserted());
        skipped.add(result.skipped());
        indexed.add(result.indexed());
        chunksCompleted.increment();
        synchronized (chunkLatencyHistogram) {
            chunkLatencyHistogram.recordValue(Math.max(1, latencyMicros));
        }
    }

    public void recordDropped() {
        dropped.increment();
    }

    public String getLocation() {
        return location;
    }

    public long getInserted() {
        return inserted.sum();
    }

    public long getSkipped() {
        return skipped.sum();
    }

    public long getIndexed() {
        return indexed.sum();
    }

    public long getDropped() {
        return dropped.sum();
    }

    /**
     * @return rows read from the source, including rows dropped for lacking an id
     */
    public long getProcessed() {
        return getInserted() + getSkipped() + getDropped();
    }

    public long getChunksCompleted() {
        return chunksCompleted.sum();
    }

    public long getElapsedTimeMs() {
        if (startTimeNanos == 0) return 0;
        long end = endTimeNanos > 0 ? endTimeNanos : System.nanoTime();
        return (end - startTimeNanos) / 1_000_000;
    }

    public double getThroughput() {
        long elapsedMs = getElapsedTimeMs();
        if (elapsedMs == 0) return 0;
        return (getProcessed() * 1000.0) / elapsedMs;
    }

    public double getAvgLatencyMs() {
        synchronized (chunkLatencyHistogram) {
            return chunkLatencyHistogram.getMean() / 1000.0;
        }
    }

    public double getMaxLatencyMs() {
        synchronized (chunkLatencyHistogram) {
            return chunkLatencyHistogram.getMaxValue() / 1000.0;
        }
    }

    public double getPercentileLatencyMs(double percentile) {
        synchronized (chunkLatencyHistogram) {
            return chunkLatencyHistogram.getValueAtPercentile(percentile) / 1000.0;
        }
    }

    public double getP50LatencyMs() {
        return getPercentileLatencyMs(50.0);
    }

    public double getP95LatencyMs() {
        return getPercentileLatencyMs(95.0);
    }

    @Override
    public String toString() {
        return String.format(
            "LoadMetrics{location=%s, inserted=%d, skipped=%d, dropped=%d, indexed=%d, chunks=%d, " +
                "elapsed=%dms, throughput=%.1f/sec, avgChunk=%.2fms, p95=%.2fms}",
            location, getInserted(), getSkipped(), getDropped(), getIndexed(), getChunksCompleted(),
            getElapsedTimeMs(), getThroughput(), getAvgLatencyMs(), getP95LatencyMs());
    }
}
