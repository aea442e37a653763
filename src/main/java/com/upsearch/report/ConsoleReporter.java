package com.upsearch.report;

import com.upsearch.config.SyncConfig;
import com.upsearch.loader.LoadMetrics;
import com.upsearch.model.PropertyRecord;
import com.upsearch.sync.SyncFailedException;
import com.upsearch.sync.SyncSummary;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Console reporter for sync runs and query results.
 */
public class ConsoleReporter {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String THIN_SEPARATOR = "-".repeat(80);
    private static final DateTimeFormatter DT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final boolean quiet;
    private final PrintStream out;

    public ConsoleReporter(boolean quiet) {
        this(quiet, System.out);
    }

    public ConsoleReporter(boolean quiet, PrintStream out) {
        this.quiet = quiet;
        this.out = out;
    }

    public void printSyncHeader(SyncConfig config, List<String> locations) {
        if (quiet) return;

        out.println();
        out.println(SEPARATOR);
        out.println("              Unclaimed Property Search - Data Sync");
        out.println(SEPARATOR);
        out.println();
        out.printf("Database:        %s%n", config.getConnection().getDatabasePath());
        out.printf("Source:          %s%n",
            config.getSourceDirectory() != null ? config.getSourceDirectory() : config.getBaseUrl());
        out.printf("Started:         %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println();
        out.println("Configuration:");
        out.printf("  Batch Size:      %,d%n", config.getBatchSize());
        out.printf("  Fetch Timeout:   %d s%n", config.getFetchTimeoutSeconds());
        out.println();
        out.println("Locations:");
        for (String location : locations) {
            out.printf("  %s%n", location);
        }
        out.println();
        out.println("Progress:");
    }

    public void printProgress(LoadMetrics metrics) {
        if (quiet) return;

        out.printf("\r  %-32s %,12d rows  %,12d new  %,12d dup  - %,.0f rows/sec",
            metrics.getLocation(), metrics.getProcessed(), metrics.getInserted(),
            metrics.getSkipped(), metrics.getThroughput());
    }

    public void printSyncResults(SyncSummary summary) {
        if (quiet) {
            printSyncResultsCompact(summary);
            return;
        }

        out.println();
        out.println();
        out.println(SEPARATOR);
        out.println("                           Results Summary");
        out.println(SEPARATOR);
        out.println();
        printLocationTable(summary);

        out.println();
        if (summary.getHealed() > 0) {
            out.printf("Index caught up: %,d rows from an earlier interrupted run%n", summary.getHealed());
        }
        out.printf("Completed:  %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println(SEPARATOR);
    }

    public void printSyncFailure(SyncFailedException failure) {
        out.println();
        out.println(SEPARATOR);
        out.println("                            SYNC FAILED");
        out.println(SEPARATOR);
        out.printf("Location:  %s%n", failure.getLocation());
        out.printf("Cause:     %s%n", failure.getCause() != null ? failure.getCause().getMessage() : failure.getMessage());
        out.println();
        out.println("Committed before the failure (safe to re-run with the same locations):");
        printLocationTable(failure.getCommittedSoFar());
        out.println(SEPARATOR);
    }

    private void printLocationTable(SyncSummary summary) {
        out.printf("%-32s %10s %10s %10s %10s %10s%n",
            "Location", "Inserted", "Skipped", "Dropped", "Rows/sec", "P95 Chunk");
        out.println(THIN_SEPARATOR);

        for (LoadMetrics m : summary.getLocations()) {
            out.printf("%-32s %,10d %,10d %,10d %,10.0f %7.1f ms%n",
                m.getLocation(),
                m.getInserted(),
                m.getSkipped(),
                m.getDropped(),
                m.getThroughput(),
                m.getP95LatencyMs());
        }

        out.println(THIN_SEPARATOR);
        out.printf("%-32s %,10d %,10d %,10d%n",
            "TOTAL", summary.getInserted(), summary.getSkipped(), summary.getDropped());
    }

    private void printSyncResultsCompact(SyncSummary summary) {
        out.printf("Processed %,d rows: %,d inserted, %,d skipped, %,d dropped%n",
            summary.getProcessed(), summary.getInserted(), summary.getSkipped(), summary.getDropped());
    }

    public void printSearchResults(String query, List<PropertyRecord> results) {
        if (!quiet) {
            out.printf("%d result(s) for '%s'%n", results.size(), query);
            out.println(THIN_SEPARATOR);
        }
        for (PropertyRecord r : results) {
            out.printf("%-14s %-32s %-20s %12s  %s%n",
                r.getPropertyId(),
                truncate(r.getOwnerName(), 32),
                truncate(r.getOwnerCity(), 20),
                r.getAmountReported().toPlainString(),
                truncate(r.getHolderName(), 40));
        }
    }

    public void printProperty(PropertyRecord r) {
        out.printf("Property ID:     %s%n", r.getPropertyId());
        out.printf("Owner:           %s%n", r.getOwnerName());
        out.printf("Address:         %s%n", r.getOwnerAddress());
        out.printf("                 %s %s %s%n", r.getOwnerCity(), r.getOwnerState(), r.getOwnerZip());
        out.printf("Amount Reported: %s%n", r.getAmountReported().toPlainString());
        out.printf("Cash Reported:   %s%n", r.getCashReported());
        out.printf("Property Type:   %s%n", r.getPropertyType());
        out.printf("Holder:          %s%n", r.getHolderName());
        out.printf("Holder Address:  %s%n", r.getHolderAddress());
        out.printf("Reported Date:   %s%n", r.getReportedDate());
    }

    public void printStatus(String databasePath, long records, long watermark, long maxSeq) {
        out.printf("Database:        %s%n", databasePath);
        out.printf("Records:         %,d%n", records);
        out.printf("Index Watermark: %,d%n", watermark);
        out.printf("Store Sequence:  %,d%n", maxSeq);
        out.printf("Index Lag:       %,d%n", maxSeq - watermark);
    }

    private static String truncate(String value, int width) {
        return value.length() <= width ? value : value.substring(0, width - 1) + "~";
    }
}
