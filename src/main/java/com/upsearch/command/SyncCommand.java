package com.upsearch.command;

import com.upsearch.PropertyDatabase;
import com.upsearch.config.SyncConfig;
import com.upsearch.report.ConsoleReporter;
import com.upsearch.search.PropertySearchService;
import com.upsearch.sync.SyncFailedException;
import com.upsearch.sync.SyncSummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "sync",
    description = "Download source archives and load them into the database",
    mixinStandardHelpOptions = true
)
public class SyncCommand implements Callable<Integer> {

    @Option(names = {"-d", "--database"}, description = "SQLite database file")
    private String databasePath;

    @Option(names = {"-u", "--base-url"}, description = "Base URL of the source archives")
    private String baseUrl;

    @Option(names = {"-s", "--source-dir"}, description = "Read archives from this directory instead of downloading")
    private String sourceDirectory;

    @Option(names = {"-S", "--source-set"}, description = "Archive set: ALL, TIERS, COMPLETE")
    private SyncConfig.SourceSet sourceSet;

    @Parameters(description = "Archive locations (override the source set)", arity = "0..*")
    private List<String> locations;

    @Option(names = {"-b", "--batch-size"}, description = "Records per chunk")
    private Integer batchSize;

    @Option(names = {"-t", "--timeout"}, description = "Fetch timeout in seconds")
    private Integer fetchTimeoutSeconds;

    @Option(names = {"-f", "--config-file"}, description = "YAML configuration file")
    private String configFile;

    @Option(names = {"--dry-run"}, description = "Show what would be synced without syncing", defaultValue = "false")
    private boolean dryRun;

    @Option(names = {"-q", "--quiet"}, description = "Suppress progress output", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            SyncConfig config = buildConfig();
            List<String> effectiveLocations = config.getEffectiveLocations();

            if (dryRun) {
                printDryRun(config, effectiveLocations);
                return 0;
            }

            return executeSync(config, effectiveLocations);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private SyncConfig buildConfig() throws IOException {
        SyncConfig config = configFile != null ? SyncConfig.fromYaml(configFile) : new SyncConfig();

        // CLI options override config file
        if (databasePath != null) {
            config.getConnection().setDatabasePath(databasePath);
        }
        if (baseUrl != null) {
            config.setBaseUrl(baseUrl);
        }
        if (sourceDirectory != null) {
            config.setSourceDirectory(sourceDirectory);
        }
        if (sourceSet != null) {
            config.setSourceSet(sourceSet);
        }
        if (locations != null && !locations.isEmpty()) {
            config.setLocations(locations);
        }
        if (batchSize != null) {
            config.setBatchSize(batchSize);
        }
        if (fetchTimeoutSeconds != null) {
            config.setFetchTimeoutSeconds(fetchTimeoutSeconds);
        }
        if (quiet) {
            config.setQuiet(true);
        }
        return config;
    }

    private void printDryRun(SyncConfig config, List<String> effectiveLocations) {
        System.out.println("\n=== DRY RUN - No data will be loaded ===\n");
        System.out.printf("  Database:      %s%n", config.getConnection().getDatabasePath());
        System.out.printf("  Source:        %s%n",
            config.getSourceDirectory() != null ? config.getSourceDirectory() : config.getBaseUrl());
        System.out.printf("  Batch Size:    %,d%n", config.getBatchSize());
        System.out.printf("  Fetch Timeout: %d s%n", config.getFetchTimeoutSeconds());
        System.out.println("\nLocations:");
        for (String location : effectiveLocations) {
            System.out.printf("  %s%n", location);
        }
    }

    private int executeSync(SyncConfig config, List<String> effectiveLocations) {
        ConsoleReporter reporter = new ConsoleReporter(config.isQuiet());
        reporter.printSyncHeader(config, effectiveLocations);

        long progressInterval = Math.max(1, config.getProgressInterval());
        try (PropertyDatabase database = PropertyDatabase.open(config.getConnection())) {
            PropertySearchService service = database.createSearchService(config, (location, result, metrics) -> {
                if (metrics.getProcessed() % progressInterval < result.size()) {
                    reporter.printProgress(metrics);
                }
            });

            SyncSummary summary = service.triggerIngestion(effectiveLocations);
            reporter.printSyncResults(summary);
            return 0;
        } catch (SyncFailedException e) {
            reporter.printSyncFailure(e);
            return 1;
        }
    }
}
