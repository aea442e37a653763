package com.upsearch.config;

import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class SyncConfig {

    public static final String DEFAULT_BASE_URL = "https://dpupd.sco.ca.gov";

    /**
     * Archive lists published by the State Controller. The full dump and the
     * amount tiers overlap, so running COMPLETE exercises deduplication.
     */
    public enum SourceSet {
        ALL(List.of("00_All_Records.zip")),
        TIERS(List.of(
            "01_From_0_To_Below_10.zip",
            "02_From_10_To_Below_100.zip",
            "03_From_100_To_Below_500.zip",
            "04_From_500_To_Beyond.zip")),
        COMPLETE(List.of(
            "00_All_Records.zip",
            "01_From_0_To_Below_10.zip",
            "02_From_10_To_Below_100.zip",
            "03_From_100_To_Below_500.zip",
            "04_From_500_To_Beyond.zip"));

        private final List<String> locations;

        SourceSet(List<String> locations) {
            this.locations = locations;
        }

        public List<String> getLocations() {
            return locations;
        }
    }

    // Connection settings
    private ConnectionConfig connection = new ConnectionConfig();

    // Sources
    private String baseUrl = DEFAULT_BASE_URL;
    private String sourceDirectory; // when set, archives are read from disk instead of HTTP
    private SourceSet sourceSet = SourceSet.ALL;
    private List<String> locations = new ArrayList<>(); // empty means use sourceSet

    // Loading
    private int batchSize = 10_000;
    private int fetchTimeoutSeconds = 60;

    // Progress reporting
    private int progressInterval = 50_000;
    private boolean quiet = false;

    public SyncConfig() {
    }

    public static SyncConfig fromYaml(String filePath) throws IOException {
        Yaml yaml = new Yaml();
        try (InputStream input = new FileInputStream(filePath)) {
            Map<String, Object> data = yaml.load(input);
            return fromMap(data);
        }
    }

    @SuppressWarnings("unchecked")
    static SyncConfig fromMap(Map<String, Object> data) {
        SyncConfig config = new SyncConfig();
        if (data == null) {
            return config;
        }

        if (data.containsKey("connection")) {
            Map<String, Object> conn = (Map<String, Object>) data.get("connection");
            if (conn.containsKey("databasePath")) {
                config.connection.setDatabasePath((String) conn.get("databasePath"));
            }
            if (conn.containsKey("connectionPoolSize")) {
                config.connection.setConnectionPoolSize(((Number) conn.get("connectionPoolSize")).intValue());
            }
            if (conn.containsKey("busyTimeoutMs")) {
                config.connection.setBusyTimeoutMs(((Number) conn.get("busyTimeoutMs")).intValue());
            }
        }

        if (data.containsKey("sync")) {
            Map<String, Object> sync = (Map<String, Object>) data.get("sync");

            if (sync.containsKey("baseUrl")) {
                config.baseUrl = (String) sync.get("baseUrl");
            }
            if (sync.containsKey("sourceDirectory")) {
                config.sourceDirectory = (String) sync.get("sourceDirectory");
            }
            if (sync.containsKey("sourceSet")) {
                config.sourceSet = SourceSet.valueOf(((String) sync.get("sourceSet")).toUpperCase());
            }
            if (sync.containsKey("locations")) {
                config.locations = new ArrayList<>((List<String>) sync.get("locations"));
            }
            if (sync.containsKey("batchSize")) {
                config.setBatchSize(((Number) sync.get("batchSize")).intValue());
            }
            if (sync.containsKey("fetchTimeoutSeconds")) {
                config.setFetchTimeoutSeconds(((Number) sync.get("fetchTimeoutSeconds")).intValue());
            }
            if (sync.containsKey("progressInterval")) {
                config.progressInterval = ((Number) sync.get("progressInterval")).intValue();
            }
            if (sync.containsKey("quiet")) {
                config.quiet = (Boolean) sync.get("quiet");
            }
        }

        return config;
    }

    public List<String> getEffectiveLocations() {
        return locations.isEmpty() ? sourceSet.getLocations() : List.copyOf(locations);
    }

    // Getters and setters
    public ConnectionConfig getConnection() {
        return connection;
    }

    public void setConnection(ConnectionConfig connection) {
        this.connection = connection;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getSourceDirectory() {
        return sourceDirectory;
    }

    public void setSourceDirectory(String sourceDirectory) {
        this.sourceDirectory = sourceDirectory;
    }

    public SourceSet getSourceSet() {
        return sourceSet;
    }

    public void setSourceSet(SourceSet sourceSet) {
        this.sourceSet = sourceSet;
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = new ArrayList<>(locations);
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        this.batchSize = batchSize;
    }

    public int getFetchTimeoutSeconds() {
        return fetchTimeoutSeconds;
    }

    public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
        if (fetchTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Fetch timeout must be positive");
        }
        this.fetchTimeoutSeconds = fetchTimeoutSeconds;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public void setProgressInterval(int progressInterval) {
        this.progressInterval = progressInterval;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }
}
