package com.upsearch.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.nio.file.Path;

public class ConnectionConfig {

    private String databasePath = "data/unclaimed.db";
    private int connectionPoolSize = 4;
    private int connectionTimeoutMs = 30000;
    private int busyTimeoutMs = 10000;

    public ConnectionConfig() {
    }

    public ConnectionConfig(String databasePath) {
        this.databasePath = databasePath;
    }

    /**
     * Creates a pooled data source over the SQLite file.
     * Every pooled connection waits up to {@code busyTimeoutMs} for the writer lock
     * instead of failing immediately with SQLITE_BUSY.
     */
    public HikariDataSource createDataSource() {
        Path parent = Path.of(databasePath).toAbsolutePath().getParent();
        if (parent != null) {
            parent.toFile().mkdirs();
        }

        HikariConfig config = new HikariConfig();
        config.setPoolName("up-search");
        config.setJdbcUrl(getJdbcUrl());
        config.setMaximumPoolSize(connectionPoolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(connectionTimeoutMs);
        config.setConnectionInitSql("PRAGMA busy_timeout = " + busyTimeoutMs);
        config.addDataSourceProperty("journal_mode", "WAL");
        // writer lock is taken at BEGIN; a competing writer waits out busy_timeout
        config.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        return new HikariDataSource(config);
    }

    public String getJdbcUrl() {
        return "jdbc:sqlite:" + databasePath;
    }

    // Getters and setters
    public String getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    public int getConnectionPoolSize() {
        return connectionPoolSize;
    }

    public void setConnectionPoolSize(int connectionPoolSize) {
        this.connectionPoolSize = connectionPoolSize;
    }

    public int getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public void setConnectionTimeoutMs(int connectionTimeoutMs) {
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }
}
