package com.upsearch.command;

import com.upsearch.PropertyDatabase;
import com.upsearch.config.ConnectionConfig;
import com.upsearch.report.ConsoleReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "status",
    description = "Show record count and index watermark",
    mixinStandardHelpOptions = true
)
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"-d", "--database"}, description = "SQLite database file", defaultValue = "data/unclaimed.db")
    private String databasePath;

    @Override
    public Integer call() {
        try (PropertyDatabase database = PropertyDatabase.openExisting(new ConnectionConfig(databasePath))) {
            new ConsoleReporter(false).printStatus(databasePath,
                database.getStore().count(),
                database.getSearchIndex().watermark(),
                database.getStore().maxSeq());
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
