package com.upsearch.command;

import com.upsearch.PropertyDatabase;
import com.upsearch.config.ConnectionConfig;
import com.upsearch.report.ConsoleReporter;
import com.upsearch.search.PropertyNotFoundException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(
    name = "get",
    description = "Show the full record for a property ID",
    mixinStandardHelpOptions = true
)
public class GetCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Property ID")
    private String propertyId;

    @Option(names = {"-d", "--database"}, description = "SQLite database file", defaultValue = "data/unclaimed.db")
    private String databasePath;

    @Override
    public Integer call() {
        try (PropertyDatabase database = PropertyDatabase.openExisting(new ConnectionConfig(databasePath))) {
            new ConsoleReporter(false).printProperty(
                database.createReadOnlySearchService().getById(propertyId));
            return 0;
        } catch (PropertyNotFoundException e) {
            System.err.println(e.getMessage());
            return 2;
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
