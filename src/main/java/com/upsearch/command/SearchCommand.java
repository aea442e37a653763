package com.upsearch.command;

import com.upsearch.PropertyDatabase;
import com.upsearch.config.ConnectionConfig;
import com.upsearch.model.PropertyRecord;
import com.upsearch.report.ConsoleReporter;
import com.upsearch.search.QueryTooShortException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "search",
    description = "Search properties by owner name, address, city or holder",
    mixinStandardHelpOptions = true
)
public class SearchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Search text (at least 2 characters)")
    private String query;

    @Option(names = {"-d", "--database"}, description = "SQLite database file", defaultValue = "data/unclaimed.db")
    private String databasePath;

    @Option(names = {"-l", "--limit"}, description = "Maximum results", defaultValue = "50")
    private int limit;

    @Option(names = {"-q", "--quiet"}, description = "Print result rows only", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        ConsoleReporter reporter = new ConsoleReporter(quiet);
        try (PropertyDatabase database = PropertyDatabase.openExisting(new ConnectionConfig(databasePath))) {
            List<PropertyRecord> results = database.createReadOnlySearchService().search(query, limit);
            reporter.printSearchResults(query, results);
            return 0;
        } catch (QueryTooShortException e) {
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
