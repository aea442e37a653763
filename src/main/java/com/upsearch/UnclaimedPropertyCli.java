package com.upsearch;

import com.upsearch.command.GetCommand;
import com.upsearch.command.SearchCommand;
import com.upsearch.command.StatusCommand;
import com.upsearch.command.SyncCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

@Command(
    name = "up-search",
    mixinStandardHelpOptions = true,
    version = "up-search 1.0.0",
    description = "Ingest and search California unclaimed property records",
    subcommands = {
        SyncCommand.class,
        SearchCommand.class,
        GetCommand.class,
        StatusCommand.class
    }
)
public class UnclaimedPropertyCli implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new UnclaimedPropertyCli())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
