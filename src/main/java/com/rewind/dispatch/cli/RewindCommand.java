package com.rewind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Rewind.
 */
@Command(
        name = "rewind",
        mixinStandardHelpOptions = true,
        version = "Rewind 0.1.0",
        description = "Checkpoints, restores and forks AI coding sessions",
        subcommands = {
                CreateCommand.class,
                ListCommand.class,
                RestoreCommand.class,
                ForkCommand.class,
                DiffCommand.class,
                TimelineCommand.class,
                CleanupCommand.class,
                SettingsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RewindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
