package com.rewind.dispatch.cli;

import com.rewind.core.exception.CheckpointException;
import com.rewind.core.manager.CheckpointManagerRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Delete all but the newest checkpoints")
@Component
public class CleanupCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions session;

    @Option(names = {"-k", "--keep"}, defaultValue = "10", description = "Checkpoints to keep (default: ${DEFAULT-VALUE})")
    private int keep;

    private final CheckpointManagerRegistry registry;

    public CleanupCommand(CheckpointManagerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        try {
            int removed = session.open(registry).cleanupOldCheckpoints(keep);
            ConsoleOutput.success("Removed " + removed + " checkpoint" + (removed != 1 ? "s" : ""));
            return 0;
        } catch (CheckpointException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
