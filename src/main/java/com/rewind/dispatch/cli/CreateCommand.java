package com.rewind.dispatch.cli;

import com.rewind.core.exception.CheckpointException;
import com.rewind.core.manager.CheckpointManager;
import com.rewind.core.manager.CheckpointManagerRegistry;
import com.rewind.core.model.CheckpointResult;
import com.rewind.core.transcript.SessionLogStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: rewind create -s &lt;session&gt; [-m description]
 * <p>
 * Loads the agent's session log (when present) and snapshots the working tree.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create a checkpoint")
@Component
public class CreateCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions session;

    @Option(names = {"-m", "--message"}, description = "Checkpoint description")
    private String description;

    @Option(names = {"--message-index"}, description = "Capture the session log only up to this line")
    private Integer messageIndex;

    private final CheckpointManagerRegistry registry;
    private final SessionLogStore sessionLogStore;

    public CreateCommand(CheckpointManagerRegistry registry, SessionLogStore sessionLogStore) {
        this.registry = registry;
        this.sessionLogStore = sessionLogStore;
    }

    @Override
    public Integer call() {
        try {
            CheckpointManager manager = session.open(registry);
            if (sessionLogStore.exists(manager.getProjectId(), manager.getSessionId())) {
                sessionLogStore.loadInto(manager, messageIndex);
            }
            CheckpointResult result = manager.createCheckpoint(description, null);
            ConsoleOutput.success("Created checkpoint " + result.checkpoint().id()
                    + " (" + result.filesProcessed() + " files, "
                    + ConsoleOutput.formatSize(result.checkpoint().metadata().snapshotSize()) + ")");
            result.warnings().forEach(ConsoleOutput::warn);
            return 0;
        } catch (CheckpointException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
