package com.rewind.dispatch.cli;

import com.rewind.core.exception.CheckpointException;
import com.rewind.core.manager.CheckpointManager;
import com.rewind.core.manager.CheckpointManagerRegistry;
import com.rewind.core.model.CheckpointResult;
import com.rewind.core.transcript.SessionLogStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: rewind restore -s &lt;session&gt; &lt;checkpoint-id&gt;
 * <p>
 * Rewrites the working tree, and the agent's session log when one exists.
 */
@Command(name = "restore", mixinStandardHelpOptions = true, description = "Restore a checkpoint")
@Component
public class RestoreCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions session;

    @Parameters(index = "0", description = "Checkpoint ID")
    private String checkpointId;

    private final CheckpointManagerRegistry registry;
    private final SessionLogStore sessionLogStore;

    public RestoreCommand(CheckpointManagerRegistry registry, SessionLogStore sessionLogStore) {
        this.registry = registry;
        this.sessionLogStore = sessionLogStore;
    }

    @Override
    public Integer call() {
        try {
            CheckpointManager manager = session.open(registry);
            CheckpointResult result = manager.restoreCheckpoint(checkpointId);
            if (sessionLogStore.exists(manager.getProjectId(), manager.getSessionId())) {
                sessionLogStore.write(manager.getProjectId(), manager.getSessionId(), result.transcript());
            }
            ConsoleOutput.success("Restored checkpoint " + result.checkpoint().shortId()
                    + " (" + result.filesProcessed() + " files)");
            result.warnings().forEach(ConsoleOutput::warn);
            return 0;
        } catch (CheckpointException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
