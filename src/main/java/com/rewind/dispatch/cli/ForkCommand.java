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
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "fork", mixinStandardHelpOptions = true, description = "Fork a session from a checkpoint")
@Component
public class ForkCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions session;

    @Parameters(index = "0", description = "Checkpoint ID")
    private String checkpointId;

    @Option(names = {"--new-session"}, required = true, description = "ID of the forked session")
    private String newSessionId;

    @Option(names = {"-m", "--message"}, description = "Description of the fork checkpoint")
    private String description;

    private final CheckpointManagerRegistry registry;
    private final SessionLogStore sessionLogStore;

    public ForkCommand(CheckpointManagerRegistry registry, SessionLogStore sessionLogStore) {
        this.registry = registry;
        this.sessionLogStore = sessionLogStore;
    }

    @Override
    public Integer call() {
        try {
            CheckpointManager source = session.open(registry);
            CheckpointResult result = registry.forkSession(source.getSessionId(), checkpointId, newSessionId, description);
            if (sessionLogStore.exists(source.getProjectId(), source.getSessionId())) {
                sessionLogStore.write(source.getProjectId(), newSessionId, result.transcript());
            }
            ConsoleOutput.success("Forked session " + newSessionId + " at checkpoint "
                    + result.checkpoint().shortId());
            result.warnings().forEach(ConsoleOutput::warn);
            return 0;
        } catch (CheckpointException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
