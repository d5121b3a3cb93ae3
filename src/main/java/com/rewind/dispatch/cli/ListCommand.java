package com.rewind.dispatch.cli;

import com.rewind.core.exception.CheckpointException;
import com.rewind.core.manager.CheckpointManager;
import com.rewind.core.manager.CheckpointManagerRegistry;
import com.rewind.core.model.Checkpoint;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List a session's checkpoints")
@Component
public class ListCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions session;

    private final CheckpointManagerRegistry registry;

    public ListCommand(CheckpointManagerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        try {
            CheckpointManager manager = session.open(registry);
            List<Checkpoint> checkpoints = manager.listCheckpoints();
            if (checkpoints.isEmpty()) {
                ConsoleOutput.info("No checkpoints for session " + manager.getSessionId());
                return 0;
            }
            String current = manager.getTimeline().currentCheckpointId();
            checkpoints.forEach(cp -> ConsoleOutput.checkpointLine(cp, cp.id().equals(current)));
            ConsoleOutput.info(checkpoints.size() + " checkpoint" + (checkpoints.size() != 1 ? "s" : ""));
            return 0;
        } catch (CheckpointException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
