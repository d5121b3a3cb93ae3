package com.rewind.dispatch.cli;

import com.rewind.core.exception.CheckpointException;
import com.rewind.core.manager.CheckpointManagerRegistry;
import com.rewind.core.model.SessionTimeline;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: rewind timeline -s &lt;session&gt;
 * <p>
 * Prints the session's checkpoint tree, including the checkpoints of other sessions it was
 * forked from.
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "Show a session's checkpoint tree")
@Component
public class TimelineCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions session;

    private final CheckpointManagerRegistry registry;

    public TimelineCommand(CheckpointManagerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        try {
            SessionTimeline timeline = session.open(registry).getTimeline();
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Timeline for session " + timeline.sessionId()
                    + " (strategy " + timeline.checkpointStrategy().wireName()
                    + ", auto-checkpoint " + (timeline.autoCheckpointEnabled() ? "on" : "off") + ")");
            if (timeline.roots().isEmpty()) {
                ConsoleOutput.info("No checkpoints recorded.");
                return 0;
            }
            ConsoleOutput.tree(timeline.roots(), timeline.sessionId(), timeline.currentCheckpointId(), "  ");
            ConsoleOutput.info(timeline.totalCheckpoints() + " checkpoint" + (timeline.totalCheckpoints() != 1 ? "s" : "") + " recorded.");
            return 0;
        } catch (CheckpointException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
