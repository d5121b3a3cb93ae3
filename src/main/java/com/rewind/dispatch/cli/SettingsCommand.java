package com.rewind.dispatch.cli;

import com.rewind.core.exception.CheckpointException;
import com.rewind.core.manager.CheckpointManager;
import com.rewind.core.manager.CheckpointManagerRegistry;
import com.rewind.core.model.CheckpointStrategy;
import com.rewind.core.model.SessionTimeline;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: rewind settings -s &lt;session&gt; [--auto | --no-auto] [--strategy smart]
 * <p>
 * Without options, prints the current settings.
 */
@Command(name = "settings", mixinStandardHelpOptions = true, description = "Show or change auto-checkpoint settings")
@Component
public class SettingsCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions session;

    @Option(names = {"--auto"}, negatable = true, description = "Enable or disable auto-checkpointing")
    private Boolean autoCheckpoint;

    @Option(names = {"--strategy"}, description = "manual, per_prompt, per_tool_use or smart")
    private String strategy;

    private final CheckpointManagerRegistry registry;

    public SettingsCommand(CheckpointManagerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        try {
            CheckpointManager manager = session.open(registry);
            SessionTimeline current = manager.getTimeline();
            if (autoCheckpoint != null || strategy != null) {
                manager.updateSettings(
                        autoCheckpoint != null ? autoCheckpoint : current.autoCheckpointEnabled(),
                        strategy != null ? CheckpointStrategy.fromValue(strategy) : current.checkpointStrategy());
                current = manager.getTimeline();
                ConsoleOutput.success("Settings updated");
            }
            ConsoleOutput.info("auto-checkpoint: " + (current.autoCheckpointEnabled() ? "on" : "off")
                    + ", strategy: " + current.checkpointStrategy().wireName());
            return 0;
        } catch (CheckpointException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
