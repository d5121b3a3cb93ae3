package com.rewind.dispatch.cli;

import com.rewind.core.exception.CheckpointException;
import com.rewind.core.manager.CheckpointManagerRegistry;
import com.rewind.core.model.CheckpointDiff;
import com.rewind.core.model.FileDiff;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "diff", mixinStandardHelpOptions = true, description = "Compare two checkpoints")
@Component
public class DiffCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions session;

    @Parameters(index = "0", description = "Older checkpoint ID")
    private String fromId;

    @Parameters(index = "1", description = "Newer checkpoint ID")
    private String toId;

    private final CheckpointManagerRegistry registry;

    public DiffCommand(CheckpointManagerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        try {
            CheckpointDiff diff = session.open(registry).getCheckpointDiff(fromId, toId);
            diff.addedFiles().forEach(p -> ConsoleOutput.fileChange("added", p));
            diff.deletedFiles().forEach(p -> ConsoleOutput.fileChange("deleted", p));
            for (FileDiff f : diff.modifiedFiles()) {
                ConsoleOutput.fileChange("modified", f.path() + " (+" + f.additions() + " -" + f.deletions() + ")");
            }
            ConsoleOutput.info(diff.addedFiles().size() + " added, " + diff.deletedFiles().size() + " deleted, "
                    + diff.modifiedFiles().size() + " modified; token delta " + diff.tokenDelta());
            return 0;
        } catch (CheckpointException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
