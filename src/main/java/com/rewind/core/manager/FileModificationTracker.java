package com.rewind.core.manager;

import com.rewind.core.transcript.ToolUse;
import com.rewind.core.transcript.TranscriptMessage;

import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bookkeeping of which files the agent touched and when, derived from tool uses in the
 * transcript. Not thread-safe; guarded by the owning manager's lock.
 */
class FileModificationTracker {

    private final Path projectRoot;
    private final Map<String, Instant> lastModified = new HashMap<>();
    private final Set<String> sinceCheckpoint = new LinkedHashSet<>();
    /** Mutating tool uses whose result has not been seen yet. */
    private final Set<String> pendingMutations = new HashSet<>();
    /** Mutating tool uses answered since the last checkpoint. */
    private final Set<String> completedMutations = new HashSet<>();

    FileModificationTracker(Path projectRoot) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    void record(TranscriptMessage message, Instant at) {
        for (ToolUse toolUse : message.toolUses()) {
            if (!toolUse.isMutating()) {
                continue;
            }
            if (toolUse.id() != null) {
                pendingMutations.add(toolUse.id());
            }
            if (toolUse.filePath() != null) {
                markModified(relativize(toolUse.filePath()), at);
            }
        }
        if (message.resultFilePath() != null) {
            markModified(relativize(message.resultFilePath()), at);
        }
        for (String id : message.toolResultIds()) {
            if (pendingMutations.remove(id)) {
                completedMutations.add(id);
            }
        }
    }

    /**
     * True when the message reports the completion of a tool use that mutated the file system.
     */
    boolean completesMutation(TranscriptMessage message) {
        if (message.resultFilePath() != null) {
            return true;
        }
        return message.toolResultIds().stream()
                .anyMatch(id -> pendingMutations.contains(id) || completedMutations.contains(id));
    }

    /**
     * Files modified since the last checkpoint, counting those the candidate message would add.
     */
    int modifiedCountWith(TranscriptMessage candidate) {
        Set<String> files = new HashSet<>(sinceCheckpoint);
        for (ToolUse toolUse : candidate.toolUses()) {
            if (toolUse.isMutating() && toolUse.filePath() != null) {
                files.add(relativize(toolUse.filePath()));
            }
        }
        if (candidate.resultFilePath() != null) {
            files.add(relativize(candidate.resultFilePath()));
        }
        return files.size();
    }

    List<String> filesModifiedSince(Instant since) {
        return lastModified.entrySet().stream()
                .filter(e -> !e.getValue().isBefore(since))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    Optional<Instant> lastModificationTime() {
        return lastModified.values().stream().max(Instant::compareTo);
    }

    void resetCheckpoint() {
        sinceCheckpoint.clear();
        completedMutations.clear();
    }

    /** Mutating tool-use ids still held, answered or not. */
    int retainedToolUseIds() {
        return pendingMutations.size() + completedMutations.size();
    }

    private void markModified(String path, Instant at) {
        lastModified.merge(path, at, (a, b) -> a.isAfter(b) ? a : b);
        sinceCheckpoint.add(path);
    }

    /**
     * Paths under the project root become root-relative with forward slashes; others are kept as given.
     */
    String relativize(String filePath) {
        Path path = Path.of(filePath);
        if (path.isAbsolute()) {
            Path normalized = path.normalize();
            if (normalized.startsWith(projectRoot)) {
                return projectRoot.relativize(normalized).toString().replace('\\', '/');
            }
            return filePath;
        }
        return path.normalize().toString().replace('\\', '/');
    }
}
