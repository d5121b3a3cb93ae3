package com.rewind.core.timeline;

import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.CheckpointStrategy;
import com.rewind.core.model.FileRef;
import com.rewind.core.model.SessionTimeline;
import com.rewind.core.model.TimelineNode;
import com.rewind.core.persistence.TimelineRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Branching history of one session.
 * <p>
 * Checkpoints are kept in a flat table keyed by id, each pointing at its parent. Besides the
 * session's own checkpoints the table holds the ancestors a fork descended from, so the tree
 * projection is rooted where the lineage really starts. Not thread-safe; the owning
 * manager serializes access.
 */
public class Timeline {

    private static final Comparator<Checkpoint> BY_CREATION = Comparator.comparing(Checkpoint::createdAt);

    private final String sessionId;
    private final String projectId;
    private final Map<String, Checkpoint> checkpoints = new LinkedHashMap<>();
    private final Map<String, List<FileRef>> files = new HashMap<>();
    private final Set<String> own = new HashSet<>();
    private String currentCheckpointId;
    private boolean autoCheckpointEnabled;
    private CheckpointStrategy strategy;

    public Timeline(String sessionId, String projectId, boolean autoCheckpointEnabled, CheckpointStrategy strategy) {
        this.sessionId = sessionId;
        this.projectId = projectId;
        this.autoCheckpointEnabled = autoCheckpointEnabled;
        this.strategy = strategy != null ? strategy : CheckpointStrategy.MANUAL;
    }

    /**
     * Adds a checkpoint of this session.
     */
    public void register(Checkpoint checkpoint, List<FileRef> fileRefs) {
        put(checkpoint, fileRefs);
        own.add(checkpoint.id());
    }

    /**
     * Adds a checkpoint of another session this one descends from.
     */
    public void registerAncestor(Checkpoint checkpoint, List<FileRef> fileRefs) {
        if (!own.contains(checkpoint.id())) {
            put(checkpoint, fileRefs);
        }
    }

    public void remove(String checkpointId) {
        checkpoints.remove(checkpointId);
        files.remove(checkpointId);
        own.remove(checkpointId);
        if (checkpointId.equals(currentCheckpointId)) {
            currentCheckpointId = null;
        }
    }

    /**
     * Moves the current pointer.
     *
     * @throws IllegalArgumentException if the checkpoint is not part of this timeline
     */
    public void moveTo(String checkpointId) {
        if (checkpointId != null && !checkpoints.containsKey(checkpointId)) {
            throw new IllegalArgumentException("Checkpoint " + checkpointId + " is not in timeline of " + sessionId);
        }
        currentCheckpointId = checkpointId;
    }

    /** True when the checkpoint is in this session's lineage, own or ancestor. */
    public boolean contains(String checkpointId) {
        return checkpoints.containsKey(checkpointId);
    }

    public boolean isOwn(String checkpointId) {
        return own.contains(checkpointId);
    }

    public Optional<Checkpoint> get(String checkpointId) {
        return Optional.ofNullable(checkpoints.get(checkpointId));
    }

    public List<FileRef> filesOf(String checkpointId) {
        return files.getOrDefault(checkpointId, List.of());
    }

    /** Own checkpoints, oldest first. */
    public List<Checkpoint> ownCheckpoints() {
        return checkpoints.values().stream()
                .filter(c -> own.contains(c.id()))
                .sorted(BY_CREATION)
                .toList();
    }

    public Optional<Checkpoint> current() {
        return currentCheckpointId == null ? Optional.empty() : get(currentCheckpointId);
    }

    public void updateSettings(boolean autoCheckpointEnabled, CheckpointStrategy strategy) {
        this.autoCheckpointEnabled = autoCheckpointEnabled;
        this.strategy = strategy != null ? strategy : CheckpointStrategy.MANUAL;
    }

    public SessionTimeline snapshot() {
        Map<String, List<Checkpoint>> children = new HashMap<>();
        List<Checkpoint> roots = new ArrayList<>();
        for (Checkpoint checkpoint : checkpoints.values()) {
            String parent = checkpoint.parentCheckpointId();
            if (parent == null || !checkpoints.containsKey(parent)) {
                roots.add(checkpoint);
            } else {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(checkpoint);
            }
        }
        List<TimelineNode> rootNodes = roots.stream()
                .sorted(BY_CREATION)
                .map(c -> toNode(c, children))
                .toList();
        return new SessionTimeline(sessionId, projectId, currentCheckpointId, own.size(),
                autoCheckpointEnabled, strategy, rootNodes);
    }

    public TimelineRecord toRecord() {
        return new TimelineRecord(sessionId, projectId, currentCheckpointId, autoCheckpointEnabled, strategy);
    }

    /**
     * Applies persisted settings and pointer. A pointer naming a checkpoint that is no longer in
     * the timeline is dropped.
     */
    public void apply(TimelineRecord record) {
        updateSettings(record.autoCheckpointEnabled(), record.strategy());
        String pointer = record.currentCheckpointId();
        currentCheckpointId = pointer != null && checkpoints.containsKey(pointer) ? pointer : null;
    }

    public String getSessionId() { return sessionId; }
    public String getProjectId() { return projectId; }
    public String getCurrentCheckpointId() { return currentCheckpointId; }
    public boolean isAutoCheckpointEnabled() { return autoCheckpointEnabled; }
    public CheckpointStrategy getStrategy() { return strategy; }

    private void put(Checkpoint checkpoint, List<FileRef> fileRefs) {
        checkpoints.put(checkpoint.id(), checkpoint);
        files.put(checkpoint.id(), fileRefs == null ? List.of() : List.copyOf(fileRefs));
    }

    private TimelineNode toNode(Checkpoint checkpoint, Map<String, List<Checkpoint>> children) {
        List<TimelineNode> childNodes = children.getOrDefault(checkpoint.id(), List.of()).stream()
                .sorted(BY_CREATION)
                .map(c -> toNode(c, children))
                .toList();
        List<String> hashes = filesOf(checkpoint.id()).stream().map(FileRef::hash).toList();
        return new TimelineNode(checkpoint, childNodes, hashes);
    }
}
