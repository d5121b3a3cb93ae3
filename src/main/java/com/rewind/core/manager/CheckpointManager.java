package com.rewind.core.manager;

import com.rewind.core.config.RewindProperties;
import com.rewind.core.exception.CheckpointException;
import com.rewind.core.exception.CheckpointNotFoundException;
import com.rewind.core.exception.InvalidLineageException;
import com.rewind.core.exception.StorageIoException;
import com.rewind.core.logging.MdcContext;
import com.rewind.core.metrics.RewindMetrics;
import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.CheckpointDiff;
import com.rewind.core.model.CheckpointMetadata;
import com.rewind.core.model.CheckpointResult;
import com.rewind.core.model.CheckpointStrategy;
import com.rewind.core.model.FileRef;
import com.rewind.core.model.FileSnapshot;
import com.rewind.core.model.SessionTimeline;
import com.rewind.core.persistence.CheckpointRecord;
import com.rewind.core.persistence.CheckpointStorage;
import com.rewind.core.persistence.LoadedCheckpoint;
import com.rewind.core.scanner.ProjectScanner;
import com.rewind.core.timeline.Timeline;
import com.rewind.core.transcript.TranscriptMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the checkpoint lifecycle of one session: tracks the transcript, decides when to
 * auto-checkpoint, and creates, restores, forks, diffs and prunes checkpoints.
 * <p>
 * Every public operation runs under one fair lock, so operations on the same session are
 * serialized in arrival order. Managers of different sessions share no mutable state.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private final String sessionId;
    private final String projectId;
    private final Path projectPath;
    private final CheckpointStorage storage;
    private final ProjectScanner scanner;
    private final RewindMetrics metrics;
    private final Clock clock;
    private final RewindProperties.Smart smart;
    private final WorkingTreeRestorer restorer;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Timeline timeline;
    private final FileModificationTracker tracker;
    private final List<String> transcript = new ArrayList<>();
    /** Transcript size at the last checkpoint, restore or fork. */
    private int baseline;
    private Instant lastCheckpointAt;
    private ManagerState state = ManagerState.IDLE;

    public CheckpointManager(String sessionId, String projectId, Path projectPath,
                             CheckpointStorage storage, ProjectScanner scanner,
                             RewindProperties properties, RewindMetrics metrics, Clock clock) {
        this.sessionId = sessionId;
        this.projectId = projectId;
        this.projectPath = projectPath.toAbsolutePath().normalize();
        this.storage = storage;
        this.scanner = scanner;
        this.metrics = metrics;
        this.clock = clock;
        this.smart = properties.getCheckpoint().getSmart();
        this.restorer = new WorkingTreeRestorer(scanner, properties.getCheckpoint().getRestore().isDeleteUntrackedFiles());
        this.tracker = new FileModificationTracker(this.projectPath);
        this.timeline = new Timeline(sessionId, projectId,
                properties.getCheckpoint().isAutoCheckpointEnabled(),
                properties.getCheckpoint().getDefaultStrategy());
        loadTimeline();
    }

    private void loadTimeline() {
        try {
            for (CheckpointRecord record : storage.listCheckpointRecords(projectId, sessionId)) {
                timeline.register(record.checkpoint(), record.files());
            }
            for (Checkpoint own : timeline.ownCheckpoints()) {
                registerAncestors(own.parentCheckpointId());
            }
            storage.loadTimeline(projectId, sessionId).ifPresent(timeline::apply);
        } catch (StorageIoException e) {
            throw wrap("load timeline", null, e);
        }
        lastCheckpointAt = timeline.current().map(Checkpoint::createdAt).orElse(clock.instant());
        if (timeline.getCurrentCheckpointId() == null) {
            List<Checkpoint> own = timeline.ownCheckpoints();
            if (!own.isEmpty()) {
                timeline.moveTo(own.get(own.size() - 1).id());
            }
        }
        log.debug("Loaded timeline of session {} with {} checkpoints", sessionId, timeline.ownCheckpoints().size());
    }

    // --- Transcript tracking ---

    /**
     * Appends one transcript line and updates the file-modification bookkeeping.
     */
    public void trackMessage(String line) {
        lock.lock();
        try {
            track(line);
        } finally {
            lock.unlock();
        }
    }

    public void trackMessages(List<String> lines) {
        lock.lock();
        try {
            lines.forEach(this::track);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the captured transcript with {@code lines}, the full transcript as the agent
     * currently holds it. Lines past the common prefix are tracked as new messages.
     */
    public void syncTranscript(List<String> lines) {
        lock.lock();
        try {
            int common = 0;
            while (common < transcript.size() && common < lines.size()
                    && transcript.get(common).equals(lines.get(common))) {
                common++;
            }
            transcript.subList(common, transcript.size()).clear();
            baseline = Math.min(baseline, common);
            lines.subList(common, lines.size()).forEach(this::track);
        } finally {
            lock.unlock();
        }
    }

    private void track(String line) {
        transcript.add(line);
        TranscriptMessage message = TranscriptMessage.parse(line);
        tracker.record(message, message.timestamp() != null ? message.timestamp() : clock.instant());
        state = ManagerState.ACCUMULATING;
    }

    /**
     * Decides whether {@code candidate} should trigger an automatic checkpoint under the active
     * strategy. The candidate may or may not have been tracked already.
     */
    public boolean shouldAutoCheckpoint(String candidate) {
        lock.lock();
        try {
            if (!timeline.isAutoCheckpointEnabled()) {
                return false;
            }
            TranscriptMessage message = TranscriptMessage.parse(candidate);
            int others = bufferedExcluding(candidate);
            String reason = switch (timeline.getStrategy()) {
                case MANUAL -> null;
                case PER_PROMPT -> message.prompt() && others > 0 ? "prompt" : null;
                case PER_TOOL_USE -> tracker.completesMutation(message) ? "tool_use" : null;
                case SMART -> smartReason(message, others);
            };
            if (reason == null) {
                return false;
            }
            log.info("Auto-checkpoint triggered for session {} by {} ({})", sessionId, reason, timeline.getStrategy().wireName());
            metrics.recordAutoCheckpointTrigger(reason);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private String smartReason(TranscriptMessage candidate, int others) {
        if (others + 1 >= smart.getMessageThreshold()) {
            return "message_threshold";
        }
        if (tracker.modifiedCountWith(candidate) > smart.getFileThreshold()) {
            return "file_threshold";
        }
        if (Duration.between(lastCheckpointAt, clock.instant()).compareTo(smart.getElapsedThreshold()) > 0) {
            return "elapsed_threshold";
        }
        return null;
    }

    private int bufferedExcluding(String candidate) {
        int buffered = transcript.size() - baseline;
        if (buffered > 0 && transcript.get(transcript.size() - 1).equals(candidate)) {
            buffered--;
        }
        return buffered;
    }

    /**
     * Checks the active strategy for {@code line}, creates a checkpoint of the state before it
     * when triggered, then tracks the line.
     *
     * @return the automatic checkpoint, if one was created
     */
    public Optional<CheckpointResult> offerMessage(String line) {
        lock.lock();
        try {
            Optional<CheckpointResult> created = Optional.empty();
            if (shouldAutoCheckpoint(line)) {
                created = Optional.of(createCheckpoint("Auto checkpoint (" + timeline.getStrategy().wireName() + ")", null));
            }
            track(line);
            return created;
        } finally {
            lock.unlock();
        }
    }

    // --- Checkpoint lifecycle ---

    /**
     * Snapshots the working tree and captured transcript into a new checkpoint.
     *
     * @param description    optional label
     * @param parentOverride parent to record instead of the current pointer; must be in the lineage
     */
    public CheckpointResult createCheckpoint(String description, String parentOverride) {
        lock.lock();
        long start = System.currentTimeMillis();
        MdcContext.setSession(sessionId, projectId);
        try {
            String parentId = parentOverride != null ? parentOverride : timeline.getCurrentCheckpointId();
            if (parentId != null && !timeline.contains(parentId)) {
                throw new InvalidLineageException("Parent " + parentId + " is not in the lineage of session " + sessionId);
            }

            ProjectScanner.ScanResult scan;
            try {
                scan = scanner.snapshot(projectPath);
            } catch (IOException e) {
                throw new CheckpointException("Session " + sessionId + ": failed to scan " + projectPath, e);
            }
            List<FileSnapshot> files = scan.files();
            List<FileRef> refs = files.stream().map(FileSnapshot::toRef).toList();
            List<FileRef> parentRefs = parentId != null ? timeline.filesOf(parentId) : List.of();
            CheckpointMetadata metadata = buildMetadata(files, CheckpointDiffs.changedFileCount(parentRefs, refs));

            Checkpoint checkpoint;
            try {
                checkpoint = storage.saveCheckpoint(sessionId, projectId, parentId, joinTranscript(),
                        files, description, metadata, Math.max(transcript.size() - 1, 0));
            } catch (StorageIoException e) {
                throw wrap("create checkpoint", null, e);
            }
            MdcContext.setCheckpoint(sessionId, projectId, checkpoint.id());

            timeline.register(checkpoint, refs);
            timeline.moveTo(checkpoint.id());
            persistTimeline();
            markCheckpointed(checkpoint.createdAt());

            metrics.recordCheckpointCreated(description != null && description.startsWith("Auto") ? "auto" : "manual",
                    System.currentTimeMillis() - start);
            metrics.recordSnapshotSize(metadata.snapshotSize());
            if (!scan.warnings().isEmpty()) {
                log.warn("Checkpoint {} skipped {} files", checkpoint.shortId(), scan.warnings().size());
            }
            log.info("Created checkpoint {} ({} files, parent {})", checkpoint.shortId(), files.size(), parentId);
            return new CheckpointResult(checkpoint, files.size(), scan.warnings(), null);
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    /**
     * Rewrites the working tree and transcript to match a checkpoint of this session's lineage.
     *
     * @throws InvalidLineageException     if the checkpoint belongs to an unrelated session
     * @throws CheckpointNotFoundException if no such checkpoint exists
     */
    public CheckpointResult restoreCheckpoint(String checkpointId) {
        lock.lock();
        try {
            requireInLineage(checkpointId);
            return restore(checkpointId);
        } finally {
            lock.unlock();
        }
    }

    private CheckpointResult restore(String checkpointId) {
        long start = System.currentTimeMillis();
        MdcContext.setCheckpoint(sessionId, projectId, checkpointId);
        boolean success = false;
        try {
            LoadedCheckpoint loaded;
            try {
                loaded = storage.loadProjectCheckpoint(projectId, checkpointId);
            } catch (StorageIoException e) {
                throw wrap("load", checkpointId, e);
            }
            WorkingTreeRestorer.Outcome outcome = restorer.restore(projectPath, loaded.files());

            transcript.clear();
            loaded.transcript().lines().filter(l -> !l.isEmpty()).forEach(transcript::add);
            timeline.moveTo(checkpointId);
            persistTimeline();
            markCheckpointed(clock.instant());
            success = true;
            log.info("Restored checkpoint {} ({} files)", loaded.checkpoint().shortId(), outcome.filesWritten());
            return new CheckpointResult(loaded.checkpoint(), outcome.filesWritten(), outcome.warnings(), loaded.transcript());
        } finally {
            metrics.recordRestore(success, System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /**
     * Starts this session from a checkpoint of any session of the project: restores its files and
     * transcript, then records a new checkpoint whose parent is {@code checkpointId}.
     */
    public CheckpointResult forkFromCheckpoint(String checkpointId, String description) {
        lock.lock();
        try {
            CheckpointRecord origin;
            try {
                origin = storage.findCheckpoint(projectId, checkpointId)
                        .orElseThrow(() -> new CheckpointNotFoundException(
                                "Checkpoint " + checkpointId + " not found in project " + projectId));
                if (!timeline.contains(checkpointId)) {
                    timeline.registerAncestor(origin.checkpoint(), origin.files());
                    registerAncestors(origin.checkpoint().parentCheckpointId());
                }
            } catch (StorageIoException e) {
                throw wrap("fork", checkpointId, e);
            }

            CheckpointResult restored = restore(checkpointId);
            String label = description != null && !description.isBlank()
                    ? description
                    : "Fork from checkpoint " + origin.checkpoint().shortId();
            CheckpointResult created = createCheckpoint(label, checkpointId);

            var warnings = new ArrayList<>(restored.warnings());
            warnings.addAll(created.warnings());
            metrics.recordFork();
            log.info("Session {} forked from checkpoint {}", sessionId, origin.checkpoint().shortId());
            return new CheckpointResult(created.checkpoint(), restored.filesProcessed(), warnings, restored.transcript());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Compares two checkpoints of this session's lineage.
     */
    public CheckpointDiff getCheckpointDiff(String fromId, String toId) {
        lock.lock();
        try {
            requireInLineage(fromId);
            requireInLineage(toId);
            Checkpoint from = timeline.get(fromId).orElseThrow();
            Checkpoint to = timeline.get(toId).orElseThrow();
            try {
                return CheckpointDiffs.diff(from, timeline.filesOf(fromId), to, timeline.filesOf(toId),
                        hash -> storage.readContent(projectId, hash));
            } catch (StorageIoException e) {
                throw wrap("diff", fromId + ".." + toId, e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keeps the {@code keepCount} newest checkpoints of this session. When the current checkpoint
     * is removed the pointer moves to the newest survivor.
     *
     * @return number of checkpoints removed
     */
    public int cleanupOldCheckpoints(int keepCount) {
        lock.lock();
        MdcContext.setSession(sessionId, projectId);
        try {
            int removed;
            Set<String> surviving = new HashSet<>();
            try {
                removed = storage.cleanupOldCheckpoints(projectId, sessionId, keepCount);
                storage.listCheckpoints(projectId, sessionId).forEach(c -> surviving.add(c.id()));
            } catch (StorageIoException e) {
                throw wrap("clean up", null, e);
            }
            if (removed == 0) {
                return 0;
            }
            String current = timeline.getCurrentCheckpointId();
            for (Checkpoint own : timeline.ownCheckpoints()) {
                if (!surviving.contains(own.id())) {
                    timeline.remove(own.id());
                }
            }
            if (current != null && !timeline.contains(current)) {
                List<Checkpoint> own = timeline.ownCheckpoints();
                timeline.moveTo(own.isEmpty() ? null : own.get(own.size() - 1).id());
                log.info("Current checkpoint {} was pruned; pointer moved to {}", current, timeline.getCurrentCheckpointId());
            }
            persistTimeline();
            return removed;
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    // --- Reads and settings ---

    public List<Checkpoint> listCheckpoints() {
        lock.lock();
        try {
            return timeline.ownCheckpoints();
        } finally {
            lock.unlock();
        }
    }

    public SessionTimeline getTimeline() {
        lock.lock();
        try {
            return timeline.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public void updateSettings(boolean autoCheckpointEnabled, CheckpointStrategy strategy) {
        lock.lock();
        try {
            timeline.updateSettings(autoCheckpointEnabled, strategy);
            persistTimeline();
            log.info("Session {} settings: auto-checkpoint {}, strategy {}", sessionId,
                    autoCheckpointEnabled, timeline.getStrategy().wireName());
        } finally {
            lock.unlock();
        }
    }

    /** True when the checkpoint is this session's own or one of its fork ancestors. */
    public boolean isInLineage(String checkpointId) {
        lock.lock();
        try {
            return timeline.contains(checkpointId);
        } finally {
            lock.unlock();
        }
    }

    public List<String> getFilesModifiedSince(Instant since) {
        lock.lock();
        try {
            return tracker.filesModifiedSince(since);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> getLastModificationTime() {
        lock.lock();
        try {
            return tracker.lastModificationTime();
        } finally {
            lock.unlock();
        }
    }

    public ManagerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public List<String> getTranscript() {
        lock.lock();
        try {
            return List.copyOf(transcript);
        } finally {
            lock.unlock();
        }
    }

    /** Messages tracked since the last checkpoint, restore or fork. */
    public int getBufferedMessageCount() {
        lock.lock();
        try {
            return transcript.size() - baseline;
        } finally {
            lock.unlock();
        }
    }

    public String getSessionId() { return sessionId; }
    public String getProjectId() { return projectId; }
    public Path getProjectPath() { return projectPath; }

    // --- Internals ---

    private void requireInLineage(String checkpointId) {
        if (timeline.contains(checkpointId)) {
            return;
        }
        boolean existsElsewhere;
        try {
            existsElsewhere = storage.findCheckpoint(projectId, checkpointId).isPresent();
        } catch (StorageIoException e) {
            throw wrap("look up", checkpointId, e);
        }
        if (existsElsewhere) {
            throw new InvalidLineageException("Checkpoint " + checkpointId
                    + " is not in the lineage of session " + sessionId);
        }
        throw new CheckpointNotFoundException("Checkpoint " + checkpointId + " not found for session " + sessionId);
    }

    private void registerAncestors(String parentId) {
        String next = parentId;
        while (next != null && !timeline.contains(next)) {
            Optional<CheckpointRecord> parent = storage.findCheckpoint(projectId, next);
            if (parent.isEmpty()) {
                // Pruned by retention; the child becomes a root.
                return;
            }
            timeline.registerAncestor(parent.get().checkpoint(), parent.get().files());
            next = parent.get().checkpoint().parentCheckpointId();
        }
    }

    private CheckpointMetadata buildMetadata(List<FileSnapshot> files, int fileChanges) {
        long tokens = 0;
        String model = null;
        String prompt = null;
        for (String line : transcript) {
            TranscriptMessage message = TranscriptMessage.parse(line);
            tokens += message.totalTokens();
            if (message.model() != null) {
                model = message.model();
            }
            if (message.prompt()) {
                prompt = message.promptText();
            }
        }
        long size = files.stream().mapToLong(FileSnapshot::size).sum();
        return new CheckpointMetadata(tokens, model, prompt, fileChanges, size, files.size());
    }

    private String joinTranscript() {
        return transcript.isEmpty() ? "" : String.join("\n", transcript) + "\n";
    }

    private void markCheckpointed(Instant at) {
        baseline = transcript.size();
        tracker.resetCheckpoint();
        lastCheckpointAt = at;
        state = ManagerState.IDLE;
    }

    private void persistTimeline() {
        try {
            storage.saveTimeline(timeline.toRecord());
        } catch (StorageIoException e) {
            throw wrap("save timeline", null, e);
        }
    }

    private StorageIoException wrap(String action, String checkpointId, StorageIoException e) {
        String target = checkpointId != null ? " checkpoint " + checkpointId : "";
        return new StorageIoException("Session " + sessionId + ": failed to " + action + target
                + ": " + e.getMessage(), e);
    }
}
