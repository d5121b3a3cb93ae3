package com.rewind.core.manager;

import com.rewind.core.config.RewindProperties;
import com.rewind.core.exception.CheckpointNotFoundException;
import com.rewind.core.exception.InvalidLineageException;
import com.rewind.core.exception.ManagerConflictException;
import com.rewind.core.metrics.RewindMetrics;
import com.rewind.core.model.CheckpointResult;
import com.rewind.core.persistence.CheckpointStorage;
import com.rewind.core.scanner.ProjectScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one {@link CheckpointManager} per active session.
 */
@Service
public class CheckpointManagerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManagerRegistry.class);

    private final CheckpointStorage storage;
    private final ProjectScanner scanner;
    private final RewindProperties properties;
    private final RewindMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CheckpointManager> managers = new LinkedHashMap<>();

    public CheckpointManagerRegistry(CheckpointStorage storage, ProjectScanner scanner,
                                     RewindProperties properties, RewindMetrics metrics, Clock clock) {
        this.storage = storage;
        this.scanner = scanner;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Returns the session's manager, creating it on first use.
     *
     * @throws ManagerConflictException if the session is already bound to another project or path
     */
    public CheckpointManager getOrCreateManager(String sessionId, String projectId, Path projectPath) {
        Path normalized = projectPath.toAbsolutePath().normalize();
        lock.lock();
        try {
            CheckpointManager existing = managers.get(sessionId);
            if (existing != null) {
                if (!existing.getProjectId().equals(projectId) || !existing.getProjectPath().equals(normalized)) {
                    throw new ManagerConflictException("Session " + sessionId + " is bound to project "
                            + existing.getProjectId() + " at " + existing.getProjectPath()
                            + ", not " + projectId + " at " + normalized);
                }
                return existing;
            }
            var manager = new CheckpointManager(sessionId, projectId, normalized,
                    storage, scanner, properties, metrics, clock);
            managers.put(sessionId, manager);
            metrics.recordActiveManagers(managers.size());
            log.info("Created checkpoint manager for session {} ({})", sessionId, normalized);
            return manager;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CheckpointManager> getManager(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(managers.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws CheckpointNotFoundException if the session has no active manager
     */
    public CheckpointManager requireManager(String sessionId) {
        return getManager(sessionId).orElseThrow(() ->
                new CheckpointNotFoundException("No active checkpoint manager for session " + sessionId));
    }

    /**
     * Drops the session's manager. Persisted checkpoints and settings are kept.
     *
     * @return true if a manager was removed
     */
    public boolean removeManager(String sessionId) {
        lock.lock();
        try {
            boolean removed = managers.remove(sessionId) != null;
            if (removed) {
                metrics.recordActiveManagers(managers.size());
                log.info("Removed checkpoint manager for session {}", sessionId);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<String> listActiveSessions() {
        lock.lock();
        try {
            return List.copyOf(managers.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return managers.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forks {@code sourceSessionId} at {@code checkpointId} into {@code newSessionId}, which gets
     * its own manager bound to the same project.
     *
     * @throws InvalidLineageException     if the checkpoint is not in the source session's lineage
     * @throws CheckpointNotFoundException if the source session is not active or the checkpoint is unknown
     */
    public CheckpointResult forkSession(String sourceSessionId, String checkpointId,
                                        String newSessionId, String description) {
        CheckpointManager source = requireManager(sourceSessionId);
        if (!source.isInLineage(checkpointId)) {
            if (storage.findCheckpoint(source.getProjectId(), checkpointId).isPresent()) {
                throw new InvalidLineageException("Checkpoint " + checkpointId
                        + " is not in the lineage of session " + sourceSessionId);
            }
            throw new CheckpointNotFoundException("Checkpoint " + checkpointId + " not found for session " + sourceSessionId);
        }
        CheckpointManager target = getOrCreateManager(newSessionId, source.getProjectId(), source.getProjectPath());
        return target.forkFromCheckpoint(checkpointId, description);
    }
}
