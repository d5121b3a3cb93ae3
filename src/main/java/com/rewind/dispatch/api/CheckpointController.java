package com.rewind.dispatch.api;

import com.rewind.core.exception.CheckpointException;
import com.rewind.core.exception.CheckpointNotFoundException;
import com.rewind.core.exception.InvalidLineageException;
import com.rewind.core.exception.ManagerConflictException;
import com.rewind.core.exception.RestoreWriteException;
import com.rewind.core.manager.CheckpointManager;
import com.rewind.core.manager.CheckpointManagerRegistry;
import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.CheckpointDiff;
import com.rewind.core.model.CheckpointResult;
import com.rewind.core.model.CheckpointStrategy;
import com.rewind.core.model.SessionTimeline;
import com.rewind.core.transcript.SessionLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for session checkpoints: create, list, restore, fork, diff, timeline,
 * settings, transcript tracking and retention.
 */
@RestController
@RequestMapping("/api/v1")
public class CheckpointController {

    private static final Logger log = LoggerFactory.getLogger(CheckpointController.class);

    private final CheckpointManagerRegistry registry;
    private final SessionLogStore sessionLogStore;

    public CheckpointController(CheckpointManagerRegistry registry, SessionLogStore sessionLogStore) {
        this.registry = registry;
        this.sessionLogStore = sessionLogStore;
    }

    /**
     * PUT /api/v1/sessions/{sessionId}: Open (or re-open) a session's checkpoint manager.
     */
    @PutMapping("/sessions/{sessionId}")
    public ResponseEntity<?> openSession(@PathVariable String sessionId, @RequestBody SessionRequest request) {
        if (isBlank(request.projectId()) || isBlank(request.projectPath())) {
            return ResponseEntity.badRequest().body(Map.of("error", "project_id and project_path are required"));
        }
        CheckpointManager manager = registry.getOrCreateManager(sessionId, request.projectId(), Path.of(request.projectPath()));
        return ResponseEntity.ok(manager.getTimeline());
    }

    /**
     * DELETE /api/v1/sessions/{sessionId}: Drop the in-memory manager; persisted checkpoints stay.
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> closeSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("removed", registry.removeManager(sessionId)));
    }

    @PostMapping("/sessions/{sessionId}/checkpoints")
    public ResponseEntity<CheckpointResult> createCheckpoint(@PathVariable String sessionId,
                                                             @RequestBody CreateCheckpointRequest request) {
        CheckpointManager manager = resolve(sessionId, request.projectId(), request.projectPath());
        if (request.messageIndex() != null || Boolean.TRUE.equals(request.loadSessionLog())) {
            sessionLogStore.loadInto(manager, request.messageIndex());
        }
        CheckpointResult result = manager.createCheckpoint(request.description(), null);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/sessions/{sessionId}/checkpoints")
    public ResponseEntity<List<Checkpoint>> listCheckpoints(@PathVariable String sessionId) {
        return ResponseEntity.ok(registry.requireManager(sessionId).listCheckpoints());
    }

    /**
     * POST /api/v1/sessions/{sessionId}/checkpoints/{checkpointId}/restore: Rewrite the working
     * tree and transcript. The agent's session log is rewritten too when one exists.
     */
    @PostMapping("/sessions/{sessionId}/checkpoints/{checkpointId}/restore")
    public ResponseEntity<CheckpointResult> restoreCheckpoint(@PathVariable String sessionId,
                                                              @PathVariable String checkpointId) {
        CheckpointManager manager = registry.requireManager(sessionId);
        CheckpointResult result = manager.restoreCheckpoint(checkpointId);
        if (sessionLogStore.exists(manager.getProjectId(), sessionId)) {
            sessionLogStore.write(manager.getProjectId(), sessionId, result.transcript());
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/sessions/{sessionId}/checkpoints/{checkpointId}/fork")
    public ResponseEntity<?> forkFromCheckpoint(@PathVariable String sessionId,
                                                @PathVariable String checkpointId,
                                                @RequestBody ForkRequest request) {
        if (isBlank(request.newSessionId())) {
            return ResponseEntity.badRequest().body(Map.of("error", "new_session_id is required"));
        }
        CheckpointResult result = registry.forkSession(sessionId, checkpointId, request.newSessionId(), request.description());
        String projectId = result.checkpoint().projectId();
        if (sessionLogStore.exists(projectId, sessionId)) {
            sessionLogStore.write(projectId, request.newSessionId(), result.transcript());
        }
        log.info("Forked session {} at {} into {}", sessionId, checkpointId, request.newSessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/sessions/{sessionId}/timeline")
    public ResponseEntity<SessionTimeline> getTimeline(@PathVariable String sessionId) {
        return ResponseEntity.ok(registry.requireManager(sessionId).getTimeline());
    }

    @GetMapping("/sessions/{sessionId}/settings")
    public ResponseEntity<SettingsRequest> getSettings(@PathVariable String sessionId) {
        SessionTimeline timeline = registry.requireManager(sessionId).getTimeline();
        return ResponseEntity.ok(new SettingsRequest(timeline.autoCheckpointEnabled(),
                timeline.checkpointStrategy().wireName()));
    }

    @PutMapping("/sessions/{sessionId}/settings")
    public ResponseEntity<?> updateSettings(@PathVariable String sessionId, @RequestBody SettingsRequest request) {
        CheckpointStrategy strategy;
        try {
            strategy = CheckpointStrategy.fromValue(request.checkpointStrategy());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        CheckpointManager manager = registry.requireManager(sessionId);
        manager.updateSettings(request.autoCheckpointEnabled(), strategy);
        return ResponseEntity.ok(manager.getTimeline());
    }

    @GetMapping("/sessions/{sessionId}/diff")
    public ResponseEntity<CheckpointDiff> getDiff(@PathVariable String sessionId,
                                                  @RequestParam String from,
                                                  @RequestParam String to) {
        return ResponseEntity.ok(registry.requireManager(sessionId).getCheckpointDiff(from, to));
    }

    /**
     * POST /api/v1/sessions/{sessionId}/messages: Track transcript lines.
     */
    @PostMapping("/sessions/{sessionId}/messages")
    public ResponseEntity<?> trackMessages(@PathVariable String sessionId, @RequestBody MessagesRequest request) {
        if (request.messages() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "messages is required"));
        }
        CheckpointManager manager = registry.requireManager(sessionId);
        manager.trackMessages(request.messages());
        return ResponseEntity.ok(Map.of(
                "tracked", request.messages().size(),
                "buffered", manager.getBufferedMessageCount()));
    }

    /**
     * POST /api/v1/sessions/{sessionId}/auto-checkpoint: Ask whether a line should trigger an
     * automatic checkpoint under the session's strategy.
     */
    @PostMapping("/sessions/{sessionId}/auto-checkpoint")
    public ResponseEntity<?> checkAutoCheckpoint(@PathVariable String sessionId, @RequestBody MessagesRequest request) {
        if (request.message() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "message is required"));
        }
        boolean should = registry.requireManager(sessionId).shouldAutoCheckpoint(request.message());
        return ResponseEntity.ok(Map.of("should_checkpoint", should));
    }

    @PostMapping("/sessions/{sessionId}/cleanup")
    public ResponseEntity<?> cleanup(@PathVariable String sessionId, @RequestParam(defaultValue = "10") int keep) {
        if (keep < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "keep must not be negative"));
        }
        int removed = registry.requireManager(sessionId).cleanupOldCheckpoints(keep);
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    /**
     * GET /api/v1/sessions/{sessionId}/modified-files: Files the agent touched in the last
     * {@code minutes} minutes.
     */
    @GetMapping("/sessions/{sessionId}/modified-files")
    public ResponseEntity<Map<String, Object>> modifiedFiles(@PathVariable String sessionId,
                                                             @RequestParam(defaultValue = "5") long minutes) {
        CheckpointManager manager = registry.requireManager(sessionId);
        Instant since = Instant.now().minus(Duration.ofMinutes(minutes));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("files", manager.getFilesModifiedSince(since));
        body.put("last_modification", manager.getLastModificationTime().map(Instant::toString).orElse(null));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/checkpoints/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(Map.of(
                "active_managers", registry.activeCount(),
                "active_sessions", registry.listActiveSessions()));
    }

    // --- Error mapping ---

    @ExceptionHandler(CheckpointNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(CheckpointNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ManagerConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(ManagerConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(InvalidLineageException.class)
    public ResponseEntity<Map<String, String>> handleLineage(InvalidLineageException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(RestoreWriteException.class)
    public ResponseEntity<Map<String, Object>> handleRestoreWrite(RestoreWriteException e) {
        log.error("Restore failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "error", e.getMessage(),
                "failed_paths", e.getFailedPaths()));
    }

    @ExceptionHandler(CheckpointException.class)
    public ResponseEntity<Map<String, String>> handleCheckpointFailure(CheckpointException e) {
        log.error("Checkpoint operation failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private CheckpointManager resolve(String sessionId, String projectId, String projectPath) {
        if (!isBlank(projectId) && !isBlank(projectPath)) {
            return registry.getOrCreateManager(sessionId, projectId, Path.of(projectPath));
        }
        return registry.requireManager(sessionId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
