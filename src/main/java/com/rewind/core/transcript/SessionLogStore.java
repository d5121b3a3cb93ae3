package com.rewind.core.transcript;

import com.rewind.core.config.RewindProperties;
import com.rewind.core.exception.TranscriptCaptureException;
import com.rewind.core.manager.CheckpointManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Reads and writes the agent's own session log, {@code <sessions-dir>/<projectId>/<sessionId>.jsonl}.
 */
@Service
public class SessionLogStore {

    private static final Logger log = LoggerFactory.getLogger(SessionLogStore.class);

    private final Path sessionsDir;

    public SessionLogStore(RewindProperties properties) {
        this.sessionsDir = Path.of(properties.getSessionsDir());
    }

    public Path logPath(String projectId, String sessionId) {
        return sessionsDir.resolve(projectId).resolve(sessionId + ".jsonl");
    }

    public boolean exists(String projectId, String sessionId) {
        return Files.isRegularFile(logPath(projectId, sessionId));
    }

    /**
     * Non-blank lines of the session log, up to and including {@code messageIndex} when given.
     *
     * @throws TranscriptCaptureException if the log cannot be read
     */
    public List<String> readLines(String projectId, String sessionId, Integer messageIndex) {
        Path path = logPath(projectId, sessionId);
        try (var lines = Files.lines(path, StandardCharsets.UTF_8)) {
            var nonBlank = lines.filter(l -> !l.isBlank());
            return (messageIndex == null ? nonBlank : nonBlank.limit(messageIndex + 1L)).toList();
        } catch (IOException | UncheckedIOException e) {
            throw new TranscriptCaptureException("Failed to read session log " + path, e);
        }
    }

    /**
     * Replaces the manager's transcript with the session log up to {@code messageIndex}.
     *
     * @return number of lines loaded
     */
    public int loadInto(CheckpointManager manager, Integer messageIndex) {
        List<String> lines = readLines(manager.getProjectId(), manager.getSessionId(), messageIndex);
        manager.syncTranscript(lines);
        log.debug("Loaded {} session log lines into session {}", lines.size(), manager.getSessionId());
        return lines.size();
    }

    /**
     * Rewrites the session log with {@code transcript}. Used after a restore, and after a fork
     * to give the new session the log of its origin checkpoint.
     */
    public void write(String projectId, String sessionId, String transcript) {
        Path path = logPath(projectId, sessionId);
        try {
            Files.createDirectories(path.getParent());
            Path tmp = Files.createTempFile(path.getParent(), "." + sessionId, ".tmp");
            try {
                Files.writeString(tmp, transcript, StandardCharsets.UTF_8);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new TranscriptCaptureException("Failed to write session log " + path, e);
        }
    }
}
