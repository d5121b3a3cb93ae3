package com.rewind.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rewind.core.exception.StorageIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link CheckpointStore} that keeps everything in a directory tree:
 * <pre>
 * root/&lt;projectId&gt;/content_pool/&lt;hh&gt;/&lt;hash&gt;
 * root/&lt;projectId&gt;/sessions/&lt;sessionId&gt;/checkpoints/&lt;id&gt;.json
 * root/&lt;projectId&gt;/sessions/&lt;sessionId&gt;/checkpoints/&lt;id&gt;.jsonl
 * root/&lt;projectId&gt;/sessions/&lt;sessionId&gt;/timeline.json
 * </pre>
 * Every file is written to a temporary sibling and moved into place, so readers never see a
 * partial file. A commit writes blobs first and the checkpoint record last; the record is
 * what makes a checkpoint visible.
 */
public class FileSystemCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemCheckpointStore.class);

    private static final String CONTENT_POOL = "content_pool";
    private static final String SESSIONS = "sessions";
    private static final String CHECKPOINTS = "checkpoints";
    private static final String RECORD_SUFFIX = ".json";
    private static final String TRANSCRIPT_SUFFIX = ".jsonl";
    private static final String TIMELINE_FILE = "timeline.json";

    private final Path root;
    private final ObjectMapper objectMapper = StoreJson.mapper();

    public FileSystemCheckpointStore(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    @Override
    public boolean hasBlob(String projectId, String hash) {
        return Files.isRegularFile(blobPath(projectId, hash));
    }

    @Override
    public Optional<byte[]> readBlob(String projectId, String hash) {
        try {
            return Optional.of(Files.readAllBytes(blobPath(projectId, hash)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageIoException("Failed to read blob " + hash + " of project " + projectId, e);
        }
    }

    @Override
    public void writeBlob(String projectId, String hash, byte[] content) {
        Path path = blobPath(projectId, hash);
        if (Files.isRegularFile(path)) {
            return;
        }
        try {
            writeAtomically(path, content);
        } catch (IOException e) {
            throw new StorageIoException("Failed to write blob " + hash + " of project " + projectId, e);
        }
    }

    @Override
    public Collection<String> listBlobs(String projectId) {
        Path pool = projectDir(projectId).resolve(CONTENT_POOL);
        if (!Files.isDirectory(pool)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(pool, 2)) {
            return stream.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .toList();
        } catch (IOException e) {
            throw new StorageIoException("Failed to list blobs of project " + projectId, e);
        }
    }

    @Override
    public void deleteBlob(String projectId, String hash) {
        try {
            Files.deleteIfExists(blobPath(projectId, hash));
        } catch (IOException e) {
            throw new StorageIoException("Failed to delete blob " + hash + " of project " + projectId, e);
        }
    }

    @Override
    public void commit(CheckpointRecord record, String transcript, Map<String, byte[]> newBlobs) {
        var checkpoint = record.checkpoint();
        String projectId = checkpoint.projectId();
        Path dir = checkpointsDir(projectId, checkpoint.sessionId());
        Path recordPath = dir.resolve(safe(checkpoint.id()) + RECORD_SUFFIX);
        Path transcriptPath = dir.resolve(safe(checkpoint.id()) + TRANSCRIPT_SUFFIX);

        newBlobs.forEach((hash, content) -> writeBlob(projectId, hash, content));
        try {
            writeAtomically(transcriptPath, transcript.getBytes(StandardCharsets.UTF_8));
            writeAtomically(recordPath, objectMapper.writeValueAsBytes(record));
        } catch (IOException e) {
            // Blobs written above are unreferenced and fall to the next sweep.
            deleteQuietly(transcriptPath);
            deleteQuietly(recordPath);
            throw new StorageIoException("Failed to commit checkpoint " + checkpoint.id(), e);
        }
        log.debug("Committed checkpoint {} ({} new blobs)", checkpoint.id(), newBlobs.size());
    }

    @Override
    public Optional<CheckpointRecord> readCheckpoint(String projectId, String sessionId, String checkpointId) {
        return readRecord(checkpointsDir(projectId, sessionId).resolve(safe(checkpointId) + RECORD_SUFFIX));
    }

    @Override
    public Optional<CheckpointRecord> findCheckpoint(String projectId, String checkpointId) {
        String fileName = safe(checkpointId) + RECORD_SUFFIX;
        for (Path sessionDir : sessionDirs(projectId)) {
            Optional<CheckpointRecord> record = readRecord(sessionDir.resolve(CHECKPOINTS).resolve(fileName));
            if (record.isPresent()) {
                return record;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<CheckpointRecord> listCheckpoints(String projectId, String sessionId) {
        return listRecords(checkpointsDir(projectId, sessionId));
    }

    @Override
    public List<CheckpointRecord> listProjectCheckpoints(String projectId) {
        var records = new ArrayList<CheckpointRecord>();
        for (Path sessionDir : sessionDirs(projectId)) {
            records.addAll(listRecords(sessionDir.resolve(CHECKPOINTS)));
        }
        return records;
    }

    @Override
    public Optional<String> readTranscript(String projectId, String sessionId, String checkpointId) {
        Path path = checkpointsDir(projectId, sessionId).resolve(safe(checkpointId) + TRANSCRIPT_SUFFIX);
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageIoException("Failed to read transcript of checkpoint " + checkpointId, e);
        }
    }

    @Override
    public long lastSequence(String projectId, String sessionId) {
        return listCheckpoints(projectId, sessionId).stream()
                .mapToLong(CheckpointRecord::sequence)
                .max()
                .orElse(0L);
    }

    @Override
    public void deleteCheckpoint(String projectId, String sessionId, String checkpointId) {
        Path dir = checkpointsDir(projectId, sessionId);
        try {
            // Record first: a checkpoint without its record is invisible.
            Files.deleteIfExists(dir.resolve(safe(checkpointId) + RECORD_SUFFIX));
            Files.deleteIfExists(dir.resolve(safe(checkpointId) + TRANSCRIPT_SUFFIX));
        } catch (IOException e) {
            throw new StorageIoException("Failed to delete checkpoint " + checkpointId, e);
        }
    }

    @Override
    public void saveTimeline(TimelineRecord timeline) {
        Path path = sessionDir(timeline.projectId(), timeline.sessionId()).resolve(TIMELINE_FILE);
        try {
            writeAtomically(path, objectMapper.writeValueAsBytes(timeline));
        } catch (IOException e) {
            throw new StorageIoException("Failed to save timeline of session " + timeline.sessionId(), e);
        }
    }

    @Override
    public Optional<TimelineRecord> readTimeline(String projectId, String sessionId) {
        Path path = sessionDir(projectId, sessionId).resolve(TIMELINE_FILE);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), TimelineRecord.class));
        } catch (IOException e) {
            throw new StorageIoException("Failed to read timeline of session " + sessionId, e);
        }
    }

    // --- Paths ---

    private Path projectDir(String projectId) {
        return root.resolve(safe(projectId));
    }

    private Path sessionDir(String projectId, String sessionId) {
        return projectDir(projectId).resolve(SESSIONS).resolve(safe(sessionId));
    }

    private Path checkpointsDir(String projectId, String sessionId) {
        return sessionDir(projectId, sessionId).resolve(CHECKPOINTS);
    }

    private Path blobPath(String projectId, String hash) {
        String name = safe(hash);
        String prefix = name.length() >= 2 ? name.substring(0, 2) : name;
        return projectDir(projectId).resolve(CONTENT_POOL).resolve(prefix).resolve(name);
    }

    private List<Path> sessionDirs(String projectId) {
        Path sessions = projectDir(projectId).resolve(SESSIONS);
        if (!Files.isDirectory(sessions)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(sessions)) {
            return stream.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            throw new StorageIoException("Failed to list sessions of project " + projectId, e);
        }
    }

    /**
     * Rejects identifiers that could escape their directory.
     */
    static String safe(String id) {
        if (id == null || id.isBlank() || id.contains("/") || id.contains("\\")
                || id.equals(".") || id.contains("..")) {
            throw new IllegalArgumentException("Invalid identifier: " + id);
        }
        return id;
    }

    // --- I/O helpers ---

    private List<CheckpointRecord> listRecords(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(p -> p.getFileName().toString().endsWith(RECORD_SUFFIX))
                    .map(this::readRecord)
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparingLong(CheckpointRecord::sequence))
                    .toList();
        } catch (IOException e) {
            throw new StorageIoException("Failed to list checkpoints in " + dir, e);
        }
    }

    private Optional<CheckpointRecord> readRecord(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), CheckpointRecord.class));
        } catch (IOException e) {
            throw new StorageIoException("Failed to read checkpoint record " + path, e);
        }
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to remove partial file {}: {}", path, e.getMessage());
        }
    }
}
