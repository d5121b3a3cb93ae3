package com.rewind.core.persistence;

import com.rewind.core.content.ContentStore;
import com.rewind.core.exception.CheckpointNotFoundException;
import com.rewind.core.exception.StorageIoException;
import com.rewind.core.metrics.RewindMetrics;
import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.CheckpointMetadata;
import com.rewind.core.model.FileRef;
import com.rewind.core.model.FileSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Persists checkpoints and resolves them back into file contents.
 * <p>
 * Saves of one project run concurrently under a shared lock; the blob sweep after a cleanup
 * takes the exclusive lock so it never deletes a blob a concurrent save is about to reference.
 */
@Service
public class CheckpointStorage {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStorage.class);

    private final CheckpointStore store;
    private final ContentStore contentStore;
    private final RewindMetrics metrics;
    private final Clock clock;
    private final Map<String, ReadWriteLock> projectLocks = new ConcurrentHashMap<>();

    public CheckpointStorage(CheckpointStore store, ContentStore contentStore,
                             RewindMetrics metrics, Clock clock) {
        this.store = store;
        this.contentStore = contentStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Hashes each snapshot, collects the blobs the project does not hold yet and commits them
     * together with the new checkpoint record and transcript.
     *
     * @return the persisted checkpoint
     * @throws StorageIoException if the commit fails; nothing becomes visible in that case
     */
    public Checkpoint saveCheckpoint(String sessionId, String projectId, String parentId,
                                     String transcript, List<FileSnapshot> files, String description,
                                     CheckpointMetadata metadata, int messageIndex) {
        ReadWriteLock lock = lockFor(projectId);
        lock.readLock().lock();
        try {
            var refs = new ArrayList<FileRef>(files.size());
            var newBlobs = new LinkedHashMap<String, byte[]>();
            int deduplicated = 0;
            for (FileSnapshot file : files) {
                String hash = file.hash() != null ? file.hash() : ContentStore.hash(file.content());
                refs.add(new FileRef(file.filePath(), hash, file.content().length));
                if (newBlobs.containsKey(hash) || contentStore.contains(projectId, hash)) {
                    deduplicated++;
                } else {
                    newBlobs.put(hash, file.content());
                }
            }

            var checkpoint = new Checkpoint(
                    UUID.randomUUID().toString(),
                    sessionId,
                    projectId,
                    parentId,
                    clock.instant(),
                    description,
                    messageIndex,
                    metadata != null ? metadata : CheckpointMetadata.empty());
            long sequence = store.lastSequence(projectId, sessionId) + 1;

            store.commit(new CheckpointRecord(checkpoint, sequence, refs), transcript, newBlobs);
            metrics.recordBlobWrites(newBlobs.size(), deduplicated);
            log.info("Saved checkpoint {} for session {} ({} files, {} new blobs)",
                    checkpoint.id(), sessionId, refs.size(), newBlobs.size());
            return checkpoint;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws CheckpointNotFoundException if the session has no such checkpoint
     * @throws StorageIoException          if a referenced blob or the transcript is missing
     */
    public LoadedCheckpoint loadCheckpoint(String projectId, String sessionId, String checkpointId) {
        CheckpointRecord record = store.readCheckpoint(projectId, sessionId, checkpointId)
                .orElseThrow(() -> new CheckpointNotFoundException(
                        "Checkpoint " + checkpointId + " not found in session " + sessionId));
        return materialise(record);
    }

    /**
     * Loads a checkpoint from any session of the project.
     */
    public LoadedCheckpoint loadProjectCheckpoint(String projectId, String checkpointId) {
        CheckpointRecord record = store.findCheckpoint(projectId, checkpointId)
                .orElseThrow(() -> new CheckpointNotFoundException(
                        "Checkpoint " + checkpointId + " not found in project " + projectId));
        return materialise(record);
    }

    public Optional<CheckpointRecord> findCheckpoint(String projectId, String checkpointId) {
        return store.findCheckpoint(projectId, checkpointId);
    }

    public List<CheckpointRecord> listCheckpointRecords(String projectId, String sessionId) {
        return store.listCheckpoints(projectId, sessionId);
    }

    /** Checkpoints of the session in creation order. */
    public List<Checkpoint> listCheckpoints(String projectId, String sessionId) {
        return store.listCheckpoints(projectId, sessionId).stream()
                .map(CheckpointRecord::checkpoint)
                .toList();
    }

    /**
     * Keeps the {@code keepCount} newest checkpoints of the session and deletes the rest, then
     * removes every blob no remaining checkpoint of the project references.
     *
     * @return number of checkpoints removed
     */
    public int cleanupOldCheckpoints(String projectId, String sessionId, int keepCount) {
        if (keepCount < 0) {
            throw new IllegalArgumentException("keepCount must not be negative: " + keepCount);
        }
        ReadWriteLock lock = lockFor(projectId);
        lock.writeLock().lock();
        try {
            List<CheckpointRecord> records = store.listCheckpoints(projectId, sessionId);
            if (keepCount >= records.size()) {
                return 0;
            }
            List<CheckpointRecord> doomed = records.subList(0, records.size() - keepCount);
            for (CheckpointRecord record : doomed) {
                store.deleteCheckpoint(projectId, sessionId, record.checkpoint().id());
            }

            Set<String> referenced = new HashSet<>();
            for (CheckpointRecord remaining : store.listProjectCheckpoints(projectId)) {
                remaining.files().forEach(ref -> referenced.add(ref.hash()));
            }
            int blobsRemoved = contentStore.sweep(projectId, referenced);
            metrics.recordCleanup(doomed.size(), blobsRemoved);
            log.info("Removed {} checkpoints of session {} and {} unreferenced blobs",
                    doomed.size(), sessionId, blobsRemoved);
            return doomed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws StorageIoException if the blob is missing
     */
    public byte[] readContent(String projectId, String hash) {
        return store.readBlob(projectId, hash)
                .orElseThrow(() -> new StorageIoException("Blob " + hash + " missing in project " + projectId));
    }

    public void saveTimeline(TimelineRecord timeline) {
        store.saveTimeline(timeline);
    }

    public Optional<TimelineRecord> loadTimeline(String projectId, String sessionId) {
        return store.readTimeline(projectId, sessionId);
    }

    private LoadedCheckpoint materialise(CheckpointRecord record) {
        Checkpoint checkpoint = record.checkpoint();
        var files = new ArrayList<FileSnapshot>(record.files().size());
        for (FileRef ref : record.files()) {
            byte[] content = store.readBlob(checkpoint.projectId(), ref.hash())
                    .orElseThrow(() -> new StorageIoException("Blob " + ref.hash() + " of " + ref.path()
                            + " missing for checkpoint " + checkpoint.id()));
            files.add(new FileSnapshot(ref.path(), content, ref.hash(), ref.size()));
        }
        String transcript = store.readTranscript(checkpoint.projectId(), checkpoint.sessionId(), checkpoint.id())
                .orElseThrow(() -> new StorageIoException("Transcript missing for checkpoint " + checkpoint.id()));
        return new LoadedCheckpoint(checkpoint, files, transcript);
    }

    private ReadWriteLock lockFor(String projectId) {
        return projectLocks.computeIfAbsent(projectId, id -> new ReentrantReadWriteLock());
    }
}
