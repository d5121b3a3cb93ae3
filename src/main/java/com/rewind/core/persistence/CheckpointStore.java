package com.rewind.core.persistence;

import com.rewind.core.exception.StorageIoException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable backend for content blobs, checkpoint records, transcripts and timelines.
 * <p>
 * Blobs are scoped per project and keyed by content hash. Checkpoint records are scoped per
 * session. Every method throws {@link StorageIoException} when the backend fails.
 */
public interface CheckpointStore {

    boolean hasBlob(String projectId, String hash);

    Optional<byte[]> readBlob(String projectId, String hash);

    /** Writes a blob. Writing a hash that already exists is a no-op. */
    void writeBlob(String projectId, String hash, byte[] content);

    Collection<String> listBlobs(String projectId);

    void deleteBlob(String projectId, String hash);

    /**
     * Persists a checkpoint atomically: the new blobs, the record and the transcript either all
     * become visible or none of them do. The record never becomes visible before its blobs.
     */
    void commit(CheckpointRecord record, String transcript, Map<String, byte[]> newBlobs);

    Optional<CheckpointRecord> readCheckpoint(String projectId, String sessionId, String checkpointId);

    /** Looks a checkpoint up in any session of the project. */
    Optional<CheckpointRecord> findCheckpoint(String projectId, String checkpointId);

    /** Checkpoints of one session, ordered by sequence. */
    List<CheckpointRecord> listCheckpoints(String projectId, String sessionId);

    /** Checkpoints of every session of the project. */
    List<CheckpointRecord> listProjectCheckpoints(String projectId);

    Optional<String> readTranscript(String projectId, String sessionId, String checkpointId);

    /** Highest sequence number used by the session, {@code 0} when it has no checkpoints. */
    long lastSequence(String projectId, String sessionId);

    void deleteCheckpoint(String projectId, String sessionId, String checkpointId);

    void saveTimeline(TimelineRecord timeline);

    Optional<TimelineRecord> readTimeline(String projectId, String sessionId);
}
