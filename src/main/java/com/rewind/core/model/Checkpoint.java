package com.rewind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable snapshot of a session's file state and transcript at one point in time.
 *
 * @param id                 globally unique checkpoint id
 * @param sessionId          session that owns the checkpoint
 * @param projectId          project the session works on
 * @param parentCheckpointId parent in the timeline, {@code null} for a root; may live in another
 *                           session's lineage after a fork
 * @param createdAt          creation instant
 * @param description        free-form label (nullable)
 * @param messageIndex       index of the last transcript line captured
 * @param metadata           summary figures
 */
public record Checkpoint(
    String id,
    String sessionId,
    String projectId,
    String parentCheckpointId,
    Instant createdAt,
    String description,
    int messageIndex,
    CheckpointMetadata metadata
) implements Serializable {

    @JsonIgnore
    public boolean isRoot() {
        return parentCheckpointId == null;
    }

    public String shortId() {
        return id.length() <= 8 ? id : id.substring(0, 8);
    }
}
