package com.rewind.core.persistence;

import com.rewind.core.model.CheckpointStrategy;

/**
 * Persisted timeline settings and pointer for one session.
 */
public record TimelineRecord(
    String sessionId,
    String projectId,
    String currentCheckpointId,
    boolean autoCheckpointEnabled,
    CheckpointStrategy strategy
) {}
