package com.rewind.core.model;

import java.util.List;

/**
 * Read projection of a session's timeline.
 *
 * @param sessionId             session id
 * @param projectId             project id
 * @param currentCheckpointId   checkpoint the working tree was last aligned with (nullable)
 * @param totalCheckpoints      checkpoints owned by this session
 * @param autoCheckpointEnabled whether {@link #checkpointStrategy} is consulted at all
 * @param checkpointStrategy    active auto-checkpoint strategy
 * @param roots                 tree roots, oldest first; fork origins from other sessions appear
 *                              as ancestors of this session's checkpoints
 */
public record SessionTimeline(
    String sessionId,
    String projectId,
    String currentCheckpointId,
    int totalCheckpoints,
    boolean autoCheckpointEnabled,
    CheckpointStrategy checkpointStrategy,
    List<TimelineNode> roots
) {}
