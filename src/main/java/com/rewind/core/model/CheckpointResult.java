package com.rewind.core.model;

import java.util.List;

/**
 * Outcome of a create, restore or fork.
 *
 * @param checkpoint     the checkpoint created or restored
 * @param filesProcessed files captured or written
 * @param warnings       non-fatal problems, e.g. files skipped while snapshotting
 * @param transcript     exact transcript of the checkpoint on restore and fork, {@code null} on create
 */
public record CheckpointResult(
    Checkpoint checkpoint,
    int filesProcessed,
    List<String> warnings,
    String transcript
) {}
