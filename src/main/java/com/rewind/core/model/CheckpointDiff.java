package com.rewind.core.model;

import java.util.List;

/**
 * Differences between two checkpoints. Derived on demand, never persisted.
 *
 * @param fromCheckpointId older side of the comparison
 * @param toCheckpointId   newer side of the comparison
 * @param modifiedFiles    paths present in both with differing content
 * @param addedFiles       paths only in {@code to}
 * @param deletedFiles     paths only in {@code from}
 * @param tokenDelta       {@code to.totalTokens - from.totalTokens}
 */
public record CheckpointDiff(
    String fromCheckpointId,
    String toCheckpointId,
    List<FileDiff> modifiedFiles,
    List<String> addedFiles,
    List<String> deletedFiles,
    long tokenDelta
) {}
