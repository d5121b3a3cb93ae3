package com.rewind.core.model;

/**
 * Coarse change figures for a file present in both checkpoints of a diff.
 *
 * @param path      project-relative path
 * @param additions line count of the newer version
 * @param deletions line count of the older version
 */
public record FileDiff(
    String path,
    long additions,
    long deletions
) {}
