package com.rewind.core.model;

import java.io.Serializable;

/**
 * Summary figures captured alongside a checkpoint.
 *
 * @param totalTokens  input + output tokens reported by the transcript up to this checkpoint
 * @param modelUsed    model named by the most recent assistant message (nullable)
 * @param userPrompt   most recent user prompt text (nullable)
 * @param fileChanges  files added, removed or modified relative to the parent checkpoint
 * @param snapshotSize total bytes across all captured files
 * @param fileCount    number of files captured
 */
public record CheckpointMetadata(
    long totalTokens,
    String modelUsed,
    String userPrompt,
    int fileChanges,
    long snapshotSize,
    int fileCount
) implements Serializable {

    public static CheckpointMetadata empty() {
        return new CheckpointMetadata(0, null, null, 0, 0, 0);
    }
}
