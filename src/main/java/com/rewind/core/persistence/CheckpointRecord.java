package com.rewind.core.persistence;

import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.FileRef;

import java.util.List;

/**
 * Stored form of a checkpoint: the checkpoint itself, its per-session sequence number
 * and the blob references of every captured file.
 */
public record CheckpointRecord(
    Checkpoint checkpoint,
    long sequence,
    List<FileRef> files
) {
    public CheckpointRecord {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
