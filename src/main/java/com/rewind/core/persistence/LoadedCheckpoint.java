package com.rewind.core.persistence;

import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.FileSnapshot;

import java.util.List;

/**
 * A checkpoint with its file contents and transcript fully materialised.
 */
public record LoadedCheckpoint(
    Checkpoint checkpoint,
    List<FileSnapshot> files,
    String transcript
) {}
