package com.rewind.core.model;

import java.util.List;

/**
 * Node of the timeline tree projection.
 *
 * @param checkpoint      the checkpoint at this node
 * @param children        checkpoints whose parent is this one, oldest first
 * @param fileSnapshotIds content hashes of the files captured by this checkpoint
 */
public record TimelineNode(
    Checkpoint checkpoint,
    List<TimelineNode> children,
    List<String> fileSnapshotIds
) {}
