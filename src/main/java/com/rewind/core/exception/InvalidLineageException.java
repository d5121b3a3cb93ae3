package com.rewind.core.exception;

/**
 * Thrown when a restore, fork or diff references a checkpoint outside the session's lineage.
 */
public class InvalidLineageException extends CheckpointException {
    public InvalidLineageException(String message) {
        super(message);
    }
}
