package com.rewind.core.exception;

/**
 * Thrown when a checkpoint, blob or session cannot be found.
 */
public class CheckpointNotFoundException extends CheckpointException {
    public CheckpointNotFoundException(String message) {
        super(message);
    }

    public CheckpointNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
