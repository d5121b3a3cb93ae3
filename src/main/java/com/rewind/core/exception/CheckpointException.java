package com.rewind.core.exception;

/**
 * Base type for failures raised by the checkpoint engine.
 */
public class CheckpointException extends RuntimeException {
    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
