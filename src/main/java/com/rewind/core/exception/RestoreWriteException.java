package com.rewind.core.exception;

import java.util.List;

/**
 * Thrown when a restore cannot write the working tree. The working tree is rolled back
 * to its state before the restore began.
 */
public class RestoreWriteException extends CheckpointException {

    private final List<String> failedPaths;

    public RestoreWriteException(String message, List<String> failedPaths, Throwable cause) {
        super(message, cause);
        this.failedPaths = List.copyOf(failedPaths);
    }

    public List<String> getFailedPaths() {
        return failedPaths;
    }
}
