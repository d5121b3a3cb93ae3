package com.rewind.core.exception;

/**
 * Thrown when blob or record I/O against the checkpoint store fails.
 */
public class StorageIoException extends CheckpointException {
    public StorageIoException(String message) {
        super(message);
    }

    public StorageIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
