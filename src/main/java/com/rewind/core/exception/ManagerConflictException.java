package com.rewind.core.exception;

/**
 * Thrown when a session id is requested with a project binding different from the one
 * its active manager was created with.
 */
public class ManagerConflictException extends CheckpointException {
    public ManagerConflictException(String message) {
        super(message);
    }
}
