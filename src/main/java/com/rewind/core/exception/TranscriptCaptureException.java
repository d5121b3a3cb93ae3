package com.rewind.core.exception;

/**
 * Thrown when the session transcript cannot be captured. Checkpoint creation fails outright.
 */
public class TranscriptCaptureException extends CheckpointException {
    public TranscriptCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
