package com.codeforge.orchestrator.checkpoint;

/**
 * A checkpoint could not be written, or a stored one could not be read back.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
