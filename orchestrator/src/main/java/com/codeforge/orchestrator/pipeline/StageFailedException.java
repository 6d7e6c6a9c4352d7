package com.codeforge.orchestrator.pipeline;

import com.codeforge.orchestrator.model.ErrorKind;

/**
 * A stage could not complete for a reason that retrying with feedback will
 * not fix. Ends the run; the kind is recorded on the project.
 */
public class StageFailedException extends RuntimeException {

    private final ErrorKind kind;

    public StageFailedException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StageFailedException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }
}
