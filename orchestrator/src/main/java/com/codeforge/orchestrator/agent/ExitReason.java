package com.codeforge.orchestrator.agent;

import com.codeforge.orchestrator.model.ErrorKind;

/**
 * Why a coding loop stopped. The set is closed: every loop ends in exactly one of these.
 */
public enum ExitReason {
    COMPLETED(null),
    BUDGET_EXHAUSTED(ErrorKind.BUDGET_EXHAUSTED),
    FATAL_TOOL_ERROR(ErrorKind.PATH_VIOLATION),
    EXTERNAL_SERVICE_ERROR(ErrorKind.EXTERNAL_SERVICE),
    CANCELLED(ErrorKind.INTERRUPTED);

    private final ErrorKind errorKind;

    ExitReason(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    /** The error this exit is recorded as; null for COMPLETED. */
    public ErrorKind errorKind() {
        return errorKind;
    }
}
