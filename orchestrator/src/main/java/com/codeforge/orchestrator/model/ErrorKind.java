package com.codeforge.orchestrator.model;

/** The kind of error that ended a stage, recorded on the Project. */
public enum ErrorKind {
    VALIDATION,
    PATH_VIOLATION,
    TOOL_EXECUTION,
    BUDGET_EXHAUSTED,
    EXTERNAL_SERVICE,
    INTERRUPTED
}
