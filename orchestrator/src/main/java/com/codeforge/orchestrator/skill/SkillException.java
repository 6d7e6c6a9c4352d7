package com.codeforge.orchestrator.skill;

/**
 * Thrown when a tool call fails in a way the coding loop must handle.
 *
 * Unchecked. Only PATH_VIOLATION is fatal for the calling task; every other
 * kind is returned to the collaborator as an error observation and the task
 * keeps going within its iteration budget.
 */
public class SkillException extends RuntimeException {

    public enum Kind {
        PATH_VIOLATION,
        TOOL_ERROR,
        NOT_FOUND,
        INVALID_ARGUMENTS,
        TIMEOUT,
        RATE_LIMITED,
        UNKNOWN_TOOL
    }

    private final Kind kind;

    public SkillException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public SkillException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean isFatal() { return kind == Kind.PATH_VIOLATION; }
}
