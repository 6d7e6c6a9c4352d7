package com.codeforge.orchestrator.sandbox;

/**
 * Thrown when a path argument resolves outside the project's sandbox root,
 * whether through "..", an absolute path or a symbolic link.
 *
 * Never retried: the task that issued the offending call fails immediately.
 */
public class PathViolationException extends RuntimeException {

    private final String requestedPath;
    private final String reason;

    public PathViolationException(String requestedPath, String reason) {
        super("Path '" + requestedPath + "' rejected: " + reason);
        this.requestedPath = requestedPath;
        this.reason        = reason;
    }

    public String getRequestedPath() { return requestedPath; }
    public String getReason()        { return reason; }
}
