package com.codeforge.orchestrator.llm;

/**
 * The text-generation service (or another network collaborator) could not
 * produce an answer: unreachable, timed out, or replied with an error status.
 */
public class ExternalServiceException extends RuntimeException {

    private final int     statusCode;
    private final boolean retryable;

    public ExternalServiceException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.retryable  = retryable;
    }

    public ExternalServiceException(int statusCode, String body) {
        super("API error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
        // 408, 429 and 5xx are transient; any other status means the request itself is wrong.
        this.retryable  = statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() { return statusCode; }

    public boolean isRetryable() { return retryable; }
}
