package com.codeforge.orchestrator.model;

/**
 * Lifecycle status of a Project.
 *
 * INTERRUPTED is the status recorded when an external cancellation stops the
 * run; the stage is FAILED but the last checkpoint is kept for a later resume.
 */
public enum ProjectStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    INTERRUPTED
}
