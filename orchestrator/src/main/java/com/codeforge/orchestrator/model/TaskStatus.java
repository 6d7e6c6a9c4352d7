package com.codeforge.orchestrator.model;

/**
 * Execution state of a single Task.
 *
 * Transitions:
 *   PENDING     → IN_PROGRESS (picked up by a coding worker)
 *   IN_PROGRESS → DONE        (completion signal received)
 *   IN_PROGRESS → FAILED      (budget exhausted, fatal tool error, collaborator down)
 *   IN_PROGRESS / FAILED → PENDING (only when a run is restored from a checkpoint)
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    DONE,
    FAILED
}
