package com.codeforge.orchestrator.model;

/**
 * States of the generation pipeline for a Project.
 *
 * Transitions (happy path):
 *   PLANNING → ARCHITECTING → CODING → REVIEWING → TESTING → FINALIZING → DONE
 *
 * REVIEWING and TESTING are optional: when disabled by the run configuration
 * they are still entered, but complete as a no-op and still checkpoint.
 * Any non-terminal state can transition to FAILED.
 */
public enum Stage {
    PLANNING,
    ARCHITECTING,
    CODING,
    REVIEWING,
    TESTING,
    FINALIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean isOptional() {
        return this == REVIEWING || this == TESTING;
    }

    /** The stage that follows this one on the happy path; terminal states have none. */
    public Stage next() {
        return switch (this) {
            case PLANNING     -> ARCHITECTING;
            case ARCHITECTING -> CODING;
            case CODING       -> REVIEWING;
            case REVIEWING    -> TESTING;
            case TESTING      -> FINALIZING;
            case FINALIZING   -> DONE;
            case DONE, FAILED -> throw new IllegalStateException("No stage after terminal state " + this);
        };
    }

    /** The happy-path predecessor; null for PLANNING and for FAILED. */
    public Stage previous() {
        return switch (this) {
            case PLANNING, FAILED -> null;
            case ARCHITECTING     -> PLANNING;
            case CODING           -> ARCHITECTING;
            case REVIEWING        -> CODING;
            case TESTING          -> REVIEWING;
            case FINALIZING       -> TESTING;
            case DONE             -> FINALIZING;
        };
    }
}
