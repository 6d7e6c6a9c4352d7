package com.codeforge.orchestrator.agent;

/**
 * Result of driving one task through the coding loop.
 *
 * @param iterations budget units this task consumed
 * @param message    the collaborator's result summary, or the error that stopped the loop
 */
public record TaskOutcome(String taskId, ExitReason reason, int iterations, String message) {

    public boolean completed() {
        return reason == ExitReason.COMPLETED;
    }
}
