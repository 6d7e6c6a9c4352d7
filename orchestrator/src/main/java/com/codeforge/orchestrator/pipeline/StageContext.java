package com.codeforge.orchestrator.pipeline;

import com.codeforge.orchestrator.agent.CancellationToken;
import com.codeforge.orchestrator.agent.IterationBudget;
import com.codeforge.orchestrator.llm.TextGenerationClient;
import com.codeforge.orchestrator.model.ErrorKind;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.sandbox.SandboxedFileGateway;

/**
 * Inputs of one stage invocation.
 *
 * @param feedback           the previous attempt's validation error, or null on the first attempt
 * @param attempt            1 for the first invocation, incremented on each retry
 * @param progressCheckpoint writes an intermediate checkpoint without completing the stage
 */
public record StageContext(
        Project              project,
        RunConfig            config,
        String               feedback,
        int                  attempt,
        TextGenerationClient generator,
        SandboxedFileGateway gateway,
        IterationBudget      budget,
        CancellationToken    cancellation,
        Runnable             progressCheckpoint) {

    /** Appends the corrective feedback, if any, to a stage's request text. */
    public String withFeedback(String request) {
        return appendFeedback(request, feedback);
    }

    public static String appendFeedback(String request, String feedback) {
        if (feedback == null) return request;
        return request + "\n\nYOUR PREVIOUS REPLY WAS REJECTED. Fix these problems and reply again:\n" + feedback;
    }

    public void checkCancelled() {
        if (cancellation.isCancelled()) {
            throw new StageFailedException(ErrorKind.INTERRUPTED, "run cancelled");
        }
    }
}
