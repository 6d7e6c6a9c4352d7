package com.codeforge.orchestrator.agent;

import com.codeforge.orchestrator.llm.TextGenerationClient;
import com.codeforge.orchestrator.model.Plan;
import com.codeforge.orchestrator.sandbox.SandboxedFileGateway;

import java.util.Set;

/**
 * Everything the coding loop needs that is shared by all tasks of one run.
 *
 * @param enabledTools tool names the collaborator may call in this run
 */
public record CodingSession(
        String               projectId,
        Plan                 plan,
        SandboxedFileGateway gateway,
        TextGenerationClient generator,
        String               model,
        IterationBudget      budget,
        CancellationToken    cancellation,
        Set<String>          enabledTools) {

    public CodingSession {
        enabledTools = Set.copyOf(enabledTools);
    }
}
