package com.codeforge.orchestrator.pipeline;

import com.codeforge.orchestrator.model.FailureRecord;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.ProjectStatus;

/**
 * How a run ended, as reported to the CLI.
 */
public record PipelineOutcome(Project project, ProjectStatus status, FailureRecord failure, String checkpointLocation) {

    public boolean succeeded() {
        return status == ProjectStatus.SUCCEEDED;
    }

    /** 0 on success, 3 when interrupted, 1 for every other failure. */
    public int exitCode() {
        return switch (status) {
            case SUCCEEDED   -> 0;
            case INTERRUPTED -> 3;
            default          -> 1;
        };
    }
}
