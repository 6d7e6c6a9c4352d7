package com.codeforge.orchestrator.taskgraph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Raw Architect output: the task list in the order the Architect wrote it. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskPlanDraft(List<TaskDraft> tasks) {

    public TaskPlanDraft {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
