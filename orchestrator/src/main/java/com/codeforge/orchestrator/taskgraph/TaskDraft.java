package com.codeforge.orchestrator.taskgraph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One task as emitted by the Architect stage, before dependency resolution.
 * Dependencies are file paths from the Plan, not task identifiers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskDraft(
        String filepath,
        String description,
        @JsonProperty("depends_on") List<String> dependsOn,
        Integer priority,
        String complexity) {

    public TaskDraft {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
