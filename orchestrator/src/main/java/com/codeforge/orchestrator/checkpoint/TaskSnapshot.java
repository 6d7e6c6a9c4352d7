package com.codeforge.orchestrator.checkpoint;

import com.codeforge.orchestrator.model.Task;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Persisted form of one Task, without its status (statuses are stored
 * separately so a resumed run can reset them).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskSnapshot(
        String id,
        @JsonProperty("filepath")      String filePath,
        String instruction,
        @JsonProperty("depends_on")    List<String> dependencies,
        int priority,
        String complexity,
        @JsonProperty("listing_index") int listingIndex) {

    static TaskSnapshot of(Task task) {
        return new TaskSnapshot(task.getId(), task.getFilePath(), task.getInstruction(),
                task.getDependencies(), task.getPriority(), task.getComplexity(), task.getListingIndex());
    }

    Task toTask() {
        return new Task(id, filePath, instruction, dependencies, priority, complexity, listingIndex);
    }
}
