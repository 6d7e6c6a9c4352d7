package com.codeforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Output of the Planner stage. Immutable once produced.
 *
 * Wire field names are snake_case because this is also the shape the
 * text-generation collaborator is asked to emit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Plan(
        String name,
        String description,
        @JsonProperty("tech_stack")        List<String> techStack,
        List<String> features,
        List<PlannedFile> files,
        @JsonProperty("required_packages") List<String> requiredPackages) {

    public Plan {
        techStack        = techStack        == null ? List.of() : List.copyOf(techStack);
        features         = features         == null ? List.of() : List.copyOf(features);
        files            = files            == null ? List.of() : List.copyOf(files);
        requiredPackages = requiredPackages == null ? List.of() : List.copyOf(requiredPackages);
    }

    public boolean declaresFile(String path) {
        return findFile(path).isPresent();
    }

    public Optional<PlannedFile> findFile(String path) {
        return files.stream().filter(f -> f.path().equals(path)).findFirst();
    }

    /** True if any tech-stack entry mentions {@code keyword} (case-insensitive). */
    public boolean usesStack(String keyword) {
        String k = keyword.toLowerCase();
        return techStack.stream().anyMatch(s -> s.toLowerCase().contains(k));
    }
}
