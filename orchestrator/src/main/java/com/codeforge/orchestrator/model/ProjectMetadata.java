package com.codeforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Summary produced by the Finalizing stage. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectMetadata(
        @JsonProperty("project_name")     String projectName,
        @JsonProperty("created_at")       Instant createdAt,
        @JsonProperty("files_created")    List<String> filesCreated,
        @JsonProperty("total_lines")      long totalLines,
        List<String> packages,
        @JsonProperty("git_initialized")  boolean gitInitialized,
        @JsonProperty("docker_requested") boolean dockerRequested,
        @JsonProperty("tests_generated")  boolean testsGenerated,
        @JsonProperty("review_count")     int reviewCount) {

    public ProjectMetadata {
        filesCreated = filesCreated == null ? List.of() : List.copyOf(filesCreated);
        packages     = packages     == null ? List.of() : List.copyOf(packages);
    }
}
