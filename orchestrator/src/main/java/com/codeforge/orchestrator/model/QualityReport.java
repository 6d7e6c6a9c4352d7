package com.codeforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Reviewer output for one generated file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QualityReport(
        String filepath,
        @JsonProperty("quality_score") int qualityScore,
        List<String> issues,
        List<String> suggestions,
        boolean approved) {

    public QualityReport {
        issues      = issues      == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /** This report attributed to {@code path}, with the score clamped to 0..100. */
    public QualityReport forFile(String path) {
        return new QualityReport(path, Math.max(0, Math.min(100, qualityScore)), issues, suggestions, approved);
    }
}
