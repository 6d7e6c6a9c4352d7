package com.codeforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Tester output for one generated file, plus the sandbox-relative path the
 * generated test code was written to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestArtifact(
        String filepath,
        String framework,
        @JsonProperty("test_cases") List<TestCase> testCases,
        @JsonProperty("test_path")  String testPath) {

    public TestArtifact {
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestCase(String name, String description, String code) {}
}
