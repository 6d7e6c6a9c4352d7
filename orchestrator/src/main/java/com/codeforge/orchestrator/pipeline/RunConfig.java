package com.codeforge.orchestrator.pipeline;

import com.codeforge.orchestrator.llm.Provider;
import com.codeforge.orchestrator.model.Stage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable configuration of one run: application defaults overlaid with CLI
 * flags. Built once and passed to the state machine; nothing reads run
 * settings from anywhere else.
 *
 * @param outputDir             parent directory of every project root
 * @param recursionLimit        size of the shared coding-loop iteration budget
 * @param stageRetries          re-invocations of a stage after a validation failure
 * @param workers               coding-stage worker-pool size; 1 means sequential
 * @param continueOnTaskFailure keep running independent tasks after one fails
 * @param model                 model name; the provider default when null
 */
public record RunConfig(
        String   projectName,
        Path     outputDir,
        int      recursionLimit,
        int      stageRetries,
        int      workers,
        boolean  continueOnTaskFailure,
        boolean  reviewEnabled,
        boolean  testingEnabled,
        boolean  gitEnabled,
        boolean  webSearchEnabled,
        boolean  dockerRequested,
        Provider provider,
        String   model,
        Duration llmTimeout,
        int      llmMaxAttempts,
        long     llmBackoffMillis) {

    public RunConfig {
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("project name must not be blank");
        }
        if (recursionLimit < 1) throw new IllegalArgumentException("recursion limit must be >= 1");
        if (stageRetries < 0)   throw new IllegalArgumentException("stage retries must be >= 0");
        if (workers < 1)        throw new IllegalArgumentException("workers must be >= 1");
        if (provider == null)   provider = Provider.ANTHROPIC;
        if (llmTimeout == null) llmTimeout = Duration.ofSeconds(120);
    }

    /** The model actually requested from the provider. */
    public String effectiveModel() {
        return model == null || model.isBlank() ? provider.defaultModel() : model;
    }

    public Path projectRoot() {
        return outputDir.resolve(projectName);
    }

    /** Whether an optional stage runs in this configuration. */
    public boolean isEnabled(Stage stage) {
        return switch (stage) {
            case REVIEWING -> reviewEnabled;
            case TESTING   -> testingEnabled;
            default        -> true;
        };
    }

    /** Tool names the coding loop may call. */
    public Set<String> enabledTools() {
        Set<String> tools = new LinkedHashSet<>(Set.of("write_file", "read_file", "list_files",
                "get_current_directory", "install_dependency"));
        if (gitEnabled)       tools.add("git");
        if (webSearchEnabled) tools.add("web_lookup");
        return tools;
    }

    public static Builder builder(String projectName) {
        return new Builder(projectName);
    }

    public Builder toBuilder() {
        return new Builder(projectName)
                .outputDir(outputDir).recursionLimit(recursionLimit).stageRetries(stageRetries)
                .workers(workers).continueOnTaskFailure(continueOnTaskFailure)
                .review(reviewEnabled).testing(testingEnabled).git(gitEnabled)
                .webSearch(webSearchEnabled).docker(dockerRequested)
                .provider(provider).model(model)
                .llmTimeout(llmTimeout).llmMaxAttempts(llmMaxAttempts).llmBackoffMillis(llmBackoffMillis);
    }

    public static final class Builder {
        private String   projectName;
        private Path     outputDir        = Path.of("generated_project");
        private int      recursionLimit   = 100;
        private int      stageRetries     = 3;
        private int      workers          = 1;
        private boolean  continueOnTaskFailure;
        private boolean  review           = true;
        private boolean  testing          = true;
        private boolean  git              = true;
        private boolean  webSearch;
        private boolean  docker;
        private Provider provider         = Provider.ANTHROPIC;
        private String   model;
        private Duration llmTimeout       = Duration.ofSeconds(120);
        private int      llmMaxAttempts   = 3;
        private long     llmBackoffMillis = 1000;

        private Builder(String projectName) { this.projectName = projectName; }

        public Builder projectName(String v)              { projectName = v; return this; }
        public Builder outputDir(Path v)                  { outputDir = v; return this; }
        public Builder recursionLimit(int v)              { recursionLimit = v; return this; }
        public Builder stageRetries(int v)                { stageRetries = v; return this; }
        public Builder workers(int v)                     { workers = v; return this; }
        public Builder continueOnTaskFailure(boolean v)   { continueOnTaskFailure = v; return this; }
        public Builder review(boolean v)                  { review = v; return this; }
        public Builder testing(boolean v)                 { testing = v; return this; }
        public Builder git(boolean v)                     { git = v; return this; }
        public Builder webSearch(boolean v)               { webSearch = v; return this; }
        public Builder docker(boolean v)                  { docker = v; return this; }
        public Builder provider(Provider v)               { provider = v; return this; }
        public Builder model(String v)                    { model = v; return this; }
        public Builder llmTimeout(Duration v)             { llmTimeout = v; return this; }
        public Builder llmMaxAttempts(int v)              { llmMaxAttempts = v; return this; }
        public Builder llmBackoffMillis(long v)           { llmBackoffMillis = v; return this; }

        public RunConfig build() {
            return new RunConfig(projectName, outputDir, recursionLimit, stageRetries, workers,
                    continueOnTaskFailure, review, testing, git, webSearch, docker,
                    provider, model, llmTimeout, llmMaxAttempts, llmBackoffMillis);
        }
    }
}
