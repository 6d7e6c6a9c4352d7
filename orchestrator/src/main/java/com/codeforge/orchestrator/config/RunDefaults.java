package com.codeforge.orchestrator.config;

import com.codeforge.orchestrator.llm.Provider;
import com.codeforge.orchestrator.pipeline.RunConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Application-level defaults for a run, from {@code application.yml} and the
 * environment. CLI flags are overlaid on the builder this returns.
 */
@Component
public class RunDefaults {

    private final Path     outputDir;
    private final int      recursionLimit;
    private final int      stageRetries;
    private final int      workers;
    private final boolean  continueOnTaskFailure;
    private final boolean  review;
    private final boolean  testing;
    private final boolean  git;
    private final boolean  webSearch;
    private final boolean  docker;
    private final Provider provider;
    private final String   model;
    private final Duration llmTimeout;
    private final int      llmMaxAttempts;
    private final long     llmBackoffMillis;

    public RunDefaults(
            @Value("${codeforge.output-dir:generated_project}") String outputDir,
            @Value("${codeforge.recursion-limit:100}") int recursionLimit,
            @Value("${codeforge.stage-retries:3}") int stageRetries,
            @Value("${codeforge.workers:1}") int workers,
            @Value("${codeforge.continue-on-task-failure:false}") boolean continueOnTaskFailure,
            @Value("${codeforge.features.review:true}") boolean review,
            @Value("${codeforge.features.testing:true}") boolean testing,
            @Value("${codeforge.features.git:true}") boolean git,
            @Value("${codeforge.features.web-search:false}") boolean webSearch,
            @Value("${codeforge.features.docker:false}") boolean docker,
            @Value("${codeforge.llm.provider:anthropic}") String provider,
            @Value("${codeforge.llm.model:}") String model,
            @Value("${codeforge.llm.timeout-seconds:120}") long timeoutSeconds,
            @Value("${codeforge.llm.max-attempts:3}") int llmMaxAttempts,
            @Value("${codeforge.llm.backoff-millis:1000}") long llmBackoffMillis) {
        this.outputDir             = Path.of(outputDir);
        this.recursionLimit        = recursionLimit;
        this.stageRetries          = stageRetries;
        this.workers               = workers;
        this.continueOnTaskFailure = continueOnTaskFailure;
        this.review                = review;
        this.testing               = testing;
        this.git                   = git;
        this.webSearch             = webSearch;
        this.docker                = docker;
        this.provider              = Provider.parse(provider);
        this.model                 = model == null || model.isBlank() ? null : model;
        this.llmTimeout            = Duration.ofSeconds(timeoutSeconds);
        this.llmMaxAttempts        = llmMaxAttempts;
        this.llmBackoffMillis      = llmBackoffMillis;
    }

    public RunConfig.Builder forProject(String projectName) {
        return RunConfig.builder(projectName)
                .outputDir(outputDir)
                .recursionLimit(recursionLimit)
                .stageRetries(stageRetries)
                .workers(workers)
                .continueOnTaskFailure(continueOnTaskFailure)
                .review(review)
                .testing(testing)
                .git(git)
                .webSearch(webSearch)
                .docker(docker)
                .provider(provider)
                .model(model)
                .llmTimeout(llmTimeout)
                .llmMaxAttempts(llmMaxAttempts)
                .llmBackoffMillis(llmBackoffMillis);
    }
}
