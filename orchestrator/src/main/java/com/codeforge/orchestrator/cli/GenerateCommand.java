package com.codeforge.orchestrator.cli;

import com.codeforge.orchestrator.agent.CancellationToken;
import com.codeforge.orchestrator.config.RunDefaults;
import com.codeforge.orchestrator.llm.Provider;
import com.codeforge.orchestrator.model.FailureRecord;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.QualityReport;
import com.codeforge.orchestrator.model.Task;
import com.codeforge.orchestrator.pipeline.PipelineFactory;
import com.codeforge.orchestrator.pipeline.PipelineOutcome;
import com.codeforge.orchestrator.pipeline.PipelineStateMachine;
import com.codeforge.orchestrator.pipeline.RunConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: codeforge generate "&lt;prompt&gt;" --name &lt;project&gt;
 * <p>
 * Runs the generation pipeline for a project, resuming from its checkpoint
 * when one exists. Ctrl-C cancels the run at the next iteration boundary and
 * keeps the checkpoint for a later resume.
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Generate (or resume generating) a project from a description")
@Component
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_USAGE       = CommandLine.ExitCode.USAGE;
    static final int EXIT_INTERRUPTED = 3;

    @Parameters(index = "0", arity = "0..1",
            description = "What to build. Optional when resuming from a checkpoint.")
    private String prompt;

    @Option(names = {"--name", "-n"}, required = true, description = "Project name; also the output directory name")
    private String name;

    @Option(names = {"--recursion-limit", "-r"}, description = "Coding-loop iteration budget for the whole run")
    private Integer recursionLimit;

    @Option(names = "--review", negatable = true, description = "Run the review stage")
    private Boolean review;

    @Option(names = "--test", negatable = true, description = "Run the test-generation stage")
    private Boolean test;

    @Option(names = "--git", negatable = true, description = "Initialise a git repository and enable the git tool")
    private Boolean git;

    @Option(names = "--docker", negatable = true, description = "Record that Docker support was requested")
    private Boolean docker;

    @Option(names = "--web-search", negatable = true, description = "Enable the web_lookup tool")
    private Boolean webSearch;

    @Option(names = "--provider", description = "Text-generation provider: anthropic, openai, groq")
    private String provider;

    @Option(names = "--model", description = "Model name (provider default when omitted)")
    private String model;

    @Option(names = "--workers", description = "Coding tasks run concurrently (1 = sequential)")
    private Integer workers;

    @Option(names = "--fresh", description = "Discard any existing checkpoint and start over")
    private boolean fresh;

    private final RunDefaults     defaults;
    private final PipelineFactory pipelineFactory;

    public GenerateCommand(RunDefaults defaults, PipelineFactory pipelineFactory) {
        this.defaults        = defaults;
        this.pipelineFactory = pipelineFactory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RunConfig config;
        try {
            config = buildConfig();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_USAGE;
        }

        if (fresh && pipelineFactory.checkpointStore().delete(config.projectName())) {
            ConsoleOutput.info("Discarded previous checkpoint for " + config.projectName());
        }

        CancellationToken cancellation = new CancellationToken();
        PipelineStateMachine machine = pipelineFactory.create(config, cancellation);

        Project project;
        try {
            project = machine.open(prompt);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_USAGE;
        }
        if (project.getPlan() != null) {
            ConsoleOutput.info("Resuming " + project.getId() + " at stage " + project.getStage());
        } else {
            ConsoleOutput.info("Generating " + project.getId() + " into " + project.getRootDir());
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancellation.cancel();
            try {
                // Let the run reach its next boundary and flush the checkpoint.
                if (!finished.await(30, TimeUnit.SECONDS)) {
                    log.warn("Run did not stop within 30s of cancellation");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "codeforge-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        PipelineOutcome outcome;
        try {
            outcome = machine.run(project);
        } finally {
            finished.countDown();
            removeHook(hook);
        }

        report(outcome);
        return outcome.exitCode();
    }

    RunConfig buildConfig() {
        RunConfig.Builder b = defaults.forProject(name);
        if (recursionLimit != null) b.recursionLimit(recursionLimit);
        if (review != null)         b.review(review);
        if (test != null)           b.testing(test);
        if (git != null)            b.git(git);
        if (docker != null)         b.docker(docker);
        if (webSearch != null)      b.webSearch(webSearch);
        if (provider != null)       b.provider(Provider.parse(provider));
        if (model != null)          b.model(model);
        if (workers != null)        b.workers(workers);
        return b.build();
    }

    private static void report(PipelineOutcome outcome) {
        Project project = outcome.project();
        System.out.println();
        if (project.getTaskGraph() != null) {
            System.out.println("TASKS:");
            for (Task t : project.getTaskGraph().executionOrder()) {
                ConsoleOutput.task(t.getId(), t.getFilePath(), t.getStatus());
            }
            System.out.println();
        }
        for (QualityReport r : project.getQualityReports()) {
            String verdict = r.approved() ? "approved" : "needs work";
            ConsoleOutput.info("[REVIEW] " + r.filepath() + " " + r.qualityScore() + "/100 " + verdict);
        }
        if (!project.getSkippedFiles().isEmpty()) {
            ConsoleOutput.warn("Skipped by optional stages: " + project.getSkippedFiles());
        }

        switch (outcome.status()) {
            case SUCCEEDED -> {
                ConsoleOutput.success("Done. Output in " + project.getRootDir());
                if (project.getMetadata() != null) {
                    ConsoleOutput.info(project.getMetadata().filesCreated().size() + " files, "
                            + project.getMetadata().totalLines() + " lines");
                }
            }
            case INTERRUPTED -> {
                ConsoleOutput.warn("Interrupted during " + outcome.failure().stage().name().toLowerCase()
                        + ". Run the same command again to resume.");
                printCheckpoint(outcome);
            }
            default -> {
                FailureRecord f = outcome.failure();
                ConsoleOutput.error("Failed at stage " + f.stage() + " (" + f.kind() + "): " + f.message());
                ConsoleOutput.warn("The output directory may contain a partial project: " + project.getRootDir());
                printCheckpoint(outcome);
            }
        }
    }

    private static void printCheckpoint(PipelineOutcome outcome) {
        if (outcome.checkpointLocation() != null) {
            ConsoleOutput.info("Last checkpoint: " + outcome.checkpointLocation());
        } else {
            ConsoleOutput.info("No checkpoint was written; the next run starts from the beginning.");
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running.
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}
