package com.codeforge.orchestrator.cli;

import com.codeforge.orchestrator.agent.CancellationToken;
import com.codeforge.orchestrator.checkpoint.CheckpointStore;
import com.codeforge.orchestrator.config.RunDefaults;
import com.codeforge.orchestrator.llm.Provider;
import com.codeforge.orchestrator.model.ErrorKind;
import com.codeforge.orchestrator.model.FailureRecord;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.ProjectStatus;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.pipeline.PipelineFactory;
import com.codeforge.orchestrator.pipeline.PipelineOutcome;
import com.codeforge.orchestrator.pipeline.PipelineStateMachine;
import com.codeforge.orchestrator.pipeline.RunConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerateCommandTest {

    @TempDir Path tmp;

    RunDefaults          defaults;
    PipelineFactory      factory;
    CheckpointStore      checkpoints;
    PipelineStateMachine machine;
    GenerateCommand      command;

    @BeforeEach
    void setUp() {
        defaults = new RunDefaults(tmp.toString(), 100, 3, 1, false, true, true, true, false, false,
                "anthropic", "", 120, 3, 1000);
        factory = mock(PipelineFactory.class);
        checkpoints = mock(CheckpointStore.class);
        machine = mock(PipelineStateMachine.class);
        when(factory.checkpointStore()).thenReturn(checkpoints);
        when(factory.create(any(RunConfig.class), any(CancellationToken.class))).thenReturn(machine);
        command = new GenerateCommand(defaults, factory);
    }

    int execute(String... args) {
        return new CommandLine(command).execute(args);
    }

    // ------------------------------------------------------------------
    // Flag overlay
    // ------------------------------------------------------------------

    @Test
    void buildConfig_usesDefaultsWhenNoFlagsGiven() {
        new CommandLine(command).parseArgs("build a calculator", "--name", "calc");

        RunConfig config = command.buildConfig();

        assertThat(config.projectName()).isEqualTo("calc");
        assertThat(config.projectRoot()).isEqualTo(tmp.resolve("calc"));
        assertThat(config.recursionLimit()).isEqualTo(100);
        assertThat(config.workers()).isEqualTo(1);
        assertThat(config.isEnabled(Stage.REVIEWING)).isTrue();
        assertThat(config.isEnabled(Stage.TESTING)).isTrue();
        assertThat(config.provider()).isEqualTo(Provider.ANTHROPIC);
        assertThat(config.effectiveModel()).isEqualTo(Provider.ANTHROPIC.defaultModel());
    }

    @Test
    void buildConfig_flagsOverrideDefaults() {
        new CommandLine(command).parseArgs("build a calculator", "--name", "calc",
                "--no-review", "--no-test", "--web-search", "-r", "40", "--workers", "4",
                "--provider", "Groq", "--model", "mixtral");

        RunConfig config = command.buildConfig();

        assertThat(config.isEnabled(Stage.REVIEWING)).isFalse();
        assertThat(config.isEnabled(Stage.TESTING)).isFalse();
        assertThat(config.enabledTools()).contains("web_lookup");
        assertThat(config.recursionLimit()).isEqualTo(40);
        assertThat(config.workers()).isEqualTo(4);
        assertThat(config.provider()).isEqualTo(Provider.GROQ);
        assertThat(config.effectiveModel()).isEqualTo("mixtral");
    }

    // ------------------------------------------------------------------
    // Exit codes
    // ------------------------------------------------------------------

    @Test
    void unknownProvider_isUsageError() {
        int exit = execute("build a calculator", "--name", "calc", "--provider", "acme");

        assertThat(exit).isEqualTo(GenerateCommand.EXIT_USAGE);
        verify(factory, never()).create(any(), any());
    }

    @Test
    void missingName_isRejectedByParser() {
        assertThat(execute("build a calculator")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void noPromptAndNoCheckpoint_isUsageError() {
        when(machine.open(null)).thenThrow(new IllegalArgumentException("a prompt is required"));

        assertThat(execute("--name", "calc")).isEqualTo(GenerateCommand.EXIT_USAGE);
        verify(machine, never()).run(any());
    }

    @Test
    void succeededRun_exitsZero() {
        Project project = new Project("calc", tmp.resolve("calc"), "build a calculator");
        when(machine.open("build a calculator")).thenReturn(project);
        when(machine.run(project)).thenReturn(new PipelineOutcome(project, ProjectStatus.SUCCEEDED, null, null));

        assertThat(execute("build a calculator", "--name", "calc")).isZero();
    }

    @Test
    void interruptedRun_exitsThree() {
        Project project = new Project("calc", tmp.resolve("calc"), "build a calculator");
        FailureRecord failure = new FailureRecord(Stage.CODING, ErrorKind.INTERRUPTED, "run cancelled");
        when(machine.open(anyString())).thenReturn(project);
        when(machine.run(project)).thenReturn(
                new PipelineOutcome(project, ProjectStatus.INTERRUPTED, failure, "/tmp/calc.json"));

        assertThat(execute("build a calculator", "--name", "calc"))
                .isEqualTo(GenerateCommand.EXIT_INTERRUPTED);
    }

    @Test
    void failedRun_exitsOne() {
        Project project = new Project("calc", tmp.resolve("calc"), "build a calculator");
        FailureRecord failure = new FailureRecord(Stage.CODING, ErrorKind.PATH_VIOLATION, "escapes root");
        when(machine.open(anyString())).thenReturn(project);
        when(machine.run(project)).thenReturn(new PipelineOutcome(project, ProjectStatus.FAILED, failure, null));

        assertThat(execute("build a calculator", "--name", "calc")).isEqualTo(1);
    }

    @Test
    void fresh_discardsCheckpointBeforeOpening() {
        Project project = new Project("calc", tmp.resolve("calc"), "build a calculator");
        when(checkpoints.delete("calc")).thenReturn(true);
        when(machine.open(anyString())).thenReturn(project);
        when(machine.run(project)).thenReturn(new PipelineOutcome(project, ProjectStatus.SUCCEEDED, null, null));

        execute("build a calculator", "--name", "calc", "--fresh");

        verify(checkpoints).delete("calc");
    }
}
