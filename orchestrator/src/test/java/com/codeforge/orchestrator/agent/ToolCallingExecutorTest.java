package com.codeforge.orchestrator.agent;

import com.codeforge.orchestrator.llm.ExternalServiceException;
import com.codeforge.orchestrator.model.Plan;
import com.codeforge.orchestrator.model.PlannedFile;
import com.codeforge.orchestrator.model.Task;
import com.codeforge.orchestrator.model.TaskStatus;
import com.codeforge.orchestrator.model.ToolCall;
import com.codeforge.orchestrator.sandbox.SandboxedFileGateway;
import com.codeforge.orchestrator.skill.ExecutionTarget;
import com.codeforge.orchestrator.skill.Skill;
import com.codeforge.orchestrator.skill.SkillExecutionContext;
import com.codeforge.orchestrator.skill.SkillManifest;
import com.codeforge.orchestrator.skill.SkillPolicy;
import com.codeforge.orchestrator.skill.SkillRegistry;
import com.codeforge.orchestrator.skill.ToolArguments;
import com.codeforge.orchestrator.skill.impl.CurrentDirectorySkill;
import com.codeforge.orchestrator.skill.impl.ListFilesSkill;
import com.codeforge.orchestrator.skill.impl.ReadFileSkill;
import com.codeforge.orchestrator.skill.impl.WriteFileSkill;
import com.codeforge.orchestrator.support.ScriptedTextGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static com.codeforge.orchestrator.support.ScriptedTextGenerator.done;
import static com.codeforge.orchestrator.support.ScriptedTextGenerator.toolCall;
import static com.codeforge.orchestrator.support.ScriptedTextGenerator.writeFile;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the coding loop, driven by a scripted collaborator against a
 * real sandbox in a temp directory.
 */
class ToolCallingExecutorTest {

    static final Set<String> FILE_TOOLS = Set.of("write_file", "read_file", "list_files",
            "get_current_directory", "once");

    @TempDir Path tmp;

    SandboxedFileGateway  gateway;
    ScriptedTextGenerator generator;
    CancellationToken     cancellation;
    ToolCallingExecutor   executor;
    Plan                  plan;
    Task                  task;

    /** A tool that may be called once per task. */
    static class OnceSkill implements Skill<ToolArguments, String> {
        @Override public SkillManifest manifest() {
            return new SkillManifest("once", "1.0.0", "once() -> str", "Callable once.", ExecutionTarget.SANDBOX_FILESYSTEM);
        }
        @Override public SkillPolicy policy() {
            return new SkillPolicy(false, false, 10, 1);
        }
        @Override public String execute(ToolArguments input, SkillExecutionContext ctx) {
            return "called";
        }
    }

    @BeforeEach
    void setUp() {
        gateway = new SandboxedFileGateway(tmp.resolve("calc"));
        generator = new ScriptedTextGenerator();
        cancellation = new CancellationToken();

        SkillRegistry registry = new SkillRegistry(List.of(
                new WriteFileSkill(), new ReadFileSkill(), new ListFilesSkill(), new CurrentDirectorySkill(),
                new OnceSkill()), new SimpleMeterRegistry());
        executor = new ToolCallingExecutor(registry, new SystemPrompts(registry), new ObjectMapper());

        plan = new Plan("calc", "A calculator", List.of("python"), List.of("add"),
                List.of(new PlannedFile("calculator.py", "arithmetic")), List.of());
        task = new Task("task-1", "calculator.py", "Implement add and subtract", List.of(), 0, "low", 0);
    }

    CodingSession session(int budget) {
        return session(new IterationBudget(budget), FILE_TOOLS);
    }

    CodingSession session(IterationBudget budget, Set<String> tools) {
        return new CodingSession("calc", plan, gateway, generator, "test-model", budget, cancellation, tools);
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    @Test
    void execute_writeThenResult_completes() {
        generator.reply(writeFile("calculator.py", "def add(a, b):\n    return a + b\n"), done("calculator ready"));

        TaskOutcome outcome = executor.execute(task, session(10));

        assertThat(outcome.reason()).isEqualTo(ExitReason.COMPLETED);
        assertThat(outcome.iterations()).isEqualTo(2);
        assertThat(outcome.message()).isEqualTo("calculator ready");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.DONE);
        assertThat(gateway.readFile("calculator.py")).contains("def add(a, b):\n    return a + b\n");

        assertThat(task.getHistory()).hasSize(1);
        ToolCall call = task.getHistory().get(0);
        assertThat(call.tool()).isEqualTo("write_file");
        assertThat(call.success()).isTrue();
        assertThat(call.arguments()).containsEntry("path", "calculator.py");
    }

    @Test
    void execute_firstRequestCarriesTaskAndToolDocs() {
        generator.reply(writeFile("calculator.py", "x = 1"), done("ok"));

        executor.execute(task, session(10));

        ScriptedTextGenerator.Call first = generator.calls().get(0);
        assertThat(first.model()).isEqualTo("test-model");
        assertThat(first.lastUserMessage())
                .contains("implement calculator.py")
                .contains("Implement add and subtract")
                .contains("Purpose: arithmetic");
        assertThat(first.systemPrompt()).contains("write_file(path: str, content: str)");
    }

    @Test
    void execute_toolObservationIsFedBack() {
        generator.reply(writeFile("calculator.py", "x = 1"), done("ok"));

        executor.execute(task, session(10));

        assertThat(generator.calls().get(1).lastUserMessage())
                .startsWith("Observation:")
                .contains("Wrote 5 bytes to calculator.py");
    }

    @Test
    void execute_resultBeforeFileExists_isNotDoneYet() {
        generator.reply(done("finished!"),
                writeFile("calculator.py", "x = 1") + "\n" + done("now really finished"));

        TaskOutcome outcome = executor.execute(task, session(10));

        assertThat(outcome.reason()).isEqualTo(ExitReason.COMPLETED);
        assertThat(outcome.iterations()).isEqualTo(2);
        assertThat(generator.calls().get(1).lastUserMessage()).contains("Not done yet");
    }

    @Test
    void execute_replyWithoutToolOrResult_getsNudge() {
        generator.reply("Let me think about the design first.",
                writeFile("calculator.py", "x = 1"), done("ok"));

        executor.execute(task, session(10));

        assertThat(generator.calls().get(1).lastUserMessage()).isEqualTo(ToolCallingExecutor.NUDGE);
    }

    // ------------------------------------------------------------------
    // Bounded exits
    // ------------------------------------------------------------------

    @Test
    void execute_pathViolation_failsTaskImmediately() {
        generator.reply(writeFile("../../etc/passwd", "root::0:0"), done("should never be read"));

        TaskOutcome outcome = executor.execute(task, session(10));

        assertThat(outcome.reason()).isEqualTo(ExitReason.FATAL_TOOL_ERROR);
        assertThat(outcome.iterations()).isEqualTo(1);
        assertThat(outcome.message()).contains("PATH_VIOLATION");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getHistory()).singleElement().extracting(ToolCall::success).isEqualTo(false);
        assertThat(gateway.listFiles(".")).isEmpty();
        assertThat(generator.remaining()).isEqualTo(1);
    }

    @Test
    void execute_budgetExhausted_stopsAfterLimit() {
        IterationBudget budget = new IterationBudget(3);
        generator.reply("thinking", "still thinking", "almost", "never asked");

        TaskOutcome outcome = executor.execute(task, session(budget, FILE_TOOLS));

        assertThat(outcome.reason()).isEqualTo(ExitReason.BUDGET_EXHAUSTED);
        assertThat(outcome.iterations()).isEqualTo(3);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(budget.remaining()).isZero();
        assertThat(generator.calls()).hasSize(3);
    }

    @Test
    void execute_budgetIsSharedAcrossTasks() {
        IterationBudget budget = new IterationBudget(3);
        generator.reply(writeFile("calculator.py", "x = 1"), done("ok"), "thinking");
        Task second = new Task("task-2", "main.py", "entry point", List.of("task-1"), 0, null, 1);

        executor.execute(task, session(budget, FILE_TOOLS));
        TaskOutcome outcome = executor.execute(second, session(budget, FILE_TOOLS));

        assertThat(outcome.reason()).isEqualTo(ExitReason.BUDGET_EXHAUSTED);
        assertThat(outcome.iterations()).isEqualTo(1);
    }

    @Test
    void execute_collaboratorUnavailable_isExternalServiceError() {
        generator.fail(new ExternalServiceException("API error 503: overloaded", true, null));

        TaskOutcome outcome = executor.execute(task, session(10));

        assertThat(outcome.reason()).isEqualTo(ExitReason.EXTERNAL_SERVICE_ERROR);
        assertThat(outcome.reason().errorKind()).isEqualTo(com.codeforge.orchestrator.model.ErrorKind.EXTERNAL_SERVICE);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void execute_cancelledBeforeStart_returnsTaskToPending() {
        cancellation.cancel();

        TaskOutcome outcome = executor.execute(task, session(10));

        assertThat(outcome.reason()).isEqualTo(ExitReason.CANCELLED);
        assertThat(outcome.iterations()).isZero();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(generator.calls()).isEmpty();
    }

    @Test
    void execute_cancelledMidTask_stopsAtNextIteration() {
        generator.answer(call -> {
            cancellation.cancel();
            return "thinking";
        });

        TaskOutcome outcome = executor.execute(task, session(10));

        assertThat(outcome.reason()).isEqualTo(ExitReason.CANCELLED);
        assertThat(outcome.iterations()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Recoverable tool errors become observations
    // ------------------------------------------------------------------

    @Test
    void execute_missingFile_isErrorObservationAndLoopContinues() {
        generator.reply(toolCall("read_file", "{\"path\": \"utils.py\"}"),
                writeFile("calculator.py", "x = 1"), done("ok"));

        TaskOutcome outcome = executor.execute(task, session(10));

        assertThat(outcome.completed()).isTrue();
        assertThat(generator.calls().get(1).lastUserMessage()).contains("ERROR [NOT_FOUND]");
        assertThat(task.getHistory()).extracting(ToolCall::success).containsExactly(false, true);
    }

    @Test
    void execute_disabledTool_isUnknownToolObservation() {
        generator.reply(toolCall("git", "{\"args\": [\"init\"]}"), writeFile("calculator.py", "x"), done("ok"));

        TaskOutcome outcome = executor.execute(task, session(10));

        assertThat(outcome.completed()).isTrue();
        assertThat(generator.calls().get(1).lastUserMessage()).contains("ERROR [UNKNOWN_TOOL]");
    }

    @Test
    void execute_malformedToolCall_isInvalidArgumentsObservation() {
        generator.reply("```tool\n{\"tool\": \"write_file\", \"args\": [1, 2]}\n```",
                writeFile("calculator.py", "x"), done("ok"));

        executor.execute(task, session(10));

        assertThat(generator.calls().get(1).lastUserMessage()).contains("ERROR [INVALID_ARGUMENTS]");
    }

    @Test
    void execute_perTaskCallLimit_isRateLimited() {
        generator.reply(toolCall("once", "{}"), toolCall("once", "{}"), writeFile("calculator.py", "x"), done("ok"));

        executor.execute(task, session(10));

        assertThat(generator.calls().get(1).lastUserMessage()).contains("called");
        assertThat(generator.calls().get(2).lastUserMessage()).contains("ERROR [RATE_LIMITED]");
    }

    // ------------------------------------------------------------------
    // decode
    // ------------------------------------------------------------------

    @Test
    void decode_nullArgumentValues_areKept() {
        ToolCallingExecutor.ToolRequest request = executor.decode("{\"tool\": \"list_files\", \"args\": {\"directory\": null}}");
        assertThat(request.tool()).isEqualTo("list_files");
        assertThat(request.args()).containsEntry("directory", null);
    }

    @Test
    void decode_missingArgs_defaultsToEmpty() {
        assertThat(executor.decode("{\"tool\": \"get_current_directory\"}").args()).isEmpty();
    }
}
