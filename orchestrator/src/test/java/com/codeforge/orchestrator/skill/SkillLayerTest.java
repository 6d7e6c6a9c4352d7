package com.codeforge.orchestrator.skill;

import com.codeforge.orchestrator.sandbox.SandboxedFileGateway;
import com.codeforge.orchestrator.skill.impl.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the tool layer: registry, error mapping and each tool.
 * No Spring context; subprocesses are replaced by a mocked ProcessRunner.
 */
class SkillLayerTest {

    static final Set<String> ALL_TOOLS = Set.of("write_file", "read_file", "list_files",
            "get_current_directory", "install_dependency", "git", "web_lookup");

    @TempDir Path tmp;

    SimpleMeterRegistry   meters;
    ProcessRunner         processRunner;
    SkillRegistry         registry;
    SkillExecutionContext ctx;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        processRunner = mock(ProcessRunner.class);
        List<Skill<?, ?>> allSkills = List.of(
                new WriteFileSkill(),
                new ReadFileSkill(),
                new ListFilesSkill(),
                new CurrentDirectorySkill(),
                new GitSkill(processRunner),
                new InstallDependencySkill(processRunner),
                new WebLookupSkill()
        );
        registry = new SkillRegistry(allSkills, meters);
        ctx = new SkillExecutionContext(new SandboxedFileGateway(tmp.resolve("proj")), "demo", "task-1",
                List.of("requests==2.31.0", "@types/node"));
    }

    static ToolArguments args(Object... kv) {
        Map<String, Object> m = new java.util.HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return ToolArguments.of(m);
    }

    String run(String tool, ToolArguments a) {
        return registry.execute(tool, a, ctx);
    }

    // ------------------------------------------------------------------
    // SkillRegistry: registration, lookup, documentation
    // ------------------------------------------------------------------

    @Test
    void registry_registersAllTools() {
        assertThat(registry.skillNames()).containsExactlyInAnyOrderElementsOf(ALL_TOOLS);
    }

    @Test
    void registry_get_unknownTool_throwsNotFoundException() {
        assertThatThrownBy(() -> registry.get("run_shell"))
                .isInstanceOf(SkillNotFoundException.class)
                .hasMessageContaining("run_shell");
    }

    @Test
    void buildToolDocumentation_listsOnlyEnabledTools() {
        String docs = registry.buildToolDocumentation(Set.of("write_file", "read_file"));

        assertThat(docs).contains("write_file(path: str, content: str) -> str");
        assertThat(docs).contains("read_file(path: str) -> str");
        assertThat(docs).doesNotContain("git(").doesNotContain("web_lookup(");
    }

    @Test
    void buildToolDocumentation_describesProtocolAndRules() {
        String docs = registry.buildToolDocumentation(ALL_TOOLS);
        assertThat(docs).contains("```tool");
        assertThat(docs).contains("RULES:");
        assertThat(docs).contains("<result>short summary</result>");
    }

    // ------------------------------------------------------------------
    // Sandbox file tools
    // ------------------------------------------------------------------

    @Test
    void writeThenRead_roundTripsThroughSandbox() {
        String written = run("write_file", args("path", "pkg/mod.py", "content", "x = 1\n"));
        assertThat(written).isEqualTo("Wrote 6 bytes to pkg/mod.py");
        assertThat(run("read_file", args("path", "pkg/mod.py"))).isEqualTo("x = 1\n");
    }

    @Test
    void readFile_missing_isNotFound() {
        SkillException e = catchThrowableOfType(() -> run("read_file", args("path", "nope.py")),
                SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.NOT_FOUND);
        assertThat(e.isFatal()).isFalse();
    }

    @Test
    void writeFile_outsideRoot_isFatalPathViolation() {
        SkillException e = catchThrowableOfType(
                () -> run("write_file", args("path", "../../etc/passwd", "content", "root::0:0")),
                SkillException.class);

        assertThat(e.getKind()).isEqualTo(SkillException.Kind.PATH_VIOLATION);
        assertThat(e.isFatal()).isTrue();
        assertThat(meters.counter("codeforge.tool.calls", "tool", "write_file", "status", "path_violation").count())
                .isEqualTo(1.0);
    }

    @Test
    void writeFile_missingContent_isInvalidArguments() {
        SkillException e = catchThrowableOfType(() -> run("write_file", args("path", "a.py")),
                SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(e).hasMessageContaining("content");
    }

    @Test
    void writeFile_nonStringContent_isInvalidArguments() {
        SkillException e = catchThrowableOfType(() -> run("write_file", args("path", "a.py", "content", 42)),
                SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
    }

    @Test
    void listFiles_defaultsToRoot() {
        run("write_file", args("path", "b.py", "content", ""));
        run("write_file", args("path", "a/c.py", "content", ""));

        assertThat(run("list_files", ToolArguments.empty())).isEqualTo("a/c.py\nb.py");
        assertThat(run("list_files", args("directory", "a"))).isEqualTo("a/c.py");
    }

    @Test
    void listFiles_emptyProject() {
        assertThat(run("list_files", args("directory", "."))).isEqualTo("(no files)");
    }

    @Test
    void getCurrentDirectory_isProjectRoot() {
        assertThat(run("get_current_directory", ToolArguments.empty())).isEqualTo(".");
    }

    // ------------------------------------------------------------------
    // git
    // ------------------------------------------------------------------

    @Test
    void git_allowedSubcommand_runsInProjectRoot() {
        when(processRunner.run(eq(List.of("git", "status")), eq(ctx.gateway().root()), eq(60), anyMap()))
                .thenReturn(new ProcessResult(0, "On branch main\n", "", 0.1));

        assertThat(run("git", args("args", List.of("status")))).contains("On branch main").contains("exit_code: 0");
    }

    @Test
    void git_argsAsString_areSplit() {
        when(processRunner.run(eq(List.of("git", "log", "--oneline")), any(), anyInt(), anyMap()))
                .thenReturn(new ProcessResult(0, "abc123 init\n", "", 0.1));

        assertThat(run("git", args("args", "log --oneline"))).contains("abc123");
    }

    @Test
    void git_disallowedSubcommand_rejectedWithoutRunning() {
        SkillException e = catchThrowableOfType(() -> run("git", args("args", List.of("push", "origin"))),
                SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        verifyNoInteractions(processRunner);
    }

    @Test
    void git_optionRedirectingRepository_rejected() {
        SkillException e = catchThrowableOfType(
                () -> run("git", args("args", List.of("status", "--git-dir=/tmp/other"))), SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        verifyNoInteractions(processRunner);
    }

    @Test
    void git_addOutsideRoot_isPathViolation() {
        SkillException e = catchThrowableOfType(() -> run("git", args("args", List.of("add", "../secret"))),
                SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.PATH_VIOLATION);
        verifyNoInteractions(processRunner);
    }

    @Test
    void git_commitMessage_isNotTreatedAsPath() {
        when(processRunner.run(any(), any(), anyInt(), anyMap())).thenReturn(new ProcessResult(0, "", "", 0.1));

        run("git", args("args", List.of("commit", "-m", "move ../shared into /lib")));

        verify(processRunner).run(eq(List.of("git", "commit", "-m", "move ../shared into /lib")),
                eq(ctx.gateway().root()), eq(60), anyMap());
    }

    // Escape attempts run against a real ProcessRunner: rejection must happen
    // before any git process starts.

    SkillException realGitFailure(String... gitArgs) {
        SkillRegistry real = new SkillRegistry(List.of(new GitSkill(new ProcessRunner())), meters);
        return catchThrowableOfType(() -> real.execute("git", args("args", List.of(gitArgs)), ctx),
                SkillException.class);
    }

    @Test
    void git_initWithDirectory_rejected() {
        SkillException e = realGitFailure("init", "../escaped");

        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(tmp.resolve("escaped")).doesNotExist();
    }

    @Test
    void git_diffNoIndex_cannotReadOutsideRoot() throws Exception {
        Path secret = Files.writeString(tmp.resolve("secret.txt"), "s3cret");

        SkillException e = realGitFailure("diff", "--no-index", "/dev/null", secret.toString());

        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(e).hasMessageNotContaining("s3cret");
    }

    @Test
    void git_outputOption_rejectedInEveryForm() {
        assertThat(realGitFailure("diff", "--output=../written.txt").getKind())
                .isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(realGitFailure("log", "--output", "../written.txt").getKind())
                .isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(realGitFailure("diff", "-o../written.txt").getKind())
                .isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(tmp.resolve("written.txt")).doesNotExist();
    }

    @Test
    void git_optionsReadingOrPlacingFiles_rejected() {
        assertThat(realGitFailure("commit", "-F", "/etc/hostname").getKind())
                .isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(realGitFailure("init", "--template=/tmp/hooks").getKind())
                .isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(realGitFailure("init", "--separate-git-dir", "../gitdir").getKind())
                .isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        assertThat(tmp.resolve("gitdir")).doesNotExist();
    }

    @Test
    void git_pathArgumentsOfEverySubcommand_mustStayInsideRoot() {
        assertThat(realGitFailure("diff", "/etc/passwd").getKind()).isEqualTo(SkillException.Kind.PATH_VIOLATION);
        assertThat(realGitFailure("log", "--", "../outside.py").getKind())
                .isEqualTo(SkillException.Kind.PATH_VIOLATION);
        assertThat(realGitFailure("status", "../").getKind()).isEqualTo(SkillException.Kind.PATH_VIOLATION);
    }

    @Test
    void git_nonZeroExit_isToolError() {
        when(processRunner.run(any(), any(), anyInt(), anyMap()))
                .thenReturn(new ProcessResult(128, "", "fatal: not a git repository", 0.1));

        SkillException e = catchThrowableOfType(() -> run("git", args("args", List.of("log"))),
                SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.TOOL_ERROR);
        assertThat(e).hasMessageContaining("not a git repository");
    }

    // ------------------------------------------------------------------
    // install_dependency
    // ------------------------------------------------------------------

    @Test
    void installDependency_declaredPackage_runsPip() {
        when(processRunner.run(eq(List.of("pip", "install", "--target", ".packages", "requests")),
                eq(ctx.gateway().root()), eq(300)))
                .thenReturn(new ProcessResult(0, "Successfully installed requests", "", 2.0));

        assertThat(run("install_dependency", args("manager", "pip", "package", "requests")))
                .isEqualTo("Installed requests with pip");
    }

    @Test
    void installDependency_undeclaredPackage_rejected() {
        SkillException e = catchThrowableOfType(
                () -> run("install_dependency", args("manager", "pip", "package", "leftpad")), SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        verify(processRunner, never()).run(any(), any(), anyInt());
    }

    @Test
    void installDependency_directReferenceOfDeclaredPackage_rejectedBeforeInstall() {
        for (String pkg : List.of("requests @ file:///etc/passwd", "requests@https://evil.example/requests.whl",
                "requests@evil.example", "git+https://evil.example/requests", "./requests", "/tmp/requests")) {
            SkillException e = catchThrowableOfType(
                    () -> run("install_dependency", args("manager", "pip", "package", pkg)), SkillException.class);
            assertThat(e.getKind()).as(pkg).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
        }
        verifyNoInteractions(processRunner);
    }

    @Test
    void installDependency_unknownManager_rejected() {
        SkillException e = catchThrowableOfType(
                () -> run("install_dependency", args("manager", "cargo", "package", "requests")),
                SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
    }

    // ------------------------------------------------------------------
    // web_lookup
    // ------------------------------------------------------------------

    @Test
    void webLookup_nonHttpUrl_rejected() {
        SkillException e = catchThrowableOfType(
                () -> run("web_lookup", args("url", "file:///etc/passwd")), SkillException.class);
        assertThat(e.getKind()).isEqualTo(SkillException.Kind.INVALID_ARGUMENTS);
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    @Test
    void execute_success_incrementsCallCounterAndTimer() {
        run("get_current_directory", ToolArguments.empty());

        assertThat(meters.counter("codeforge.tool.calls",
                "tool", "get_current_directory", "status", "success").count()).isEqualTo(1.0);
        assertThat(meters.timer("codeforge.tool.duration",
                "tool", "get_current_directory", "target", "sandbox_filesystem").count()).isEqualTo(1L);
    }
}
