package com.codeforge.orchestrator.skill.impl;

import com.codeforge.orchestrator.skill.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs an allowlisted git subcommand with the project root as working directory.
 *
 * Options that redirect git to another repository, or that read or write
 * files by name, are refused. Every non-option argument, revisions included,
 * must resolve inside the root.
 */
@Component
public class GitSkill implements Skill<ToolArguments, String> {

    static final Set<String> ALLOWED_SUBCOMMANDS = Set.of("init", "add", "commit", "status", "log", "diff");

    // Options that point git at another repository, read or write files by
    // name, or compare paths outside the work tree.
    private static final Set<String> FORBIDDEN_OPTIONS = Set.of(
            "-C", "-c", "--git-dir", "--work-tree", "--exec-path", "--namespace",
            "--separate-git-dir", "--template", "--no-index", "--output", "-o",
            "-F", "--file", "--pathspec-from-file", "--ext-diff", "--textconv");

    // Short options whose value may be attached, as in -o../out or -F/etc/msg.
    private static final Set<Character> FORBIDDEN_SHORT = Set.of('C', 'c', 'o', 'F');

    // Options whose next argument is a value, not a path.
    private static final Set<String> VALUE_OPTIONS = Set.of("-m", "-am", "--message", "-n", "--max-count");

    // Commits must not depend on the host's git identity being configured.
    private static final Map<String, String> IDENTITY = Map.of(
            "GIT_AUTHOR_NAME",     "codeforge",
            "GIT_AUTHOR_EMAIL",    "codeforge@localhost",
            "GIT_COMMITTER_NAME",  "codeforge",
            "GIT_COMMITTER_EMAIL", "codeforge@localhost");

    private static final SkillManifest MANIFEST = new SkillManifest(
            "git", "1.0.0",
            "git(args: list[str]) -> str",
            "Run git in the project root. Allowed subcommands: init, add, commit, status, log, diff.",
            ExecutionTarget.SUBPROCESS);

    private static final SkillPolicy POLICY = SkillPolicy.subprocess(60, 20);

    private final ProcessRunner processRunner;

    public GitSkill(ProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    @Override public SkillManifest manifest() { return MANIFEST; }
    @Override public SkillPolicy   policy()   { return POLICY; }

    @Override
    public String execute(ToolArguments args, SkillExecutionContext ctx) {
        List<String> gitArgs = args.requireStringList("args");
        checkAllowed(gitArgs, ctx);

        List<String> command = new ArrayList<>(gitArgs.size() + 1);
        command.add("git");
        command.addAll(gitArgs);

        ProcessResult result = processRunner.run(command, ctx.gateway().root(), POLICY.commandTimeoutSec(), IDENTITY);
        if (!result.success()) {
            throw new SkillException(SkillException.Kind.TOOL_ERROR,
                    "git " + gitArgs.get(0) + " failed\n" + result.toObservation());
        }
        return result.toObservation();
    }

    /**
     * Every option is checked against the forbidden set and every other
     * argument must resolve inside the project root. {@code init} takes no
     * directory argument.
     */
    private static void checkAllowed(List<String> gitArgs, SkillExecutionContext ctx) {
        String subcommand = gitArgs.get(0);
        if (!ALLOWED_SUBCOMMANDS.contains(subcommand)) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "git subcommand '" + subcommand + "' is not allowed; use one of " + ALLOWED_SUBCOMMANDS);
        }
        boolean pathsOnly = false;
        for (int i = 1; i < gitArgs.size(); i++) {
            String arg = gitArgs.get(i);
            if (!pathsOnly && "--".equals(arg)) {
                pathsOnly = true;
                continue;
            }
            if (!pathsOnly && arg.startsWith("-")) {
                checkOption(arg);
                if (VALUE_OPTIONS.contains(arg)) {
                    i++;
                }
                continue;
            }
            if ("init".equals(subcommand)) {
                throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                        "git init always runs in the project root; directory arguments are not allowed");
            }
            // PathViolationException propagates and is mapped by the registry.
            ctx.gateway().resolve(arg);
        }
    }

    private static void checkOption(String arg) {
        String option = arg.contains("=") ? arg.substring(0, arg.indexOf('=')) : arg;
        boolean shortCluster = !arg.startsWith("--") && arg.length() > 1;
        if (FORBIDDEN_OPTIONS.contains(option)
                || (shortCluster && FORBIDDEN_SHORT.contains(arg.charAt(1)))) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "git option '" + option + "' is not allowed");
        }
    }
}
