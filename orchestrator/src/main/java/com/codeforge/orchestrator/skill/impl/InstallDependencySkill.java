package com.codeforge.orchestrator.skill.impl;

import com.codeforge.orchestrator.skill.*;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Installs a package the Plan declared, locally to the project root.
 *
 * pip installs into {@code .packages/} under the root; npm installs into the
 * root's {@code node_modules/}. Packages the Plan does not list are refused.
 */
@Component
public class InstallDependencySkill implements Skill<ToolArguments, String> {

    private static final SkillManifest MANIFEST = new SkillManifest(
            "install_dependency", "1.0.0",
            "install_dependency(manager: \"pip\"|\"npm\", package: str) -> str",
            "Install one of the project's declared packages locally with pip or npm.",
            ExecutionTarget.SUBPROCESS);

    private static final SkillPolicy POLICY = SkillPolicy.subprocess(300, 10);

    // A package name with optional extras and version constraints, or an npm
    // name with an @version. URLs, paths and direct references never match.
    private static final Pattern PLAIN_REQUIREMENT = Pattern.compile(
            "(@[A-Za-z0-9._-]+/)?[A-Za-z0-9._-]+"
            + "(\\[[A-Za-z0-9._,-]+])?"
            + "((==|>=|<=|!=|~=|>|<)[A-Za-z0-9.*+!-]+(,(==|>=|<=|!=|~=|>|<)[A-Za-z0-9.*+!-]+)*"
            + "|@[A-Za-z0-9.^~*-]+)?");

    private final ProcessRunner processRunner;

    public InstallDependencySkill(ProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    @Override public SkillManifest manifest() { return MANIFEST; }
    @Override public SkillPolicy   policy()   { return POLICY; }

    @Override
    public String execute(ToolArguments args, SkillExecutionContext ctx) {
        String manager = args.requireString("manager").toLowerCase(Locale.ROOT);
        String pkg     = args.requireString("package").trim();

        if (!isPlainRequirement(pkg)) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "package '" + pkg + "' must be a package name with an optional version, not a URL or path");
        }
        if ("pip".equals(manager) && pkg.contains("@")) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "pip package '" + pkg + "' must not use an @ direct reference");
        }
        if (!isDeclared(pkg, ctx.declaredPackages())) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "package '" + pkg + "' is not in the project's required packages " + ctx.declaredPackages());
        }

        List<String> command = switch (manager) {
            case "pip" -> List.of("pip", "install", "--target", ".packages", pkg);
            case "npm" -> List.of("npm", "install", "--no-audit", "--no-fund", pkg);
            default -> throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "manager must be 'pip' or 'npm', got '" + manager + "'");
        };

        ProcessResult result = processRunner.run(command, ctx.gateway().root(), POLICY.commandTimeoutSec());
        if (!result.success()) {
            throw new SkillException(SkillException.Kind.TOOL_ERROR,
                    manager + " install " + pkg + " failed\n" + result.toObservation());
        }
        return "Installed " + pkg + " with " + manager;
    }

    static boolean isPlainRequirement(String pkg) {
        return PLAIN_REQUIREMENT.matcher(pkg).matches() && !pkg.startsWith("-") && !pkg.startsWith(".")
                && !pkg.contains("..");
    }

    /** A declared entry matches on its bare name, ignoring any version specifier. */
    static boolean isDeclared(String pkg, List<String> declared) {
        String name = bareName(pkg);
        return declared.stream().anyMatch(d -> bareName(d).equalsIgnoreCase(name));
    }

    static String bareName(String requirement) {
        String s = requirement.trim();
        int start = s.startsWith("@") ? 1 : 0;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '=' || c == '<' || c == '>' || c == '~' || c == '!' || c == '[' || c == ' '
                    || (c == '@' && i > 0)) {
                return s.substring(0, i);
            }
        }
        return s;
    }
}
