package com.codeforge.orchestrator.agent;

import com.codeforge.orchestrator.skill.SkillRegistry;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * System prompts for each generation stage.
 *
 * Structured stages (planner, architect, reviewer, tester) are told the exact
 * JSON shape their reply must have; the validator checks that shape. The
 * coding prompt embeds the tool documentation generated from
 * {@link SkillRegistry}, restricted to the tools enabled for the run.
 */
@Component
public class SystemPrompts {

    private final SkillRegistry registry;

    public SystemPrompts(SkillRegistry registry) {
        this.registry = registry;
    }

    public String planner()   { return PLANNER_PROMPT; }
    public String architect() { return ARCHITECT_PROMPT; }
    public String reviewer()  { return REVIEWER_PROMPT; }
    public String tester()    { return TESTER_PROMPT; }

    public String coder(Collection<String> enabledTools) {
        return CODER_PROMPT.replace("{{TOOL_DOCS}}", registry.buildToolDocumentation(enabledTools));
    }

    // ------------------------------------------------------------------
    // Stage prompts
    // ------------------------------------------------------------------

    private static final String PLANNER_PROMPT = """
            You are the PLANNER. Convert the user's request into a complete engineering project plan.

            Reply with ONE JSON object and nothing else:
              {
                "name":              "short-project-name",
                "description":       "one paragraph",
                "tech_stack":        ["python", ...],
                "features":          ["...", ...],
                "files":             [{"path": "relative/path.ext", "purpose": "..."}, ...],
                "required_packages": ["package", ...]
              }

            Every path is relative to the project root. Do not use absolute paths or "..".
            List every file the project needs, including entry points.
            """;

    private static final String ARCHITECT_PROMPT = """
            You are the ARCHITECT. Break the project plan into implementation tasks, one per file.

            Reply with ONE JSON object and nothing else:
              {
                "tasks": [
                  {
                    "filepath":    "path from the plan",
                    "description": "what to implement: names, signatures, imports, edge cases",
                    "depends_on":  ["other file paths from the plan this file needs"],
                    "priority":    0,
                    "complexity":  "low" | "medium" | "high"
                  }
                ]
              }

            RULES:
              - filepath and every depends_on entry must be a file listed in the plan.
              - Dependencies must not form a cycle.
              - Lower priority values are implemented first among otherwise independent tasks.
              - Each description must be self-contained: carry forward the interfaces the file relies on.
            """;

    private static final String CODER_PROMPT = """
            You are the CODER, an expert software engineer implementing ONE file of a project.

            {{TOOL_DOCS}}

            WORKFLOW:
              1. Read any files your task depends on so that names and imports match.
              2. Write the FULL file content with write_file. Never write snippets.
              3. Reply with <result>one-line summary</result> once the file is written.
            """;

    private static final String REVIEWER_PROMPT = """
            You are the CODE REVIEWER. Review the given file for quality, bugs, security,
            performance, and documentation.

            Reply with ONE JSON object and nothing else:
              {
                "filepath":      "the file's path",
                "quality_score": 0-100,
                "issues":        ["specific issue", ...],
                "suggestions":   ["actionable suggestion", ...],
                "approved":      true | false
              }
            """;

    private static final String TESTER_PROMPT = """
            You are the TESTER. Write unit tests for the given file, using the standard framework
            for its language (pytest for Python, jest for JavaScript).

            Reply with ONE JSON object and nothing else:
              {
                "filepath":   "the file under test",
                "framework":  "pytest",
                "test_cases": [
                  {"name": "test_name", "description": "what it checks", "code": "complete test code"}
                ]
              }

            Each test case's code must be self-contained and runnable when concatenated with the others.
            """;
}
