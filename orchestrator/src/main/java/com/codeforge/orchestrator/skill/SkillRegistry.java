package com.codeforge.orchestrator.skill;

import com.codeforge.orchestrator.sandbox.PathViolationException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process tool registry.
 *
 * All {@link Skill} beans declared as Spring {@code @Component}s are
 * collected at startup via constructor injection.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by name ({@link #get}).</li>
 *   <li>Uniform execution ({@link #execute}): every call is timed and
 *       counted, and every failure, whatever its origin, comes out as a
 *       {@link SkillException} with a {@link SkillException.Kind}.</li>
 *   <li>Tool documentation generation ({@link #buildToolDocumentation}),
 *       always in sync with the registered skill set.</li>
 * </ol>
 */
@Component
public class SkillRegistry {

    private static final Logger log = LoggerFactory.getLogger(SkillRegistry.class);

    private final Map<String, Skill<?, ?>> skills = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public SkillRegistry(List<Skill<?, ?>> allSkills, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Skill<?, ?> skill : allSkills) {
            skills.put(skill.manifest().name(), skill);
            log.info("Registered tool '{}' v{} [{}]",
                    skill.manifest().name(),
                    skill.manifest().version(),
                    skill.manifest().target());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Skill<?, ?> get(String name) {
        Skill<?, ?> skill = skills.get(name);
        if (skill == null) {
            throw new SkillNotFoundException(name);
        }
        return skill;
    }

    public boolean contains(String name) {
        return skills.containsKey(name);
    }

    /** Returns all registered skill names (sorted). */
    public List<String> skillNames() {
        return skills.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named skill.
     *
     * Every call is timed and counted:
     * <pre>
     *   codeforge.tool.calls{tool, status="success|path_violation|tool_error|..."}
     *   codeforge.tool.duration{tool, target="sandbox_filesystem|subprocess|network"}
     * </pre>
     *
     * @throws SkillException for every failure; callers never see raw I/O or
     *                        sandbox exceptions
     */
    @SuppressWarnings("unchecked")
    public <I, O> O execute(String skillName, I input, SkillExecutionContext ctx) {
        Skill<I, O> skill = (Skill<I, O>) get(skillName);
        String targetTag = skill.manifest().target().name().toLowerCase();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return skill.execute(input, ctx);
        } catch (SkillException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (PathViolationException e) {
            status = "path_violation";
            throw new SkillException(SkillException.Kind.PATH_VIOLATION, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            status = "invalid_arguments";
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS, e.getMessage(), e);
        } catch (UncheckedIOException e) {
            status = "tool_error";
            throw new SkillException(SkillException.Kind.TOOL_ERROR,
                    e.getMessage() + ": " + e.getCause().getMessage(), e);
        } catch (Exception e) {
            status = "tool_error";
            throw new SkillException(SkillException.Kind.TOOL_ERROR,
                    "Unexpected error in tool '" + skillName + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("codeforge.tool.duration",
                    "tool", skillName, "target", targetTag));
            meterRegistry.counter("codeforge.tool.calls",
                    "tool", skillName, "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Tool documentation generation
    // ------------------------------------------------------------------

    /**
     * Generate the AVAILABLE TOOLS block of the coding prompt, restricted to
     * the tools enabled for this run.
     */
    public String buildToolDocumentation(Collection<String> enabledTools) {
        StringBuilder sb = new StringBuilder();
        sb.append("""
                You can act on the project only through the tools below. To call one,
                reply with exactly one fenced block of this form:

                ```tool
                {"tool": "<name>", "args": {"<arg>": <value>}}
                ```

                The result is returned to you as an observation.

                AVAILABLE TOOLS:
                """);

        skills.values().stream()
                .map(Skill::manifest)
                .filter(m -> enabledTools.contains(m.name()))
                .sorted(Comparator
                        .comparing((SkillManifest m) -> m.target().ordinal())
                        .thenComparing(SkillManifest::name))
                .forEach(m -> {
                    sb.append("  ").append(m.signature()).append("\n");
                    sb.append("      ").append(m.description()).append("\n\n");
                });

        sb.append("""
                RULES:
                  - One tool call per reply; wait for the observation before continuing.
                  - All paths are relative to the project root. Paths outside it are rejected
                    and end your task immediately.
                  - When the file is complete, reply with <result>short summary</result>.
                    This ends your task.
                """);

        return sb.toString();
    }
}
