package com.codeforge.orchestrator.pipeline.stage;

import com.codeforge.orchestrator.model.Plan;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.ProjectMetadata;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.pipeline.StageContext;
import com.codeforge.orchestrator.pipeline.StageHandler;
import com.codeforge.orchestrator.sandbox.SandboxedFileGateway;
import com.codeforge.orchestrator.skill.SkillException;
import com.codeforge.orchestrator.skill.SkillExecutionContext;
import com.codeforge.orchestrator.skill.SkillRegistry;
import com.codeforge.orchestrator.skill.ToolArguments;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FINALIZING: writes the dependency manifest, initialises git when enabled,
 * and records the {@link ProjectMetadata} summary.
 *
 * Git runs through the same tool contract as the coding loop. A git failure is
 * reported in the metadata ({@code git_initialized=false}) and does not fail
 * the run; the generated files are already complete at this point.
 */
@Component
public class FinalizerStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(FinalizerStage.class);

    static final String COMMIT_MESSAGE = "Initial commit: project generated by codeforge";

    // Tool-managed directories are not part of the generated project.
    private static final Set<String> IGNORED_DIRS = Set.of(".git/", ".packages/", "node_modules/");

    private final SkillRegistry registry;
    private final ObjectMapper  objectMapper;

    public FinalizerStage(SkillRegistry registry, ObjectMapper objectMapper) {
        this.registry     = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stage stage() {
        return Stage.FINALIZING;
    }

    @Override
    public void run(StageContext ctx) {
        Project project = ctx.project();
        Plan plan = project.getPlan();
        SandboxedFileGateway gateway = ctx.gateway();

        writeDependencyManifest(plan, gateway);

        boolean gitInitialized = false;
        if (ctx.config().gitEnabled()) {
            ctx.checkCancelled();
            gitInitialized = initGit(project, plan, gateway);
        }

        List<String> files = gateway.listFiles(".").stream()
                .filter(f -> IGNORED_DIRS.stream().noneMatch(f::startsWith))
                .toList();
        long totalLines = files.stream()
                .mapToLong(f -> gateway.readFile(f).map(c -> c.lines().count()).orElse(0L))
                .sum();

        ProjectMetadata metadata = new ProjectMetadata(plan.name(), project.getCreatedAt(), files, totalLines,
                plan.requiredPackages(), gitInitialized, ctx.config().dockerRequested(),
                !project.getTestArtifacts().isEmpty(), project.getQualityReports().size());
        project.setMetadata(metadata);
        log.info("Project {} finalised: {} files, {} lines, git={}",
                plan.name(), files.size(), totalLines, gitInitialized);
    }

    /** requirements.txt for Python stacks, package.json for JavaScript stacks. */
    void writeDependencyManifest(Plan plan, SandboxedFileGateway gateway) {
        if (plan.requiredPackages().isEmpty()) {
            return;
        }
        if (plan.usesStack("python")) {
            gateway.writeFile("requirements.txt", String.join("\n", plan.requiredPackages()) + "\n");
            log.info("Wrote requirements.txt ({} packages)", plan.requiredPackages().size());
        } else if (plan.usesStack("javascript") || plan.usesStack("node")
                || plan.usesStack("react") || plan.usesStack("vue")) {
            Map<String, Object> pkg = new LinkedHashMap<>();
            pkg.put("name", plan.name().toLowerCase().replaceAll("[^a-z0-9-]+", "-"));
            pkg.put("version", "1.0.0");
            Map<String, String> deps = new LinkedHashMap<>();
            plan.requiredPackages().forEach(p -> deps.put(p, "latest"));
            pkg.put("dependencies", deps);
            try {
                gateway.writeFile("package.json",
                        objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(pkg) + "\n");
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot serialise package.json", e);
            }
            log.info("Wrote package.json ({} dependencies)", deps.size());
        }
    }

    private boolean initGit(Project project, Plan plan, SandboxedFileGateway gateway) {
        SkillExecutionContext toolCtx = new SkillExecutionContext(gateway, project.getId(), "finalize",
                plan.requiredPackages());
        try {
            git(toolCtx, "init");
            git(toolCtx, "add", ".");
            git(toolCtx, "commit", "-m", COMMIT_MESSAGE);
            return true;
        } catch (SkillException e) {
            log.warn("Git initialisation failed; project left without a repository: {}", e.getMessage());
            return false;
        }
    }

    private void git(SkillExecutionContext toolCtx, String... args) {
        registry.execute("git", ToolArguments.of(Map.<String, Object>of("args", List.of(args))), toolCtx);
    }
}
