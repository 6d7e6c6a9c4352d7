package com.codeforge.orchestrator.pipeline.stage;

import com.codeforge.orchestrator.agent.SystemPrompts;
import com.codeforge.orchestrator.model.PlannedFile;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.model.TestArtifact;
import com.codeforge.orchestrator.pipeline.StageContext;
import com.codeforge.orchestrator.pipeline.StageHandler;
import com.codeforge.orchestrator.validation.StageSchemas;
import com.codeforge.orchestrator.validation.StructuredOutputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * TESTING (optional): generates unit tests for each Python, JavaScript or
 * TypeScript source file and writes them under {@code tests/} or
 * {@code __tests__/}. Files that already look like tests are left alone.
 * Never fails the run; files without a valid test plan are recorded as skipped.
 */
@Component
public class TesterStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(TesterStage.class);

    private final StructuredOutputValidator validator;
    private final SystemPrompts             prompts;

    public TesterStage(StructuredOutputValidator validator, SystemPrompts prompts) {
        this.validator = validator;
        this.prompts   = prompts;
    }

    @Override
    public Stage stage() {
        return Stage.TESTING;
    }

    @Override
    public void run(StageContext ctx) {
        Project project = ctx.project();
        List<TestArtifact> artifacts = new ArrayList<>();
        List<String> skipped = new ArrayList<>(project.getSkippedFiles());

        for (PlannedFile file : project.getPlan().files()) {
            if (file.path().toLowerCase(Locale.ROOT).contains("test")) {
                continue;
            }
            Optional<SourceLanguage> language = SourceLanguage.of(file.path()).filter(SourceLanguage::testable);
            if (language.isEmpty()) {
                continue;
            }
            Optional<String> code = ctx.gateway().readFile(file.path());
            if (code.isEmpty()) {
                log.info("No tests for {}: file was not generated", file.path());
                continue;
            }

            String request = "File: " + file.path() + "\nLanguage: " + language.get().label()
                    + "\n\nCode to test:\n```\n" + code.get() + "\n```";
            Optional<TestArtifact> plan = PerFileGeneration.generate(ctx, validator,
                    StageSchemas.TEST_PLAN, TestArtifact.class, prompts.tester(), request, file.path());
            if (plan.isEmpty()) {
                skipped.add(file.path());
                continue;
            }

            String testPath = language.get().testPathFor(file.path());
            ctx.gateway().writeFile(testPath, render(file.path(), plan.get(), language.get()));
            artifacts.add(new TestArtifact(file.path(), plan.get().framework(), plan.get().testCases(), testPath));
            log.info("Generated {} test(s) for {} in {}", plan.get().testCases().size(), file.path(), testPath);
        }

        project.setTestArtifacts(artifacts);
        project.setSkippedFiles(skipped);
    }

    static String render(String sourcePath, TestArtifact plan, SourceLanguage language) {
        String c = language.commentPrefix();
        StringBuilder sb = new StringBuilder();
        sb.append(c).append(" Generated tests for ").append(sourcePath).append("\n\n");
        for (TestArtifact.TestCase tc : plan.testCases()) {
            sb.append(c).append(" Test: ").append(tc.name()).append("\n");
            if (tc.description() != null && !tc.description().isBlank()) {
                sb.append(c).append(" ").append(tc.description()).append("\n");
            }
            sb.append(tc.code()).append("\n\n");
        }
        return sb.toString();
    }
}
