package com.codeforge.orchestrator.pipeline.stage;

import com.codeforge.orchestrator.agent.SystemPrompts;
import com.codeforge.orchestrator.model.PlannedFile;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.QualityReport;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.pipeline.StageContext;
import com.codeforge.orchestrator.pipeline.StageHandler;
import com.codeforge.orchestrator.validation.StageSchemas;
import com.codeforge.orchestrator.validation.StructuredOutputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * REVIEWING (optional): one {@link QualityReport} per generated file.
 * Never fails the run; files without a valid report are recorded as skipped.
 */
@Component
public class ReviewerStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(ReviewerStage.class);

    private final StructuredOutputValidator validator;
    private final SystemPrompts             prompts;

    public ReviewerStage(StructuredOutputValidator validator, SystemPrompts prompts) {
        this.validator = validator;
        this.prompts   = prompts;
    }

    @Override
    public Stage stage() {
        return Stage.REVIEWING;
    }

    @Override
    public void run(StageContext ctx) {
        Project project = ctx.project();
        List<QualityReport> reports = new ArrayList<>();
        List<String> skipped = new ArrayList<>(project.getSkippedFiles());

        for (PlannedFile file : project.getPlan().files()) {
            Optional<String> code = ctx.gateway().readFile(file.path());
            if (code.isEmpty()) {
                log.info("Not reviewing {}: file was not generated", file.path());
                continue;
            }
            String language = SourceLanguage.of(file.path()).map(SourceLanguage::label).orElse("unknown");
            String request = "File: " + file.path() + "\nLanguage: " + language
                    + "\nPurpose: " + file.purpose() + "\n\nCode:\n```\n" + code.get() + "\n```";

            Optional<QualityReport> report = PerFileGeneration.generate(ctx, validator,
                    StageSchemas.QUALITY_REPORT, QualityReport.class, prompts.reviewer(), request, file.path());
            if (report.isEmpty()) {
                skipped.add(file.path());
                continue;
            }
            QualityReport r = report.get().forFile(file.path());
            reports.add(r);
            if (r.approved()) {
                log.info("{} approved (score {})", file.path(), r.qualityScore());
            } else {
                log.warn("{} needs improvement (score {}): {}", file.path(), r.qualityScore(),
                        r.issues().stream().limit(3).toList());
            }
        }

        project.setQualityReports(reports);
        project.setSkippedFiles(skipped);
        log.info("Reviewed {} file(s), {} skipped", reports.size(), skipped.size());
    }
}
