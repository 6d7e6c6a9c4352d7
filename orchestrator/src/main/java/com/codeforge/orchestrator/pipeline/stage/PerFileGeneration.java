package com.codeforge.orchestrator.pipeline.stage;

import com.codeforge.orchestrator.llm.ExternalServiceException;
import com.codeforge.orchestrator.llm.Message;
import com.codeforge.orchestrator.pipeline.StageContext;
import com.codeforge.orchestrator.validation.OutputSchema;
import com.codeforge.orchestrator.validation.StructuredOutputValidator;
import com.codeforge.orchestrator.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * One structured request per file, for the optional stages.
 *
 * Each file gets the stage's retry budget on its own. A file whose output
 * still fails validation, or whose request cannot reach the collaborator,
 * yields empty and the stage carries on with the next file.
 */
final class PerFileGeneration {

    private static final Logger log = LoggerFactory.getLogger(PerFileGeneration.class);

    private PerFileGeneration() {}

    static <T> Optional<T> generate(StageContext ctx, StructuredOutputValidator validator,
                                    OutputSchema schema, Class<T> type,
                                    String systemPrompt, String request, String filePath) {
        int maxAttempts = ctx.config().stageRetries() + 1;
        String feedback = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ctx.checkCancelled();
            String text = StageContext.appendFeedback(request, feedback);
            try {
                String reply = ctx.generator().complete(ctx.config().effectiveModel(),
                        List.of(Message.user(text)), systemPrompt);
                return Optional.of(validator.validate(reply, schema, type));
            } catch (ValidationException e) {
                feedback = e.toFeedback();
                log.warn("{} for {} rejected (attempt {}/{}): {}",
                        schema.name(), filePath, attempt, maxAttempts, e.getMessage());
            } catch (ExternalServiceException e) {
                log.warn("{} for {} skipped: {}", schema.name(), filePath, e.getMessage());
                return Optional.empty();
            }
        }
        log.warn("{} for {} skipped after {} attempts", schema.name(), filePath, maxAttempts);
        return Optional.empty();
    }
}
