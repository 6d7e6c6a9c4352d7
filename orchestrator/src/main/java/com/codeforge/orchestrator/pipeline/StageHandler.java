package com.codeforge.orchestrator.pipeline;

import com.codeforge.orchestrator.model.Stage;

/**
 * The unit of work behind one pipeline stage.
 *
 * A handler validates its output before attaching it to the project, so a
 * failed attempt leaves the project unchanged.
 */
public interface StageHandler {

    Stage stage();

    /**
     * @throws com.codeforge.orchestrator.validation.ValidationException output malformed; the stage is retried with feedback
     * @throws StageFailedException                                        unrecoverable; the run fails
     */
    void run(StageContext ctx);
}
