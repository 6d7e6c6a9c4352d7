package com.codeforge.orchestrator.validation;

import static com.codeforge.orchestrator.validation.FieldSpec.optional;
import static com.codeforge.orchestrator.validation.FieldSpec.required;
import static com.codeforge.orchestrator.validation.FieldSpec.requiredObjects;
import static com.codeforge.orchestrator.validation.FieldType.*;

/** Expected output shapes for each stage that produces a structured artifact. */
public final class StageSchemas {

    private StageSchemas() {}

    public static final OutputSchema PLANNED_FILE = OutputSchema.of("file",
            required("path", STRING),
            required("purpose", STRING));

    public static final OutputSchema PLAN = OutputSchema.of("Plan",
            required("name", STRING),
            required("description", STRING),
            required("tech_stack", STRING_LIST),
            required("features", STRING_LIST),
            requiredObjects("files", PLANNED_FILE),
            optional("required_packages", STRING_LIST));

    public static final OutputSchema TASK = OutputSchema.of("task",
            required("filepath", STRING),
            required("description", STRING),
            optional("depends_on", STRING_LIST),
            optional("priority", INTEGER),
            optional("complexity", STRING));

    public static final OutputSchema TASK_PLAN = OutputSchema.of("TaskPlan",
            requiredObjects("tasks", TASK));

    public static final OutputSchema QUALITY_REPORT = OutputSchema.of("QualityReport",
            required("filepath", STRING),
            required("quality_score", INTEGER),
            required("issues", STRING_LIST),
            required("suggestions", STRING_LIST),
            required("approved", BOOLEAN));

    public static final OutputSchema TEST_CASE = OutputSchema.of("test_case",
            required("name", STRING),
            optional("description", STRING),
            required("code", STRING));

    public static final OutputSchema TEST_PLAN = OutputSchema.of("TestPlan",
            required("filepath", STRING),
            required("framework", STRING),
            requiredObjects("test_cases", TEST_CASE));
}
