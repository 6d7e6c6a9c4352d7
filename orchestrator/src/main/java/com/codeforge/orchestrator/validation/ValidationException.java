package com.codeforge.orchestrator.validation;

import java.util.List;

/**
 * A stage's output did not match its expected shape.
 *
 * Carries every violated field, not just the first one, so that the whole
 * list can be handed back to the collaborator as corrective feedback.
 */
public class ValidationException extends RuntimeException {

    private final String       schemaName;
    private final List<String> violations;

    public ValidationException(String schemaName, List<String> violations) {
        super(schemaName + " output is invalid: " + String.join("; ", violations));
        this.schemaName = schemaName;
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String schemaName, String violation) {
        this(schemaName, List.of(violation));
    }

    public String       getSchemaName() { return schemaName; }
    public List<String> getViolations() { return violations; }

    /** Feedback text appended to the next invocation of the failing stage. */
    public String toFeedback() {
        StringBuilder sb = new StringBuilder("Your previous ")
                .append(schemaName)
                .append(" output was rejected. Fix every problem below and reply with the complete corrected JSON:\n");
        violations.forEach(v -> sb.append("  - ").append(v).append('\n'));
        return sb.toString();
    }
}
