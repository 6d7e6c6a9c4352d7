package com.codeforge.orchestrator.agent;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the collaborator's text replies in the coding loop to extract:
 *   1. tool-call blocks  (```tool {...}```), run through the skill registry
 *   2. <result> tags     the task-complete signal
 *
 * Reply → extract tool call → execute → observation → reply → ...
 * until the collaborator writes <result>...</result>.
 */
public final class ResponseParser {

    // ```tool ... ``` (also accepts ```json when the body names a "tool")
    private static final Pattern TOOL_BLOCK = Pattern.compile(
            "```(?:tool|json)\\s*\\n?(\\{.*?})\\s*```",
            Pattern.DOTALL
    );

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the JSON body of the first tool-call block.
     *
     * Returns Optional.empty() if the reply contains no tool call (it is
     * still reasoning, or it wrote the final <result> directly).
     */
    public static Optional<String> extractToolCall(String response) {
        if (response == null) return Optional.empty();
        Matcher m = TOOL_BLOCK.matcher(response);
        while (m.find()) {
            String body = m.group(1).strip();
            if (body.contains("\"tool\"")) {
                return Optional.of(body);
            }
        }
        return Optional.empty();
    }

    /**
     * Extract the content of the first &lt;result&gt;...&lt;/result&gt; tag.
     */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }
}
