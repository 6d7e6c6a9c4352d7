package com.codeforge.orchestrator.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One sandboxed operation requested by the coding loop, together with its result.
 *
 * @param tool      registered tool name, e.g. "write_file"
 * @param arguments arguments as sent by the collaborator
 * @param success   false when the tool raised an error
 * @param payload   success payload or error message
 */
public record ToolCall(String tool, Map<String, Object> arguments, boolean success, String payload) {

    public ToolCall {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(arguments));
    }
}
