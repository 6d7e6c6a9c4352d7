package com.codeforge.orchestrator.skill;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments of one tool call, as decoded from the collaborator's request.
 * Accessors raise INVALID_ARGUMENTS instead of returning wrongly typed values.
 */
public record ToolArguments(Map<String, Object> values) {

    public ToolArguments {
        // Map.copyOf rejects null values, which JSON may legitimately contain.
        values = values == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(values));
    }

    public static ToolArguments of(Map<String, Object> values) {
        return new ToolArguments(values);
    }

    public static ToolArguments empty() {
        return new ToolArguments(Map.of());
    }

    public String requireString(String name) {
        Object v = values.get(name);
        if (v == null) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS, "missing argument '" + name + "'");
        }
        if (!(v instanceof String s)) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "argument '" + name + "' must be a string");
        }
        return s;
    }

    public String optionalString(String name, String defaultValue) {
        return values.get(name) == null ? defaultValue : requireString(name);
    }

    public List<String> requireStringList(String name) {
        Object v = values.get(name);
        if (v instanceof String s && !s.isBlank()) {
            return List.of(s.trim().split("\\s+"));
        }
        if (!(v instanceof List<?> list) || list.isEmpty()) {
            throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                    "argument '" + name + "' must be a non-empty list of strings");
        }
        for (Object o : list) {
            if (!(o instanceof String)) {
                throw new SkillException(SkillException.Kind.INVALID_ARGUMENTS,
                        "argument '" + name + "' must contain only strings");
            }
        }
        @SuppressWarnings("unchecked")
        List<String> strings = (List<String>) list;
        return List.copyOf(strings);
    }
}
