package com.codeforge.orchestrator.validation;

import java.util.List;

/**
 * Expected shape of a stage's raw output: field names, JSON types and
 * required/optional flags. Shape only; no semantic rules.
 */
public record OutputSchema(String name, List<FieldSpec> fields) {

    public OutputSchema {
        fields = List.copyOf(fields);
    }

    public static OutputSchema of(String name, FieldSpec... fields) {
        return new OutputSchema(name, List.of(fields));
    }
}
