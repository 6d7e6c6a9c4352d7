package com.codeforge.orchestrator.validation;

/**
 * One field of an {@link OutputSchema}.
 *
 * @param name     JSON property name
 * @param type     required JSON shape
 * @param required whether absence (or null) is a violation
 * @param nested   element schema for OBJECT and OBJECT_LIST fields, null otherwise
 */
public record FieldSpec(String name, FieldType type, boolean required, OutputSchema nested) {

    public static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, true, null);
    }

    public static FieldSpec optional(String name, FieldType type) {
        return new FieldSpec(name, type, false, null);
    }

    public static FieldSpec requiredObjects(String name, OutputSchema element) {
        return new FieldSpec(name, FieldType.OBJECT_LIST, true, element);
    }
}
