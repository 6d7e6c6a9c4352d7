package com.codeforge.orchestrator.validation;

/** JSON shapes a schema field can require. */
public enum FieldType {
    STRING,
    INTEGER,
    BOOLEAN,
    STRING_LIST,
    OBJECT,
    OBJECT_LIST
}
