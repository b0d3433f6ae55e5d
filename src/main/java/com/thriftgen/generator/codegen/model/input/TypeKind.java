package com.thriftgen.generator.codegen.model.input;

/**
 * Shape of a {@link TypeRef}.
 */
public enum TypeKind {
    PRIMITIVE,
    LIST,
    SET,
    MAP,
    REFERENCE
}
