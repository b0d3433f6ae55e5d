package com.thriftgen.generator.codegen.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A constant declaration.
 */
@Value
@Builder(toBuilder = true)
public class ConstantDef {

    @NonNull
    String name;

    @NonNull
    TypeRef type;

    @NonNull
    Object value;

    /**
     * Module the constant was declared in. {@code null} means the schema that
     * carries it; a different module marks a constant pulled in via an include.
     */
    String declaringModule;
}
