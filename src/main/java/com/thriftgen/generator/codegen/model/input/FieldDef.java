package com.thriftgen.generator.codegen.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One field of a struct, union or exception, or one argument of a function.
 */
@Value
@Builder(toBuilder = true)
public class FieldDef {

    /** Thrift field id. */
    int id;

    @NonNull
    String name;

    @NonNull
    TypeRef type;

    boolean required;

    /**
     * Literal default declared in the IDL, or {@code null}.
     * Literals are Boolean, Integer, Long, Double, String, List, Set or Map values.
     */
    Object defaultValue;

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
