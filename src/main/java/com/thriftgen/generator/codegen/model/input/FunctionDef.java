package com.thriftgen.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An RPC function signature of a service.
 */
@Value
@Builder(toBuilder = true)
public class FunctionDef {

    @NonNull
    String name;

    /** Return type, or {@code null} for {@code void}. */
    TypeRef returnType;

    @NonNull
    @Singular
    List<FieldDef> arguments;

    @NonNull
    @Singular
    List<FieldDef> exceptions;

    boolean oneway;

    public boolean isVoid() {
        return returnType == null;
    }
}
