package com.thriftgen.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A service declaration.
 */
@Value
@Builder(toBuilder = true)
public class ServiceDef {

    @NonNull
    String name;

    /** Logical name of the extended service, or {@code null}. */
    String extendsService;

    @NonNull
    @Singular
    List<FunctionDef> functions;
}
