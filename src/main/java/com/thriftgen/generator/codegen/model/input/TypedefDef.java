package com.thriftgen.generator.codegen.model.input;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code typedef <target> <name>}.
 */
@Value
public class TypedefDef {

    @NonNull
    String name;

    @NonNull
    TypeRef target;
}
