package com.thriftgen.generator.codegen.resolve;

import com.thriftgen.generator.codegen.model.output.GeneratorKind;

import lombok.NonNull;
import lombok.Value;

/**
 * Two units claiming the same output name that cannot be merged.
 */
@Value
public class NameCollision {

    @NonNull
    String moduleName;

    /** Generator of the unit seen first. */
    @NonNull
    GeneratorKind first;

    @NonNull
    GeneratorKind second;

    public String describe() {
        return "Name collision: " + moduleName + " is produced by both the "
                + first.name().toLowerCase() + " and the " + second.name().toLowerCase() + " generator";
    }
}
