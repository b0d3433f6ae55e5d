package com.thriftgen.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An enum declaration with its ordered values.
 */
@Value
@Builder(toBuilder = true)
public class EnumDef {

    @NonNull
    String name;

    @NonNull
    @Singular
    List<EnumValueDef> values;
}
