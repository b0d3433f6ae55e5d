package com.thriftgen.generator.codegen.model.input;

import lombok.NonNull;
import lombok.Value;

/**
 * One name/value pair of an enum.
 */
@Value
public class EnumValueDef {

    @NonNull
    String name;

    int value;
}
