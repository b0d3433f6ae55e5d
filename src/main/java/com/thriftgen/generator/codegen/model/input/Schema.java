package com.thriftgen.generator.codegen.model.input;

import java.util.Map;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Parsed representation of one Thrift file.
 *
 * Every collection keeps declaration order. The enclosing {@link FileGroup} is
 * attached for the duration of one generation pass and is only used to resolve
 * output names.
 */
@Value
@Builder(toBuilder = true)
public class Schema {

    /** Module name, the IDL file name without extension (e.g. "shared"). */
    @NonNull
    String module;

    /** Java package the schema's entities are generated into. */
    @NonNull
    String namespace;

    @NonNull
    @Singular
    Map<String, TypedefDef> typedefs;

    @NonNull
    @Singular
    Map<String, StructDef> structs;

    @NonNull
    @Singular
    Map<String, StructDef> unions;

    @NonNull
    @Singular
    Map<String, StructDef> exceptions;

    @NonNull
    @Singular("enumDef")
    Map<String, EnumDef> enums;

    @NonNull
    @Singular
    Map<String, ConstantDef> constants;

    @NonNull
    @Singular
    Map<String, ServiceDef> services;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    FileGroup fileGroup;

    public Schema withFileGroup(FileGroup fileGroup) {
        return toBuilder().fileGroup(fileGroup).build();
    }
}
