package com.thriftgen.generator.codegen.model.input;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A struct, union or exception declaration.
 */
@Value
public class StructDef {

    @NonNull
    String name;

    @NonNull
    StructKind kind;

    @NonNull
    List<FieldDef> fields;

    @Builder(toBuilder = true)
    public StructDef(@NonNull String name, @NonNull StructKind kind, @Singular List<FieldDef> fields) {
        Set<String> seen = new HashSet<>();
        for (FieldDef field : fields) {
            if (!seen.add(field.getName())) {
                throw new IllegalArgumentException(
                        "Duplicate field '" + field.getName() + "' in " + kind.name().toLowerCase() + " " + name);
            }
        }
        this.name = name;
        this.kind = kind;
        this.fields = List.copyOf(fields);
    }
}
