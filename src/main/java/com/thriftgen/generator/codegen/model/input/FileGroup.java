package com.thriftgen.generator.codegen.model.input;

import java.util.Map;
import java.util.Optional;

/**
 * Name-resolution authority spanning the schemas of one IDL file and its
 * includes.
 *
 * Implementations are read-only; {@link #withCurrentModule(String)} returns a
 * view whose relative lookups are anchored at the given module.
 */
public interface FileGroup {

    /**
     * Schemas of the group keyed by module name, in generation order.
     */
    Map<String, Schema> getSchemas();

    String getCurrentModule();

    FileGroup withCurrentModule(String module);

    /**
     * Resolves a logical name ({@code Name} or {@code module.Name}) to the
     * fully-qualified output name it is generated under.
     */
    String destModule(String logicalName);

    default String destModule(String module, String name) {
        return destModule(module + "." + name);
    }

    /**
     * Output name of the constants module of the current module.
     */
    String constantsModule();

    /**
     * Whether the constant was declared by the current module rather than
     * inherited from an included one.
     */
    boolean ownsConstant(ConstantDef constant);

    /**
     * Aliased type when the logical name refers to a typedef, fully
     * dereferenced.
     */
    Optional<TypeRef> typedefTarget(String logicalName);

    /**
     * Struct, union or exception declared under the logical name.
     */
    Optional<StructDef> findStruct(String logicalName);

    Optional<EnumDef> findEnum(String logicalName);
}
