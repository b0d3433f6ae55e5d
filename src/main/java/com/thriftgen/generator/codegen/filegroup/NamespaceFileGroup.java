package com.thriftgen.generator.codegen.filegroup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import com.thriftgen.generator.codegen.model.input.ConstantDef;
import com.thriftgen.generator.codegen.model.input.EnumDef;
import com.thriftgen.generator.codegen.model.input.FileGroup;
import com.thriftgen.generator.codegen.model.input.Schema;
import com.thriftgen.generator.codegen.model.input.StructDef;
import com.thriftgen.generator.codegen.model.input.TypeRef;
import com.thriftgen.generator.codegen.model.input.TypedefDef;
import com.thriftgen.generator.codegen.util.NamingUtil;

/**
 * File group that maps every module onto the Java package declared by its
 * {@code namespace java} line.
 *
 * Naming:
 * - entities: {@code <namespace>.<Name>} (first letter upper-cased)
 * - typedefs: {@code <namespace>.<Name>} with the rest of the name lower-cased
 * - constants: {@code <namespace>.<Module>} in PascalCase
 */
public class NamespaceFileGroup implements FileGroup {

    private static final int MAX_TYPEDEF_CHAIN = 32;

    private final Map<String, Schema> schemas;
    private final String currentModule;

    private NamespaceFileGroup(Map<String, Schema> schemas, String currentModule) {
        this.schemas = schemas;
        this.currentModule = currentModule;
    }

    /**
     * Builds a group whose first schema is the current module.
     */
    public static NamespaceFileGroup of(List<Schema> schemas) {
        if (schemas.isEmpty()) {
            throw new IllegalArgumentException("A file group needs at least one schema");
        }
        Map<String, Schema> byModule = new LinkedHashMap<>();
        for (Schema schema : schemas) {
            byModule.put(schema.getModule(), schema);
        }
        return new NamespaceFileGroup(Collections.unmodifiableMap(byModule), schemas.get(0).getModule());
    }

    public static NamespaceFileGroup of(Schema... schemas) {
        return of(List.of(schemas));
    }

    @Override
    public Map<String, Schema> getSchemas() {
        return schemas;
    }

    @Override
    public String getCurrentModule() {
        return currentModule;
    }

    @Override
    public FileGroup withCurrentModule(String module) {
        return new NamespaceFileGroup(schemas, module);
    }

    @Override
    public String destModule(String logicalName) {
        String module = moduleOf(logicalName);
        String simple = simpleNameOf(logicalName);
        Schema schema = schemas.get(module);

        if (schema != null && schema.getTypedefs().containsKey(simple)) {
            return namespaceOf(module) + "." + NamingUtil.capitalize(simple);
        }
        return namespaceOf(module) + "." + NamingUtil.upperFirst(simple);
    }

    @Override
    public String constantsModule() {
        return namespaceOf(currentModule) + "." + NamingUtil.toPascalCase(currentModule);
    }

    @Override
    public boolean ownsConstant(ConstantDef constant) {
        return constant.getDeclaringModule() == null
                || Objects.equals(constant.getDeclaringModule(), currentModule);
    }

    @Override
    public Optional<TypeRef> typedefTarget(String logicalName) {
        String module = moduleOf(logicalName);
        String simple = simpleNameOf(logicalName);
        TypeRef found = null;

        for (int i = 0; i < MAX_TYPEDEF_CHAIN; i++) {
            Schema schema = schemas.get(module);
            TypedefDef typedef = schema == null ? null : schema.getTypedefs().get(simple);
            if (typedef == null) {
                break;
            }
            found = typedef.getTarget();
            if (!found.isReference()) {
                break;
            }
            String next = found.getReferenceName();
            module = next.contains(".") ? next.substring(0, next.lastIndexOf('.')) : module;
            simple = simpleNameOf(next);
            found = TypeRef.reference(module + "." + simple);
        }
        return Optional.ofNullable(found);
    }

    @Override
    public Optional<StructDef> findStruct(String logicalName) {
        Schema schema = schemas.get(moduleOf(logicalName));
        if (schema == null) {
            return Optional.empty();
        }
        String simple = simpleNameOf(logicalName);
        return Stream.of(schema.getStructs(), schema.getUnions(), schema.getExceptions())
                .map(byName -> byName.get(simple))
                .filter(Objects::nonNull)
                .findFirst();
    }

    @Override
    public Optional<EnumDef> findEnum(String logicalName) {
        Schema schema = schemas.get(moduleOf(logicalName));
        return schema == null
                ? Optional.empty()
                : Optional.ofNullable(schema.getEnums().get(simpleNameOf(logicalName)));
    }

    private String moduleOf(String logicalName) {
        int dot = logicalName.lastIndexOf('.');
        return dot < 0 ? currentModule : logicalName.substring(0, dot);
    }

    private static String simpleNameOf(String logicalName) {
        int dot = logicalName.lastIndexOf('.');
        return dot < 0 ? logicalName : logicalName.substring(dot + 1);
    }

    private String namespaceOf(String module) {
        Schema schema = schemas.get(module);
        return schema != null ? schema.getNamespace() : module;
    }
}
