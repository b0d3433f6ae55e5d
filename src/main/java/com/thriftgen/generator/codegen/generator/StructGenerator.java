package com.thriftgen.generator.codegen.generator;

import java.util.ArrayList;
import java.util.List;

import com.thriftgen.generator.codegen.mapper.ThriftToJavaTypeMapper;
import com.thriftgen.generator.codegen.model.input.FieldDef;
import com.thriftgen.generator.codegen.model.input.Schema;
import com.thriftgen.generator.codegen.model.input.StructDef;
import com.thriftgen.generator.codegen.model.input.StructKind;
import com.thriftgen.generator.codegen.model.output.GeneratedUnit;
import com.thriftgen.generator.codegen.model.output.GeneratorKind;
import com.thriftgen.generator.codegen.util.ImportManager;
import com.thriftgen.generator.codegen.util.NamingUtil;

/**
 * Generates data classes for structs, unions and exceptions.
 *
 * Generated classes are immutable Lombok {@code @Value} types with a
 * {@code toBuilder()}-enabled builder; every field is boxed so it can be absent.
 * Exceptions extend {@link RuntimeException}.
 */
public class StructGenerator {

    public GeneratedUnit generate(StructKind kind, Schema schema, String fullName, StructDef struct) {
        ThriftToJavaTypeMapper types = new ThriftToJavaTypeMapper(schema.getFileGroup());
        String className = NamingUtil.simpleName(fullName);

        ImportManager imports = new ImportManager(NamingUtil.packageName(fullName));
        imports.addImport("lombok.Builder");
        imports.addImport("lombok.Value");

        StringBuilder declaration = new StringBuilder();
        declaration.append("@Value\n@Builder(toBuilder = true)\n");
        if (kind == StructKind.EXCEPTION) {
            imports.addImport("lombok.EqualsAndHashCode");
            declaration.append("@EqualsAndHashCode(callSuper = false)\n");
        }
        declaration.append("public class ").append(className);
        if (kind == StructKind.EXCEPTION) {
            declaration.append(" extends RuntimeException");
        }

        List<String> members = new ArrayList<>();
        if (kind == StructKind.EXCEPTION) {
            members.add("    private static final long serialVersionUID = 1L;");
        }
        for (FieldDef field : struct.getFields()) {
            members.add(fieldDeclaration(kind, field, types));
        }

        return GeneratedUnit.builder()
                .moduleName(fullName)
                .generator(generatorKind(kind))
                .imports(imports.getImports().stream().sorted().toList())
                .javadoc(javadoc(kind, struct))
                .declaration(declaration.toString())
                .members(members)
                .build();
    }

    private static String fieldDeclaration(StructKind kind, FieldDef field, ThriftToJavaTypeMapper types) {
        StringBuilder doc = new StringBuilder()
                .append(field.getId()).append(": ")
                .append(field.isRequired() ? "required " : "optional ")
                .append(field.getType().describe()).append(" ").append(field.getName());
        if (field.hasDefault()) {
            doc.append(" = ").append(field.getDefaultValue());
        }
        return "    /** " + doc + " */\n"
                + "    " + types.javaType(field.getType()) + " " + NamingUtil.propertyName(kind, field) + ";";
    }

    private static String javadoc(StructKind kind, StructDef struct) {
        String text = "Thrift " + kind.name().toLowerCase() + " {@code " + struct.getName() + "}.";
        if (kind == StructKind.UNION) {
            text += "\n\nAt most one field is expected to be set.";
        }
        return text;
    }

    private static GeneratorKind generatorKind(StructKind kind) {
        return switch (kind) {
            case STRUCT -> GeneratorKind.STRUCT;
            case UNION -> GeneratorKind.UNION;
            case EXCEPTION -> GeneratorKind.EXCEPTION;
        };
    }
}
