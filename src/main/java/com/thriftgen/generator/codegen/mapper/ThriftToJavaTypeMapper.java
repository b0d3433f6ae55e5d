package com.thriftgen.generator.codegen.mapper;

import com.thriftgen.generator.codegen.model.input.FileGroup;
import com.thriftgen.generator.codegen.model.input.PrimitiveType;
import com.thriftgen.generator.codegen.model.input.TypeRef;

/**
 * Maps Thrift types onto the Java types used in generated modules.
 *
 * Base types map to their boxed Java counterparts so that every field can be
 * absent. Containers and entity references are spelled fully qualified;
 * typedefs are replaced by the type they alias.
 */
public class ThriftToJavaTypeMapper {

    private final FileGroup fileGroup;

    public ThriftToJavaTypeMapper(FileGroup fileGroup) {
        this.fileGroup = fileGroup;
    }

    public String javaType(TypeRef type) {
        return switch (type.getKind()) {
            case PRIMITIVE -> javaType(type.getPrimitive());
            case LIST -> "java.util.List<" + javaType(type.getElementType()) + ">";
            case SET -> "java.util.Set<" + javaType(type.getElementType()) + ">";
            case MAP -> "java.util.Map<" + javaType(type.getKeyType()) + ", " + javaType(type.getElementType()) + ">";
            case REFERENCE -> fileGroup.typedefTarget(type.getReferenceName())
                    .map(this::javaType)
                    .orElseGet(() -> fileGroup.destModule(type.getReferenceName()));
        };
    }

    /**
     * Java return type of a function; {@code null} means {@code void}.
     */
    public String returnType(TypeRef type) {
        return type == null ? "void" : javaType(type);
    }

    public static String javaType(PrimitiveType primitive) {
        return switch (primitive) {
            case BOOL -> "Boolean";
            case BYTE -> "Byte";
            case I16 -> "Short";
            case I32 -> "Integer";
            case I64 -> "Long";
            case DOUBLE -> "Double";
            case STRING -> "String";
            case BINARY -> "byte[]";
        };
    }
}
