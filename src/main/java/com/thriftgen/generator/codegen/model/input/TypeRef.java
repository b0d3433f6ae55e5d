package com.thriftgen.generator.codegen.model.input;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Declared type of a field, constant, typedef or function argument.
 *
 * A type is either a Thrift base type, a parametric container, or a reference
 * to a named entity. References hold the logical name as written in the IDL
 * ({@code Point} or {@code shared.Point}); resolving it to an output name is the
 * job of the {@link FileGroup}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TypeRef {

    @NonNull
    TypeKind kind;

    PrimitiveType primitive;

    /** Element type for lists and sets, value type for maps. */
    TypeRef elementType;

    /** Key type for maps. */
    TypeRef keyType;

    String referenceName;

    public static TypeRef primitive(PrimitiveType primitive) {
        return new TypeRef(TypeKind.PRIMITIVE, primitive, null, null, null);
    }

    public static TypeRef listOf(TypeRef element) {
        return new TypeRef(TypeKind.LIST, null, element, null, null);
    }

    public static TypeRef setOf(TypeRef element) {
        return new TypeRef(TypeKind.SET, null, element, null, null);
    }

    public static TypeRef mapOf(TypeRef key, TypeRef value) {
        return new TypeRef(TypeKind.MAP, null, value, key, null);
    }

    public static TypeRef reference(String logicalName) {
        return new TypeRef(TypeKind.REFERENCE, null, null, null, logicalName);
    }

    public boolean isPrimitive() {
        return kind == TypeKind.PRIMITIVE;
    }

    public boolean isReference() {
        return kind == TypeKind.REFERENCE;
    }

    /**
     * IDL spelling of the type, used in generated javadoc.
     */
    public String describe() {
        return switch (kind) {
            case PRIMITIVE -> primitive.getThriftName();
            case LIST -> "list<" + elementType.describe() + ">";
            case SET -> "set<" + elementType.describe() + ">";
            case MAP -> "map<" + keyType.describe() + "," + elementType.describe() + ">";
            case REFERENCE -> referenceName;
        };
    }
}
