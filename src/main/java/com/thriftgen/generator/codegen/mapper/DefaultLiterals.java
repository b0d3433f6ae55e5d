package com.thriftgen.generator.codegen.mapper;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.thriftgen.generator.codegen.model.input.EnumDef;
import com.thriftgen.generator.codegen.model.input.EnumValueDef;
import com.thriftgen.generator.codegen.model.input.FieldDef;
import com.thriftgen.generator.codegen.model.input.FileGroup;
import com.thriftgen.generator.codegen.model.input.StructDef;
import com.thriftgen.generator.codegen.model.input.TypeRef;
import com.thriftgen.generator.codegen.util.NamingUtil;
import com.thriftgen.testdata.EnumValue;
import com.thriftgen.testdata.StructValue;

/**
 * Interprets IDL literals (constant values and field defaults) against their
 * declared type.
 *
 * {@link #toJava} renders a Java expression for generated source;
 * {@link #toValue} produces the equivalent runtime value for directly executed
 * companions.
 */
public class DefaultLiterals {

    private final FileGroup fileGroup;

    public DefaultLiterals(FileGroup fileGroup) {
        this.fileGroup = fileGroup;
    }

    public String toJava(Object literal, TypeRef type) {
        return switch (type.getKind()) {
            case PRIMITIVE -> switch (type.getPrimitive()) {
                case BOOL -> Boolean.toString(asBoolean(literal));
                case BYTE -> "(byte) " + asNumber(literal).intValue();
                case I16 -> "(short) " + asNumber(literal).intValue();
                case I32 -> Integer.toString(asNumber(literal).intValue());
                case I64 -> asNumber(literal).longValue() + "L";
                case DOUBLE -> asNumber(literal).doubleValue() + "d";
                case STRING -> quote(literal.toString());
                case BINARY -> quote(literal.toString()) + ".getBytes(java.nio.charset.StandardCharsets.UTF_8)";
            };
            case LIST -> asCollection(literal).stream()
                    .map(element -> toJava(element, type.getElementType()))
                    .collect(Collectors.joining(", ", "java.util.List.of(", ")"));
            case SET -> asCollection(literal).stream()
                    .map(element -> toJava(element, type.getElementType()))
                    .collect(Collectors.joining(", ", "java.util.Set.of(", ")"));
            case MAP -> asMap(literal).entrySet().stream()
                    .map(e -> "java.util.Map.entry(" + toJava(e.getKey(), type.getKeyType()) + ", "
                            + toJava(e.getValue(), type.getElementType()) + ")")
                    .collect(Collectors.joining(", ", "java.util.Map.ofEntries(", ")"));
            case REFERENCE -> referenceToJava(literal, type.getReferenceName());
        };
    }

    public Object toValue(Object literal, TypeRef type) {
        return switch (type.getKind()) {
            case PRIMITIVE -> switch (type.getPrimitive()) {
                case BOOL -> asBoolean(literal);
                case BYTE -> asNumber(literal).byteValue();
                case I16 -> asNumber(literal).shortValue();
                case I32 -> asNumber(literal).intValue();
                case I64 -> asNumber(literal).longValue();
                case DOUBLE -> asNumber(literal).doubleValue();
                case STRING -> literal.toString();
                case BINARY -> literal.toString().getBytes(StandardCharsets.UTF_8);
            };
            case LIST -> {
                List<Object> list = new ArrayList<>();
                asCollection(literal).forEach(element -> list.add(toValue(element, type.getElementType())));
                yield list;
            }
            case SET -> {
                Set<Object> set = new LinkedHashSet<>();
                asCollection(literal).forEach(element -> set.add(toValue(element, type.getElementType())));
                yield set;
            }
            case MAP -> {
                Map<Object, Object> map = new LinkedHashMap<>();
                asMap(literal).forEach((k, v) -> map.put(toValue(k, type.getKeyType()), toValue(v, type.getElementType())));
                yield map;
            }
            case REFERENCE -> referenceToValue(literal, type.getReferenceName());
        };
    }

    private String referenceToJava(Object literal, String logicalName) {
        Optional<TypeRef> aliased = fileGroup.typedefTarget(logicalName);
        if (aliased.isPresent()) {
            return toJava(literal, aliased.get());
        }
        String javaName = fileGroup.destModule(logicalName);

        Optional<EnumDef> enumDef = fileGroup.findEnum(logicalName);
        if (enumDef.isPresent()) {
            return javaName + "." + enumMember(enumDef.get(), literal).getName();
        }

        StructDef struct = fileGroup.findStruct(logicalName)
                .orElseThrow(() -> unsupported(literal, logicalName));
        Map<?, ?> values = asMap(literal);
        StringBuilder sb = new StringBuilder(javaName).append(".builder()");
        for (FieldDef field : struct.getFields()) {
            if (values.containsKey(field.getName())) {
                sb.append(".").append(NamingUtil.propertyName(struct.getKind(), field))
                        .append("(").append(toJava(values.get(field.getName()), field.getType())).append(")");
            }
        }
        return sb.append(".build()").toString();
    }

    private Object referenceToValue(Object literal, String logicalName) {
        Optional<TypeRef> aliased = fileGroup.typedefTarget(logicalName);
        if (aliased.isPresent()) {
            return toValue(literal, aliased.get());
        }
        String javaName = fileGroup.destModule(logicalName);

        Optional<EnumDef> enumDef = fileGroup.findEnum(logicalName);
        if (enumDef.isPresent()) {
            EnumValueDef member = enumMember(enumDef.get(), literal);
            return new EnumValue(javaName, member.getName(), member.getValue());
        }

        StructDef struct = fileGroup.findStruct(logicalName)
                .orElseThrow(() -> unsupported(literal, logicalName));
        Map<?, ?> values = asMap(literal);
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldDef field : struct.getFields()) {
            Object value = values.get(field.getName());
            fields.put(field.getName(), value == null ? null : toValue(value, field.getType()));
        }
        return new StructValue(javaName, fields);
    }

    private static EnumValueDef enumMember(EnumDef enumDef, Object literal) {
        if (literal instanceof Number number) {
            return enumDef.getValues().stream()
                    .filter(v -> v.getValue() == number.intValue())
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Enum " + enumDef.getName() + " has no value " + number));
        }
        String name = NamingUtil.simpleName(literal.toString());
        return enumDef.getValues().stream()
                .filter(v -> v.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Enum " + enumDef.getName() + " has no member " + name));
    }

    private static boolean asBoolean(Object literal) {
        if (literal instanceof Boolean b) {
            return b;
        }
        return asNumber(literal).intValue() != 0;
    }

    private static Number asNumber(Object literal) {
        if (literal instanceof Number number) {
            return number;
        }
        throw new IllegalArgumentException("Expected a numeric literal but got " + literal);
    }

    private static Collection<?> asCollection(Object literal) {
        if (literal instanceof Collection<?> collection) {
            return collection;
        }
        throw new IllegalArgumentException("Expected a list or set literal but got " + literal);
    }

    private static Map<?, ?> asMap(Object literal) {
        if (literal instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("Expected a map literal but got " + literal);
    }

    private static IllegalArgumentException unsupported(Object literal, String logicalName) {
        return new IllegalArgumentException("Cannot interpret literal " + literal + " as " + logicalName);
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
