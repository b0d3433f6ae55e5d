package com.thriftgen.generator.codegen.util;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import com.thriftgen.generator.codegen.model.input.FieldDef;
import com.thriftgen.generator.codegen.model.input.PrimitiveType;
import com.thriftgen.generator.codegen.model.input.StructKind;

/**
 * Utility for consistent Java naming conventions.
 */
public class NamingUtil {

    private static final Set<String> THROWABLE_PROPERTIES =
            Set.of("message", "localizedMessage", "cause", "stackTrace", "suppressed");
    private static final String SHADOW_SUFFIX = "Field";

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts snake_name or kebab-name to PascalCase.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_.]"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts an IDL field name to a Java field name.
     * Names that are already camelCase are kept as they are.
     */
    public static String toCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        if (!name.contains("_") && !name.contains("-")) {
            return name.substring(0, 1).toLowerCase() + name.substring(1);
        }
        String pascal = toPascalCase(name);
        if (pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase() + pascal.substring(1);
    }

    /**
     * Java property name of a struct, union or exception field.
     *
     * An exception field whose Lombok getter would override a {@link Throwable}
     * getter gets a {@code Field} suffix ({@code cause} becomes
     * {@code causeField}). A string {@code message} is kept, since its getter
     * is a valid override of {@link Throwable#getMessage()}.
     */
    public static String propertyName(StructKind kind, FieldDef field) {
        String name = toCamelCase(field.getName());
        if (kind != StructKind.EXCEPTION || !THROWABLE_PROPERTIES.contains(name)) {
            return name;
        }
        if (name.equals("message") && field.getType().isPrimitive()
                && field.getType().getPrimitive() == PrimitiveType.STRING) {
            return name;
        }
        return name + SHADOW_SUFFIX;
    }

    /**
     * Upper-cases the first letter and lower-cases the rest.
     */
    public static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase() + str.substring(1).toLowerCase();
    }

    /**
     * Upper-cases the first letter and keeps the rest.
     */
    public static String upperFirst(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase() + str.substring(1);
    }

    /**
     * Converts camelCase or snake_case to SCREAMING_SNAKE_CASE.
     */
    public static String toScreamingSnakeCase(String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase();
    }

    /**
     * Getter name Lombok derives for a boxed field.
     */
    public static String getterName(String javaFieldName) {
        return "get" + upperFirst(javaFieldName);
    }

    public static String simpleName(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
    }

    public static String packageName(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? "" : qualifiedName.substring(0, dot);
    }
}
