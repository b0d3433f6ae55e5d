package com.thriftgen.generator.codegen.util;

import java.util.stream.Collectors;

/**
 * Small helpers for laying out generated source.
 */
public class SourceFormat {

    private SourceFormat() {
        // Utility class
    }

    /**
     * Prefixes every non-blank line with {@code spaces} spaces.
     */
    public static String indent(String text, int spaces) {
        String pad = " ".repeat(spaces);
        return text.lines()
                .map(line -> line.isBlank() ? line : pad + line)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Indents a class member one level.
     */
    public static String member(String text) {
        return indent(text, 4);
    }
}
