package com.thriftgen.generator.codegen.writer;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Maps output names to source file paths.
 */
public class TargetPaths {

    private TargetPaths() {
        // Utility class
    }

    /**
     * {@code a.b.C} becomes {@code a/b/C.java}.
     */
    public static Path targetPath(String moduleName) {
        String[] segments = moduleName.split("\\.");
        segments[segments.length - 1] = segments[segments.length - 1] + ".java";
        return Path.of(segments[0], Arrays.copyOfRange(segments, 1, segments.length));
    }
}
