package com.thriftgen.generator.codegen;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for writing generated modules.
 */
@Data
@Builder
public class GeneratorConfig {
    private Path outputDir;
    private Path testDataOutputDir;
    private boolean dryRun;

    /**
     * Root for test-data companions; falls back to the main output directory.
     */
    public Path getEffectiveTestDataOutputDir() {
        return testDataOutputDir != null ? testDataOutputDir : outputDir;
    }
}
