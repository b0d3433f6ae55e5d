package com.thriftgen.generator.codegen.model.output;

/**
 * Output streams of a generation pass. Each stream is resolved and written
 * independently.
 */
public enum GeneratedFileType {
    MAIN,
    TEST_DATA
}
