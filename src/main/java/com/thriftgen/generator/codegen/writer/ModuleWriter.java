package com.thriftgen.generator.codegen.writer;

import java.io.IOException;
import java.nio.file.Path;

import com.thriftgen.generator.codegen.model.output.GeneratedFile;

/**
 * Persists rendered modules.
 */
public interface ModuleWriter {

    /**
     * Writes one file and returns the location it was written to.
     */
    Path write(GeneratedFile file) throws IOException;
}
