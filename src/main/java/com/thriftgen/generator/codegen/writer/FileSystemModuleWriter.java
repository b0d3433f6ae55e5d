package com.thriftgen.generator.codegen.writer;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.model.output.GeneratedFile;
import com.thriftgen.generator.codegen.util.FileWriteUtil;

import lombok.NonNull;

/**
 * Writes main modules under one source root and test-data modules under
 * another.
 */
public class FileSystemModuleWriter implements ModuleWriter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemModuleWriter.class);

    private final Path mainRoot;
    private final Path testDataRoot;

    public FileSystemModuleWriter(@NonNull Path mainRoot, @NonNull Path testDataRoot) {
        this.mainRoot = mainRoot;
        this.testDataRoot = testDataRoot;
    }

    @Override
    public Path write(GeneratedFile file) throws IOException {
        Path root = switch (file.getType()) {
            case MAIN -> mainRoot;
            case TEST_DATA -> testDataRoot;
        };
        Path target = root.resolve(file.getPath());
        FileWriteUtil.safeWriteString(target, file.getContents());
        log.debug("Wrote {}", target);
        return target;
    }
}
