package com.thriftgen.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.thriftgen.generator.codegen.resolve.NameCollision;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one generation pass over a file group.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private NameCollision collision;

    @Builder.Default
    private List<Path> writtenFiles = List.of();

    private int schemasProcessed;
    private int modulesGenerated;
    private int testDataModulesGenerated;
    private int modulesMerged;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult failure(NameCollision collision) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(collision.describe())
                .collision(collision)
                .build();
    }
}
