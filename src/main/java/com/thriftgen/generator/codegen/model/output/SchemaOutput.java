package com.thriftgen.generator.codegen.model.output;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Units produced from one schema, split by output stream.
 */
@Value
public class SchemaOutput {

    @NonNull
    List<GeneratedUnit> modules;

    @NonNull
    List<GeneratedUnit> testDataModules;

    public List<GeneratedUnit> stream(GeneratedFileType type) {
        return type == GeneratedFileType.MAIN ? modules : testDataModules;
    }
}
