package com.thriftgen.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.generator.BehaviourGenerator;
import com.thriftgen.generator.codegen.generator.ConstantGenerator;
import com.thriftgen.generator.codegen.generator.EnumGenerator;
import com.thriftgen.generator.codegen.generator.ServiceGenerator;
import com.thriftgen.generator.codegen.generator.StructGenerator;
import com.thriftgen.generator.codegen.generator.TestDataGenerator;
import com.thriftgen.generator.codegen.model.input.ConstantDef;
import com.thriftgen.generator.codegen.model.input.EnumDef;
import com.thriftgen.generator.codegen.model.input.FileGroup;
import com.thriftgen.generator.codegen.model.input.Schema;
import com.thriftgen.generator.codegen.model.input.ServiceDef;
import com.thriftgen.generator.codegen.model.input.StructDef;
import com.thriftgen.generator.codegen.model.input.StructKind;
import com.thriftgen.generator.codegen.model.output.GeneratedFile;
import com.thriftgen.generator.codegen.model.output.GeneratedFileType;
import com.thriftgen.generator.codegen.model.output.GeneratedUnit;
import com.thriftgen.generator.codegen.model.output.SchemaOutput;
import com.thriftgen.generator.codegen.resolve.NameCollisionResolver;
import com.thriftgen.generator.codegen.resolve.ResolutionResult;
import com.thriftgen.generator.codegen.writer.FileSystemModuleWriter;
import com.thriftgen.generator.codegen.writer.ModuleWriter;
import com.thriftgen.generator.codegen.writer.TargetPaths;
import com.thriftgen.generator.codegen.writer.UnitRenderer;

/**
 * Turns the schemas of a file group into Java modules and their test-data
 * companions.
 *
 * Every schema is generated first; each output stream is then resolved across
 * all schemas before anything is written.
 */
public class ThriftGenerator {
    private static final Logger log = LoggerFactory.getLogger(ThriftGenerator.class);

    private final StructGenerator structGenerator = new StructGenerator();
    private final EnumGenerator enumGenerator = new EnumGenerator();
    private final ConstantGenerator constantGenerator = new ConstantGenerator();
    private final ServiceGenerator serviceGenerator = new ServiceGenerator();
    private final BehaviourGenerator behaviourGenerator = new BehaviourGenerator();
    private final TestDataGenerator testDataGenerator;
    private final NameCollisionResolver resolver = new NameCollisionResolver();
    private final UnitRenderer renderer = new UnitRenderer();

    public ThriftGenerator() {
        this(new TestDataGenerator());
    }

    public ThriftGenerator(TestDataGenerator testDataGenerator) {
        this.testDataGenerator = testDataGenerator;
    }

    /**
     * Generates the units of one schema. The schema must carry its file group.
     */
    public SchemaOutput generateSchema(Schema schema) {
        FileGroup fileGroup = Objects.requireNonNull(schema.getFileGroup(), "Schema " + schema.getModule() + " has no file group")
                .withCurrentModule(schema.getModule());
        Schema current = schema.withFileGroup(fileGroup);

        List<GeneratedUnit> modules = new ArrayList<>();
        modules.addAll(generateEnums(current));
        modules.addAll(generateConstants(current));
        modules.addAll(generateStructs(current, StructKind.STRUCT, current.getStructs()));
        modules.addAll(generateStructs(current, StructKind.UNION, current.getUnions()));
        modules.addAll(generateStructs(current, StructKind.EXCEPTION, current.getExceptions()));
        for (ServiceDef service : current.getServices().values()) {
            modules.add(serviceGenerator.generate(current, service));
        }
        for (ServiceDef service : current.getServices().values()) {
            modules.add(behaviourGenerator.generate(current, service));
        }

        List<GeneratedUnit> testDataModules = testDataGenerator.generate(current);

        log.debug("Schema {}: {} modules, {} test-data modules", schema.getModule(), modules.size(), testDataModules.size());
        return new SchemaOutput(List.copyOf(modules), List.copyOf(testDataModules));
    }

    /**
     * Generates every schema of the file group, in the group's order.
     */
    public List<SchemaOutput> generateAll(FileGroup fileGroup) {
        return fileGroup.getSchemas().values().stream()
                .map(schema -> generateSchema(schema.withFileGroup(fileGroup)))
                .toList();
    }

    /**
     * Paths, relative to the output directory, of the main modules the file
     * group generates.
     */
    public List<Path> targets(FileGroup fileGroup) {
        return units(generateAll(fileGroup), GeneratedFileType.MAIN).stream()
                .map(GeneratedUnit::getModuleName)
                .distinct()
                .map(TargetPaths::targetPath)
                .toList();
    }

    /**
     * Renders every main module of the file group, last generated first.
     */
    public String generateToString(FileGroup fileGroup) throws IOException {
        List<GeneratedUnit> units = new ArrayList<>(units(generateAll(fileGroup), GeneratedFileType.MAIN));
        Collections.reverse(units);

        List<String> sources = new ArrayList<>();
        for (GeneratedUnit unit : units) {
            sources.add(renderer.render(unit));
        }
        return String.join("\n", sources);
    }

    public GeneratorResult generate(FileGroup fileGroup, GeneratorConfig config) {
        Path testDataOutputDir = config.getEffectiveTestDataOutputDir();
        return generate(fileGroup, config, new FileSystemModuleWriter(config.getOutputDir(), testDataOutputDir));
    }

    public GeneratorResult generate(FileGroup fileGroup, GeneratorConfig config, ModuleWriter writer) {
        try {
            log.info("Generating {} schema(s)...", fileGroup.getSchemas().size());
            List<SchemaOutput> outputs = generateAll(fileGroup);

            List<GeneratedFile> files = new ArrayList<>();
            int merged = 0;
            int[] counts = new int[GeneratedFileType.values().length];
            for (GeneratedFileType type : GeneratedFileType.values()) {
                List<GeneratedUnit> units = units(outputs, type);
                ResolutionResult resolution = resolver.resolve(units);
                if (!resolution.isSuccess()) {
                    log.error(resolution.getCollision().describe());
                    return GeneratorResult.failure(resolution.getCollision());
                }
                merged += units.size() - resolution.getUnits().size();
                counts[type.ordinal()] = resolution.getUnits().size();
                for (GeneratedUnit unit : resolution.getUnits()) {
                    files.add(GeneratedFile.builder()
                            .path(TargetPaths.targetPath(unit.getModuleName()))
                            .contents(renderer.render(unit))
                            .type(type)
                            .build());
                }
            }

            List<Path> written = new ArrayList<>();
            if (config.isDryRun()) {
                log.info("Dry run: {} file(s) not written", files.size());
            } else {
                for (GeneratedFile file : files) {
                    written.add(writer.write(file));
                }
                log.info("Wrote {} file(s)", written.size());
            }

            return GeneratorResult.builder()
                    .success(true)
                    .writtenFiles(List.copyOf(written))
                    .schemasProcessed(outputs.size())
                    .modulesGenerated(counts[GeneratedFileType.MAIN.ordinal()])
                    .testDataModulesGenerated(counts[GeneratedFileType.TEST_DATA.ordinal()])
                    .modulesMerged(merged)
                    .build();

        } catch (IOException e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    private List<GeneratedUnit> generateEnums(Schema schema) {
        List<GeneratedUnit> units = new ArrayList<>();
        for (Map.Entry<String, EnumDef> entry : schema.getEnums().entrySet()) {
            String fullName = schema.getFileGroup().destModule(schema.getModule(), entry.getKey());
            units.add(enumGenerator.generate(fullName, entry.getValue()));
        }
        return units;
    }

    private List<GeneratedUnit> generateConstants(Schema schema) {
        FileGroup fileGroup = schema.getFileGroup();
        List<ConstantDef> owned = schema.getConstants().values().stream()
                .filter(fileGroup::ownsConstant)
                .toList();
        if (owned.isEmpty()) {
            log.debug("No constants module for {}", schema.getModule());
            return List.of();
        }
        return List.of(constantGenerator.generate(fileGroup.constantsModule(), owned, schema));
    }

    private List<GeneratedUnit> generateStructs(Schema schema, StructKind kind, Map<String, StructDef> structs) {
        List<GeneratedUnit> units = new ArrayList<>();
        for (Map.Entry<String, StructDef> entry : structs.entrySet()) {
            String fullName = schema.getFileGroup().destModule(schema.getModule(), entry.getKey());
            units.add(structGenerator.generate(kind, schema, fullName, entry.getValue()));
        }
        return units;
    }

    private static List<GeneratedUnit> units(List<SchemaOutput> outputs, GeneratedFileType type) {
        return outputs.stream()
                .flatMap(output -> output.stream(type).stream())
                .toList();
    }
}
