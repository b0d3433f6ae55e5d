package com.thriftgen.generator.codegen.testdata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.model.input.EnumDef;
import com.thriftgen.generator.codegen.model.input.FileGroup;
import com.thriftgen.generator.codegen.model.input.Schema;
import com.thriftgen.generator.codegen.model.input.StructDef;
import com.thriftgen.generator.codegen.model.input.TypedefDef;
import com.thriftgen.generator.codegen.testdata.ir.TestDataLabel;
import com.thriftgen.generator.codegen.testdata.ir.TestDataPlan;
import com.thriftgen.generator.codegen.util.NamingUtil;
import com.thriftgen.testdata.TestDataNaming;

/**
 * Derives one companion plan per typedef, struct, exception, union and enum of
 * a schema.
 *
 * The schema must carry a file group anchored at its own module.
 */
public class TestDataPlanner {

    private static final Logger log = LoggerFactory.getLogger(TestDataPlanner.class);

    private final FieldDrawCompiler fieldCompiler;

    public TestDataPlanner() {
        this(new FieldDrawCompiler());
    }

    public TestDataPlanner(FieldDrawCompiler fieldCompiler) {
        this.fieldCompiler = fieldCompiler;
    }

    public List<TestDataPlan> plan(Schema schema) {
        FileGroup fileGroup = schema.getFileGroup();
        if (fileGroup == null) {
            throw new IllegalArgumentException("Schema " + schema.getModule() + " has no file group attached");
        }

        List<TestDataPlan> plans = new ArrayList<>();

        for (Map.Entry<String, TypedefDef> entry : schema.getTypedefs().entrySet()) {
            plans.add(planTypedef(schema, fileGroup, entry.getKey(), entry.getValue()));
        }
        for (StructDef struct : schema.getStructs().values()) {
            plans.add(planStruct(schema, fileGroup, TestDataLabel.STRUCT, struct));
        }
        for (StructDef exception : schema.getExceptions().values()) {
            plans.add(planStruct(schema, fileGroup, TestDataLabel.EXCEPTION, exception));
        }
        for (StructDef union : schema.getUnions().values()) {
            plans.add(planStruct(schema, fileGroup, TestDataLabel.UNION, union));
        }
        for (EnumDef enumDef : schema.getEnums().values()) {
            plans.add(planEnum(schema, fileGroup, enumDef));
        }

        log.debug("Planned {} test-data modules for {}", plans.size(), schema.getModule());
        return plans;
    }

    /**
     * A typedef has no body of its own: its companion name comes from the
     * capitalized alias nested under the schema module, resolved like any
     * other entity.
     */
    private TestDataPlan planTypedef(Schema schema, FileGroup fileGroup, String key, TypedefDef typedef) {
        String dataName = fileGroup.destModule(schema.getModule() + "." + NamingUtil.capitalize(key));
        return TestDataPlan.builder()
                .label(TestDataLabel.TYPEDEF)
                .dataModuleName(dataName)
                .testDataModuleName(TestDataNaming.testDataModuleFor(dataName))
                .aliasedType(typedef.getTarget())
                .fileGroup(fileGroup)
                .build();
    }

    private TestDataPlan planStruct(Schema schema, FileGroup fileGroup, TestDataLabel label, StructDef struct) {
        String dataName = fileGroup.destModule(schema.getModule(), struct.getName());
        return TestDataPlan.builder()
                .label(label)
                .dataModuleName(dataName)
                .testDataModuleName(TestDataNaming.testDataModuleFor(dataName))
                .draws(fieldCompiler.compileDraws(struct.getFields()))
                .defaults(fieldCompiler.compileDefaults(struct.getFields()))
                .fileGroup(fileGroup)
                .build();
    }

    private TestDataPlan planEnum(Schema schema, FileGroup fileGroup, EnumDef enumDef) {
        String dataName = fileGroup.destModule(schema.getModule(), enumDef.getName());
        return TestDataPlan.builder()
                .label(TestDataLabel.ENUM)
                .dataModuleName(dataName)
                .testDataModuleName(TestDataNaming.testDataModuleFor(dataName))
                .enumValues(enumDef.getValues())
                .fileGroup(fileGroup)
                .build();
    }
}
