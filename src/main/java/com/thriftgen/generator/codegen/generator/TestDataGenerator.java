package com.thriftgen.generator.codegen.generator;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.model.input.Schema;
import com.thriftgen.generator.codegen.model.output.GeneratedUnit;
import com.thriftgen.generator.codegen.testdata.TestDataPlanner;
import com.thriftgen.generator.codegen.testdata.ir.TestDataPlan;
import com.thriftgen.generator.codegen.testdata.lower.JavaSourceLowering;

/**
 * Generates the test-data companion of every typedef, struct, exception, union
 * and enum of a schema.
 */
public class TestDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(TestDataGenerator.class);

    private final TestDataPlanner planner;
    private final JavaSourceLowering lowering;

    public TestDataGenerator() {
        this(new TestDataPlanner(), new JavaSourceLowering());
    }

    public TestDataGenerator(TestDataPlanner planner, JavaSourceLowering lowering) {
        this.planner = planner;
        this.lowering = lowering;
    }

    public List<GeneratedUnit> generate(Schema schema) {
        return planner.plan(schema).stream()
                .map(this::generate)
                .toList();
    }

    public GeneratedUnit generate(TestDataPlan plan) {
        log.debug("Generating {} companion {}", plan.getLabel(), plan.getTestDataModuleName());
        return lowering.lower(plan);
    }
}
