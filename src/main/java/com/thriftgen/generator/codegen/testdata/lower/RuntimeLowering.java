package com.thriftgen.generator.codegen.testdata.lower;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.mapper.DefaultLiterals;
import com.thriftgen.generator.codegen.model.input.FileGroup;
import com.thriftgen.generator.codegen.model.input.Schema;
import com.thriftgen.generator.codegen.testdata.TestDataPlanner;
import com.thriftgen.generator.codegen.testdata.ir.DefaultRule;
import com.thriftgen.generator.codegen.testdata.ir.DrawExprVisitor;
import com.thriftgen.generator.codegen.testdata.ir.NullableDraw;
import com.thriftgen.generator.codegen.testdata.ir.TestDataPlan;
import com.thriftgen.generator.codegen.testdata.ir.TypeDraw;
import com.thriftgen.testdata.Binding;
import com.thriftgen.testdata.Bindings;
import com.thriftgen.testdata.EnumValue;
import com.thriftgen.testdata.Gen;
import com.thriftgen.testdata.GenContext;
import com.thriftgen.testdata.StructValue;
import com.thriftgen.testdata.TestDataModule;

/**
 * Lowers companion plans to executable closures over {@link StructValue}
 * instances, without going through generated source.
 */
public class RuntimeLowering {

    private static final Logger log = LoggerFactory.getLogger(RuntimeLowering.class);

    private final TestDataPlanner planner;
    private final Function<CompiledTestData, ValueGenerators> primitives;

    public RuntimeLowering() {
        this(new TestDataPlanner(), DefaultValueGenerators::new);
    }

    public RuntimeLowering(TestDataPlanner planner, Function<CompiledTestData, ValueGenerators> primitives) {
        this.planner = planner;
        this.primitives = primitives;
    }

    /**
     * Compiles the companions of every schema in the group.
     */
    public CompiledTestData compile(FileGroup fileGroup) {
        CompiledTestData compiled = new CompiledTestData();
        ValueGenerators generators = primitives.apply(compiled);

        for (Schema schema : fileGroup.getSchemas().values()) {
            Schema anchored = schema.withFileGroup(fileGroup.withCurrentModule(schema.getModule()));
            for (TestDataPlan plan : planner.plan(anchored)) {
                compiled.register(plan.getDataModuleName(), lower(plan, compiled, generators));
            }
        }
        log.debug("Compiled {} executable test-data modules", compiled.getDataModuleNames().size());
        return compiled;
    }

    TestDataModule<Object> lower(TestDataPlan plan, CompiledTestData owner, ValueGenerators generators) {
        if (plan.isComposite()) {
            return new CompositeModule(plan, owner, generators);
        }
        return switch (plan.getLabel()) {
            case TYPEDEF -> new TypedefModule(plan, owner, generators);
            case ENUM -> new EnumModule(plan);
            case STRUCT, EXCEPTION, UNION -> new EmptyModule(plan);
        };
    }

    private static final class CompositeModule implements TestDataModule<Object> {

        private final TestDataPlan plan;
        private final CompiledTestData owner;
        private final ValueGenerators generators;
        private final DefaultLiterals literals;

        CompositeModule(TestDataPlan plan, CompiledTestData owner, ValueGenerators generators) {
            this.plan = plan;
            this.owner = owner;
            this.generators = generators;
            this.literals = new DefaultLiterals(plan.getFileGroup());
        }

        @Override
        public Gen<Object> getGenerator(GenContext context) {
            DrawLowering lowering = new DrawLowering(plan.getFileGroup(), generators, context);
            List<Binding<?>> bindings = plan.getDraws().stream()
                    .<Binding<?>>map(draw -> Binding.of(draw.getFieldName(), draw.getExpr().accept(lowering)))
                    .toList();
            String typeName = plan.getDataModuleName();
            return Gen.letAll(bindings, (Bindings values) -> new StructValue(typeName, values.asMap()));
        }

        @Override
        public Object applyDefaults(Object instance, GenContext context) {
            if (instance == null) {
                return null;
            }
            StructValue struct = (StructValue) instance;
            Map<String, Object> replaced = new LinkedHashMap<>();
            for (DefaultRule rule : plan.getDefaults()) {
                Object value = owner.applyDefaults(struct.get(rule.getFieldName()), context);
                if (value == null && rule.hasFallback()) {
                    value = literals.toValue(rule.getLiteral(), rule.getType());
                }
                replaced.put(rule.getFieldName(), value);
            }
            return struct.with(replaced);
        }
    }

    private static final class EmptyModule implements TestDataModule<Object> {

        private final StructValue instance;

        EmptyModule(TestDataPlan plan) {
            this.instance = StructValue.empty(plan.getDataModuleName());
        }

        @Override
        public Gen<Object> getGenerator(GenContext context) {
            return Gen.constant(instance);
        }

        @Override
        public Object applyDefaults(Object instance, GenContext context) {
            return instance;
        }
    }

    private static final class EnumModule implements TestDataModule<Object> {

        private final EnumValue first;

        EnumModule(TestDataPlan plan) {
            this.first = plan.getEnumValues().stream()
                    .findFirst()
                    .map(v -> new EnumValue(plan.getDataModuleName(), v.getName(), v.getValue()))
                    .orElse(null);
        }

        @Override
        public Gen<Object> getGenerator(GenContext context) {
            return Gen.constant(first);
        }

        @Override
        public Object applyDefaults(Object instance, GenContext context) {
            return instance;
        }
    }

    private static final class TypedefModule implements TestDataModule<Object> {

        private final TestDataPlan plan;
        private final CompiledTestData owner;
        private final ValueGenerators generators;

        TypedefModule(TestDataPlan plan, CompiledTestData owner, ValueGenerators generators) {
            this.plan = plan;
            this.owner = owner;
            this.generators = generators;
        }

        @Override
        public Gen<Object> getGenerator(GenContext context) {
            return generators.generatorFor(plan.getAliasedType(), plan.getFileGroup(), context);
        }

        @Override
        public Object applyDefaults(Object instance, GenContext context) {
            return owner.applyDefaults(instance, context);
        }
    }

    private static final class DrawLowering implements DrawExprVisitor<Gen<Object>> {

        private final FileGroup fileGroup;
        private final ValueGenerators generators;
        private final GenContext context;

        DrawLowering(FileGroup fileGroup, ValueGenerators generators, GenContext context) {
            this.fileGroup = fileGroup;
            this.generators = generators;
            this.context = context;
        }

        @Override
        public Gen<Object> visit(TypeDraw draw) {
            return generators.generatorFor(draw.getType(), fileGroup, context);
        }

        @Override
        public Gen<Object> visit(NullableDraw draw) {
            return Gen.nullable(draw.getInner().accept(this));
        }
    }
}
