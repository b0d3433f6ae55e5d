package com.thriftgen.generator.codegen.generator;

import java.util.ArrayList;
import java.util.List;

import com.thriftgen.generator.codegen.mapper.DefaultLiterals;
import com.thriftgen.generator.codegen.mapper.ThriftToJavaTypeMapper;
import com.thriftgen.generator.codegen.model.input.ConstantDef;
import com.thriftgen.generator.codegen.model.input.Schema;
import com.thriftgen.generator.codegen.model.output.GeneratedUnit;
import com.thriftgen.generator.codegen.model.output.GeneratorKind;
import com.thriftgen.generator.codegen.util.NamingUtil;

/**
 * Generates the constants module of a schema: one {@code public static final}
 * field per owned constant.
 *
 * No constructor is emitted so the members can be merged into a type that
 * shares the module name.
 */
public class ConstantGenerator {

    public GeneratedUnit generate(String fullName, List<ConstantDef> constants, Schema schema) {
        ThriftToJavaTypeMapper types = new ThriftToJavaTypeMapper(schema.getFileGroup());
        DefaultLiterals literals = new DefaultLiterals(schema.getFileGroup());

        List<String> members = new ArrayList<>();
        for (ConstantDef constant : constants) {
            members.add("    public static final " + types.javaType(constant.getType()) + " " + constant.getName()
                    + " = " + literals.toJava(constant.getValue(), constant.getType()) + ";");
        }

        return GeneratedUnit.builder()
                .moduleName(fullName)
                .generator(GeneratorKind.CONSTANT)
                .javadoc("Constants declared in {@code " + schema.getModule() + ".thrift}.")
                .declaration("public final class " + NamingUtil.simpleName(fullName))
                .members(members)
                .build();
    }
}
