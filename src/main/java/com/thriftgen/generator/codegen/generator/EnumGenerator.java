package com.thriftgen.generator.codegen.generator;

import java.util.ArrayList;
import java.util.List;

import com.thriftgen.generator.codegen.model.input.EnumDef;
import com.thriftgen.generator.codegen.model.input.EnumValueDef;
import com.thriftgen.generator.codegen.model.output.GeneratedUnit;
import com.thriftgen.generator.codegen.model.output.GeneratorKind;
import com.thriftgen.generator.codegen.util.NamingUtil;
import com.thriftgen.generator.codegen.util.SourceFormat;

/**
 * Generates a Java enum carrying each member's Thrift value.
 */
public class EnumGenerator {

    public GeneratedUnit generate(String fullName, EnumDef enumDef) {
        String enumName = NamingUtil.simpleName(fullName);

        List<String> constants = new ArrayList<>();
        for (EnumValueDef value : enumDef.getValues()) {
            constants.add(value.getName() + "(" + value.getValue() + ")");
        }

        String field = "    private final int value;";

        String constructor = """
                    %s(int value) {
                        this.value = value;
                    }""".formatted(enumName);

        String getter = """
                    public int getValue() {
                        return value;
                    }""";

        String finder = """
                    /**
                     * Member with the given Thrift value, or {@code null}.
                     */
                    public static %s findByValue(int value) {
                        for (%s member : values()) {
                            if (member.value == value) {
                                return member;
                            }
                        }
                        return null;
                    }""".formatted(enumName, enumName);

        return GeneratedUnit.builder()
                .moduleName(fullName)
                .generator(GeneratorKind.ENUM)
                .javadoc("Thrift enum {@code " + enumDef.getName() + "}.")
                .declaration("public enum " + enumName)
                .enumConstants(constants)
                .member(field)
                .member(SourceFormat.member(constructor))
                .member(SourceFormat.member(getter))
                .member(SourceFormat.member(finder))
                .build();
    }
}
