package com.thriftgen.generator.codegen.model.output;

/**
 * Which leaf generator produced a unit.
 */
public enum GeneratorKind {
    ENUM,
    CONSTANT,
    STRUCT,
    UNION,
    EXCEPTION,
    SERVICE,
    BEHAVIOUR,
    TEST_DATA;

    public UnitKind getUnitKind() {
        return this == CONSTANT ? UnitKind.CONSTANT_DEFINITION : UnitKind.TYPE_DEFINITION;
    }
}
