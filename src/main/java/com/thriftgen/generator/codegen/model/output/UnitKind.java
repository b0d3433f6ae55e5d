package com.thriftgen.generator.codegen.model.output;

/**
 * Merge-relevant classification of a generated unit.
 *
 * Constant definitions may be folded into a type definition that shares their
 * output name; no other pairing can be merged.
 */
public enum UnitKind {
    TYPE_DEFINITION,
    CONSTANT_DEFINITION
}
