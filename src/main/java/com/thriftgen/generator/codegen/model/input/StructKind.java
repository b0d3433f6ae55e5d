package com.thriftgen.generator.codegen.model.input;

/**
 * The three data-bearing entity kinds that share one generator.
 */
public enum StructKind {
    STRUCT,
    UNION,
    EXCEPTION
}
