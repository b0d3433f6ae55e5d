package com.thriftgen.generator.codegen.model.input;

/**
 * Thrift base types.
 */
public enum PrimitiveType {
    BOOL("bool"),
    BYTE("byte"),
    I16("i16"),
    I32("i32"),
    I64("i64"),
    DOUBLE("double"),
    STRING("string"),
    BINARY("binary");

    private final String thriftName;

    PrimitiveType(String thriftName) {
        this.thriftName = thriftName;
    }

    public String getThriftName() {
        return thriftName;
    }
}
