package com.thriftgen.generator.codegen.resolve;

import com.thriftgen.generator.codegen.model.output.GeneratorKind;

/**
 * Raised when two generated units share an output name and neither is a
 * constants unit.
 */
public class NameCollisionException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient NameCollision collision;

    public NameCollisionException(NameCollision collision) {
        super(collision.describe());
        this.collision = collision;
    }

    public NameCollision getCollision() {
        return collision;
    }

    public String getModuleName() {
        return collision.getModuleName();
    }

    public GeneratorKind getFirst() {
        return collision.getFirst();
    }

    public GeneratorKind getSecond() {
        return collision.getSecond();
    }
}
