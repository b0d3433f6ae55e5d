package com.thriftgen.generator.codegen.resolve;

import java.util.List;
import java.util.Optional;

import com.thriftgen.generator.codegen.model.output.GeneratedUnit;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of collision resolution: the deduplicated units, or the first
 * collision that could not be merged.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolutionResult {

    List<GeneratedUnit> units;
    NameCollision collision;

    public static ResolutionResult success(List<GeneratedUnit> units) {
        return new ResolutionResult(List.copyOf(units), null);
    }

    public static ResolutionResult failure(NameCollision collision) {
        return new ResolutionResult(List.of(), collision);
    }

    public boolean isSuccess() {
        return collision == null;
    }

    public Optional<NameCollision> getCollisionIfAny() {
        return Optional.ofNullable(collision);
    }

    /**
     * Returns the resolved units or throws the collision.
     */
    public List<GeneratedUnit> orElseThrow() {
        if (collision != null) {
            throw new NameCollisionException(collision);
        }
        return units;
    }
}
