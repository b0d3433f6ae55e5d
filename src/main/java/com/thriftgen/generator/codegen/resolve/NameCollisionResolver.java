package com.thriftgen.generator.codegen.resolve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.model.output.GeneratedUnit;
import com.thriftgen.generator.codegen.model.output.UnitKind;

/**
 * Collapses units that share an output name.
 *
 * A constants unit merges into the type definition of the same name: the
 * type's header wins, imports are unioned and the members of the unit seen
 * first come first. Any other repeat is a collision.
 */
public class NameCollisionResolver {

    private static final Logger log = LoggerFactory.getLogger(NameCollisionResolver.class);

    public ResolutionResult resolve(List<GeneratedUnit> units) {
        Map<String, GeneratedUnit> byName = new LinkedHashMap<>();

        for (GeneratedUnit unit : units) {
            GeneratedUnit existing = byName.get(unit.getModuleName());
            if (existing == null) {
                byName.put(unit.getModuleName(), unit);
                continue;
            }
            if (!mergeable(existing, unit)) {
                NameCollision collision = new NameCollision(unit.getModuleName(), existing.getGenerator(), unit.getGenerator());
                log.debug(collision.describe());
                return ResolutionResult.failure(collision);
            }
            log.debug("Merging {} and {} units named {}", existing.getGenerator(), unit.getGenerator(), unit.getModuleName());
            byName.put(unit.getModuleName(), merge(existing, unit));
        }

        return ResolutionResult.success(new ArrayList<>(byName.values()));
    }

    public List<GeneratedUnit> resolveOrThrow(List<GeneratedUnit> units) {
        return resolve(units).orElseThrow();
    }

    private static boolean mergeable(GeneratedUnit first, GeneratedUnit second) {
        return (first.getKind() == UnitKind.CONSTANT_DEFINITION) != (second.getKind() == UnitKind.CONSTANT_DEFINITION);
    }

    static GeneratedUnit merge(GeneratedUnit first, GeneratedUnit second) {
        GeneratedUnit header = switch (first.getKind()) {
            case CONSTANT_DEFINITION -> second;
            case TYPE_DEFINITION -> first;
        };

        Set<String> imports = new LinkedHashSet<>(first.getImports());
        imports.addAll(second.getImports());

        List<String> members = new ArrayList<>(first.getMembers());
        members.addAll(second.getMembers());

        return header.toBuilder()
                .clearImports()
                .imports(imports)
                .clearMembers()
                .members(members)
                .build();
    }
}
