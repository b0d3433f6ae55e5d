package com.thriftgen.generator.codegen.model.output;

import java.util.List;
import java.util.Set;

import com.thriftgen.generator.codegen.util.NamingUtil;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One generated Java module: header metadata plus an ordered list of member
 * declarations.
 *
 * The header (generator kind, javadoc, declaration line) drives collision
 * resolution; members are opaque source blocks, already indented for the class
 * body.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedUnit {

    /** Fully-qualified output name. */
    @NonNull
    String moduleName;

    @NonNull
    GeneratorKind generator;

    @NonNull
    @Singular("importName")
    Set<String> imports;

    /** Class javadoc without comment markers, or {@code null}. */
    String javadoc;

    /** Type declaration up to (not including) the opening brace. */
    @NonNull
    String declaration;

    /**
     * Enum constant list rendered ahead of the members. Part of the header, so
     * it survives a merge in either order.
     */
    @NonNull
    @Singular
    List<String> enumConstants;

    @NonNull
    @Singular
    List<String> members;

    public UnitKind getKind() {
        return generator.getUnitKind();
    }

    public String getPackageName() {
        return NamingUtil.packageName(moduleName);
    }

    public String getSimpleName() {
        return NamingUtil.simpleName(moduleName);
    }
}
