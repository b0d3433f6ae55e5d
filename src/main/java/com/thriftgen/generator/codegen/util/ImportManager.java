package com.thriftgen.generator.codegen.util;

import java.util.Set;
import java.util.TreeSet;

/**
 * Collects import statements for one generated Java module.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage;
    }

    /**
     * Adds an import for a fully qualified class name.
     * Skips if in same package or java.lang.
     */
    public void addImport(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty() || !fullQualifiedName.contains(".")) {
            return;
        }

        if (fullQualifiedName.startsWith("java.lang.") && fullQualifiedName.indexOf('.', "java.lang.".length()) < 0) {
            return;
        }

        if (NamingUtil.packageName(fullQualifiedName).equals(currentPackage)) {
            return;
        }

        imports.add(fullQualifiedName);
    }

    public Set<String> getImports() {
        return Set.copyOf(imports);
    }
}
