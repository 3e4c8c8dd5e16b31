package com.ovsdb.modelgen.codegen.util;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects import statements for a generated class.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage;
    }

    /**
     * Adds an import for a fully qualified class name.
     * Skips if in same package, java.lang or unqualified.
     */
    public void addImport(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty()) {
            return;
        }

        String packageName = getPackageName(fullQualifiedName);
        if (packageName.isEmpty() || packageName.equals("java.lang")) {
            return;
        }

        // Skip same package
        if (packageName.equals(currentPackage)) {
            return;
        }

        imports.add(fullQualifiedName);
    }

    /**
     * Adds multiple imports.
     */
    public void addImports(Iterable<String> fullQualifiedNames) {
        for (String fqn : fullQualifiedNames) {
            addImport(fqn);
        }
    }

    /**
     * Imports in lexical order.
     */
    public List<String> getImports() {
        return List.copyOf(imports);
    }

    private String getPackageName(String fullQualifiedName) {
        int lastDot = fullQualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return "";
        }
        return fullQualifiedName.substring(0, lastDot);
    }

    /**
     * Simple name of a fully qualified class name.
     */
    public static String simpleName(String fullQualifiedName) {
        return fullQualifiedName.substring(fullQualifiedName.lastIndexOf('.') + 1);
    }
}
