package com.mockgen.generator.codegen.util;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.mockgen.generator.codegen.exception.GenerationException;

/**
 * Manages import statements for generated Java classes.
 *
 * Every simple name is bound to at most one top-level class. The first class to claim a name
 * is referenced by its simple name; later classes with the same simple name are written fully
 * qualified. Types from {@code java.lang} and from the current package are referenced
 * unqualified without an import.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();
    private final Map<String, String> bindings = new HashMap<>();
    private final Set<String> reserved = new HashSet<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage == null ? "" : currentPackage;
    }

    /**
     * Claims a simple name for a class without importing it yet. It is imported once referenced.
     */
    public void bind(String fullQualifiedName) {
        String simpleName = simpleName(fullQualifiedName);
        if (!reserved.contains(simpleName)) {
            bindings.putIfAbsent(simpleName, fullQualifiedName);
        }
    }

    /**
     * Keeps a simple name away from imports, e.g. a type variable or the generated class itself.
     */
    public void reserve(String simpleName) {
        reserved.add(simpleName);
    }

    /**
     * Returns the source form of a class reference and records the import it needs.
     *
     * @param packagePath package of the class, "" for the unnamed package
     * @param baseName    class name below the package; nested classes use dots
     */
    public String reference(String packagePath, String baseName) {
        if (packagePath.isEmpty()) {
            if (!currentPackage.isEmpty()) {
                throw new GenerationException("Type " + baseName
                        + " is declared in the unnamed package and cannot be referenced from package " + currentPackage);
            }
            return baseName;
        }

        int dot = baseName.indexOf('.');
        String topLevel = dot < 0 ? baseName : baseName.substring(0, dot);
        String nestedSuffix = dot < 0 ? "" : baseName.substring(dot);
        String topLevelFqn = packagePath + "." + topLevel;

        if (reserved.contains(topLevel)) {
            return packagePath + "." + baseName;
        }
        String bound = bindings.putIfAbsent(topLevel, topLevelFqn);
        if (bound != null && !bound.equals(topLevelFqn)) {
            return packagePath + "." + baseName;
        }
        addImport(topLevelFqn);
        return topLevel + nestedSuffix;
    }

    /**
     * Returns the simple name of a bound top-level class, importing it when needed.
     */
    public String reference(String fullQualifiedName) {
        int lastDot = fullQualifiedName.lastIndexOf('.');
        return reference(fullQualifiedName.substring(0, lastDot), fullQualifiedName.substring(lastDot + 1));
    }

    /**
     * Adds an import for a fully qualified class name.
     * Skips java.lang and the current package.
     */
    public void addImport(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty()) {
            return;
        }

        String packageName = getPackageName(fullQualifiedName);
        if (packageName.equals("java.lang")) {
            return;
        }
        if (packageName.equals(currentPackage)) {
            return;
        }

        imports.add(fullQualifiedName);
    }

    /**
     * Generates import statements as a string.
     */
    public String generateImports() {
        if (imports.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        for (String imp : imports) {
            sb.append("import ").append(imp).append(";\n");
        }
        return sb.toString();
    }

    public Set<String> getImports() {
        return Set.copyOf(imports);
    }

    private static String simpleName(String fullQualifiedName) {
        return fullQualifiedName.substring(fullQualifiedName.lastIndexOf('.') + 1);
    }

    private static String getPackageName(String fullQualifiedName) {
        int lastDot = fullQualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return "";
        }
        return fullQualifiedName.substring(0, lastDot);
    }
}
