package com.mockgen.generator.codegen.util;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import javax.lang.model.SourceVersion;

import com.mockgen.generator.codegen.model.TypeRef;

/**
 * Utility for consistent Java naming conventions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Upper-cases the first character: {@code show} becomes {@code Show}.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * Name stem of the matcher class for a type.
     * {@code List<Widget>} gives {@code ListOfWidget}, {@code Map<String, Widget>} gives
     * {@code MapOfStringAndWidget}, {@code Widget[]} gives {@code WidgetArray}.
     */
    public static String matcherStem(TypeRef type) {
        return matcherStem(type, false);
    }

    /**
     * Like {@link #matcherStem(TypeRef)}, with each class name prefixed by its package:
     * {@code com.acme.Widget} gives {@code ComAcmeWidget}.
     */
    public static String qualifiedMatcherStem(TypeRef type) {
        return matcherStem(type, true);
    }

    private static String matcherStem(TypeRef type, boolean qualified) {
        switch (type.getKind()) {
            case PRIMITIVE:
                return toPascalCase(type.getBaseName());
            case ARRAY:
                return matcherStem(type.getComponentType(), qualified) + "Array";
            case WILDCARD:
                return type.getWildcardBound() == null ? "Any" : matcherStem(type.getWildcardBound(), qualified);
            case TYPE_VARIABLE:
                return toPascalCase(type.getBaseName());
            default:
                String base = type.getBaseName().replace(".", "");
                if (qualified && !type.getPackagePath().isEmpty()) {
                    base = Arrays.stream(type.getPackagePath().split("\\."))
                            .map(NamingUtil::toPascalCase)
                            .collect(Collectors.joining()) + base;
                }
                if (type.getTypeArguments().isEmpty()) {
                    return base;
                }
                return base + "Of" + type.getTypeArguments().stream()
                        .map(argument -> matcherStem(argument, qualified))
                        .collect(Collectors.joining("And"));
        }
    }

    /**
     * Disambiguates a class name by appending a numeric suffix.
     */
    public static String disambiguateClassName(String baseName, Set<String> usedNames) {
        if (!usedNames.contains(baseName)) {
            return baseName;
        }

        int suffix = 2;
        String candidate;
        do {
            candidate = baseName + suffix;
            suffix++;
        } while (usedNames.contains(candidate));

        return candidate;
    }

    /**
     * Turns a directory name into a legal package segment: {@code my-service} becomes {@code my_service}.
     */
    public static String sanitizeIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean valid = i == 0 ? Character.isJavaIdentifierStart(c) : Character.isJavaIdentifierPart(c);
            if (valid) {
                sb.append(c);
            } else if (i == 0 && Character.isJavaIdentifierPart(c)) {
                sb.append('_').append(c);
            } else {
                sb.append('_');
            }
        }
        String result = sb.toString();
        return SourceVersion.isKeyword(result) ? result + "_" : result;
    }

    /**
     * Appends underscores to a parameter name until it is neither a keyword nor a reserved local name.
     */
    public static String safeParameterName(String name, Set<String> reservedNames) {
        String candidate = name;
        while (SourceVersion.isKeyword(candidate) || reservedNames.contains(candidate)) {
            candidate = candidate + "_";
        }
        return candidate;
    }
}
