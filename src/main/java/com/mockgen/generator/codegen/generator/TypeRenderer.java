package com.mockgen.generator.codegen.generator;

import java.util.List;
import java.util.stream.Collectors;

import com.mockgen.generator.codegen.model.TypeParameter;
import com.mockgen.generator.codegen.model.TypeRef;
import com.mockgen.generator.codegen.util.ImportManager;

/**
 * Renders {@link TypeRef}s as Java source, registering the imports they need.
 */
class TypeRenderer {

    private final ImportManager importManager;

    TypeRenderer(ImportManager importManager) {
        this.importManager = importManager;
    }

    /**
     * Source form usable anywhere a type is expected; varargs arrays render as {@code []}.
     */
    String render(TypeRef type) {
        switch (type.getKind()) {
            case PRIMITIVE:
            case TYPE_VARIABLE:
                return type.getBaseName();
            case ARRAY:
                return render(type.getComponentType()) + "[]";
            case WILDCARD:
                if (type.getWildcardBound() == null) {
                    return "?";
                }
                return (type.isWildcardSuper() ? "? super " : "? extends ") + render(type.getWildcardBound());
            default:
                String name = importManager.reference(type.getPackagePath(), type.getBaseName());
                if (type.getTypeArguments().isEmpty()) {
                    return name;
                }
                return name + type.getTypeArguments().stream().map(this::render).collect(Collectors.joining(", ", "<", ">"));
        }
    }

    /**
     * Source form of a parameter's declared type; the varargs parameter renders with {@code ...}.
     */
    String renderParameter(TypeRef type) {
        if (type.isVariadic()) {
            return render(type.getComponentType()) + "...";
        }
        return render(type);
    }

    String renderBoxed(TypeRef type) {
        return render(type.boxed());
    }

    /**
     * Declaration form: {@code <K extends Comparable<K>, V>}, or "" when there are none.
     */
    String renderTypeParameters(List<TypeParameter> typeParameters) {
        if (typeParameters.isEmpty()) {
            return "";
        }
        return typeParameters.stream().map(this::renderTypeParameter).collect(Collectors.joining(", ", "<", ">"));
    }

    /**
     * Usage form: {@code <K, V>}, or "" when there are none.
     */
    String renderTypeArguments(List<TypeParameter> typeParameters) {
        if (typeParameters.isEmpty()) {
            return "";
        }
        return typeParameters.stream().map(TypeParameter::getName).collect(Collectors.joining(", ", "<", ">"));
    }

    private String renderTypeParameter(TypeParameter typeParameter) {
        if (typeParameter.getBounds().isEmpty()) {
            return typeParameter.getName();
        }
        return typeParameter.getName() + " extends "
                + typeParameter.getBounds().stream().map(this::render).collect(Collectors.joining(" & "));
    }
}
