package com.mockgen.generator.codegen.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.mockgen.generator.codegen.exception.SignatureConstraintException;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Describes the type of a parameter, result, bound or type argument.
 *
 * Immutable; equality is structural. Generic type arguments, array components and
 * wildcard bounds are nested {@code TypeRef}s.
 */
@Value
@Builder(toBuilder = true)
public class TypeRef {

    private static final Map<String, String> BOXES = Map.of(
            "boolean", "Boolean",
            "byte", "Byte",
            "short", "Short",
            "char", "Character",
            "int", "Integer",
            "long", "Long",
            "float", "Float",
            "double", "Double");

    private static final Set<String> BUILT_IN_CLASSES = Set.of(
            "java.lang.Boolean", "java.lang.Byte", "java.lang.Short", "java.lang.Character",
            "java.lang.Integer", "java.lang.Long", "java.lang.Float", "java.lang.Double",
            "java.lang.String", "java.lang.Object", "java.lang.Void");

    @NonNull
    TypeKind kind;

    /**
     * Primitive keyword, class name below its package ("Map.Entry" for nested classes),
     * type variable name, "?" for wildcards, "" for arrays.
     */
    @NonNull
    String baseName;

    @NonNull
    @Builder.Default
    String packagePath = "";

    @Singular
    List<TypeRef> typeArguments;

    /** Element type of an array. */
    TypeRef componentType;

    /** Bound of a wildcard; null for an unbounded {@code ?}. */
    TypeRef wildcardBound;

    boolean wildcardSuper;

    /** True only for the trailing array parameter of a varargs method. */
    boolean variadic;

    public static TypeRef primitive(String keyword) {
        if (!BOXES.containsKey(keyword)) {
            throw new IllegalArgumentException("Not a primitive type: " + keyword);
        }
        return TypeRef.builder().kind(TypeKind.PRIMITIVE).baseName(keyword).build();
    }

    public static TypeRef classType(String packagePath, String baseName, TypeRef... typeArguments) {
        return classType(packagePath, baseName, List.of(typeArguments));
    }

    public static TypeRef classType(String packagePath, String baseName, List<TypeRef> typeArguments) {
        return TypeRef.builder()
                .kind(TypeKind.CLASS)
                .packagePath(packagePath == null ? "" : packagePath)
                .baseName(baseName)
                .typeArguments(typeArguments)
                .build();
    }

    public static TypeRef array(TypeRef componentType) {
        return TypeRef.builder().kind(TypeKind.ARRAY).baseName("").componentType(componentType).build();
    }

    public static TypeRef typeVariable(String name) {
        return TypeRef.builder().kind(TypeKind.TYPE_VARIABLE).baseName(name).build();
    }

    public static TypeRef wildcard() {
        return TypeRef.builder().kind(TypeKind.WILDCARD).baseName("?").build();
    }

    public static TypeRef extendsWildcard(TypeRef bound) {
        return TypeRef.builder().kind(TypeKind.WILDCARD).baseName("?").wildcardBound(bound).build();
    }

    public static TypeRef superWildcard(TypeRef bound) {
        return TypeRef.builder().kind(TypeKind.WILDCARD).baseName("?").wildcardBound(bound).wildcardSuper(true).build();
    }

    /**
     * Marks this array type as the varargs parameter type.
     */
    public TypeRef asVariadic() {
        if (kind != TypeKind.ARRAY) {
            throw new SignatureConstraintException("Only array types can be variadic, got " + getCanonicalName());
        }
        return toBuilder().variadic(true).build();
    }

    public boolean isPrimitive() {
        return kind == TypeKind.PRIMITIVE;
    }

    public String getQualifiedName() {
        return packagePath.isEmpty() ? baseName : packagePath + "." + baseName;
    }

    public String getTopLevelName() {
        int dot = baseName.indexOf('.');
        return dot < 0 ? baseName : baseName.substring(0, dot);
    }

    public String getSimpleName() {
        return baseName.substring(baseName.lastIndexOf('.') + 1);
    }

    /**
     * The reference type used where a primitive cannot appear (generic arguments, matchers).
     */
    public TypeRef boxed() {
        if (kind != TypeKind.PRIMITIVE) {
            return this;
        }
        return classType("java.lang", BOXES.get(baseName));
    }

    /**
     * The type a matcher for this parameter works on: the recorded sequence for varargs, the type itself otherwise.
     */
    public TypeRef matcherType() {
        if (!variadic) {
            return this;
        }
        return classType("java.util", "List", componentType.boxed());
    }

    /**
     * Primitives, their boxes, {@code String}, {@code Object} and {@code Void}.
     */
    public boolean isBuiltIn() {
        if (kind == TypeKind.PRIMITIVE) {
            return true;
        }
        return kind == TypeKind.CLASS && typeArguments.isEmpty() && BUILT_IN_CLASSES.contains(getQualifiedName());
    }

    public boolean containsTypeVariable() {
        switch (kind) {
            case TYPE_VARIABLE:
                return true;
            case ARRAY:
                return componentType.containsTypeVariable();
            case WILDCARD:
                return wildcardBound != null && wildcardBound.containsTypeVariable();
            case CLASS:
                return typeArguments.stream().anyMatch(TypeRef::containsTypeVariable);
            default:
                return false;
        }
    }

    /**
     * Replaces type variables by the given bindings. Unbound variables stay as they are.
     */
    public TypeRef substitute(Map<String, TypeRef> bindings) {
        if (bindings.isEmpty()) {
            return this;
        }
        switch (kind) {
            case TYPE_VARIABLE:
                return bindings.getOrDefault(baseName, this);
            case ARRAY:
                return toBuilder().componentType(componentType.substitute(bindings)).build();
            case WILDCARD:
                return wildcardBound == null ? this : toBuilder().wildcardBound(wildcardBound.substitute(bindings)).build();
            case CLASS:
                List<TypeRef> arguments = new ArrayList<>(typeArguments.size());
                for (TypeRef argument : typeArguments) {
                    arguments.add(argument.substitute(bindings));
                }
                return toBuilder().clearTypeArguments().typeArguments(arguments).build();
            default:
                return this;
        }
    }

    /**
     * Fully qualified source form, e.g. {@code java.util.Map<java.lang.String, com.acme.Widget[]>}.
     */
    public String getCanonicalName() {
        switch (kind) {
            case ARRAY:
                return componentType.getCanonicalName() + (variadic ? "..." : "[]");
            case WILDCARD:
                if (wildcardBound == null) {
                    return "?";
                }
                return (wildcardSuper ? "? super " : "? extends ") + wildcardBound.getCanonicalName();
            case CLASS:
                if (typeArguments.isEmpty()) {
                    return getQualifiedName();
                }
                StringBuilder sb = new StringBuilder(getQualifiedName()).append('<');
                for (int i = 0; i < typeArguments.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(typeArguments.get(i).getCanonicalName());
                }
                return sb.append('>').toString();
            default:
                return baseName;
        }
    }

    @Override
    public String toString() {
        return getCanonicalName();
    }
}
