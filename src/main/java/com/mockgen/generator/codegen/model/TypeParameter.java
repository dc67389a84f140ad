package com.mockgen.generator.codegen.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A type parameter of a generic interface or method, e.g. {@code T extends Comparable<T>}.
 */
@Value
@Builder(toBuilder = true)
public class TypeParameter {

    @NonNull
    String name;

    @Singular
    List<TypeRef> bounds;

    public static TypeParameter of(String name, List<TypeRef> bounds) {
        return TypeParameter.builder().name(name).bounds(bounds).build();
    }

    public TypeParameter substitute(Map<String, TypeRef> bindings) {
        return toBuilder().clearBounds().bounds(bounds.stream().map(b -> b.substitute(bindings)).toList()).build();
    }
}
