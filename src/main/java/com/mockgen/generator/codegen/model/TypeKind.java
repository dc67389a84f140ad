package com.mockgen.generator.codegen.model;

/**
 * Structural category of a {@link TypeRef}.
 */
public enum TypeKind {
    PRIMITIVE,
    CLASS,
    ARRAY,
    TYPE_VARIABLE,
    WILDCARD
}
