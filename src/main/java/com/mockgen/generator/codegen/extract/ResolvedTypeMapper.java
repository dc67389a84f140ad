package com.mockgen.generator.codegen.extract;

import java.util.ArrayList;
import java.util.List;

import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedTypeParameterDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.resolution.types.ResolvedWildcard;
import com.mockgen.generator.codegen.exception.ExtractionException;
import com.mockgen.generator.codegen.model.TypeParameter;
import com.mockgen.generator.codegen.model.TypeRef;

/**
 * Maps symbol-solver types onto {@link TypeRef}s.
 */
class ResolvedTypeMapper {

    TypeRef map(ResolvedType type) {
        if (type.isPrimitive()) {
            return TypeRef.primitive(type.asPrimitive().describe());
        }
        if (type.isArray()) {
            return TypeRef.array(map(type.asArrayType().getComponentType()));
        }
        if (type.isTypeVariable()) {
            return TypeRef.typeVariable(type.asTypeParameter().getName());
        }
        if (type.isWildcard()) {
            ResolvedWildcard wildcard = type.asWildcard();
            if (!wildcard.isBounded()) {
                return TypeRef.wildcard();
            }
            TypeRef bound = map(wildcard.getBoundedType());
            return wildcard.isSuper() ? TypeRef.superWildcard(bound) : TypeRef.extendsWildcard(bound);
        }
        if (type.isReferenceType()) {
            return mapReference(type.asReferenceType());
        }
        throw new ExtractionException("Unsupported type in interface signature: " + type.describe());
    }

    TypeRef mapReference(ResolvedReferenceType reference) {
        ResolvedReferenceTypeDeclaration declaration = reference.getTypeDeclaration()
                .orElseThrow(() -> new ExtractionException("Unresolved type: " + reference.describe()));
        List<TypeRef> arguments = new ArrayList<>();
        if (!reference.isRawType()) {
            for (ResolvedType argument : reference.typeParametersValues()) {
                arguments.add(map(argument));
            }
        }
        return TypeRef.classType(declaration.getPackageName(), declaration.getClassName(), arguments);
    }

    TypeParameter mapTypeParameter(ResolvedTypeParameterDeclaration declaration) {
        List<TypeRef> bounds = new ArrayList<>();
        for (ResolvedTypeParameterDeclaration.Bound bound : declaration.getBounds()) {
            if (bound.isExtends()) {
                TypeRef mapped = map(bound.getType());
                if (!isObject(mapped)) {
                    bounds.add(mapped);
                }
            }
        }
        return TypeParameter.of(declaration.getName(), bounds);
    }

    static boolean isObject(TypeRef type) {
        return type.getTypeArguments().isEmpty() && "java.lang.Object".equals(type.getQualifiedName());
    }
}
