package com.mockgen.generator.codegen.extract;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.List;

import com.mockgen.generator.codegen.exception.ExtractionException;
import com.mockgen.generator.codegen.model.TypeParameter;
import com.mockgen.generator.codegen.model.TypeRef;

/**
 * Maps {@code java.lang.reflect} types onto {@link TypeRef}s.
 */
class ReflectionTypeMapper {

    TypeRef map(Type type) {
        if (type instanceof Class<?> cls) {
            if (cls.isPrimitive()) {
                return TypeRef.primitive(cls.getName());
            }
            if (cls.isArray()) {
                return TypeRef.array(map(cls.getComponentType()));
            }
            return TypeRef.classType(cls.getPackageName(), nestedName(cls));
        }
        if (type instanceof ParameterizedType parameterized) {
            Class<?> raw = (Class<?>) parameterized.getRawType();
            List<TypeRef> arguments = new ArrayList<>();
            for (Type argument : parameterized.getActualTypeArguments()) {
                arguments.add(map(argument));
            }
            return TypeRef.classType(raw.getPackageName(), nestedName(raw), arguments);
        }
        if (type instanceof GenericArrayType genericArray) {
            return TypeRef.array(map(genericArray.getGenericComponentType()));
        }
        if (type instanceof TypeVariable<?> variable) {
            return TypeRef.typeVariable(variable.getName());
        }
        if (type instanceof WildcardType wildcard) {
            if (wildcard.getLowerBounds().length > 0) {
                return TypeRef.superWildcard(map(wildcard.getLowerBounds()[0]));
            }
            Type[] upper = wildcard.getUpperBounds();
            if (upper.length == 0 || upper[0] == Object.class) {
                return TypeRef.wildcard();
            }
            return TypeRef.extendsWildcard(map(upper[0]));
        }
        throw new ExtractionException("Unsupported reflected type: " + type.getTypeName());
    }

    List<TypeParameter> mapTypeParameters(TypeVariable<?>[] variables) {
        List<TypeParameter> parameters = new ArrayList<>(variables.length);
        for (TypeVariable<?> variable : variables) {
            List<TypeRef> bounds = new ArrayList<>();
            for (Type bound : variable.getBounds()) {
                if (bound != Object.class) {
                    bounds.add(map(bound));
                }
            }
            parameters.add(TypeParameter.of(variable.getName(), bounds));
        }
        return parameters;
    }

    private static String nestedName(Class<?> cls) {
        Class<?> enclosing = cls.getEnclosingClass();
        if (enclosing == null) {
            return cls.getSimpleName();
        }
        return nestedName(enclosing) + "." + cls.getSimpleName();
    }
}
