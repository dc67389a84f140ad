package com.mockgen.generator.codegen.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.mockgen.generator.codegen.exception.SignatureConstraintException;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One method of an interface's method set.
 */
@Value
@Builder(toBuilder = true)
public class MethodSignature {

    @NonNull
    String name;

    @Singular
    List<TypeParameter> typeParameters;

    @Singular
    List<Parameter> params;

    /** Declared results in order; empty for {@code void}. */
    @Singular
    List<TypeRef> results;

    @Singular
    List<TypeRef> thrownTypes;

    public boolean isVariadic() {
        return !params.isEmpty() && params.get(params.size() - 1).getType().isVariadic();
    }

    public boolean isVoid() {
        return results.isEmpty();
    }

    public List<TypeRef> getParameterTypes() {
        return params.stream().map(Parameter::getType).toList();
    }

    /**
     * Rejects malformed signatures: a variadic parameter must be the only one and the last one,
     * and must be an array.
     *
     * @throws SignatureConstraintException if a rule is broken
     */
    public MethodSignature validate() {
        for (int i = 0; i < params.size(); i++) {
            TypeRef type = params.get(i).getType();
            if (!type.isVariadic()) {
                continue;
            }
            if (i != params.size() - 1) {
                throw new SignatureConstraintException("Method " + name + ": variadic parameter '"
                        + params.get(i).getName() + "' must be the last parameter");
            }
            if (type.getKind() != TypeKind.ARRAY) {
                throw new SignatureConstraintException("Method " + name + ": variadic parameter '"
                        + params.get(i).getName() + "' must have an array type");
            }
        }
        return this;
    }

    /**
     * Applies type-variable bindings from a parameterized super-interface. The method's own
     * type parameters shadow bindings of the same name.
     */
    public MethodSignature substitute(Map<String, TypeRef> bindings) {
        if (bindings.isEmpty()) {
            return this;
        }
        Map<String, TypeRef> effective = new HashMap<>(bindings);
        typeParameters.forEach(tp -> effective.remove(tp.getName()));
        if (effective.isEmpty()) {
            return this;
        }
        return toBuilder()
                .clearTypeParameters()
                .typeParameters(typeParameters.stream().map(tp -> tp.substitute(effective)).toList())
                .clearParams()
                .params(params.stream().map(p -> p.toBuilder().type(p.getType().substitute(effective)).build()).toList())
                .clearResults()
                .results(results.stream().map(r -> r.substitute(effective)).toList())
                .clearThrownTypes()
                .thrownTypes(thrownTypes.stream().map(t -> t.substitute(effective)).toList())
                .build();
    }

    /**
     * Same signature ignoring parameter names.
     */
    public boolean hasSameShape(MethodSignature other) {
        return name.equals(other.name)
                && typeParameters.equals(other.typeParameters)
                && getParameterTypes().equals(other.getParameterTypes())
                && results.equals(other.results)
                && thrownTypes.equals(other.thrownTypes);
    }
}
