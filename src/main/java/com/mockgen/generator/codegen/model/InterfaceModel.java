package com.mockgen.generator.codegen.model;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.mockgen.generator.codegen.exception.ExtractionException;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Backend-agnostic description of an interface's method set, in a stable order.
 */
@Value
@Builder(toBuilder = true)
public class InterfaceModel {

    /** Name below the package; nested interfaces use dots ("Outer.Inner"). */
    @NonNull
    String interfaceName;

    @NonNull
    @Builder.Default
    String sourcePackage = "";

    @Singular
    List<TypeParameter> typeParameters;

    @Singular
    List<MethodSignature> methods;

    public String getQualifiedName() {
        return sourcePackage.isEmpty() ? interfaceName : sourcePackage + "." + interfaceName;
    }

    public String getSimpleName() {
        return interfaceName.substring(interfaceName.lastIndexOf('.') + 1);
    }

    /**
     * The interface as a type, parameterized by its own type variables.
     */
    public TypeRef asTypeRef() {
        return TypeRef.classType(sourcePackage, interfaceName,
                typeParameters.stream().map(tp -> TypeRef.typeVariable(tp.getName())).toList());
    }

    public Optional<MethodSignature> findMethod(String name) {
        return methods.stream().filter(m -> m.getName().equals(name)).findFirst();
    }

    /**
     * Checks unique method names and every method's signature rules.
     */
    public InterfaceModel validate() {
        Set<String> names = new HashSet<>();
        for (MethodSignature method : methods) {
            if (!names.add(method.getName())) {
                throw new ExtractionException("Interface " + getQualifiedName()
                        + " declares method '" + method.getName() + "' more than once");
            }
            method.validate();
        }
        return this;
    }

    /**
     * Equal in everything but parameter names and method order.
     */
    public boolean isStructurallyEquivalent(InterfaceModel other) {
        if (!getQualifiedName().equals(other.getQualifiedName())
                || !typeParameters.equals(other.typeParameters)
                || methods.size() != other.methods.size()) {
            return false;
        }
        Map<String, MethodSignature> byName = new HashMap<>();
        other.methods.forEach(m -> byName.put(m.getName(), m));
        for (MethodSignature method : methods) {
            MethodSignature counterpart = byName.get(method.getName());
            if (counterpart == null || !method.hasSameShape(counterpart)) {
                return false;
            }
        }
        return true;
    }
}
