package com.mockgen.generator.codegen.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mockgen.generator.codegen.exception.ExtractionException;
import com.mockgen.generator.codegen.model.MethodSignature;

/**
 * Flattens an interface and its super-interfaces into one method set.
 *
 * Methods must be offered most-derived first. A later method with the same name and parameter
 * types is the same method (inherited or overridden) and is dropped; the same name with different
 * parameter types is a collision.
 */
class MethodSetCollector {

    private final String interfaceName;
    private final Map<String, MethodSignature> methods = new LinkedHashMap<>();
    private final Map<String, String> declaringTypes = new LinkedHashMap<>();

    MethodSetCollector(String interfaceName) {
        this.interfaceName = interfaceName;
    }

    void add(MethodSignature method, String declaringType) {
        MethodSignature existing = methods.get(method.getName());
        if (existing == null) {
            methods.put(method.getName(), method.validate());
            declaringTypes.put(method.getName(), declaringType);
            return;
        }
        if (existing.getParameterTypes().equals(method.getParameterTypes())) {
            return;
        }
        throw new ExtractionException("Method name collision in " + interfaceName + ": '" + method.getName()
                + "' is declared by " + declaringTypes.get(method.getName()) + " and " + declaringType
                + " with different parameters; overloaded methods cannot be mocked");
    }

    List<MethodSignature> methods() {
        return new ArrayList<>(methods.values());
    }
}
