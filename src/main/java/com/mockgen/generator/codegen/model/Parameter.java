package com.mockgen.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A method parameter. The name is the declared one (source extraction) or a synthesized one (reflection).
 */
@Value
@Builder(toBuilder = true)
public class Parameter {

    @NonNull
    String name;

    @NonNull
    TypeRef type;

    public static Parameter of(String name, TypeRef type) {
        return Parameter.builder().name(name).type(type).build();
    }
}
