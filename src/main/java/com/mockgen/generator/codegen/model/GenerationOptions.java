package com.mockgen.generator.codegen.model;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-mock rendering options.
 */
@Value
@Builder(toBuilder = true)
public class GenerationOptions {

    /** Package declaration of the generated mock; "" for the unnamed package. */
    @NonNull
    String packageName;

    /**
     * Package the mock will be part of. When set it must equal {@link #packageName}; types declared
     * in it are then referenced unqualified instead of imported.
     */
    String selfPackagePath;

    @NonNull
    String mockClassName;

    @NonNull
    Path destinationPath;

    public String getEffectiveSelfPackage() {
        return selfPackagePath == null || selfPackagePath.isBlank() ? packageName : selfPackagePath;
    }
}
