package com.mockgen.generator.codegen.model.output;

import java.nio.file.Path;
import java.util.Set;

import com.mockgen.generator.codegen.model.TypeRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A rendered mock, together with the parameter types it references (input to matcher generation).
 */
@Value
@Builder
public class GeneratedArtifact {

    @NonNull
    Path destinationPath;

    @NonNull
    String packageName;

    @NonNull
    String className;

    @NonNull
    String sourceText;

    /** Matcher types of all parameters, in first-reference order. */
    @NonNull
    Set<TypeRef> referencedTypes;

    public GeneratedFile toGeneratedFile() {
        return GeneratedFile.builder().path(destinationPath).contents(sourceText).type(GeneratedFileType.MOCK).build();
    }
}
