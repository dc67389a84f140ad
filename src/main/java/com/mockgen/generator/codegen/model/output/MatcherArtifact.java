package com.mockgen.generator.codegen.model.output;

import java.nio.file.Path;

import com.mockgen.generator.codegen.model.TypeRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A rendered matcher class for one non-built-in type.
 */
@Value
@Builder
public class MatcherArtifact {

    @NonNull
    TypeRef typeRef;

    @NonNull
    String className;

    @NonNull
    Path destinationPath;

    @NonNull
    String sourceText;

    public GeneratedFile toGeneratedFile() {
        return GeneratedFile.builder().path(destinationPath).contents(sourceText).type(GeneratedFileType.MATCHER).build();
    }
}
