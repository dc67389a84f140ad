package com.mockgen.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    private int interfacesProcessed;
    @Builder.Default
    private List<Path> mockFiles = List.of();
    @Builder.Default
    private List<Path> matcherFiles = List.of();

    /** Files whose content changed; an unchanged interface leaves its mock untouched. */
    private int filesWritten;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
