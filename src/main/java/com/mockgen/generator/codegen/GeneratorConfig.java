package com.mockgen.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.mockgen.generator.codegen.model.request.ExtractionRequest;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one generation run.
 */
@Data
@Builder(toBuilder = true)
public class GeneratorConfig {
    private ExtractionRequest request;

    /** Single destination file; only valid when exactly one interface is extracted. */
    private Path outputFile;
    private Path outputDir;

    /** Package of the generated mocks; null keeps each interface's own package. */
    private String packageName;
    private String selfPackage;

    private boolean debug;
    private boolean useSyntacticBackend;

    private boolean generateMatchers;
    private Path matchersDir;
    private String matchersPackage;

    @Builder.Default
    private List<Path> classpath = List.of();
    @Builder.Default
    private List<Path> sourceRoots = List.of();

    @Builder.Default
    private Path workingDirectory = Path.of(".");
}
