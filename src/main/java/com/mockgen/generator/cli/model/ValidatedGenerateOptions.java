package com.mockgen.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.mockgen.generator.codegen.model.request.ExtractionRequest;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    ExtractionRequest request;
    Path outputFile;
    Path outputDir;
    String packageName;
    List<Path> classpath;
    Path workingDirectory;
}
