package com.mockgen.generator.codegen.model.request;

import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;

/**
 * A single {@code .java} file declaring the interface to mock.
 */
@Value
public class SourceFileRequest implements ExtractionRequest {

    @NonNull
    Path sourceFile;

    public String getFileStem() {
        String fileName = sourceFile.getFileName().toString();
        return fileName.endsWith(".java") ? fileName.substring(0, fileName.length() - ".java".length()) : fileName;
    }

    @Override
    public String describe() {
        return sourceFile.toString();
    }
}
