package com.mockgen.generator.codegen.model.request;

/**
 * What to extract: a package plus interface names, or a single source file.
 */
public interface ExtractionRequest {

    /**
     * Short human-readable form for logs and error messages.
     */
    String describe();
}
