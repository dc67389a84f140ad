package com.mockgen.generator.codegen.model.output;

/**
 * Categories of generated artifacts.
 */
public enum GeneratedFileType {
    MOCK,
    MATCHER
}
