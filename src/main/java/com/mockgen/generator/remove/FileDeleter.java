package com.mockgen.generator.remove;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Deletes one file.
 */
@FunctionalInterface
public interface FileDeleter {

    FileDeleter DEFAULT = Files::delete;

    void delete(Path file) throws IOException;
}
