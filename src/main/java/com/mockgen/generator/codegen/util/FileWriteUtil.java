package com.mockgen.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     * The content goes to a temporary sibling first and is then moved over the target,
     * so readers never observe a partially written file.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path parentDir = target.getParent();
        Files.createDirectories(parentDir);

        Path temp = Files.createTempFile(parentDir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Writes the content unless the file already holds exactly this content.
     *
     * @return true if the file was written
     */
    public static boolean writeIfChanged(Path filePath, String content) throws IOException {
        if (Files.isRegularFile(filePath)
                && Files.readString(filePath, StandardCharsets.UTF_8).equals(content)) {
            return false;
        }
        safeWriteString(filePath, content);
        return true;
    }
}
