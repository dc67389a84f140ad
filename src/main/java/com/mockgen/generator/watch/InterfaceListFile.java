package com.mockgen.generator.watch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code interfaces_to_mock} file of a watched directory.
 *
 * Each line that is neither blank nor a {@code #} comment names a source file ({@code Display.java})
 * or an interface ({@code Display}) declared in the directory.
 */
public final class InterfaceListFile {
    private static final Logger log = LoggerFactory.getLogger(InterfaceListFile.class);

    public static final String FILE_NAME = "interfaces_to_mock";

    static final String HEADER = "# Interfaces to mock in this directory, one per line.\n"
            + "# Name a source file (Display.java) or an interface (Display) declared here.\n";

    private InterfaceListFile() {
    }

    /**
     * @return true if the file was created
     */
    public static boolean createIfMissing(Path directory) throws IOException {
        Path file = directory.resolve(FILE_NAME);
        if (Files.exists(file)) {
            return false;
        }
        Files.writeString(file, HEADER, StandardCharsets.UTF_8);
        log.info("Created {}", file);
        return true;
    }

    public static boolean exists(Path directory) {
        return Files.isRegularFile(directory.resolve(FILE_NAME));
    }

    /**
     * Source files listed for the directory, in file order; missing list file means none.
     */
    public static List<Path> read(Path directory) throws IOException {
        Path file = directory.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<Path> sources = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String entry = line.strip();
            if (entry.isEmpty() || entry.startsWith("#")) {
                continue;
            }
            sources.add(directory.resolve(entry.endsWith(".java") ? entry : entry + ".java"));
        }
        return sources;
    }
}
