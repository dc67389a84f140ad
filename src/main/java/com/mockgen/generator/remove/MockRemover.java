package com.mockgen.generator.remove;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.codegen.generator.GeneratedFileMarker;

/**
 * Deletes generated files, recognised by the marker on their first line.
 * Hand-written files are never touched.
 */
public class MockRemover {
    private static final Logger log = LoggerFactory.getLogger(MockRemover.class);

    private final PrintWriter out;
    private final BufferedReader in;
    private final FileDeleter deleter;

    public MockRemover(PrintWriter out, BufferedReader in, FileDeleter deleter) {
        this.out = out;
        this.in = in;
        this.deleter = deleter;
    }

    /**
     * @return the files deleted, or in dry-run mode the files that would be deleted
     */
    public List<Path> remove(RemoveOptions options) throws IOException {
        List<Path> affected = new ArrayList<>();
        for (Path file : findGeneratedFiles(options.getRoot(), options.isRecursive())) {
            if (options.isDryRun()) {
                print(options, "Would delete " + file);
                affected.add(file);
                continue;
            }
            if (options.isInteractive() && !confirm(file)) {
                print(options, "Skipped " + file);
                continue;
            }
            deleter.delete(file);
            log.debug("Deleted {}", file);
            print(options, "Deleted " + file);
            affected.add(file);
        }
        return affected;
    }

    /**
     * Generated {@code .java} files below the root, in path order. A file root is checked on its own.
     */
    public List<Path> findGeneratedFiles(Path root, boolean recursive) throws IOException {
        if (Files.isRegularFile(root)) {
            return isGenerated(root) ? List.of(root) : List.of();
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("No such file or directory: " + root);
        }
        List<Path> result = new ArrayList<>();
        try (Stream<Path> files = recursive ? Files.walk(root) : Files.list(root)) {
            for (Path file : (Iterable<Path>) files.sorted()::iterator) {
                if (Files.isRegularFile(file) && isGenerated(file)) {
                    result.add(file);
                }
            }
        }
        return result;
    }

    static boolean isGenerated(Path file) throws IOException {
        if (!file.getFileName().toString().endsWith(".java")) {
            return false;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return GeneratedFileMarker.isMarker(reader.readLine());
        } catch (MalformedInputException e) {
            log.debug("Skipping {}: not UTF-8", file);
            return false;
        }
    }

    private boolean confirm(Path file) throws IOException {
        out.print("Delete " + file + "? [y/N] ");
        out.flush();
        String answer = in.readLine();
        return answer != null && (answer.strip().equalsIgnoreCase("y") || answer.strip().equalsIgnoreCase("yes"));
    }

    private void print(RemoveOptions options, String message) {
        if (!options.isSilent()) {
            out.println(message);
            out.flush();
        }
    }
}
