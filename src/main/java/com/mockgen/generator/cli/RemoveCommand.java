package com.mockgen.generator.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.remove.FileDeleter;
import com.mockgen.generator.remove.MockRemover;
import com.mockgen.generator.remove.RemoveOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command deleting generated mocks and matchers.
 */
@Command(
        name = "remove",
        mixinStandardHelpOptions = true,
        description = "Removes generated files. Only files starting with the mockgen marker are considered."
)
public class RemoveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RemoveCommand.class);

    @Parameters(arity = "0..1", paramLabel = "PATH", description = "File or directory (default: current directory)")
    private Path path;

    @Option(names = { "--recursive", "-r" }, description = "Include subdirectories")
    private boolean recursive;

    @Option(names = { "--non-interactive", "-n" }, description = "Delete without asking")
    private boolean nonInteractive;

    @Option(names = { "--dry-run", "-d" }, description = "Only report what would be deleted")
    private boolean dryRun;

    @Option(names = { "--silent", "-s" }, description = "Print nothing")
    private boolean silent;

    @Override
    public Integer call() {
        RemoveOptions options = RemoveOptions.builder()
                .root(path == null ? Path.of("").toAbsolutePath() : path)
                .recursive(recursive)
                .interactive(!nonInteractive)
                .dryRun(dryRun)
                .silent(silent)
                .build();

        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            List<Path> affected = new MockRemover(out, in, FileDeleter.DEFAULT).remove(options);
            log.debug("{} file(s) {}", affected.size(), dryRun ? "would be deleted" : "deleted");
            return 0;
        } catch (IOException e) {
            log.error("Remove failed: {}", e.getMessage());
            return 1;
        }
    }
}
