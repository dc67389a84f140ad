package com.mockgen.generator.cli;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.codegen.GeneratorConfig;
import com.mockgen.generator.codegen.MockGenerator;
import com.mockgen.generator.watch.InterfaceListFile;
import com.mockgen.generator.watch.MockFileWatcher;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command that keeps mocks in sync with the interfaces listed in each directory's
 * {@value InterfaceListFile#FILE_NAME} file until the process is interrupted.
 */
@Command(
        name = "watch",
        mixinStandardHelpOptions = true,
        description = "Regenerates mocks whenever a listed interface changes."
)
public class WatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WatchCommand.class);

    @Parameters(paramLabel = "DIR", description = "Directories to watch (default: current directory)")
    private List<Path> directories = new ArrayList<>();

    @Option(names = { "--recursive", "-r" }, description = "Also watch subdirectories that have an interface list")
    private boolean recursive;

    @Option(names = { "--interval-ms" }, defaultValue = "2000", description = "Polling interval in milliseconds (default: 2000)")
    private long intervalMillis;

    @Option(names = { "--generate-matchers", "-m" }, description = "Generate argument matchers next to each mock")
    private boolean generateMatchers;

    @Option(names = { "--classpath", "-cp" }, description = "Class directories and jars for resolving referenced types")
    private String classpath;

    @Option(names = { "--source-root", "-s" }, description = "Source root for resolving referenced types (repeatable)")
    private List<Path> sourceRoots = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        List<Path> targets = directories.isEmpty() ? List.of(Path.of("")) : directories;
        targets = targets.stream().map(p -> p.toAbsolutePath().normalize()).toList();
        for (Path target : targets) {
            if (!Files.isDirectory(target)) {
                log.error("Not a directory: {}", target);
                return 1;
            }
        }
        if (intervalMillis <= 0) {
            log.error("--interval-ms must be positive. Got: {}", intervalMillis);
            return 1;
        }

        GeneratorConfig baseConfig = GeneratorConfig.builder()
                .generateMatchers(generateMatchers)
                .classpath(parseClasspath())
                .sourceRoots(sourceRoots.stream().map(Path::toAbsolutePath).toList())
                .build();
        MockFileWatcher watcher = new MockFileWatcher(targets, recursive, Duration.ofMillis(intervalMillis), baseConfig,
                config -> new MockGenerator(config).generate());

        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                watcher.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        }, "mockgen-shutdown"));

        watcher.start();
        done.await();
        return 0;
    }

    private List<Path> parseClasspath() {
        if (classpath == null || classpath.isBlank()) {
            return List.of();
        }
        return Arrays.stream(classpath.split(File.pathSeparator)).map(String::trim).filter(s -> !s.isEmpty())
                .map(Path::of).toList();
    }
}
