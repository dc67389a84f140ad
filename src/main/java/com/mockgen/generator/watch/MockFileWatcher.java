package com.mockgen.generator.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mockgen.generator.codegen.GeneratorConfig;
import com.mockgen.generator.codegen.GeneratorResult;
import com.mockgen.generator.codegen.destination.DestinationResolver;
import com.mockgen.generator.codegen.model.request.SourceFileRequest;

/**
 * Polls watched directories and regenerates the mocks of listed interfaces whose source changed.
 *
 * Runs for one directory go through a {@link CoalescingRunner}, so they never overlap and a burst
 * of changes costs at most one extra run. A run reads the source as it is when the run starts.
 */
public class MockFileWatcher {
    private static final Logger log = LoggerFactory.getLogger(MockFileWatcher.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);

    private final List<Path> targets;
    private final boolean recursive;
    private final Duration interval;
    private final GeneratorConfig baseConfig;
    private final Function<GeneratorConfig, GeneratorResult> generator;

    private final Map<Path, CoalescingRunner> runners = new ConcurrentHashMap<>();
    private final Map<Path, SourceState> states = new ConcurrentHashMap<>();

    private Executor runExecutor;
    private ExecutorService ownedRunExecutor;
    private ScheduledExecutorService ticker;

    /**
     * @param baseConfig options shared by every run (classpath, source roots, matchers); request,
     *                   destination and package are set per source file
     * @param generator  performs one generation run
     */
    public MockFileWatcher(List<Path> targets, boolean recursive, Duration interval, GeneratorConfig baseConfig,
                           Function<GeneratorConfig, GeneratorResult> generator) {
        this.targets = List.copyOf(targets);
        this.recursive = recursive;
        this.interval = interval;
        this.baseConfig = baseConfig;
        this.generator = generator;
    }

    /**
     * Creates missing {@code interfaces_to_mock} files and starts polling.
     */
    public synchronized void start() throws IOException {
        if (ticker != null) {
            throw new IllegalStateException("Watcher already started");
        }
        for (Path target : targets) {
            InterfaceListFile.createIfMissing(target);
        }
        ownedRunExecutor = Executors.newCachedThreadPool(daemonThreads("mockgen-run"));
        runExecutor = ownedRunExecutor;
        ticker = Executors.newSingleThreadScheduledExecutor(daemonThreads("mockgen-watch"));
        ticker.scheduleWithFixedDelay(this::safeUpdate, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Watching {} (recursive: {}, every {} ms)", targets, recursive, interval.toMillis());
    }

    /**
     * Stops polling. A run already in progress is allowed to finish.
     */
    public synchronized void stop() throws InterruptedException {
        if (ticker == null) {
            return;
        }
        ticker.shutdownNow();
        ticker.awaitTermination(1, TimeUnit.MINUTES);
        ownedRunExecutor.shutdown();
        if (!ownedRunExecutor.awaitTermination(1, TimeUnit.MINUTES)) {
            log.warn("Generation runs still active after one minute");
        }
        ticker = null;
        log.info("Stopped watching {}", targets);
    }

    /**
     * One polling tick: triggers a run for every directory holding a listed source whose content
     * changed or whose mock is missing. Runs on the given executor; {@link #start()} uses its own.
     */
    public void update(Executor executor) throws IOException {
        for (Path directory : watchedDirectories()) {
            if (hasPendingChanges(directory)) {
                runners.computeIfAbsent(directory,
                        dir -> new CoalescingRunner(dir.toString(), executor, () -> regenerate(dir))).trigger();
            }
        }
    }

    private void safeUpdate() {
        try {
            update(runExecutor);
        } catch (IOException | RuntimeException e) {
            log.error("Watch tick failed", e);
        }
    }

    List<Path> watchedDirectories() throws IOException {
        Set<Path> directories = new LinkedHashSet<>();
        for (Path target : targets) {
            if (!Files.isDirectory(target)) {
                log.warn("Not a directory: {}", target);
                continue;
            }
            if (!recursive) {
                directories.add(target);
                continue;
            }
            try (Stream<Path> walk = Files.walk(target)) {
                walk.filter(Files::isDirectory)
                        .filter(dir -> dir.equals(target) || InterfaceListFile.exists(dir))
                        .forEach(directories::add);
            }
        }
        return new ArrayList<>(directories);
    }

    private boolean hasPendingChanges(Path directory) throws IOException {
        for (Path source : InterfaceListFile.read(directory)) {
            if (needsRun(source)) {
                return true;
            }
        }
        return false;
    }

    private boolean needsRun(Path source) throws IOException {
        if (!Files.isRegularFile(source)) {
            return false;
        }
        SourceState state = states.get(source);
        if (state == null || !state.checksum.equals(checksum(source))) {
            return true;
        }
        return state.succeeded && !Files.exists(mockPathOf(source));
    }

    private void regenerate(Path directory) {
        List<Path> sources;
        try {
            sources = InterfaceListFile.read(directory);
        } catch (IOException e) {
            log.error("Cannot read {}", directory.resolve(InterfaceListFile.FILE_NAME), e);
            return;
        }
        for (Path source : sources) {
            if (!Files.isRegularFile(source)) {
                log.warn("Listed source file does not exist: {}", source);
                continue;
            }
            try {
                if (!needsRun(source)) {
                    continue;
                }
                String checksum = checksum(source);
                GeneratorResult result = generator.apply(configFor(source));
                if (result.isSuccess()) {
                    log.info("Regenerated mock for {}", source);
                } else {
                    log.error("Generating mock for {} failed: {}", source, result.getErrorMessage());
                }
                states.put(source, new SourceState(checksum, result.isSuccess()));
            } catch (IOException | RuntimeException e) {
                log.error("Generating mock for {} failed", source, e);
            }
        }
    }

    private GeneratorConfig configFor(Path source) {
        return baseConfig.toBuilder()
                .request(new SourceFileRequest(source))
                .outputFile(null)
                .outputDir(source.getParent())
                .packageName(null)
                .build();
    }

    private static Path mockPathOf(Path source) {
        String mockName = DestinationResolver.defaultMockClassName(new SourceFileRequest(source).getFileStem());
        return source.resolveSibling(mockName + ".java");
    }

    static String checksum(Path file) throws IOException {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(Files.readAllBytes(file)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class SourceState {
        private final String checksum;
        private final boolean succeeded;

        private SourceState(String checksum, boolean succeeded) {
            this.checksum = checksum;
            this.succeeded = succeeded;
        }
    }
}
