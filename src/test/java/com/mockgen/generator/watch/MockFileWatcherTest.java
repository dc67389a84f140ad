package com.mockgen.generator.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mockgen.generator.codegen.GeneratorConfig;
import com.mockgen.generator.codegen.GeneratorResult;
import com.mockgen.generator.codegen.model.request.SourceFileRequest;

import static org.assertj.core.api.Assertions.*;

/**
 * Drives single polling ticks on the calling thread with a fake generation run.
 */
class MockFileWatcherTest {

    @TempDir
    Path tempDir;

    private final List<GeneratorConfig> runs = new ArrayList<>();
    private boolean failRuns;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("Display.java"), "public interface Display { void clear(); }\n");
        Files.writeString(tempDir.resolve(InterfaceListFile.FILE_NAME), "# mocks\n\nDisplay\n");
    }

    @Test
    void testFirstTickGeneratesListedInterface() throws IOException {
        MockFileWatcher watcher = watcher(false, tempDir);

        watcher.update(Runnable::run);

        assertThat(runs).hasSize(1);
        GeneratorConfig config = runs.get(0);
        assertThat(config.getRequest()).isEqualTo(new SourceFileRequest(tempDir.resolve("Display.java")));
        assertThat(config.getOutputDir()).isEqualTo(tempDir);
        assertThat(config.getPackageName()).isNull();
        assertThat(config.isGenerateMatchers()).isTrue();
    }

    @Test
    void testUnchangedSourceIsNotRegenerated() throws IOException {
        MockFileWatcher watcher = watcher(false, tempDir);

        watcher.update(Runnable::run);
        watcher.update(Runnable::run);

        assertThat(runs).hasSize(1);
    }

    @Test
    void testChangedSourceIsRegenerated() throws IOException {
        MockFileWatcher watcher = watcher(false, tempDir);
        watcher.update(Runnable::run);

        Files.writeString(tempDir.resolve("Display.java"), "public interface Display { void clear(); int size(); }\n");
        watcher.update(Runnable::run);

        assertThat(runs).hasSize(2);
    }

    @Test
    void testDeletedMockIsRegenerated() throws IOException {
        MockFileWatcher watcher = watcher(false, tempDir);
        watcher.update(Runnable::run);

        Files.delete(tempDir.resolve("MockDisplay.java"));
        watcher.update(Runnable::run);

        assertThat(runs).hasSize(2);
        assertThat(tempDir.resolve("MockDisplay.java")).exists();
    }

    @Test
    void testFailedRunWaitsForNextChange() throws IOException {
        failRuns = true;
        MockFileWatcher watcher = watcher(false, tempDir);

        watcher.update(Runnable::run);
        watcher.update(Runnable::run);
        assertThat(runs).hasSize(1);

        failRuns = false;
        Files.writeString(tempDir.resolve("Display.java"), "public interface Display { void reset(); }\n");
        watcher.update(Runnable::run);
        assertThat(runs).hasSize(2);
    }

    @Test
    void testMissingListedSourceIsSkipped() throws IOException {
        Files.writeString(tempDir.resolve(InterfaceListFile.FILE_NAME), "Gone.java\n");

        watcher(false, tempDir).update(Runnable::run);

        assertThat(runs).isEmpty();
    }

    @Test
    void testRecursiveWatchIncludesListedSubdirectories() throws IOException {
        Path listed = Files.createDirectories(tempDir.resolve("a/listed"));
        Path unlisted = Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(listed.resolve(InterfaceListFile.FILE_NAME), "Base\n");
        Files.writeString(listed.resolve("Base.java"), "public interface Base { String name(); }\n");

        assertThat(watcher(true, tempDir).watchedDirectories()).containsExactlyInAnyOrder(tempDir, listed);
        assertThat(watcher(false, tempDir).watchedDirectories()).containsExactly(tempDir);
        assertThat(watcher(true, tempDir).watchedDirectories()).doesNotContain(unlisted);

        watcher(true, tempDir).update(Runnable::run);
        assertThat(runs).extracting(c -> ((SourceFileRequest) c.getRequest()).getFileStem())
                .containsExactlyInAnyOrder("Display", "Base");
    }

    @Test
    void testStartCreatesListFile() throws IOException, InterruptedException {
        Path fresh = Files.createDirectories(tempDir.resolve("fresh"));
        MockFileWatcher watcher = watcher(false, fresh);

        watcher.start();
        try {
            assertThat(fresh.resolve(InterfaceListFile.FILE_NAME)).exists();
            assertThatThrownBy(watcher::start).isInstanceOf(IllegalStateException.class);
        } finally {
            watcher.stop();
        }
        assertThat(Files.readString(fresh.resolve(InterfaceListFile.FILE_NAME))).isEqualTo(InterfaceListFile.HEADER);
    }

    @Test
    void testChecksumTracksContent() throws IOException {
        Path file = tempDir.resolve("Display.java");
        String before = MockFileWatcher.checksum(file);

        Files.writeString(file, "changed");

        assertThat(MockFileWatcher.checksum(file)).hasSize(64).isNotEqualTo(before);
    }

    private MockFileWatcher watcher(boolean recursive, Path target) {
        GeneratorConfig base = GeneratorConfig.builder().generateMatchers(true).workingDirectory(tempDir).build();
        return new MockFileWatcher(List.of(target), recursive, Duration.ofHours(1), base, this::fakeRun);
    }

    private synchronized GeneratorResult fakeRun(GeneratorConfig config) {
        runs.add(config);
        if (failRuns) {
            return GeneratorResult.failure("broken source");
        }
        SourceFileRequest request = (SourceFileRequest) config.getRequest();
        try {
            Files.writeString(config.getOutputDir().resolve("Mock" + request.getFileStem() + ".java"), "// mock\n");
        } catch (IOException e) {
            return GeneratorResult.failure(e.getMessage());
        }
        return GeneratorResult.builder().success(true).interfacesProcessed(1).build();
    }
}
