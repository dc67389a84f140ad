package com.mockgen.generator.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mockgen.generator.codegen.generator.GeneratedFileMarker;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the command line end to end.
 */
class MockgenCommandTest {

    private static final Path DISPLAY_SOURCE = Path.of("src/test/java/com/mockgen/fixtures/Display.java").toAbsolutePath();

    @TempDir
    Path tempDir;

    @Test
    void testGenerateThenRemove() throws IOException {
        Path outputDir = tempDir.resolve("doubles");

        int generated = execute("generate", DISPLAY_SOURCE.toString(), "--output-dir", outputDir.toString());

        assertThat(generated).isZero();
        Path mock = outputDir.resolve("MockDisplay.java");
        String source = Files.readString(mock);
        assertThat(source).startsWith(GeneratedFileMarker.MARKER);
        assertThat(source).contains("package doubles;");

        int removed = execute("remove", "--non-interactive", "--silent", outputDir.toString());

        assertThat(removed).isZero();
        assertThat(mock).doesNotExist();
    }

    @Test
    void testInvalidOptionsFail() {
        assertThat(execute("generate", "com.acme")).isEqualTo(1);
    }

    @Test
    void testGenerationFailureFails() {
        assertThat(execute("generate", "--output-dir", tempDir.toString(), "com.acme.nowhere", "Missing")).isEqualTo(1);
    }

    @Test
    void testRemoveMissingPathFails() {
        assertThat(execute("remove", "-n", tempDir.resolve("nope").toString())).isEqualTo(1);
    }

    @Test
    void testUsageErrorsFromPicocli() {
        assertThat(execute("generate")).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(execute("unknown-command")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private static int execute(String... args) {
        return new CommandLine(new MockgenCommand()).execute(args);
    }
}
