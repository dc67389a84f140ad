package com.mockgen.generator.integration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mockgen.generator.codegen.GeneratorConfig;
import com.mockgen.generator.codegen.GeneratorResult;
import com.mockgen.generator.codegen.MockGenerator;
import com.mockgen.generator.codegen.extract.ReflectiveInterfaceExtractor;
import com.mockgen.generator.codegen.generator.GeneratedFileMarker;
import com.mockgen.generator.codegen.model.request.PackageRequest;
import com.mockgen.generator.codegen.model.request.SourceFileRequest;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for complete generation runs.
 */
class MockGeneratorIntegrationTest {

    private static final String FIXTURES = "com.mockgen.fixtures";

    @TempDir
    Path tempDir;

    @Test
    void testGenerateMocksAndMatchers() throws IOException {
        Path mocksDir = tempDir.resolve("mocks");
        GeneratorConfig config = GeneratorConfig.builder()
                .request(PackageRequest.of(FIXTURES, "WidgetStore", "GadgetStore"))
                .outputDir(mocksDir)
                .packageName("mocks")
                .generateMatchers(true)
                .workingDirectory(tempDir)
                .build();

        GeneratorResult result = generator(config).generate();

        assertThat(result.isSuccess()).as(result.getErrorMessage()).isTrue();
        assertThat(result.getInterfacesProcessed()).isEqualTo(2);
        assertThat(result.getMockFiles()).containsExactly(
                mocksDir.resolve("MockWidgetStore.java"), mocksDir.resolve("MockGadgetStore.java"));
        assertThat(result.getMatcherFiles()).containsExactly(mocksDir.resolve("matchers/WidgetMatchers.java"));
        assertThat(result.getFilesWritten()).isEqualTo(3);

        String mock = Files.readString(mocksDir.resolve("MockWidgetStore.java"));
        assertThat(mock).startsWith(GeneratedFileMarker.MARKER);
        assertThat(mock).contains("package mocks;");
        assertThat(Files.readString(mocksDir.resolve("matchers/WidgetMatchers.java"))).contains("package mocks.matchers;");
    }

    @Test
    void testRegenerationIsIdempotent() {
        GeneratorConfig config = GeneratorConfig.builder()
                .request(PackageRequest.of(FIXTURES, "Display"))
                .outputDir(tempDir)
                .packageName("mocks")
                .workingDirectory(tempDir)
                .build();

        assertThat(generator(config).generate().getFilesWritten()).isEqualTo(1);

        GeneratorResult second = generator(config).generate();
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.getFilesWritten()).isZero();
    }

    @Test
    void testFailingInterfaceLeavesDestinationUntouched() throws IOException {
        Path mocksDir = tempDir.resolve("mocks");
        GeneratorConfig config = GeneratorConfig.builder()
                .request(PackageRequest.of(FIXTURES, "Display", "CollidingHandler"))
                .outputDir(mocksDir)
                .workingDirectory(tempDir)
                .build();

        GeneratorResult result = generator(config).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("handle");
        assertThat(Files.exists(mocksDir)).isFalse();
    }

    @Test
    void testOutputFileNamesTheMockClass() throws IOException {
        Path output = tempDir.resolve("doubles/FakeDisplay.java");
        GeneratorConfig config = GeneratorConfig.builder()
                .request(PackageRequest.of(FIXTURES, "Display"))
                .outputFile(output)
                .packageName("doubles")
                .workingDirectory(tempDir)
                .build();

        GeneratorResult result = generator(config).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(Files.readString(output)).contains("public class FakeDisplay implements Display {");
    }

    @Test
    void testOutputFileWithSeveralInterfaces() {
        GeneratorConfig config = GeneratorConfig.builder()
                .request(PackageRequest.of(FIXTURES, "Display", "Base"))
                .outputFile(tempDir.resolve("MockBoth.java"))
                .workingDirectory(tempDir)
                .build();

        GeneratorResult result = generator(config).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("--output");
    }

    @Test
    void testSourceFileKeepsParameterNamesAndPackage() throws IOException {
        Path source = Path.of("src/test/java/com/mockgen/fixtures/Display.java").toAbsolutePath();
        GeneratorConfig config = GeneratorConfig.builder()
                .request(new SourceFileRequest(source))
                .outputDir(tempDir)
                .workingDirectory(tempDir)
                .build();

        GeneratorResult result = new MockGenerator(config).generate();

        assertThat(result.isSuccess()).as(result.getErrorMessage()).isTrue();
        String mock = Files.readString(tempDir.resolve("MockDisplay.java"));
        assertThat(mock).contains("package com.mockgen.fixtures;");
        assertThat(mock).contains("public String show(String message, int... codes) {");
    }

    @Test
    void testMissingInterface() throws IOException {
        GeneratorConfig config = GeneratorConfig.builder()
                .request(PackageRequest.of(FIXTURES, "Nope"))
                .outputDir(tempDir)
                .workingDirectory(tempDir)
                .build();

        GeneratorResult result = generator(config).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("com.mockgen.fixtures.Nope");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    private MockGenerator generator(GeneratorConfig config) {
        return new MockGenerator(config, new ReflectiveInterfaceExtractor(getClass().getClassLoader()), null);
    }
}
