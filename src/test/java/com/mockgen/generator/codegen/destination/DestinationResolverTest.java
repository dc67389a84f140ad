package com.mockgen.generator.codegen.destination;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DestinationResolverTest {

    private final Path workingDirectory = Path.of("/work/my-service").toAbsolutePath();
    private final DestinationResolver resolver = new DestinationResolver(workingDirectory);

    @Test
    void testResolvePackage() {
        assertThat(resolver.resolvePackage("com.acme.mocks", Path.of("/tmp/x"))).isEqualTo("com.acme.mocks");
        assertThat(resolver.resolvePackage(null, Path.of("/tmp/test-doubles"))).isEqualTo("test_doubles");
        assertThat(resolver.resolvePackage(null, null)).isEqualTo("my_service_test");
    }

    @Test
    void testMockNamesAndPaths() {
        assertThat(DestinationResolver.defaultMockClassName("Display")).isEqualTo("MockDisplay");
        assertThat(DestinationResolver.defaultMockClassName("Outer.Inner")).isEqualTo("MockInner");
        assertThat(DestinationResolver.classNameOf(Path.of("out/FakeDisplay.java"))).isEqualTo("FakeDisplay");

        assertThat(resolver.resolveMockPath("MockDisplay", null, null)).isEqualTo(workingDirectory.resolve("MockDisplay.java"));
        assertThat(resolver.resolveMockPath("MockDisplay", null, Path.of("out"))).isEqualTo(Path.of("out/MockDisplay.java"));
        assertThat(resolver.resolveMockPath("Fake", Path.of("a/Fake.java"), Path.of("out"))).isEqualTo(Path.of("a/Fake.java"));
    }

    @Test
    void testMatchersLocation() {
        assertThat(resolver.resolveMatchersDir(null, Path.of("out"))).isEqualTo(Path.of("out/matchers"));
        assertThat(resolver.resolveMatchersDir(Path.of("m"), Path.of("out"))).isEqualTo(Path.of("m"));
        assertThat(DestinationResolver.resolveMatchersPackage(null, "com.acme.mocks")).isEqualTo("com.acme.mocks.matchers");
        assertThat(DestinationResolver.resolveMatchersPackage(null, "")).isEqualTo("matchers");
        assertThat(DestinationResolver.resolveMatchersPackage("custom", "com.acme.mocks")).isEqualTo("custom");
    }
}
