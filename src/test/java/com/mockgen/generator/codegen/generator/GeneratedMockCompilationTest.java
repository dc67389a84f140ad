package com.mockgen.generator.codegen.generator;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.lang.reflect.Method;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mockgen.fixtures.Calculator;
import com.mockgen.fixtures.Display;
import com.mockgen.fixtures.Widget;
import com.mockgen.fixtures.WidgetStore;
import com.mockgen.generator.codegen.extract.ReflectiveInterfaceExtractor;
import com.mockgen.generator.codegen.model.GenerationOptions;
import com.mockgen.generator.codegen.model.InterfaceModel;
import com.mockgen.generator.codegen.model.output.GeneratedArtifact;
import com.mockgen.generator.codegen.model.request.PackageRequest;
import com.mockgen.runtime.ArgumentMatcher;
import com.mockgen.runtime.InvocationCount;
import com.mockgen.runtime.Matchers;
import com.mockgen.runtime.MockController;
import com.mockgen.runtime.Stubbing;
import com.mockgen.runtime.StubbingPolicy;
import com.mockgen.runtime.UnstubbedCallException;
import com.mockgen.runtime.VerificationError;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Compiles generated mocks with the system compiler and drives them through their helpers.
 */
@SuppressWarnings("unchecked")
class GeneratedMockCompilationTest {

    private static final String PACKAGE = "com.mockgen.generated";
    private static final List<String> INTERFACES = List.of("Display", "Calculator", "WidgetStore", "GadgetStore",
            "Extended", "Repository", "StringRepository");

    @TempDir
    static Path tempDir;

    private static URLClassLoader loader;

    @BeforeAll
    static void compileMocks() throws IOException, URISyntaxException {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assumeTrue(compiler != null, "a JDK compiler is required");

        ReflectiveInterfaceExtractor extractor = new ReflectiveInterfaceExtractor(GeneratedMockCompilationTest.class.getClassLoader());
        MockClassGenerator generator = new MockClassGenerator();
        Path sourceDir = tempDir.resolve("src/com/mockgen/generated");
        Path classesDir = Files.createDirectories(tempDir.resolve("classes"));
        Files.createDirectories(sourceDir);

        List<String> arguments = new ArrayList<>(List.of("-d", classesDir.toString(), "-classpath", classpath()));
        for (String name : INTERFACES) {
            InterfaceModel model = extractor.extract(PackageRequest.of("com.mockgen.fixtures", name)).get(0);
            GeneratedArtifact artifact = generator.generate(model, GenerationOptions.builder()
                    .packageName(PACKAGE)
                    .mockClassName("Mock" + name)
                    .destinationPath(sourceDir.resolve("Mock" + name + ".java"))
                    .build());
            Files.writeString(artifact.getDestinationPath(), artifact.getSourceText());
            arguments.add(artifact.getDestinationPath().toString());
        }

        ByteArrayOutputStream errors = new ByteArrayOutputStream();
        int status = compiler.run(null, errors, errors, arguments.toArray(new String[0]));
        assertThat(status).as(errors.toString(StandardCharsets.UTF_8)).isZero();

        loader = new URLClassLoader(new URL[] { classesDir.toUri().toURL() }, GeneratedMockCompilationTest.class.getClassLoader());
    }

    @Test
    void testStubbedAndDefaultResults() throws Exception {
        Object mock = newMock("MockDisplay");
        Display display = (Display) mock;

        Stubbing<String> stubbing = (Stubbing<String>) helper(mock, "whenShow", String.class, int[].class)
                .invoke(mock, "hello", new int[] { 1, 2 });
        stubbing.thenReturn("stubbed");

        assertThat(display.show("hello", 1, 2)).isEqualTo("stubbed");
        assertThat(display.show("hello", 1)).isNull();
        assertThat(display.show("hello")).isNull();
        assertThat(helper(mock, "countCallsToShow").invoke(mock)).isEqualTo(3);
    }

    @Test
    void testMatcherStubbingOnPrimitives() throws Exception {
        Object mock = newMock("MockCalculator");
        Calculator calculator = (Calculator) mock;

        ((Stubbing<Integer>) helper(mock, "whenAdd", ArgumentMatcher.class, ArgumentMatcher.class)
                .invoke(mock, Matchers.anyInt(), Matchers.eq(2)))
                .thenReturn(42);

        assertThat(calculator.add(7, 2)).isEqualTo(42);
        assertThat(calculator.add(7, 3)).isZero();
        assertThat(calculator.total()).isZero();
        assertThat(calculator.ready()).isFalse();
        assertThat(calculator.describe()).isNull();
    }

    @Test
    void testVerificationHelpers() throws Exception {
        Object mock = newMock("MockWidgetStore");
        WidgetStore store = (WidgetStore) mock;
        Widget widget = new Widget("gear");

        store.save(widget);
        store.save(widget);

        helper(mock, "verifySave", InvocationCount.class).invoke(mock, InvocationCount.times(2));
        helper(mock, "verifySave", InvocationCount.class, ArgumentMatcher.class)
                .invoke(mock, InvocationCount.never(), Matchers.eq(new Widget("other")));
        MockController controller = (MockController) helper(mock, "getMockController").invoke(mock);
        assertThatThrownBy(() -> controller.verify("find", InvocationCount.once()))
                .isInstanceOf(VerificationError.class)
                .hasMessageContaining("find");
        assertThat((List<?>) helper(mock, "callsToSave").invoke(mock)).hasSize(2);
    }

    @Test
    void testStrictPolicy() throws Exception {
        Class<?> mockClass = loader.loadClass(PACKAGE + ".MockCalculator");
        Calculator calculator = (Calculator) mockClass.getConstructor(StubbingPolicy.class).newInstance(StubbingPolicy.STRICT);

        assertThatThrownBy(() -> calculator.add(1, 2)).isInstanceOf(UnstubbedCallException.class);
    }

    private static Object newMock(String className) throws Exception {
        return loader.loadClass(PACKAGE + "." + className).getConstructor().newInstance();
    }

    private static Method helper(Object mock, String name, Class<?>... parameterTypes) throws NoSuchMethodException {
        return mock.getClass().getMethod(name, parameterTypes);
    }

    private static String classpath() throws URISyntaxException {
        return String.join(File.pathSeparator,
                Path.of(MockController.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString(),
                Path.of(Display.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
    }
}
