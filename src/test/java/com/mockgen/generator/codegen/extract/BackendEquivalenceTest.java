package com.mockgen.generator.codegen.extract;

import java.util.List;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.mockgen.generator.codegen.model.InterfaceModel;
import com.mockgen.generator.codegen.model.request.PackageRequest;

import static org.assertj.core.api.Assertions.*;

/**
 * Both extractors must agree on everything but parameter names and method order.
 */
class BackendEquivalenceTest {

    private final ReflectiveInterfaceExtractor reflective = new ReflectiveInterfaceExtractor(getClass().getClassLoader());
    private final SyntacticInterfaceExtractor syntactic =
            new SyntacticInterfaceExtractor(List.of(SyntacticInterfaceExtractorTest.TEST_SOURCES), List.of());

    @ParameterizedTest
    @ValueSource(strings = { "Display", "Extended", "WidgetStore", "GadgetStore", "Repository", "StringRepository", "Calculator", "Waiter" })
    void testBackendsProduceEquivalentModels(String interfaceName) {
        PackageRequest request = PackageRequest.of("com.mockgen.fixtures", interfaceName);

        InterfaceModel fromClasses = reflective.extract(request).get(0);
        InterfaceModel fromSource = syntactic.extract(request).get(0);

        assertThat(fromClasses.isStructurallyEquivalent(fromSource))
                .as("%s%nreflective: %s%nsyntactic:  %s", interfaceName, fromClasses, fromSource)
                .isTrue();
        assertThat(fromClasses.getMethods()).hasSameSizeAs(fromSource.getMethods());
    }
}
