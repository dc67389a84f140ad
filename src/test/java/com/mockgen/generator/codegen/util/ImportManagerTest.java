package com.mockgen.generator.codegen.util;

import org.junit.jupiter.api.Test;

import com.mockgen.generator.codegen.exception.GenerationException;

import static org.assertj.core.api.Assertions.*;

class ImportManagerTest {

    @Test
    void testFirstClassClaimsSimpleName() {
        ImportManager imports = new ImportManager("com.acme.mocks");

        assertThat(imports.reference("java.util", "List")).isEqualTo("List");
        assertThat(imports.reference("java.awt", "List")).isEqualTo("java.awt.List");
        assertThat(imports.getImports()).containsExactly("java.util.List");
    }

    @Test
    void testBoundNameIsKeptForLaterReference() {
        ImportManager imports = new ImportManager("com.acme.mocks");
        imports.bind("com.mockgen.runtime.Matchers");

        assertThat(imports.reference("com.acme.widgets", "Matchers")).isEqualTo("com.acme.widgets.Matchers");
        assertThat(imports.reference("com.mockgen.runtime.Matchers")).isEqualTo("Matchers");
        assertThat(imports.getImports()).containsExactly("com.mockgen.runtime.Matchers");
    }

    @Test
    void testReservedNamesAreAlwaysQualified() {
        ImportManager imports = new ImportManager("com.acme.mocks");
        imports.reserve("T");
        imports.reserve("MockWidgetStore");

        assertThat(imports.reference("com.acme", "T")).isEqualTo("com.acme.T");
        assertThat(imports.reference("com.acme", "MockWidgetStore")).isEqualTo("com.acme.MockWidgetStore");
        assertThat(imports.getImports()).isEmpty();
    }

    @Test
    void testNestedClassImportsItsTopLevelClass() {
        ImportManager imports = new ImportManager("com.acme.mocks");

        assertThat(imports.reference("java.util", "Map.Entry")).isEqualTo("Map.Entry");
        assertThat(imports.reference("java.util", "Map")).isEqualTo("Map");
        assertThat(imports.getImports()).containsExactly("java.util.Map");
    }

    @Test
    void testJavaLangAndOwnPackagesNeedNoImport() {
        ImportManager imports = new ImportManager("com.acme.mocks");

        assertThat(imports.reference("java.lang", "String")).isEqualTo("String");
        assertThat(imports.reference("com.acme.mocks", "Helper")).isEqualTo("Helper");
        assertThat(imports.generateImports()).isEmpty();
    }

    @Test
    void testParentPackageIsImported() {
        ImportManager imports = new ImportManager("com.acme.mocks");

        assertThat(imports.reference("com.acme", "Widget")).isEqualTo("Widget");
        assertThat(imports.getImports()).containsExactly("com.acme.Widget");
    }

    @Test
    void testImportsAreSorted() {
        ImportManager imports = new ImportManager("com.acme.mocks");
        imports.reference("java.util", "Optional");
        imports.reference("com.acme", "Widget");
        imports.reference("java.io", "IOException");

        assertThat(imports.generateImports()).isEqualTo("""
                import com.acme.Widget;
                import java.io.IOException;
                import java.util.Optional;
                """);
    }

    @Test
    void testUnnamedPackageType() {
        assertThat(new ImportManager("").reference("", "Widget")).isEqualTo("Widget");
        assertThatThrownBy(() -> new ImportManager("com.acme.mocks").reference("", "Widget"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("unnamed package");
    }
}
