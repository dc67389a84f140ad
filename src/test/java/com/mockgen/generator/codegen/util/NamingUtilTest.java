package com.mockgen.generator.codegen.util;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.mockgen.generator.codegen.model.TypeRef;

import static org.assertj.core.api.Assertions.*;

class NamingUtilTest {

    private static final TypeRef STRING = TypeRef.classType("java.lang", "String");
    private static final TypeRef WIDGET = TypeRef.classType("com.acme", "Widget");

    @Test
    void testToPascalCase() {
        assertThat(NamingUtil.toPascalCase("show")).isEqualTo("Show");
        assertThat(NamingUtil.toPascalCase("X")).isEqualTo("X");
        assertThat(NamingUtil.toPascalCase("")).isEmpty();
    }

    @Test
    void testMatcherStems() {
        assertThat(NamingUtil.matcherStem(WIDGET)).isEqualTo("Widget");
        assertThat(NamingUtil.matcherStem(TypeRef.classType("java.util", "List", WIDGET))).isEqualTo("ListOfWidget");
        assertThat(NamingUtil.matcherStem(TypeRef.classType("java.util", "Map", STRING, WIDGET)))
                .isEqualTo("MapOfStringAndWidget");
        assertThat(NamingUtil.matcherStem(TypeRef.array(WIDGET))).isEqualTo("WidgetArray");
        assertThat(NamingUtil.matcherStem(TypeRef.array(TypeRef.primitive("int")))).isEqualTo("IntArray");
        assertThat(NamingUtil.matcherStem(TypeRef.classType("java.util", "Map.Entry", STRING, WIDGET)))
                .isEqualTo("MapEntryOfStringAndWidget");
    }

    @Test
    void testQualifiedMatcherStems() {
        assertThat(NamingUtil.qualifiedMatcherStem(WIDGET)).isEqualTo("ComAcmeWidget");
        assertThat(NamingUtil.qualifiedMatcherStem(TypeRef.array(WIDGET))).isEqualTo("ComAcmeWidgetArray");
        assertThat(NamingUtil.qualifiedMatcherStem(TypeRef.classType("java.util", "List", WIDGET)))
                .isEqualTo("JavaUtilListOfComAcmeWidget");
    }

    @Test
    void testDisambiguateClassName() {
        assertThat(NamingUtil.disambiguateClassName("WidgetMatchers", Set.of())).isEqualTo("WidgetMatchers");
        assertThat(NamingUtil.disambiguateClassName("WidgetMatchers", Set.of("WidgetMatchers", "WidgetMatchers2")))
                .isEqualTo("WidgetMatchers3");
    }

    @Test
    void testSanitizeIdentifier() {
        assertThat(NamingUtil.sanitizeIdentifier("my-service")).isEqualTo("my_service");
        assertThat(NamingUtil.sanitizeIdentifier("2fa")).isEqualTo("_2fa");
        assertThat(NamingUtil.sanitizeIdentifier("class")).isEqualTo("class_");
    }

    @Test
    void testSafeParameterName() {
        assertThat(NamingUtil.safeParameterName("value", Set.of())).isEqualTo("value");
        assertThat(NamingUtil.safeParameterName("mockController", Set.of("mockController"))).isEqualTo("mockController_");
        assertThat(NamingUtil.safeParameterName("default", Set.of("default_"))).isEqualTo("default__");
    }
}
