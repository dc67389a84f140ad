package com.mockgen.runtime;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MatchersTest {

    @Test
    void testEqComparesArraysDeeply() {
        assertThat(Matchers.eq(new int[] {1, 2}).matches(new int[] {1, 2})).isTrue();
        assertThat(Matchers.eq(new int[] {1, 2}).matches(new int[] {2, 1})).isFalse();
    }

    @Test
    void testNullMatchers() {
        assertThat(Matchers.isNull().matches(null)).isTrue();
        assertThat(Matchers.notNull().matches(null)).isFalse();
        assertThat(Matchers.anyInt().matches(3)).isTrue();
    }

    @Test
    void testArgThatDescribesItself() {
        ArgumentMatcher<String> shortText = Matchers.argThat("short text", s -> s.length() < 5);

        assertThat(shortText.matches("abc")).isTrue();
        assertThat(shortText).hasToString("short text");
    }

    @Test
    void testOneOfAndIsA() {
        assertThat(Matchers.oneOf("a", "b").matches("b")).isTrue();
        assertThat(Matchers.oneOf("a", "b").matches("c")).isFalse();
        assertThat(Matchers.<Object>isA(CharSequence.class).matches("text")).isTrue();
        assertThat(Matchers.<Object>isA(CharSequence.class).matches(4)).isFalse();
    }

    @Test
    void testVarargsToList() {
        assertThat(Varargs.toList(new String[] {"x", "y"})).containsExactly("x", "y");
        assertThat(Varargs.toList(new long[0])).isEmpty();
        assertThat(Varargs.toList(null)).isNull();
        assertThat(Matchers.<Object>eq(List.of(1, 2)).matches(Varargs.toList(new int[] {1, 2}))).isTrue();
    }
}
