package com.mockgen.runtime;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Factory methods for the argument matchers used by generated mocks.
 * Every matcher has a readable {@code toString()} for verification messages.
 */
public final class Matchers {

    private Matchers() {
        // Utility class
    }

    public static <T> ArgumentMatcher<T> any() {
        return new DescribedMatcher<>("any()", argument -> true);
    }

    /**
     * Equality matcher. Arrays are compared element by element.
     */
    public static <T> ArgumentMatcher<T> eq(T expected) {
        return new DescribedMatcher<>("eq(" + Describer.describe(expected) + ")",
                argument -> Objects.deepEquals(expected, argument));
    }

    public static <T> ArgumentMatcher<T> isNull() {
        return new DescribedMatcher<>("isNull()", Objects::isNull);
    }

    public static <T> ArgumentMatcher<T> notNull() {
        return new DescribedMatcher<>("notNull()", Objects::nonNull);
    }

    public static <T> ArgumentMatcher<T> isA(Class<?> type) {
        return new DescribedMatcher<>("isA(" + type.getSimpleName() + ")", type::isInstance);
    }

    public static <T> ArgumentMatcher<T> argThat(String description, Predicate<? super T> predicate) {
        return new DescribedMatcher<>(description, predicate::test);
    }

    @SafeVarargs
    public static <T> ArgumentMatcher<T> oneOf(T... candidates) {
        return new DescribedMatcher<>("oneOf(" + Describer.describe(candidates) + ")", argument -> {
            for (T candidate : candidates) {
                if (Objects.deepEquals(candidate, argument)) {
                    return true;
                }
            }
            return false;
        });
    }

    public static ArgumentMatcher<Integer> anyInt() {
        return any();
    }

    public static ArgumentMatcher<Long> anyLong() {
        return any();
    }

    public static ArgumentMatcher<Double> anyDouble() {
        return any();
    }

    public static ArgumentMatcher<Float> anyFloat() {
        return any();
    }

    public static ArgumentMatcher<Boolean> anyBoolean() {
        return any();
    }

    public static ArgumentMatcher<Short> anyShort() {
        return any();
    }

    public static ArgumentMatcher<Byte> anyByte() {
        return any();
    }

    public static ArgumentMatcher<Character> anyChar() {
        return any();
    }

    public static ArgumentMatcher<String> anyString() {
        return any();
    }

    private static final class DescribedMatcher<T> implements ArgumentMatcher<T> {

        private final String description;
        private final ArgumentMatcher<T> delegate;

        private DescribedMatcher(String description, ArgumentMatcher<T> delegate) {
            this.description = description;
            this.delegate = delegate;
        }

        @Override
        public boolean matches(T argument) {
            return delegate.matches(argument);
        }

        @Override
        public String toString() {
            return description;
        }
    }
}
