package com.mockgen.runtime;

/**
 * Decides whether a single recorded argument satisfies an expectation.
 *
 * @param <T> the argument type
 */
@FunctionalInterface
public interface ArgumentMatcher<T> {

    boolean matches(T argument);
}
