package com.mockgen.runtime;

import java.util.List;

/**
 * Computes the result of a stubbed call from its recorded arguments.
 *
 * @param <R> the (boxed) result type
 */
@FunctionalInterface
public interface Answer<R> {

    R answer(List<Object> arguments) throws Throwable;
}
