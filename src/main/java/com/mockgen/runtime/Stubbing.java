package com.mockgen.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A registered "when called with these arguments, respond like this" rule.
 * Responses are consumed in registration order; the last one repeats.
 *
 * @param <R> the (boxed) result type of the stubbed method, {@code Void} for void methods
 */
public final class Stubbing<R> {

    @FunctionalInterface
    private interface Response {
        ReturnValues respond(List<Object> arguments) throws Throwable;
    }

    private final String methodName;
    private final List<ArgumentMatcher<?>> matchers;
    private final List<Response> responses = new ArrayList<>();
    private int next;

    Stubbing(String methodName, List<ArgumentMatcher<?>> matchers) {
        this.methodName = methodName;
        this.matchers = List.copyOf(matchers);
    }

    public synchronized Stubbing<R> thenReturn(R value) {
        ReturnValues values = ReturnValues.of(value);
        responses.add(arguments -> values);
        return this;
    }

    @SafeVarargs
    public final synchronized Stubbing<R> thenReturn(R first, R... more) {
        thenReturn(first);
        for (R value : more) {
            thenReturn(value);
        }
        return this;
    }

    /**
     * Registers a complete result tuple, for methods whose model declares several results.
     */
    public synchronized Stubbing<R> thenReturnValues(Object... values) {
        ReturnValues tuple = ReturnValues.of(values);
        responses.add(arguments -> tuple);
        return this;
    }

    public synchronized Stubbing<R> thenThrow(Throwable throwable) {
        responses.add(arguments -> {
            throw throwable;
        });
        return this;
    }

    public synchronized Stubbing<R> thenAnswer(Answer<? extends R> answer) {
        responses.add(arguments -> ReturnValues.of(answer.answer(arguments)));
        return this;
    }

    String getMethodName() {
        return methodName;
    }

    boolean matches(List<Object> arguments) {
        return ArgumentMatching.matchesAll(matchers, arguments);
    }

    synchronized ReturnValues respond(List<Object> arguments, ReturnValues defaults) throws Throwable {
        if (responses.isEmpty()) {
            return defaults;
        }
        Response response = responses.get(Math.min(next, responses.size() - 1));
        if (next < responses.size()) {
            next++;
        }
        return response.respond(arguments);
    }

    @Override
    public String toString() {
        return methodName + Arrays.toString(matchers.toArray());
    }
}
