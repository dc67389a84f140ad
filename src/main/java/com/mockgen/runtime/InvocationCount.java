package com.mockgen.runtime;

/**
 * Expected number of invocations, expressed as an inclusive range.
 */
public final class InvocationCount {

    private final int min;
    private final int max;
    private final String description;

    private InvocationCount(int min, int max, String description) {
        this.min = min;
        this.max = max;
        this.description = description;
    }

    public static InvocationCount times(int count) {
        checkNotNegative(count);
        return new InvocationCount(count, count, "exactly " + count + (count == 1 ? " time" : " times"));
    }

    public static InvocationCount once() {
        return times(1);
    }

    public static InvocationCount never() {
        return new InvocationCount(0, 0, "never");
    }

    public static InvocationCount atLeast(int count) {
        checkNotNegative(count);
        return new InvocationCount(count, Integer.MAX_VALUE, "at least " + count + (count == 1 ? " time" : " times"));
    }

    public static InvocationCount atLeastOnce() {
        return atLeast(1);
    }

    public static InvocationCount atMost(int count) {
        checkNotNegative(count);
        return new InvocationCount(0, count, "at most " + count + (count == 1 ? " time" : " times"));
    }

    public boolean accepts(int actual) {
        return actual >= min && actual <= max;
    }

    @Override
    public String toString() {
        return description;
    }

    private static void checkNotNegative(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Invocation count must be >= 0. Got: " + count);
        }
    }
}
