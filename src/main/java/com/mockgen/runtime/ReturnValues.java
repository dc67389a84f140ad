package com.mockgen.runtime;

import java.util.Arrays;

/**
 * Ordered, immutable aggregate of the values a mocked call produces.
 * A Java method yields zero or one value; the tuple form keeps stubbing uniform for any arity.
 */
public final class ReturnValues {

    private static final ReturnValues EMPTY = new ReturnValues(new Object[0]);

    private final Object[] values;

    private ReturnValues(Object[] values) {
        this.values = values;
    }

    public static ReturnValues empty() {
        return EMPTY;
    }

    public static ReturnValues of(Object... values) {
        if (values == null) {
            return new ReturnValues(new Object[] {null});
        }
        return values.length == 0 ? EMPTY : new ReturnValues(values.clone());
    }

    public Object get(int index) {
        if (index < 0 || index >= values.length) {
            throw new IndexOutOfBoundsException("Return value " + index + " requested, but only " + values.length + " present");
        }
        return values[index];
    }

    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReturnValues other)) {
            return false;
        }
        return Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(values);
    }
}
