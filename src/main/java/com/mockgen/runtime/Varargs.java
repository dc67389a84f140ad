package com.mockgen.runtime;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts a varargs array (primitive or reference) into the single ordered sequence value
 * that generated mocks record, so that verification does not depend on how a call site expanded it.
 */
public final class Varargs {

    private Varargs() {
        // Utility class
    }

    /**
     * Returns an unmodifiable list view of the given array, or {@code null} when the array itself is null.
     */
    public static List<Object> toList(Object array) {
        if (array == null) {
            return null;
        }
        if (!array.getClass().isArray()) {
            throw new IllegalArgumentException("Not an array: " + array.getClass().getName());
        }
        int length = Array.getLength(array);
        List<Object> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            values.add(Array.get(array, i));
        }
        return Collections.unmodifiableList(values);
    }
}
