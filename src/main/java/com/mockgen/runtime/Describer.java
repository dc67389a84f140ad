package com.mockgen.runtime;

import java.util.Arrays;

/**
 * Renders argument values for failure messages.
 */
final class Describer {

    private Describer() {
        // Utility class
    }

    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return "\"" + s + "\"";
        }
        if (value.getClass().isArray()) {
            return Arrays.deepToString(new Object[] {value}).replaceAll("^\\[|\\]$", "");
        }
        return String.valueOf(value);
    }
}
