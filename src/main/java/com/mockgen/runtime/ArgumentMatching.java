package com.mockgen.runtime;

import java.util.List;

/**
 * Applies a matcher list to recorded arguments. An empty matcher list matches any arguments.
 */
final class ArgumentMatching {

    private ArgumentMatching() {
        // Utility class
    }

    @SuppressWarnings("unchecked")
    static boolean matchesAll(List<ArgumentMatcher<?>> matchers, List<Object> arguments) {
        if (matchers.isEmpty()) {
            return true;
        }
        if (matchers.size() != arguments.size()) {
            throw new IllegalArgumentException("Expected " + arguments.size() + " matchers but got " + matchers.size());
        }
        for (int i = 0; i < matchers.size(); i++) {
            ArgumentMatcher<Object> matcher = (ArgumentMatcher<Object>) matchers.get(i);
            if (!matcher.matches(arguments.get(i))) {
                return false;
            }
        }
        return true;
    }
}
