package com.mockgen.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stub table and call log behind one generated mock instance.
 * Generated mocks delegate every intercepted call and every stubbing or verification helper here.
 */
public final class MockController {

    private final String mockName;
    private final StubbingPolicy policy;
    private final Map<String, List<Stubbing<?>>> stubbings = new LinkedHashMap<>();
    private final Map<String, List<RecordedCall>> calls = new LinkedHashMap<>();

    public MockController(String mockName) {
        this(mockName, StubbingPolicy.DEFAULT_VALUES);
    }

    public MockController(String mockName, StubbingPolicy policy) {
        this.mockName = mockName;
        this.policy = policy == null ? StubbingPolicy.DEFAULT_VALUES : policy;
    }

    /**
     * Records the call and produces its results: the latest matching stub wins, otherwise the defaults.
     */
    public ReturnValues invoke(String methodName, Object[] arguments, ReturnValues defaults) {
        RecordedCall call = new RecordedCall(mockName, methodName, arguments);
        Stubbing<?> stubbing;
        synchronized (this) {
            calls.computeIfAbsent(methodName, k -> new ArrayList<>()).add(call);
            stubbing = findStubbing(methodName, call.getArguments());
        }
        if (stubbing == null) {
            if (policy == StubbingPolicy.STRICT && defaults.size() > 0) {
                throw new UnstubbedCallException("Unstubbed call: " + call);
            }
            return defaults;
        }
        try {
            return stubbing.respond(call.getArguments(), defaults);
        } catch (Throwable t) {
            throw MockController.<RuntimeException>rethrow(t);
        }
    }

    public synchronized <R> Stubbing<R> when(String methodName, ArgumentMatcher<?>... matchers) {
        Stubbing<R> stubbing = new Stubbing<>(methodName, Arrays.asList(matchers));
        stubbings.computeIfAbsent(methodName, k -> new ArrayList<>()).add(stubbing);
        return stubbing;
    }

    /**
     * Recorded calls of the method whose arguments satisfy the matchers, in call order.
     * No matchers means any arguments.
     */
    public synchronized List<RecordedCall> calls(String methodName, ArgumentMatcher<?>... matchers) {
        List<ArgumentMatcher<?>> matcherList = Arrays.asList(matchers);
        List<RecordedCall> matching = new ArrayList<>();
        for (RecordedCall call : calls.getOrDefault(methodName, List.of())) {
            if (ArgumentMatching.matchesAll(matcherList, call.getArguments())) {
                matching.add(call);
            }
        }
        return Collections.unmodifiableList(matching);
    }

    public int countCalls(String methodName, ArgumentMatcher<?>... matchers) {
        return calls(methodName, matchers).size();
    }

    public void verify(String methodName, InvocationCount expected, ArgumentMatcher<?>... matchers) {
        int actual = countCalls(methodName, matchers);
        if (!expected.accepts(actual)) {
            throw new VerificationError(describeMismatch(methodName, expected, actual, matchers));
        }
    }

    public synchronized List<RecordedCall> allCalls() {
        List<RecordedCall> all = new ArrayList<>();
        calls.values().forEach(all::addAll);
        all.sort((a, b) -> Long.compare(a.getSequence(), b.getSequence()));
        return Collections.unmodifiableList(all);
    }

    public String getMockName() {
        return mockName;
    }

    public StubbingPolicy getPolicy() {
        return policy;
    }

    private Stubbing<?> findStubbing(String methodName, List<Object> arguments) {
        List<Stubbing<?>> candidates = stubbings.getOrDefault(methodName, List.of());
        for (int i = candidates.size() - 1; i >= 0; i--) {
            if (candidates.get(i).matches(arguments)) {
                return candidates.get(i);
            }
        }
        return null;
    }

    private String describeMismatch(String methodName, InvocationCount expected, int actual, ArgumentMatcher<?>[] matchers) {
        StringBuilder sb = new StringBuilder();
        sb.append("Expected ").append(mockName).append('.').append(methodName)
                .append(matchers.length == 0 ? "(<any>)" : Arrays.toString(matchers).replace('[', '(').replace(']', ')'))
                .append(" to be called ").append(expected)
                .append(", but it was called ").append(actual).append(actual == 1 ? " time" : " times");
        List<RecordedCall> recorded = calls(methodName);
        if (!recorded.isEmpty()) {
            sb.append(". Recorded calls:");
            for (RecordedCall call : recorded) {
                sb.append(System.lineSeparator()).append("    ").append(call);
            }
        }
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E rethrow(Throwable t) throws E {
        throw (E) t;
    }
}
