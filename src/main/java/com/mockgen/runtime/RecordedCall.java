package com.mockgen.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One invocation of a mocked method, in call order.
 * The sequence number is global across all mocks so that calls on different mocks can be ordered.
 */
public final class RecordedCall {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String mockName;
    private final String methodName;
    private final List<Object> arguments;
    private final long sequence;

    RecordedCall(String mockName, String methodName, Object[] arguments) {
        this.mockName = mockName;
        this.methodName = methodName;
        List<Object> copy = new ArrayList<>(arguments.length);
        Collections.addAll(copy, arguments);
        this.arguments = Collections.unmodifiableList(copy);
        this.sequence = SEQUENCE.incrementAndGet();
    }

    public String getMockName() {
        return mockName;
    }

    public String getMethodName() {
        return methodName;
    }

    public List<Object> getArguments() {
        return arguments;
    }

    @SuppressWarnings("unchecked")
    public <T> T argument(int index) {
        return (T) arguments.get(index);
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(mockName).append('.').append(methodName).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(Describer.describe(arguments.get(i)));
        }
        return sb.append(')').toString();
    }
}
