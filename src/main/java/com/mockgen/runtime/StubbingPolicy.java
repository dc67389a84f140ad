package com.mockgen.runtime;

/**
 * What a mock does when a call matches no stub.
 */
public enum StubbingPolicy {

    /** Return the default value of every declared result type. */
    DEFAULT_VALUES,

    /** Throw {@link UnstubbedCallException} for calls that produce a value. */
    STRICT
}
