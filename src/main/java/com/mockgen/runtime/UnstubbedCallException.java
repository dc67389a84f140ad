package com.mockgen.runtime;

/**
 * Raised by a {@link StubbingPolicy#STRICT} mock when a value-returning call matches no stub.
 */
public class UnstubbedCallException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnstubbedCallException(String message) {
        super(message);
    }
}
