package com.mockgen.generator.codegen.exception;

/**
 * Base of all failures that abort a generation run.
 */
public class MockGenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MockGenException(String message) {
        super(message);
    }

    public MockGenException(String message, Throwable cause) {
        super(message, cause);
    }
}
