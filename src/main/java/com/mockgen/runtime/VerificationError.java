package com.mockgen.runtime;

/**
 * Raised when a verification against a mock's recorded calls fails.
 */
public class VerificationError extends AssertionError {

    private static final long serialVersionUID = 1L;

    public VerificationError(String message) {
        super(message);
    }
}
