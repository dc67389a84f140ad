package com.mockgen.generator.codegen.exception;

/**
 * A method signature breaks a structural rule, e.g. a variadic parameter that is not last.
 */
public class SignatureConstraintException extends MockGenException {

    private static final long serialVersionUID = 1L;

    public SignatureConstraintException(String message) {
        super(message);
    }
}
