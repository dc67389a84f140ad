package com.mockgen.generator.codegen.exception;

/**
 * Source text could not be rendered from an otherwise valid interface model.
 */
public class GenerationException extends MockGenException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
