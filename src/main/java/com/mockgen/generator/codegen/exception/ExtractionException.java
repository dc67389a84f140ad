package com.mockgen.generator.codegen.exception;

/**
 * An interface model could not be built: interface or type not found, ambiguous or multi-interface
 * request to a single-interface extractor, unresolved import, unparseable source, or a method name collision.
 */
public class ExtractionException extends MockGenException {

    private static final long serialVersionUID = 1L;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
