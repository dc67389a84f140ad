package com.mockgen.generator.cli.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Carries every problem found in the command-line options, so they can be reported at once.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(errors.size() + " invalid option(s): " + String.join("; ", errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	/**
	 * One error per line, each prefixed with a dash.
	 */
	public String toReport() {
		return errors.stream().map(e -> "  - " + e).collect(Collectors.joining(System.lineSeparator()));
	}
}
