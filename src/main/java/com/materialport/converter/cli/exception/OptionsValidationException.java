package com.materialport.converter.cli.exception;

import java.util.List;

/**
 * Raised after all convert options have been checked; holds every problem
 * found so the user can fix them in one go.
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

	public int getErrorCount() {
		return errors.size();
	}
}
