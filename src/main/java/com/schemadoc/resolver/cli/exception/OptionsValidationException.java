package com.schemadoc.resolver.cli.exception;

import java.util.List;

import lombok.Value;

/**
 * Every problem found while validating lookup options, each tied to the option
 * (or positional identifier) it concerns.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** Source name used for problems with the positional object identifier. */
	public static final String IDENTIFIER = "<identifier>";

	private final transient List<OptionError> optionErrors;

	public OptionsValidationException(List<OptionError> optionErrors) {
		super(describe(optionErrors));
		this.optionErrors = List.copyOf(optionErrors);
	}

	public List<OptionError> getOptionErrors() {
		return optionErrors;
	}

	/**
	 * Messages only, in the order they were found.
	 */
	public List<String> getErrors() {
		return optionErrors.stream().map(OptionError::getMessage).toList();
	}

	public boolean hasErrorFor(String option) {
		return optionErrors.stream().anyMatch(e -> e.getOption().equals(option));
	}

	private static String describe(List<OptionError> errors) {
		StringBuilder sb = new StringBuilder();
		for (OptionError error : errors) {
			if (sb.length() > 0) {
				sb.append(System.lineSeparator());
			}
			sb.append(error.getOption()).append(": ").append(error.getMessage());
		}
		return sb.toString();
	}

	@Value
	public static class OptionError {
		String option;
		String message;
	}
}
