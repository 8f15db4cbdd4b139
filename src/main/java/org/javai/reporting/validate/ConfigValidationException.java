package org.javai.reporting.validate;

import java.util.List;
import org.javai.reporting.ReportQueryException;

/**
 * Carries the messages produced by {@link QueryValidator#validateConfig} when a report
 * configuration is rejected, or a single message when the configuration could not be read.
 */
public class ConfigValidationException extends ReportQueryException {

	private final List<String> errors;

	public ConfigValidationException(List<String> errors) {
		super("Invalid report configuration: " + String.join("; ", errors));
		this.errors = List.copyOf(errors);
	}

	public ConfigValidationException(String error, Throwable cause) {
		super("Invalid report configuration: " + error, cause);
		this.errors = List.of(error);
	}

	public List<String> errors() {
		return errors;
	}
}
