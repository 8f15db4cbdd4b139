package org.javai.reporting.config;

import org.javai.reporting.ReportQueryException;

/**
 * Thrown when reporting settings cannot be read or contain invalid values.
 */
public class ReportingSettingsException extends ReportQueryException {

	public ReportingSettingsException(String message) {
		super(message);
	}

	public ReportingSettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
