package org.javai.reporting.export;

import org.javai.reporting.ReportQueryException;

/**
 * Raised when a result cannot be written in the requested format.
 */
public class ExportException extends ReportQueryException {

	public ExportException(String message) {
		super(message);
	}

	public ExportException(String message, Throwable cause) {
		super(message, cause);
	}
}
