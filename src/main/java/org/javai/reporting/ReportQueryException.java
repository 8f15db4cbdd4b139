package org.javai.reporting;

/**
 * Base type for every failure the reporting engine reports by exception.
 *
 * <p>Execution failures are not part of this hierarchy: they are captured into a failed
 * {@link org.javai.reporting.exec.QueryResult}.</p>
 */
public class ReportQueryException extends RuntimeException {

	public ReportQueryException(String message) {
		super(message);
	}

	public ReportQueryException(String message, Throwable cause) {
		super(message, cause);
	}
}
