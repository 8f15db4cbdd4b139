package org.javai.reporting.query;

import org.javai.reporting.ReportQueryException;

/**
 * Thrown when a SELECT statement cannot be assembled from a report configuration.
 */
public class QueryBuildException extends ReportQueryException {

	public QueryBuildException(String message) {
		super(message);
	}

	public QueryBuildException(String message, Throwable cause) {
		super(message, cause);
	}
}
