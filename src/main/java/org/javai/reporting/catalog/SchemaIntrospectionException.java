package org.javai.reporting.catalog;

import org.javai.reporting.ReportQueryException;

/**
 * Thrown when the data store cannot list its tables at all. Failures on single tables do not raise this.
 */
public class SchemaIntrospectionException extends ReportQueryException {

	public SchemaIntrospectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
