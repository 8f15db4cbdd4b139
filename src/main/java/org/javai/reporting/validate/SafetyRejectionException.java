package org.javai.reporting.validate;

import org.javai.reporting.ReportQueryException;

/**
 * Raised when built SQL fails the safety gate. Execution must not proceed.
 *
 * <p>The message carries the rejection reason only, never the SQL text.</p>
 */
public class SafetyRejectionException extends ReportQueryException {

	public SafetyRejectionException(String reason) {
		super("Query rejected: " + reason);
	}
}
