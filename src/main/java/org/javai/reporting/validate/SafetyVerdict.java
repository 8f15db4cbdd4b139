package org.javai.reporting.validate;

/**
 * Outcome of {@link QueryValidator#validateQuerySafety}.
 *
 * @param safe whether the statement may be executed
 * @param reason why it was rejected, or a confirmation message
 */
public record SafetyVerdict(boolean safe, String reason) {

	static SafetyVerdict accepted() {
		return new SafetyVerdict(true, "Query is safe");
	}

	static SafetyVerdict rejected(String reason) {
		return new SafetyVerdict(false, reason);
	}

	/**
	 * @throws SafetyRejectionException unless the verdict is safe
	 */
	public void orThrow() {
		if (!safe) {
			throw new SafetyRejectionException(reason);
		}
	}
}
