package org.javai.reporting.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;

/**
 * Comparison operators available to report filters.
 */
public enum FilterOperator {

	EQ("eq", "equals"),
	NE("ne", "not_equals"),
	GT("gt", "greater_than"),
	GE("ge"),
	LT("lt", "less_than"),
	LE("le"),
	LIKE("like"),
	ILIKE("ilike"),
	IN("in"),
	NOT_IN("not_in"),
	BETWEEN("between"),
	IS_NULL("is_null"),
	IS_NOT_NULL("is_not_null"),
	STARTS_WITH("starts_with"),
	ENDS_WITH("ends_with"),
	CONTAINS("contains");

	private final String token;
	private final List<String> aliases;

	FilterOperator(String token, String... aliases) {
		this.token = token;
		this.aliases = List.of(aliases);
	}

	@JsonValue
	public String token() {
		return token;
	}

	/**
	 * @return false for the null checks, which compare against nothing
	 */
	public boolean requiresValue() {
		return this != IS_NULL && this != IS_NOT_NULL;
	}

	public boolean requiresSecondValue() {
		return this == BETWEEN;
	}

	/**
	 * Resolves an operator from its token, case-insensitively. The names used by earlier report
	 * builders ({@code equals}, {@code not_equals}, {@code greater_than}, {@code less_than}) are accepted too.
	 *
	 * @throws IllegalArgumentException for an unknown token
	 */
	@JsonCreator
	public static FilterOperator fromToken(String token) {
		if (token == null) {
			return null;
		}
		String normalized = token.trim().toLowerCase();
		return Arrays.stream(values())
				.filter(op -> op.token.equals(normalized) || op.aliases.contains(normalized))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown filter operator: " + token));
	}

	@Override
	public String toString() {
		return token;
	}
}
