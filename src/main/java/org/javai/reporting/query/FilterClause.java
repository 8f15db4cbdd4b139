package org.javai.reporting.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One WHERE condition of a report.
 *
 * @param column column the condition applies to, optionally table-qualified
 * @param operator comparison operator
 * @param value compared value; a comma-separated list for {@code in}/{@code not_in}; unused by the null checks
 * @param value2 upper bound, only for {@code between}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterClause(
		@JsonProperty("column") @JsonAlias("field") String column,
		@JsonProperty("operator") FilterOperator operator,
		@JsonProperty("value") String value,
		@JsonProperty("value2") String value2) {

	public static FilterClause of(String column, FilterOperator operator, String value) {
		return new FilterClause(column, operator, value, null);
	}

	public static FilterClause between(String column, String from, String to) {
		return new FilterClause(column, FilterOperator.BETWEEN, from, to);
	}

	public static FilterClause isNull(String column) {
		return new FilterClause(column, FilterOperator.IS_NULL, null, null);
	}

	public boolean hasValue() {
		return value != null && !value.isEmpty();
	}

	public boolean hasValue2() {
		return value2 != null && !value2.isEmpty();
	}
}
