package org.javai.reporting.join;

import org.javai.reporting.query.ExplicitJoin;

/**
 * A join the schema's foreign keys support between two tables.
 *
 * @param table the table to join onto the report's primary table
 * @param condition ON condition with fully qualified columns
 * @param type join type, LEFT for every foreign-key suggestion
 * @param description human-readable explanation of the relationship
 */
public record JoinSuggestion(String table, String condition, String type, String description) {

	/**
	 * @return the entry to place in a report configuration's joins
	 */
	public ExplicitJoin toExplicitJoin() {
		return new ExplicitJoin(type, table, condition);
	}
}
