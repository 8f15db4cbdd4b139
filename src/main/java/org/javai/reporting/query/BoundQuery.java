package org.javai.reporting.query;

import java.util.List;

/**
 * SQL text with {@code ?} placeholders and the values to bind to them, in order.
 */
public record BoundQuery(String sql, List<String> parameters) {

	public BoundQuery {
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
	}

	public static BoundQuery of(String sql) {
		return new BoundQuery(sql, List.of());
	}
}
