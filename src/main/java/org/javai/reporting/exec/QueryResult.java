package org.javai.reporting.exec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materialized outcome of one execution. Callers branch on {@link #success()}; execution errors
 * are reported here and never thrown.
 *
 * @param success whether the statement ran to completion
 * @param records rows keyed by column label, in result order; empty on failure
 * @param columns column labels in select order; empty on failure
 * @param rowCount number of records
 * @param executionTime wall-clock time spent executing and materializing
 * @param sql the executed SQL text
 * @param error failure message, null on success
 */
public record QueryResult(
		boolean success,
		List<Map<String, Object>> records,
		List<String> columns,
		int rowCount,
		Duration executionTime,
		String sql,
		String error) {

	public QueryResult {
		List<Map<String, Object>> rows = new ArrayList<>();
		if (records != null) {
			for (Map<String, Object> row : records) {
				rows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
			}
		}
		records = Collections.unmodifiableList(rows);
		columns = columns != null ? List.copyOf(columns) : List.of();
		executionTime = executionTime != null ? executionTime : Duration.ZERO;
	}

	public static QueryResult success(List<Map<String, Object>> records, List<String> columns,
			Duration executionTime, String sql) {
		return new QueryResult(true, records, columns, records.size(), executionTime, sql, null);
	}

	public static QueryResult failure(String sql, String error, Duration executionTime) {
		return new QueryResult(false, List.of(), List.of(), 0, executionTime, sql, error);
	}

	/**
	 * @return execution time in fractional seconds, as shown by report UIs
	 */
	public double executionSeconds() {
		return executionTime.toNanos() / 1_000_000_000.0;
	}
}
