package org.javai.reporting.config;

import java.time.Duration;

/**
 * Limits applied when report SQL is executed.
 *
 * @param queryTimeout statement timeout handed to the JDBC driver; zero disables it
 * @param maxRows maximum rows materialized per execution; zero means driver default
 * @param fetchSize JDBC fetch size hint; zero means driver default
 * @param maxConcurrentQueries worker threads available for in-flight executions
 * @param defaultDeadline how long a pooled execution may take before it is cancelled
 */
public record ExecutionSettings(
		Duration queryTimeout,
		int maxRows,
		int fetchSize,
		int maxConcurrentQueries,
		Duration defaultDeadline) {

	public ExecutionSettings {
		queryTimeout = queryTimeout != null ? queryTimeout : Duration.ZERO;
		defaultDeadline = defaultDeadline != null ? defaultDeadline : Duration.ofSeconds(60);
		if (maxRows < 0 || fetchSize < 0) {
			throw new IllegalArgumentException("maxRows and fetchSize must not be negative");
		}
		if (maxConcurrentQueries < 1) {
			throw new IllegalArgumentException("maxConcurrentQueries must be at least 1");
		}
	}

	public static ExecutionSettings defaults() {
		return new ExecutionSettings(Duration.ofSeconds(30), 10_000, 500, 4, Duration.ofSeconds(60));
	}
}
