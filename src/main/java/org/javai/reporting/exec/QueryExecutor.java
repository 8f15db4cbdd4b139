package org.javai.reporting.exec;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.sql.DataSource;
import org.javai.reporting.config.ExecutionSettings;
import org.javai.reporting.query.BoundQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs report SQL over JDBC and materializes every row eagerly.
 *
 * <p>Nothing escapes this class as an exception: connection, driver and conversion failures all
 * produce a failed {@link QueryResult} carrying the message and the SQL text. Result size is bounded
 * by the report's LIMIT and by {@link ExecutionSettings#maxRows()}; a result that reaches the row cap is
 * logged at WARN.</p>
 *
 * <p>Timestamps are rendered as {@code yyyy-MM-dd HH:mm:ss} strings. When two result columns share a
 * label, the later ones get a {@code _2}, {@code _3}... suffix.</p>
 */
public class QueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

	private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private final DataSource dataSource;
	private final ExecutionSettings settings;

	public QueryExecutor(DataSource dataSource, ExecutionSettings settings) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	public QueryExecutor(DataSource dataSource) {
		this(dataSource, ExecutionSettings.defaults());
	}

	public QueryResult execute(String sql) {
		return execute(BoundQuery.of(sql), CancellationToken.create());
	}

	public QueryResult execute(BoundQuery query) {
		return execute(query, CancellationToken.create());
	}

	public QueryResult execute(BoundQuery query, CancellationToken token) {
		long start = System.nanoTime();
		String sql = query != null ? query.sql() : null;
		if (sql == null || sql.isBlank()) {
			return QueryResult.failure(sql, "No SQL to execute", elapsedSince(start));
		}
		if (token.isCancelled()) {
			return QueryResult.failure(sql, "Query was cancelled", elapsedSince(start));
		}

		try (Connection connection = dataSource.getConnection();
				PreparedStatement statement = connection.prepareStatement(sql)) {
			applySettings(statement);
			List<String> parameters = query.parameters();
			for (int i = 0; i < parameters.size(); i++) {
				statement.setObject(i + 1, parameters.get(i));
			}
			if (!token.attach(statement)) {
				return QueryResult.failure(sql, "Query was cancelled", elapsedSince(start));
			}
			try (ResultSet rs = statement.executeQuery()) {
				QueryResult result = materialize(rs, sql, start);
				logger.debug("Report query returned {} row(s) in {} ms", result.rowCount(), result.executionTime().toMillis());
				if (settings.maxRows() > 0 && result.rowCount() >= settings.maxRows()) {
					logger.warn("Report query reached the row cap of {}; the result may be incomplete", settings.maxRows());
				}
				return result;
			} finally {
				token.detach();
			}
		} catch (SQLException | RuntimeException e) {
			Duration elapsed = elapsedSince(start);
			String message = token.isCancelled()
					? "Query was cancelled"
					: (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
			logger.warn("Report query failed after {} ms: {}", elapsed.toMillis(), message);
			return QueryResult.failure(sql, message, elapsed);
		}
	}

	private void applySettings(PreparedStatement statement) throws SQLException {
		long timeoutSeconds = settings.queryTimeout().toSeconds();
		if (timeoutSeconds > 0) {
			statement.setQueryTimeout((int) Math.min(timeoutSeconds, Integer.MAX_VALUE));
		}
		if (settings.maxRows() > 0) {
			statement.setMaxRows(settings.maxRows());
		}
		if (settings.fetchSize() > 0) {
			statement.setFetchSize(settings.fetchSize());
		}
	}

	private static QueryResult materialize(ResultSet rs, String sql, long start) throws SQLException {
		List<String> columns = columnLabels(rs.getMetaData());
		List<Map<String, Object>> records = new ArrayList<>();
		while (rs.next()) {
			Map<String, Object> record = new LinkedHashMap<>();
			for (int i = 0; i < columns.size(); i++) {
				record.put(columns.get(i), convert(rs.getObject(i + 1)));
			}
			records.add(record);
		}
		return QueryResult.success(records, columns, elapsedSince(start), sql);
	}

	private static List<String> columnLabels(ResultSetMetaData metaData) throws SQLException {
		List<String> labels = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (int i = 1; i <= metaData.getColumnCount(); i++) {
			String label = metaData.getColumnLabel(i);
			if (label == null || label.isBlank()) {
				label = metaData.getColumnName(i);
			}
			String unique = label;
			for (int n = 2; !seen.add(unique); n++) {
				unique = label + "_" + n;
			}
			labels.add(unique);
		}
		return labels;
	}

	private static Object convert(Object value) {
		if (value instanceof Timestamp timestamp) {
			return timestamp.toLocalDateTime().format(TIMESTAMP_FORMAT);
		}
		if (value instanceof LocalDateTime dateTime) {
			return dateTime.format(TIMESTAMP_FORMAT);
		}
		if (value instanceof java.sql.Date date) {
			return date.toLocalDate().toString();
		}
		return value;
	}

	private static Duration elapsedSince(long start) {
		return Duration.ofNanos(System.nanoTime() - start);
	}
}
