package org.javai.reporting.query;

import java.util.List;
import org.javai.reporting.ReportQueryException;

/**
 * Thrown when a requested report column matches neither a base column of the primary table
 * nor a registered enhanced column.
 */
public class ColumnNotFoundException extends ReportQueryException {

	private final String column;
	private final String table;
	private final List<String> validColumns;

	public ColumnNotFoundException(String column, String table, List<String> validColumns) {
		super("Column '%s' not found in table '%s'. Valid columns: %s"
				.formatted(column, table, validColumns));
		this.column = column;
		this.table = table;
		this.validColumns = List.copyOf(validColumns);
	}

	public String column() {
		return column;
	}

	public String table() {
		return table;
	}

	public List<String> validColumns() {
		return validColumns;
	}
}
