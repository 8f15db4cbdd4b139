package org.javai.reporting.catalog;

import java.util.List;
import org.javai.reporting.ReportQueryException;

/**
 * Thrown when a table name is not present in the schema catalog.
 */
public class UnknownTableException extends ReportQueryException {

	private final String table;
	private final List<String> availableTables;

	public UnknownTableException(String table, List<String> availableTables) {
		super("Unknown table: " + table + ". Available tables: " + availableTables);
		this.table = table;
		this.availableTables = List.copyOf(availableTables);
	}

	public String table() {
		return table;
	}

	public List<String> availableTables() {
		return availableTables;
	}
}
