package org.javai.reporting;

import java.util.List;
import java.util.OptionalLong;
import org.javai.reporting.catalog.ColumnInfo;

/**
 * Summary of one table for report builder screens.
 *
 * @param table the table name
 * @param displayName human-readable table name
 * @param columns base columns with display names and types
 * @param rowCount current number of rows, empty when counting failed
 */
public record TableInfo(String table, String displayName, List<ColumnInfo> columns, OptionalLong rowCount) {

	public TableInfo {
		columns = List.copyOf(columns);
	}

	public int columnCount() {
		return columns.size();
	}
}
