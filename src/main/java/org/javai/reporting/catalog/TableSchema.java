package org.javai.reporting.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Columns and foreign keys of one table. Column order is the data store's ordinal order.
 */
public record TableSchema(String name, Map<String, ColumnSchema> columns, List<ForeignKeyRef> foreignKeys) {

	public TableSchema {
		columns = columns != null ? Collections.unmodifiableMap(new LinkedHashMap<>(columns)) : Map.of();
		foreignKeys = foreignKeys != null ? List.copyOf(foreignKeys) : List.of();
	}

	/**
	 * Placeholder for a table that could not be introspected.
	 */
	public static TableSchema empty(String name) {
		return new TableSchema(name, Map.of(), List.of());
	}

	public List<String> columnNames() {
		return List.copyOf(columns.keySet());
	}

	public Optional<ColumnSchema> column(String columnName) {
		return Optional.ofNullable(columns.get(columnName));
	}

	public boolean hasColumn(String columnName) {
		return columns.containsKey(columnName);
	}

	public List<ForeignKeyRef> foreignKeysTo(String referencedTable) {
		return foreignKeys.stream()
				.filter(fk -> fk.referencedTable().equals(referencedTable))
				.toList();
	}
}
