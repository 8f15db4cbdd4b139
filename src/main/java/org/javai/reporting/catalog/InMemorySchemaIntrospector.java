package org.javai.reporting.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link SchemaIntrospector} for tests or data stores described by hand.
 *
 * <pre>{@code
 * SchemaIntrospector schema = new InMemorySchemaIntrospector()
 *     .addTable("statuses")
 *     .addPrimaryKey("statuses", "id", "INTEGER")
 *     .addColumn("statuses", "name", "VARCHAR")
 *     .addTable("workorders")
 *     .addPrimaryKey("workorders", "id", "INTEGER")
 *     .addColumn("workorders", "status_id", "INTEGER")
 *     .addForeignKey("workorders", "status_id", "statuses", "id");
 * }</pre>
 */
public class InMemorySchemaIntrospector implements SchemaIntrospector {

	private final Map<String, TableBuilder> tables = new LinkedHashMap<>();

	public InMemorySchemaIntrospector addTable(String name) {
		tables.putIfAbsent(name, new TableBuilder());
		return this;
	}

	public InMemorySchemaIntrospector addColumn(String table, String name, String type) {
		return addColumn(table, name, type, true, false);
	}

	public InMemorySchemaIntrospector addPrimaryKey(String table, String name, String type) {
		return addColumn(table, name, type, false, true);
	}

	public InMemorySchemaIntrospector addColumn(String table, String name, String type,
			boolean nullable, boolean primaryKey) {
		builder(table).columns.put(name, new ColumnSchema(name, type, nullable, primaryKey));
		return this;
	}

	public InMemorySchemaIntrospector addForeignKey(String table, String localColumn,
			String referencedTable, String referencedColumn) {
		builder(table).foreignKeys.add(new ForeignKeyRef(localColumn, referencedTable, referencedColumn));
		return this;
	}

	@Override
	public List<String> tableNames() {
		return List.copyOf(tables.keySet());
	}

	@Override
	public TableSchema describeTable(String table) {
		TableBuilder builder = tables.get(table);
		if (builder == null) {
			return TableSchema.empty(table);
		}
		return new TableSchema(table, builder.columns, builder.foreignKeys);
	}

	private TableBuilder builder(String table) {
		TableBuilder builder = tables.get(table);
		if (builder == null) {
			throw new IllegalArgumentException("Table not found: " + table);
		}
		return builder;
	}

	private static final class TableBuilder {
		private final Map<String, ColumnSchema> columns = new LinkedHashMap<>();
		private final List<ForeignKeyRef> foreignKeys = new ArrayList<>();
	}
}
