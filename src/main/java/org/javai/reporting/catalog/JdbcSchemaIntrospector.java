package org.javai.reporting.catalog;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.sql.DataSource;

/**
 * {@link SchemaIntrospector} backed by JDBC {@link DatabaseMetaData}.
 *
 * <p>Each call borrows its own connection from the data source, so a failure while describing one
 * table does not poison the others.</p>
 */
public class JdbcSchemaIntrospector implements SchemaIntrospector {

	private static final String[] TABLE_TYPES = {"TABLE"};

	private final DataSource dataSource;
	private final String catalog;
	private final String schemaPattern;

	/**
	 * @param dataSource source of connections
	 * @param catalog JDBC catalog to restrict to, or null for any
	 * @param schemaPattern JDBC schema pattern to restrict to, or null for any
	 */
	public JdbcSchemaIntrospector(DataSource dataSource, String catalog, String schemaPattern) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
		this.catalog = catalog;
		this.schemaPattern = schemaPattern;
	}

	public JdbcSchemaIntrospector(DataSource dataSource) {
		this(dataSource, null, null);
	}

	@Override
	public List<String> tableNames() throws SQLException {
		try (Connection connection = dataSource.getConnection()) {
			DatabaseMetaData metaData = connection.getMetaData();
			List<String> names = new ArrayList<>();
			try (ResultSet rs = metaData.getTables(catalog, schemaPattern, "%", TABLE_TYPES)) {
				while (rs.next()) {
					names.add(rs.getString("TABLE_NAME"));
				}
			}
			return names;
		}
	}

	@Override
	public TableSchema describeTable(String table) throws SQLException {
		try (Connection connection = dataSource.getConnection()) {
			DatabaseMetaData metaData = connection.getMetaData();

			Set<String> primaryKey = new HashSet<>();
			try (ResultSet rs = metaData.getPrimaryKeys(catalog, schemaPattern, table)) {
				while (rs.next()) {
					primaryKey.add(rs.getString("COLUMN_NAME"));
				}
			}

			Map<String, ColumnSchema> columns = new LinkedHashMap<>();
			try (ResultSet rs = metaData.getColumns(catalog, schemaPattern, table, "%")) {
				while (rs.next()) {
					String name = rs.getString("COLUMN_NAME");
					boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
					columns.put(name, new ColumnSchema(name, rs.getString("TYPE_NAME"), nullable,
							primaryKey.contains(name)));
				}
			}

			List<ForeignKeyRef> foreignKeys = new ArrayList<>();
			try (ResultSet rs = metaData.getImportedKeys(catalog, schemaPattern, table)) {
				while (rs.next()) {
					foreignKeys.add(new ForeignKeyRef(
							rs.getString("FKCOLUMN_NAME"),
							rs.getString("PKTABLE_NAME"),
							rs.getString("PKCOLUMN_NAME")));
				}
			}
			return new TableSchema(table, columns, foreignKeys);
		}
	}
}
