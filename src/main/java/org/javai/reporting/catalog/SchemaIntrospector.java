package org.javai.reporting.catalog;

import java.sql.SQLException;
import java.util.List;

/**
 * Source of schema metadata consumed by {@link SchemaCatalog#build}.
 */
public interface SchemaIntrospector {

	/**
	 * @return the names of all user tables, in a stable order
	 */
	List<String> tableNames() throws SQLException;

	/**
	 * @param table a name returned by {@link #tableNames()}
	 * @return the table's columns (ordinal order), primary key flags and foreign keys
	 */
	TableSchema describeTable(String table) throws SQLException;
}
