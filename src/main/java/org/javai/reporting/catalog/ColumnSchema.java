package org.javai.reporting.catalog;

/**
 * A base column as reported by the data store.
 *
 * @param name column name
 * @param type data store type name (e.g. "VARCHAR", "INTEGER")
 * @param nullable whether the column accepts nulls
 * @param primaryKey whether the column is part of the table's primary key
 */
public record ColumnSchema(String name, String type, boolean nullable, boolean primaryKey) {
}
