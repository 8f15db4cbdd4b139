package org.javai.reporting.catalog;

/**
 * A single-column foreign key of a table.
 *
 * @param localColumn the referencing column in the owning table
 * @param referencedTable the referenced table
 * @param referencedColumn the referenced column, typically the primary key
 */
public record ForeignKeyRef(String localColumn, String referencedTable, String referencedColumn) {
}
