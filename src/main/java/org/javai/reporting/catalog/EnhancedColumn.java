package org.javai.reporting.catalog;

import java.util.Optional;

/**
 * A selectable report column: either a base column of the table (no join) or a column of a
 * lookup table reached through a foreign key, named {@code <lookupTable>.<column>}.
 */
public record EnhancedColumn(String name, String displayName, String type, JoinDescriptor join) {

	public static EnhancedColumn base(ColumnSchema column) {
		return new EnhancedColumn(column.name(), Names.humanize(column.name()), column.type(), null);
	}

	public Optional<JoinDescriptor> joinDescriptor() {
		return Optional.ofNullable(join);
	}

	public boolean isDerived() {
		return join != null;
	}
}
