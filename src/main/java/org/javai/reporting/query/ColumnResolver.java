package org.javai.reporting.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.reporting.catalog.EnhancedColumn;
import org.javai.reporting.catalog.JoinDescriptor;
import org.javai.reporting.catalog.SchemaCatalog;

/**
 * Resolves requested report columns against one catalog snapshot.
 *
 * <p>A name that exactly matches an enhanced column of the primary table is kept as written and
 * contributes that column's join. Any other name loses its table prefix and must be a base column of
 * the primary table; it is then re-qualified with the primary table. Joins are returned once per
 * (table, local key, foreign key), in order of first use.</p>
 */
public class ColumnResolver {

	private final SchemaCatalog catalog;

	public ColumnResolver(SchemaCatalog catalog) {
		this.catalog = Objects.requireNonNull(catalog, "catalog");
	}

	/**
	 * @throws org.javai.reporting.catalog.UnknownTableException if the primary table is not catalogued
	 * @throws ColumnNotFoundException if a column resolves to nothing
	 */
	public ResolvedColumns resolve(String primaryTable, List<String> requestedColumns) {
		List<String> baseColumns = catalog.getColumns(primaryTable);

		List<String> expressions = new ArrayList<>();
		Map<JoinDescriptor.Key, JoinDescriptor> joins = new LinkedHashMap<>();

		for (String requested : requestedColumns) {
			if (requested == null || requested.isBlank()) {
				throw new ColumnNotFoundException(String.valueOf(requested), primaryTable, validColumns(primaryTable));
			}
			Optional<EnhancedColumn> derived = catalog.findDerivedColumn(primaryTable, requested);
			if (derived.isPresent()) {
				JoinDescriptor join = derived.get().join();
				joins.putIfAbsent(join.key(), join);
				expressions.add(requested);
				continue;
			}
			String baseName = stripTablePrefix(requested);
			if (!baseColumns.contains(baseName)) {
				throw new ColumnNotFoundException(requested, primaryTable, validColumns(primaryTable));
			}
			expressions.add(primaryTable + "." + baseName);
		}
		return new ResolvedColumns(expressions, new ArrayList<>(joins.values()));
	}

	private List<String> validColumns(String primaryTable) {
		return catalog.getEnhancedColumns(primaryTable).stream()
				.map(EnhancedColumn::name)
				.toList();
	}

	private static String stripTablePrefix(String column) {
		int dot = column.lastIndexOf('.');
		return dot >= 0 ? column.substring(dot + 1) : column;
	}
}
