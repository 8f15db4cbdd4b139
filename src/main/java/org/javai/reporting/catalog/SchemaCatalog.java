package org.javai.reporting.catalog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.reporting.config.CatalogSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable snapshot of the reportable schema: tables, their columns and foreign keys, display
 * names, and the enhanced columns derived from foreign keys into lookup tables.
 *
 * <p>A snapshot never changes after construction and may be shared between threads freely.
 * To pick up schema changes build a new one, usually through {@link SchemaCatalogProvider#refresh()}.</p>
 *
 * <h2>Enhanced columns</h2>
 *
 * <p>For every foreign key whose referenced table appears in
 * {@link CatalogSettings#lookupTables()}, the configured columns of that lookup table become
 * selectable from the referencing table under the name {@code <lookupTable>.<column>}:</p>
 *
 * <pre>{@code
 * // workorders.status_id -> statuses.id, lookup_tables: {statuses: [name]}
 * catalog.getEnhancedColumns("workorders");
 * // [id, title, status_id, statuses.name (join statuses on status_id = id)]
 * }</pre>
 *
 * <p>Only the first foreign key from a table to a given lookup table is used; self references
 * are ignored.</p>
 */
public final class SchemaCatalog {

	private static final Logger logger = LoggerFactory.getLogger(SchemaCatalog.class);

	private final Map<String, TableSchema> tables;
	private final Map<String, String> displayNames;
	private final Map<String, List<EnhancedColumn>> derivedColumns;
	private final Instant builtAt;

	private SchemaCatalog(Map<String, TableSchema> tables, CatalogSettings settings, Instant builtAt) {
		this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
		this.builtAt = builtAt;

		Map<String, String> names = new LinkedHashMap<>();
		for (String table : this.tables.keySet()) {
			names.put(table, settings.displayNames().getOrDefault(table, Names.humanize(table)));
		}
		this.displayNames = Collections.unmodifiableMap(names);

		Map<String, List<EnhancedColumn>> derived = new LinkedHashMap<>();
		for (TableSchema table : this.tables.values()) {
			derived.put(table.name(), deriveColumns(table, settings.lookupTables()));
		}
		this.derivedColumns = Collections.unmodifiableMap(derived);
	}

	/**
	 * Introspects the data store and builds a snapshot.
	 *
	 * <p>Tables matching an excluded prefix are skipped. A table whose description fails is
	 * catalogued with no columns and the build continues.</p>
	 *
	 * @throws SchemaIntrospectionException if the table list itself cannot be read
	 */
	public static SchemaCatalog build(SchemaIntrospector introspector, CatalogSettings settings) {
		Objects.requireNonNull(introspector, "introspector");
		Objects.requireNonNull(settings, "settings");

		List<String> names;
		try {
			names = introspector.tableNames();
		} catch (Exception e) {
			throw new SchemaIntrospectionException("Unable to list tables: " + e.getMessage(), e);
		}

		Map<String, TableSchema> tables = new LinkedHashMap<>();
		int failures = 0;
		for (String name : names) {
			if (settings.isExcluded(name)) {
				logger.debug("Skipping internal table {}", name);
				continue;
			}
			try {
				tables.put(name, introspector.describeTable(name));
			} catch (Exception e) {
				failures++;
				logger.warn("Unable to introspect table {}; cataloguing it without columns: {}", name, e.getMessage());
				tables.put(name, TableSchema.empty(name));
			}
		}
		logger.info("Schema catalog built with {} table(s), {} introspection failure(s)", tables.size(), failures);
		return new SchemaCatalog(tables, settings, Instant.now());
	}

	/**
	 * Builds a snapshot from already known table schemas.
	 */
	public static SchemaCatalog of(Collection<TableSchema> tables, CatalogSettings settings) {
		Map<String, TableSchema> byName = new LinkedHashMap<>();
		for (TableSchema table : tables) {
			byName.put(table.name(), table);
		}
		return new SchemaCatalog(byName, settings, Instant.now());
	}

	public Map<String, TableSchema> tables() {
		return tables;
	}

	public List<String> tableNames() {
		return List.copyOf(tables.keySet());
	}

	public boolean hasTable(String table) {
		return table != null && tables.containsKey(table);
	}

	public Instant builtAt() {
		return builtAt;
	}

	/**
	 * @throws UnknownTableException if the table is not catalogued
	 */
	public TableSchema table(String table) {
		TableSchema schema = table != null ? tables.get(table) : null;
		if (schema == null) {
			throw new UnknownTableException(table, tableNames());
		}
		return schema;
	}

	/**
	 * @return table name to display name, in catalog order
	 */
	public Map<String, String> listTables() {
		return displayNames;
	}

	public String displayName(String table) {
		table(table);
		return displayNames.get(table);
	}

	/**
	 * @return the base column names of the table in catalog order
	 */
	public List<String> getColumns(String table) {
		return table(table).columnNames();
	}

	/**
	 * @return base columns followed by the foreign-key derived columns of the table
	 */
	public List<EnhancedColumn> getEnhancedColumns(String table) {
		TableSchema schema = table(table);
		List<EnhancedColumn> result = new ArrayList<>();
		for (ColumnSchema column : schema.columns().values()) {
			result.add(EnhancedColumn.base(column));
		}
		result.addAll(derivedColumns.get(table));
		return result;
	}

	/**
	 * Looks up a foreign-key derived column of the table by its exact name.
	 */
	public Optional<EnhancedColumn> findDerivedColumn(String table, String columnName) {
		return derivedColumns.getOrDefault(table, List.of()).stream()
				.filter(c -> c.name().equals(columnName))
				.findFirst();
	}

	public List<ColumnInfo> describeColumns(String table) {
		return table(table).columns().values().stream()
				.map(c -> new ColumnInfo(c.name(), Names.humanize(c.name()), c.type()))
				.toList();
	}

	public Optional<String> columnType(String table, String column) {
		return table(table).column(column).map(ColumnSchema::type);
	}

	private List<EnhancedColumn> deriveColumns(TableSchema table, Map<String, List<String>> lookupTables) {
		List<EnhancedColumn> result = new ArrayList<>();
		Set<String> joinedTargets = new HashSet<>();
		for (ForeignKeyRef fk : table.foreignKeys()) {
			String target = fk.referencedTable();
			List<String> projected = lookupTables.get(target);
			if (projected == null || target.equals(table.name())) {
				continue;
			}
			TableSchema targetSchema = tables.get(target);
			if (targetSchema == null) {
				continue;
			}
			if (!joinedTargets.add(target)) {
				logger.debug("Ignoring additional foreign key {}.{} to lookup table {}",
						table.name(), fk.localColumn(), target);
				continue;
			}
			String targetDisplayName = displayNames.get(target);
			JoinDescriptor join = new JoinDescriptor(target, fk.localColumn(), fk.referencedColumn(), targetDisplayName);
			for (String columnName : projected) {
				targetSchema.column(columnName).ifPresent(column -> result.add(new EnhancedColumn(
						target + "." + column.name(),
						targetDisplayName + " " + Names.humanize(column.name()),
						column.type(),
						join)));
			}
		}
		return List.copyOf(result);
	}
}
