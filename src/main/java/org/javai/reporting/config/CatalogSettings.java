package org.javai.reporting.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema catalog settings.
 *
 * @param excludedTablePrefixes tables whose name starts with one of these (case-insensitive) are not catalogued
 * @param displayNames explicit display names by table; unlisted tables get a humanized name
 * @param lookupTables referenced table name to the columns projected from it as enhanced columns
 */
public record CatalogSettings(
		List<String> excludedTablePrefixes,
		Map<String, String> displayNames,
		Map<String, List<String>> lookupTables) {

	public CatalogSettings {
		excludedTablePrefixes = excludedTablePrefixes != null ? List.copyOf(excludedTablePrefixes) : List.of();
		displayNames = displayNames != null ? Map.copyOf(displayNames) : Map.of();
		Map<String, List<String>> lookups = new LinkedHashMap<>();
		if (lookupTables != null) {
			lookupTables.forEach((table, columns) -> lookups.put(table, columns != null ? List.copyOf(columns) : List.of()));
		}
		lookupTables = Collections.unmodifiableMap(lookups);
	}

	public static CatalogSettings defaults() {
		Map<String, List<String>> lookups = new LinkedHashMap<>();
		lookups.put("statuses", List.of("name"));
		lookups.put("priorities", List.of("name"));
		lookups.put("users", List.of("username", "email"));
		return new CatalogSettings(
				List.of("alembic_", "flyway_", "databasechangelog", "sqlite_"),
				Map.of(),
				lookups);
	}

	/**
	 * @return true if the table is internal bookkeeping and should be left out of the catalog
	 */
	public boolean isExcluded(String table) {
		String lower = table.toLowerCase();
		return excludedTablePrefixes.stream().anyMatch(prefix -> lower.startsWith(prefix.toLowerCase()));
	}
}
