package org.javai.reporting.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link ReportingSettings} from YAML. Absent sections and keys fall back to
 * the defaults of the corresponding settings record.
 *
 * <pre>{@code
 * catalog:
 *   excluded_table_prefixes: [alembic_, flyway_]
 *   display_names:
 *     work_orders: Work Orders
 *   lookup_tables:
 *     statuses: [name]
 *     users: [username, email]
 * execution:
 *   query_timeout_seconds: 30
 *   max_rows: 10000
 *   fetch_size: 500
 *   max_concurrent_queries: 4
 *   deadline_seconds: 60
 * export:
 *   sheet_name: Report
 *   file_name_prefix: custom_report
 * }</pre>
 */
public class ReportingSettingsLoader {

	/** Classpath resource consulted by {@link #loadDefaultResource()}. */
	public static final String DEFAULT_RESOURCE = "reporting.yml";

	private final Yaml yaml = new Yaml();

	public ReportingSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (ReportingSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new ReportingSettingsException("Failed to read reporting settings from path: " + path, e);
		}
	}

	public ReportingSettings load(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildSettings(data);
		} catch (ReportingSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new ReportingSettingsException("Failed to read reporting settings from input stream", e);
		}
	}

	public ReportingSettings load(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildSettings(data);
		} catch (ReportingSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new ReportingSettingsException("Failed to read reporting settings from reader", e);
		}
	}

	public ReportingSettings loadString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildSettings(data);
		} catch (ReportingSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new ReportingSettingsException("Failed to read reporting settings from string", e);
		}
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the built-in defaults when it is absent.
	 */
	public ReportingSettings loadDefaultResource() {
		InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			return ReportingSettings.defaults();
		}
		try (in) {
			return load(in);
		} catch (IOException e) {
			throw new ReportingSettingsException("Failed to close " + DEFAULT_RESOURCE, e);
		}
	}

	private ReportingSettings buildSettings(Map<String, Object> data) {
		if (data == null) {
			return ReportingSettings.defaults();
		}
		return new ReportingSettings(
				buildCatalog(section(data, "catalog")),
				buildExecution(section(data, "execution")),
				buildExport(section(data, "export")));
	}

	private CatalogSettings buildCatalog(Map<String, Object> data) {
		CatalogSettings defaults = CatalogSettings.defaults();
		if (data == null) {
			return defaults;
		}
		List<String> prefixes = data.containsKey("excluded_table_prefixes")
				? stringList(data.get("excluded_table_prefixes"), "catalog.excluded_table_prefixes")
				: defaults.excludedTablePrefixes();

		Map<String, String> displayNames = new LinkedHashMap<>();
		Map<String, Object> names = section(data, "display_names");
		if (names != null) {
			names.forEach((table, name) -> displayNames.put(table, String.valueOf(name)));
		}

		Map<String, List<String>> lookups;
		Map<String, Object> lookupSection = section(data, "lookup_tables");
		if (lookupSection == null) {
			lookups = defaults.lookupTables();
		} else {
			lookups = new LinkedHashMap<>();
			for (Map.Entry<String, Object> entry : lookupSection.entrySet()) {
				lookups.put(entry.getKey(),
						stringList(entry.getValue(), "catalog.lookup_tables." + entry.getKey()));
			}
		}
		return new CatalogSettings(prefixes, displayNames, lookups);
	}

	private ExecutionSettings buildExecution(Map<String, Object> data) {
		ExecutionSettings defaults = ExecutionSettings.defaults();
		if (data == null) {
			return defaults;
		}
		try {
			return new ExecutionSettings(
					Duration.ofSeconds(intValue(data, "query_timeout_seconds", (int) defaults.queryTimeout().toSeconds())),
					intValue(data, "max_rows", defaults.maxRows()),
					intValue(data, "fetch_size", defaults.fetchSize()),
					intValue(data, "max_concurrent_queries", defaults.maxConcurrentQueries()),
					Duration.ofSeconds(intValue(data, "deadline_seconds", (int) defaults.defaultDeadline().toSeconds())));
		} catch (IllegalArgumentException e) {
			throw new ReportingSettingsException("Invalid execution settings: " + e.getMessage(), e);
		}
	}

	private ExportSettings buildExport(Map<String, Object> data) {
		if (data == null) {
			return ExportSettings.defaults();
		}
		return new ExportSettings(
				(String) data.get("sheet_name"),
				(String) data.get("file_name_prefix"));
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return null;
		}
		if (!(value instanceof Map)) {
			throw new ReportingSettingsException("Settings key '" + key + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static List<String> stringList(Object value, String key) {
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new ReportingSettingsException("Settings key '" + key + "' must be a list");
		}
		List<String> result = new ArrayList<>();
		for (Object item : list) {
			result.add(String.valueOf(item));
		}
		return result;
	}

	private static int intValue(Map<String, Object> data, String key, int fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		throw new ReportingSettingsException("Settings key '" + key + "' must be a number, got: " + value);
	}
}
