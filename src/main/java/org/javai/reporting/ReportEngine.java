package org.javai.reporting;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import javax.sql.DataSource;
import org.javai.reporting.catalog.ColumnInfo;
import org.javai.reporting.catalog.EnhancedColumn;
import org.javai.reporting.catalog.JdbcSchemaIntrospector;
import org.javai.reporting.catalog.SchemaCatalog;
import org.javai.reporting.catalog.SchemaCatalogProvider;
import org.javai.reporting.catalog.TableSchema;
import org.javai.reporting.config.ReportingSettings;
import org.javai.reporting.exec.QueryExecutionPool;
import org.javai.reporting.exec.QueryExecutor;
import org.javai.reporting.exec.QueryResult;
import org.javai.reporting.export.ExportFormat;
import org.javai.reporting.export.ResultExporter;
import org.javai.reporting.join.JoinAdvisor;
import org.javai.reporting.join.JoinSuggestion;
import org.javai.reporting.query.BoundQuery;
import org.javai.reporting.query.QueryBuilder;
import org.javai.reporting.query.ReportConfig;
import org.javai.reporting.validate.ConfigValidationException;
import org.javai.reporting.validate.QueryValidator;
import org.javai.reporting.validate.SafetyVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for building, checking, running and exporting ad-hoc reports.
 *
 * <p>Every call works against one snapshot of the schema catalog, taken at the start of the call.
 * A typical request:</p>
 *
 * <pre>{@code
 * try (ReportEngine engine = ReportEngine.create(dataSource, new ReportingSettingsLoader().loadDefaultResource())) {
 *     QueryResult result = engine.run(config);
 *     if (result.success()) {
 *         byte[] xlsx = engine.exportSpreadsheet(result);
 *     }
 * }
 * }</pre>
 *
 * <p>Configuration and safety problems are thrown; data-store failures are reported in the
 * returned {@link QueryResult}.</p>
 */
public class ReportEngine implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ReportEngine.class);

	private final SchemaCatalogProvider catalogs;
	private final ReportingSettings settings;
	private final QueryValidator validator = new QueryValidator();
	private final QueryExecutor executor;
	private final QueryExecutionPool pool;
	private final ResultExporter exporter;
	private final Clock clock;

	public ReportEngine(SchemaCatalogProvider catalogs, DataSource dataSource, ReportingSettings settings) {
		this(catalogs, dataSource, settings, Clock.systemDefaultZone());
	}

	ReportEngine(SchemaCatalogProvider catalogs, DataSource dataSource, ReportingSettings settings, Clock clock) {
		this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
		this.settings = Objects.requireNonNull(settings, "settings");
		this.clock = Objects.requireNonNull(clock, "clock");
		this.executor = new QueryExecutor(dataSource, settings.execution());
		this.pool = new QueryExecutionPool(executor, settings.execution());
		this.exporter = new ResultExporter(settings.export(), clock);
	}

	/**
	 * Creates an engine that introspects the schema through the data source's JDBC metadata.
	 */
	public static ReportEngine create(DataSource dataSource, ReportingSettings settings) {
		SchemaCatalogProvider catalogs =
				new SchemaCatalogProvider(new JdbcSchemaIntrospector(dataSource), settings.catalog());
		return new ReportEngine(catalogs, dataSource, settings);
	}

	public SchemaCatalog catalog() {
		return catalogs.current();
	}

	/**
	 * @return table name to display name, in catalog order
	 */
	public Map<String, String> listTables() {
		return catalog().listTables();
	}

	public List<String> getColumns(String table) {
		return catalog().getColumns(table);
	}

	public List<EnhancedColumn> getEnhancedColumns(String table) {
		return catalog().getEnhancedColumns(table);
	}

	public List<ColumnInfo> describeColumns(String table) {
		return catalog().describeColumns(table);
	}

	/**
	 * @return SQL with filter values inlined, for display
	 */
	public String buildQuery(ReportConfig config) {
		return new QueryBuilder(catalog()).build(config);
	}

	public BoundQuery buildBoundQuery(ReportConfig config) {
		return new QueryBuilder(catalog()).buildBound(config);
	}

	public List<String> validateConfig(ReportConfig config) {
		return validator.validateConfig(config);
	}

	public SafetyVerdict validateSafety(String sql) {
		return validator.validateQuerySafety(sql);
	}

	/**
	 * Runs caller-supplied SQL after the safety check.
	 *
	 * @throws org.javai.reporting.validate.SafetyRejectionException if the SQL is not a plain SELECT
	 */
	public QueryResult execute(String sql) {
		validator.validateQuerySafety(sql).orThrow();
		return pool.run(BoundQuery.of(sql));
	}

	public QueryResult run(ReportConfig config) {
		return run(config, settings.execution().defaultDeadline());
	}

	/**
	 * Validates the configuration, builds the parameterized statement, checks it and executes it.
	 *
	 * @throws ConfigValidationException if the configuration is incomplete
	 * @throws org.javai.reporting.query.ColumnNotFoundException if a column does not resolve
	 * @throws org.javai.reporting.validate.SafetyRejectionException if the built SQL fails the safety check
	 */
	public QueryResult run(ReportConfig config, Duration deadline) {
		List<String> errors = validator.validateConfig(config);
		if (!errors.isEmpty()) {
			throw new ConfigValidationException(errors);
		}
		BoundQuery query = buildBoundQuery(config);
		validator.validateQuerySafety(query.sql()).orThrow();
		logger.debug("Running report on {} with {} parameter(s)", config.primaryTable(), query.parameters().size());
		return pool.run(query, deadline);
	}

	public String exportCsv(QueryResult result) {
		return exporter.toCsv(result);
	}

	public byte[] exportSpreadsheet(QueryResult result) {
		return exporter.toSpreadsheet(result);
	}

	/**
	 * @return a one-page PDF preview titled with the configured sheet name
	 */
	public byte[] exportPdf(QueryResult result) {
		return exporter.toPdf(result);
	}

	public byte[] export(QueryResult result, ExportFormat format) {
		return exporter.export(result, format);
	}

	/**
	 * @return a timestamped download name such as {@code custom_report_20240131_154500.xlsx}
	 */
	public String exportFileName(ExportFormat format) {
		return format.fileName(settings.export().fileNamePrefix(), clock);
	}

	public List<JoinSuggestion> suggestJoins(String tableA, String tableB) {
		return new JoinAdvisor(catalog()).suggestJoins(tableA, tableB);
	}

	/**
	 * @throws org.javai.reporting.catalog.UnknownTableException if the table is not in the catalog
	 */
	public TableInfo tableInfo(String table) {
		SchemaCatalog catalog = catalog();
		TableSchema schema = catalog.table(table);
		QueryResult count = pool.run(BoundQuery.of("SELECT COUNT(*) AS row_count FROM " + schema.name()));
		OptionalLong rowCount = OptionalLong.empty();
		if (!count.success()) {
			logger.warn("Unable to count rows of table {}: {}", schema.name(), count.error());
		} else if (!count.records().isEmpty()) {
			Object value = count.records().get(0).values().iterator().next();
			if (value instanceof Number number) {
				rowCount = OptionalLong.of(number.longValue());
			}
		}
		return new TableInfo(schema.name(), catalog.displayName(schema.name()),
				catalog.describeColumns(schema.name()), rowCount);
	}

	public SchemaCatalog refreshCatalog() {
		return catalogs.refresh();
	}

	@Override
	public void close() {
		pool.close();
	}
}
