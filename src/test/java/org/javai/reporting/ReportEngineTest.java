package org.javai.reporting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import javax.sql.DataSource;
import org.javai.reporting.catalog.InMemorySchemaIntrospector;
import org.javai.reporting.catalog.SchemaCatalogProvider;
import org.javai.reporting.catalog.UnknownTableException;
import org.javai.reporting.config.ReportingSettings;
import org.javai.reporting.exec.QueryResult;
import org.javai.reporting.export.ExportFormat;
import org.javai.reporting.query.ColumnNotFoundException;
import org.javai.reporting.query.FilterOperator;
import org.javai.reporting.query.ReportConfig;
import org.javai.reporting.testsupport.ReportingFixtures;
import org.javai.reporting.validate.ConfigValidationException;
import org.javai.reporting.validate.SafetyRejectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

@DisplayName("ReportEngine")
class ReportEngineTest {

	@Mock
	private DataSource dataSource;

	@Mock
	private Connection connection;

	@Mock
	private PreparedStatement statement;

	@Mock
	private ResultSet resultSet;

	@Mock
	private ResultSetMetaData metaData;

	private InMemorySchemaIntrospector schema;
	private ReportEngine engine;

	ReportEngineTest() {
		MockitoAnnotations.openMocks(this);
	}

	@BeforeEach
	void setUp() throws SQLException {
		when(dataSource.getConnection()).thenReturn(connection);
		when(connection.prepareStatement(anyString())).thenReturn(statement);
		when(statement.executeQuery()).thenReturn(resultSet);
		when(resultSet.getMetaData()).thenReturn(metaData);

		schema = ReportingFixtures.workOrderSchema();
		ReportingSettings settings = ReportingSettings.defaults();
		engine = new ReportEngine(new SchemaCatalogProvider(schema, settings.catalog()), dataSource, settings,
				Clock.fixed(Instant.parse("2024-01-31T15:45:00Z"), ZoneOffset.UTC));
	}

	@AfterEach
	void tearDown() {
		engine.close();
	}

	private void returnsSingleColumn(String label, Object... values) throws SQLException {
		when(metaData.getColumnCount()).thenReturn(1);
		when(metaData.getColumnLabel(1)).thenReturn(label);
		Boolean[] more = new Boolean[values.length];
		for (int i = 0; i < values.length; i++) {
			more[i] = i < values.length - 1;
		}
		if (values.length == 0) {
			when(resultSet.next()).thenReturn(false);
		} else {
			when(resultSet.next()).thenReturn(true, more);
			when(resultSet.getObject(1)).thenReturn(values[0], Arrays.copyOfRange(values, 1, values.length));
		}
	}

	@Nested
	@DisplayName("Catalog access")
	class CatalogAccess {

		@Test
		@DisplayName("Should list reportable tables with display names")
		void listsTables() {
			assertThat(engine.listTables())
					.containsEntry("workorders", "Workorders")
					.doesNotContainKey("alembic_version");
		}

		@Test
		@DisplayName("Should expose base and enhanced columns")
		void exposesColumns() {
			assertThat(engine.getColumns("statuses")).containsExactly("id", "name");
			assertThat(engine.getEnhancedColumns("workorders"))
					.anyMatch(column -> column.name().equals("statuses.name"));
			assertThat(engine.describeColumns("users")).hasSize(3);
		}

		@Test
		@DisplayName("Should see new tables only after a refresh")
		void refreshesCatalog() {
			assertThat(engine.listTables()).doesNotContainKey("invoices");

			schema.addTable("invoices").addPrimaryKey("invoices", "id", "INTEGER");
			assertThat(engine.listTables()).doesNotContainKey("invoices");

			engine.refreshCatalog();
			assertThat(engine.listTables()).containsKey("invoices");
		}

		@Test
		@DisplayName("Should suggest joins from foreign keys")
		void suggestsJoins() {
			assertThat(engine.suggestJoins("workorders", "companies"))
					.singleElement()
					.satisfies(suggestion -> assertThat(suggestion.condition())
							.isEqualTo("workorders.company_id = companies.id"));
		}
	}

	@Nested
	@DisplayName("Running reports")
	class RunningReports {

		@Test
		@DisplayName("Should build the display SQL with inlined values")
		void buildsDisplaySql() {
			ReportConfig config = ReportConfig.builder("workorders")
					.columns("id", "title")
					.filter("priority", FilterOperator.EQ, "HIGH")
					.limit(10)
					.build();

			assertThat(engine.buildQuery(config))
					.isEqualTo("SELECT workorders.id, workorders.title FROM workorders WHERE priority = 'HIGH' LIMIT 10");
		}

		@Test
		@DisplayName("Should execute the parameterized statement")
		void executesBoundStatement() throws SQLException {
			returnsSingleColumn("id", 7, 9);
			ReportConfig config = ReportConfig.builder("workorders")
					.columns("id")
					.filter("priority", FilterOperator.EQ, "HIGH")
					.limit(10)
					.build();

			QueryResult result = engine.run(config);

			assertThat(result.success()).isTrue();
			assertThat(result.rowCount()).isEqualTo(2);
			assertThat(result.sql()).isEqualTo("SELECT workorders.id FROM workorders WHERE priority = ? LIMIT 10");
			verify(connection).prepareStatement("SELECT workorders.id FROM workorders WHERE priority = ? LIMIT 10");
			verify(statement).setObject(1, "HIGH");
		}

		@Test
		@DisplayName("Should keep filter values out of the safety check's keyword scan")
		void boundValuesAreNotKeywords() throws SQLException {
			returnsSingleColumn("id");
			ReportConfig config = ReportConfig.builder("workorders")
					.columns("id")
					.filter("title", FilterOperator.CONTAINS, "drop table")
					.build();

			assertThat(engine.run(config).success()).isTrue();
			verify(statement).setObject(1, "%drop table%");
		}

		@Test
		@DisplayName("Should reject invalid configurations before touching the database")
		void rejectsInvalidConfig() throws SQLException {
			ReportConfig config = ReportConfig.builder("workorders").build();

			assertThatThrownBy(() -> engine.run(config))
					.isInstanceOfSatisfying(ConfigValidationException.class,
							e -> assertThat(e.errors()).containsExactly("At least one column must be selected"));
			verify(dataSource, never()).getConnection();
		}

		@Test
		@DisplayName("Should reject unknown columns")
		void rejectsUnknownColumns() {
			ReportConfig config = ReportConfig.builder("workorders").columns("bogus_col").build();

			assertThatThrownBy(() -> engine.run(config))
					.isInstanceOf(ColumnNotFoundException.class)
					.hasMessageContaining("bogus_col")
					.hasMessageContaining("workorders");
		}

		@Test
		@DisplayName("Should refuse unsafe ad-hoc SQL")
		void refusesUnsafeSql() throws SQLException {
			assertThatThrownBy(() -> engine.execute("SELECT * FROM users; DROP TABLE users;"))
					.isInstanceOf(SafetyRejectionException.class);
			verify(dataSource, never()).getConnection();
		}

		@Test
		@DisplayName("Should report execution failures in the result")
		void reportsExecutionFailure() throws SQLException {
			when(statement.executeQuery()).thenThrow(new SQLException("canceling statement due to statement timeout"));

			QueryResult result = engine.execute("SELECT id FROM workorders");

			assertThat(result.success()).isFalse();
			assertThat(result.error()).contains("statement timeout");
		}
	}

	@Nested
	@DisplayName("Table info and export")
	class TableInfoAndExport {

		@Test
		@DisplayName("Should count rows and describe columns")
		void describesTable() throws SQLException {
			returnsSingleColumn("row_count", 42L);

			TableInfo info = engine.tableInfo("statuses");

			assertThat(info.displayName()).isEqualTo("Statuses");
			assertThat(info.columnCount()).isEqualTo(2);
			assertThat(info.rowCount()).hasValue(42L);
			verify(connection).prepareStatement("SELECT COUNT(*) AS row_count FROM statuses");
		}

		@Test
		@DisplayName("Should leave the row count empty when counting fails")
		void countFailureLeavesRowCountEmpty() throws SQLException {
			when(statement.executeQuery()).thenThrow(new SQLException("permission denied"));

			assertThat(engine.tableInfo("statuses").rowCount()).isEmpty();
		}

		@Test
		@DisplayName("Should reject unknown tables")
		void rejectsUnknownTable() {
			assertThatThrownBy(() -> engine.tableInfo("invoices")).isInstanceOf(UnknownTableException.class);
		}

		@Test
		@DisplayName("Should export results and name the download")
		void exportsResults() throws SQLException {
			returnsSingleColumn("id", 1);
			QueryResult result = engine.execute("SELECT id FROM workorders");

			assertThat(engine.exportCsv(result)).isEqualTo("id\r\n1\r\n");
			assertThat(new String(engine.export(result, ExportFormat.CSV), StandardCharsets.UTF_8)).isEqualTo("id\r\n1\r\n");
			assertThat(engine.exportSpreadsheet(result)).isNotEmpty();
			assertThat(new String(engine.exportPdf(result), 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
			assertThat(engine.exportFileName(ExportFormat.PDF)).isEqualTo("custom_report_20240131_154500.pdf");
			assertThat(engine.exportFileName(ExportFormat.SPREADSHEET)).isEqualTo("custom_report_20240131_154500.xlsx");
		}
	}
}
