package org.javai.reporting.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.reporting.catalog.UnknownTableException;
import org.javai.reporting.testsupport.ReportingFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QueryBuilder")
class QueryBuilderTest {

	private QueryBuilder builder;

	@BeforeEach
	void setUp() {
		builder = new QueryBuilder(ReportingFixtures.workOrderCatalog());
	}

	private static ReportConfig.Builder workorders(String... columns) {
		return ReportConfig.builder("workorders").columns(columns);
	}

	@Nested
	@DisplayName("Clause assembly")
	class ClauseAssembly {

		@Test
		@DisplayName("Should emit clauses in SELECT, FROM, WHERE, LIMIT order")
		void buildsFilteredLimitedQuery() {
			ReportConfig config = workorders("id", "title")
					.filter("priority", FilterOperator.EQ, "HIGH")
					.limit(10)
					.build();

			assertThat(builder.build(config))
					.isEqualTo("SELECT workorders.id, workorders.title FROM workorders WHERE priority = 'HIGH' LIMIT 10");
		}

		@Test
		@DisplayName("Should omit WHERE when there are no filters")
		void omitsWhereWithoutFilters() {
			assertThat(builder.build(workorders("id").build()))
					.isEqualTo("SELECT workorders.id FROM workorders");
		}

		@Test
		@DisplayName("Should omit LIMIT unless it is positive")
		void omitsNonPositiveLimit() {
			assertThat(builder.build(workorders("id").limit(0).build())).doesNotContain("LIMIT");
			assertThat(builder.build(workorders("id").limit(-5).build())).doesNotContain("LIMIT");
			assertThat(builder.build(workorders("id").limit(1).build())).endsWith(" LIMIT 1");
		}

		@Test
		@DisplayName("Should strip table prefixes from base columns and qualify with the primary table")
		void requalifiesBaseColumns() {
			assertThat(builder.build(workorders("orders.title").build()))
					.isEqualTo("SELECT workorders.title FROM workorders");
		}

		@Test
		@DisplayName("Should place GROUP BY and ORDER BY after WHERE")
		void ordersTrailingClauses() {
			ReportConfig config = workorders("priority")
					.filter("title", FilterOperator.IS_NOT_NULL, null)
					.groupBy("priority")
					.orderBy("priority", "desc")
					.limit(5)
					.build();

			assertThat(builder.build(config)).isEqualTo(
					"SELECT workorders.priority FROM workorders WHERE title IS NOT NULL GROUP BY priority ORDER BY priority DESC LIMIT 5");
		}

		@Test
		@DisplayName("Should reject configurations without a table or columns")
		void rejectsIncompleteConfig() {
			assertThatThrownBy(() -> builder.build(ReportConfig.builder(" ").columns("id").build()))
					.isInstanceOf(QueryBuildException.class)
					.hasMessage("Primary table is required");
			assertThatThrownBy(() -> builder.build(workorders().build()))
					.isInstanceOf(QueryBuildException.class)
					.hasMessage("At least one column is required");
		}

		@Test
		@DisplayName("Should reject unknown primary tables")
		void rejectsUnknownTable() {
			assertThatThrownBy(() -> builder.build(ReportConfig.builder("invoices").columns("id").build()))
					.isInstanceOf(UnknownTableException.class)
					.hasMessageContaining("invoices");
		}
	}

	@Nested
	@DisplayName("Enhanced column joins")
	class EnhancedColumnJoins {

		@Test
		@DisplayName("Should left join the lookup table of an enhanced column")
		void joinsLookupTable() {
			assertThat(builder.build(workorders("id", "statuses.name").build())).isEqualTo(
					"SELECT workorders.id, statuses.name FROM workorders "
							+ "LEFT JOIN statuses ON workorders.status_id = statuses.id");
		}

		@Test
		@DisplayName("Should join a lookup table once however many of its columns are selected")
		void joinsEachLookupOnce() {
			String sql = builder.build(workorders("users.username", "users.email", "priorities.name").build());

			assertThat(sql).isEqualTo("SELECT users.username, users.email, priorities.name FROM workorders "
					+ "LEFT JOIN users ON workorders.assigned_to = users.id "
					+ "LEFT JOIN priorities ON workorders.priority_id = priorities.id");
		}

		@Test
		@DisplayName("Should append explicit joins after derived joins")
		void appendsExplicitJoins() {
			ReportConfig config = workorders("id", "statuses.name")
					.join("left outer join", "companies", "workorders.company_id = companies.id")
					.build();

			assertThat(builder.build(config)).isEqualTo("SELECT workorders.id, statuses.name FROM workorders "
					+ "LEFT JOIN statuses ON workorders.status_id = statuses.id "
					+ "LEFT OUTER JOIN companies ON workorders.company_id = companies.id");
		}

		@Test
		@DisplayName("Should default explicit joins to INNER and reject unknown join types")
		void normalizesJoinTypes() {
			assertThat(builder.build(workorders("id").join(null, "companies", "workorders.company_id = companies.id").build()))
					.contains("INNER JOIN companies ON");
			assertThat(builder.build(workorders("id").join("cross", "companies", null).build()))
					.endsWith("CROSS JOIN companies");
			assertThatThrownBy(() -> builder.build(workorders("id").join("SIDEWAYS", "companies", "x = y").build()))
					.isInstanceOf(QueryBuildException.class)
					.hasMessageContaining("SIDEWAYS");
		}
	}

	@Nested
	@DisplayName("Filters")
	class Filters {

		private String where(FilterClause filter) {
			String sql = builder.build(workorders("id").filter(filter).build());
			return sql.substring(sql.indexOf(" WHERE ") + " WHERE ".length());
		}

		@Test
		@DisplayName("Should render comparison operators")
		void rendersComparisons() {
			assertThat(where(FilterClause.of("priority", FilterOperator.NE, "LOW"))).isEqualTo("priority != 'LOW'");
			assertThat(where(FilterClause.of("id", FilterOperator.GE, "3"))).isEqualTo("id >= '3'");
			assertThat(where(FilterClause.of("id", FilterOperator.LT, "9"))).isEqualTo("id < '9'");
			assertThat(where(FilterClause.of("title", FilterOperator.ILIKE, "pump%"))).isEqualTo("title ILIKE 'pump%'");
		}

		@Test
		@DisplayName("Should wrap pattern operators with wildcards")
		void rendersPatternOperators() {
			assertThat(where(FilterClause.of("title", FilterOperator.CONTAINS, "leak"))).isEqualTo("title LIKE '%leak%'");
			assertThat(where(FilterClause.of("title", FilterOperator.STARTS_WITH, "leak"))).isEqualTo("title LIKE 'leak%'");
			assertThat(where(FilterClause.of("title", FilterOperator.ENDS_WITH, "leak"))).isEqualTo("title LIKE '%leak'");
		}

		@Test
		@DisplayName("Should split list operators on commas")
		void rendersLists() {
			assertThat(where(FilterClause.of("priority", FilterOperator.IN, "HIGH, LOW")))
					.isEqualTo("priority IN ('HIGH', 'LOW')");
			assertThat(where(FilterClause.of("priority", FilterOperator.NOT_IN, "LOW")))
					.isEqualTo("priority NOT IN ('LOW')");
		}

		@Test
		@DisplayName("Should render range and null checks")
		void rendersRangesAndNullChecks() {
			assertThat(where(FilterClause.between("created_at", "2024-01-01", "2024-12-31")))
					.isEqualTo("created_at BETWEEN '2024-01-01' AND '2024-12-31'");
			assertThat(where(FilterClause.isNull("assigned_to"))).isEqualTo("assigned_to IS NULL");
		}

		@Test
		@DisplayName("Should double single quotes in inlined values")
		void escapesQuotes() {
			assertThat(where(FilterClause.of("title", FilterOperator.EQ, "O'Brien's pump")))
					.isEqualTo("title = 'O''Brien''s pump'");
		}

		@Test
		@DisplayName("Should join several filters with AND")
		void combinesFilters() {
			ReportConfig config = workorders("id")
					.filter("priority", FilterOperator.EQ, "HIGH")
					.filter("workorders.status_id", FilterOperator.GT, "2")
					.build();

			assertThat(builder.build(config))
					.endsWith("WHERE priority = 'HIGH' AND workorders.status_id > '2'");
		}

		@Test
		@DisplayName("Should reject filter columns that are not identifiers")
		void rejectsInjectedColumn() {
			assertThatThrownBy(() -> where(FilterClause.of("priority = 'x' OR 1=1 --", FilterOperator.EQ, "HIGH")))
					.isInstanceOf(QueryBuildException.class)
					.hasMessageContaining("Invalid filter column");
		}

		@Test
		@DisplayName("Should reject between without an upper bound")
		void rejectsIncompleteBetween() {
			assertThatThrownBy(() -> where(new FilterClause("created_at", FilterOperator.BETWEEN, "2024-01-01", null)))
					.isInstanceOf(QueryBuildException.class)
					.hasMessageContaining("between");
		}
	}

	@Nested
	@DisplayName("Bound parameters")
	class BoundParameters {

		@Test
		@DisplayName("Should replace every filter value with a placeholder")
		void bindsValues() {
			ReportConfig config = workorders("id", "title")
					.filter("priority", FilterOperator.IN, "HIGH,MEDIUM")
					.filter(FilterClause.between("created_at", "2024-01-01", "2024-06-30"))
					.filter("title", FilterOperator.CONTAINS, "O'Brien")
					.limit(10)
					.build();

			BoundQuery query = builder.buildBound(config);

			assertThat(query.sql()).isEqualTo("SELECT workorders.id, workorders.title FROM workorders "
					+ "WHERE priority IN (?, ?) AND created_at BETWEEN ? AND ? AND title LIKE ? LIMIT 10");
			assertThat(query.parameters())
					.containsExactly("HIGH", "MEDIUM", "2024-01-01", "2024-06-30", "%O'Brien%");
		}

		@Test
		@DisplayName("Should produce no parameters for null checks")
		void nullChecksNeedNoParameters() {
			BoundQuery query = builder.buildBound(workorders("id").filter(FilterClause.isNull("assigned_to")).build());

			assertThat(query.parameters()).isEmpty();
		}
	}

	@Nested
	@DisplayName("Sorting")
	class SortingClause {

		@Test
		@DisplayName("Should qualify the sorting column and default to ascending")
		void qualifiesSortingColumn() {
			assertThat(builder.build(workorders("id").sorting("created_at", null).build()))
					.endsWith("ORDER BY workorders.created_at ASC");
			assertThat(builder.build(workorders("id").sorting("created_at", "desc").build()))
					.endsWith("ORDER BY workorders.created_at DESC");
		}

		@Test
		@DisplayName("Should prefer order_by over sorting")
		void orderByWins() {
			ReportConfig config = workorders("id")
					.orderBy("title", "asc")
					.sorting("created_at", "desc")
					.build();

			assertThat(builder.build(config)).endsWith("ORDER BY title ASC");
		}

		@Test
		@DisplayName("Should reject directions other than asc and desc")
		void rejectsUnknownDirection() {
			assertThatThrownBy(() -> builder.build(workorders("id").orderBy("title", "sideways").build()))
					.isInstanceOf(QueryBuildException.class)
					.hasMessageContaining("sideways");
		}
	}
}
