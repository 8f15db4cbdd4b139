package org.javai.reporting.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarative description of a report: what to select from which table, how to filter, join,
 * group, sort and limit it. Supplied per call; the engine never keeps it.
 *
 * <p>JSON form, as sent by report builder UIs:</p>
 *
 * <pre>{@code
 * {
 *   "primary_table": "workorders",
 *   "columns": ["id", "title", "statuses.name"],
 *   "filters": [{"column": "priority", "operator": "eq", "value": "HIGH"}],
 *   "joins": [{"type": "INNER", "table": "companies", "condition": "workorders.company_id = companies.id"}],
 *   "group_by": [],
 *   "sorting": {"column": "created_at", "order": "desc"},
 *   "limit": 10
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportConfig(
		@JsonProperty("primary_table") String primaryTable,
		@JsonProperty("columns") List<String> columns,
		@JsonProperty("filters") List<FilterClause> filters,
		@JsonProperty("joins") List<ExplicitJoin> joins,
		@JsonProperty("group_by") List<String> groupBy,
		@JsonProperty("order_by") String orderBy,
		@JsonProperty("direction") String direction,
		@JsonProperty("sorting") Sorting sorting,
		@JsonProperty("limit") Integer limit) {

	public ReportConfig {
		columns = copy(columns);
		filters = copy(filters);
		joins = copy(joins);
		groupBy = copy(groupBy);
	}

	// tolerates null elements so that validation can report them
	private static <T> List<T> copy(List<T> list) {
		return list != null ? Collections.unmodifiableList(new ArrayList<>(list)) : List.of();
	}

	public static Builder builder(String primaryTable) {
		return new Builder(primaryTable);
	}

	/**
	 * Fluent construction for callers that do not start from JSON.
	 */
	public static final class Builder {

		private final String primaryTable;
		private final List<String> columns = new ArrayList<>();
		private final List<FilterClause> filters = new ArrayList<>();
		private final List<ExplicitJoin> joins = new ArrayList<>();
		private final List<String> groupBy = new ArrayList<>();
		private String orderBy;
		private String direction;
		private Sorting sorting;
		private Integer limit;

		private Builder(String primaryTable) {
			this.primaryTable = primaryTable;
		}

		public Builder columns(String... names) {
			columns.addAll(List.of(names));
			return this;
		}

		public Builder filter(FilterClause filter) {
			filters.add(filter);
			return this;
		}

		public Builder filter(String column, FilterOperator operator, String value) {
			return filter(FilterClause.of(column, operator, value));
		}

		public Builder join(String type, String table, String condition) {
			joins.add(new ExplicitJoin(type, table, condition));
			return this;
		}

		public Builder groupBy(String... names) {
			groupBy.addAll(List.of(names));
			return this;
		}

		public Builder orderBy(String orderBy, String direction) {
			this.orderBy = orderBy;
			this.direction = direction;
			return this;
		}

		public Builder sorting(String column, String order) {
			this.sorting = new Sorting(column, order);
			return this;
		}

		public Builder limit(Integer limit) {
			this.limit = limit;
			return this;
		}

		public ReportConfig build() {
			return new ReportConfig(primaryTable, columns, filters, joins, groupBy, orderBy, direction, sorting, limit);
		}
	}
}
