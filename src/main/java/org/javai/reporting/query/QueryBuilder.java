package org.javai.reporting.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.javai.reporting.ReportQueryException;
import org.javai.reporting.catalog.JoinDescriptor;
import org.javai.reporting.catalog.SchemaCatalog;

/**
 * Assembles a SELECT statement from a {@link ReportConfig}.
 *
 * <p>Clauses always appear in the order SELECT, FROM, JOIN, WHERE, GROUP BY, ORDER BY, LIMIT and
 * absent clauses are left out. For example:</p>
 *
 * <pre>{@code
 * ReportConfig config = ReportConfig.builder("workorders")
 *     .columns("id", "title")
 *     .filter("priority", FilterOperator.EQ, "HIGH")
 *     .limit(10)
 *     .build();
 *
 * new QueryBuilder(catalog).build(config);
 * // SELECT workorders.id, workorders.title FROM workorders WHERE priority = 'HIGH' LIMIT 10
 * }</pre>
 *
 * <p>{@link #build} inlines filter values as quoted literals. {@link #buildBound} produces the same
 * statement with {@code ?} placeholders and should be preferred for execution.</p>
 */
public class QueryBuilder {

	private static final Pattern IDENTIFIER =
			Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

	private static final Set<String> JOIN_TYPES = Set.of(
			"INNER", "LEFT", "RIGHT", "FULL", "CROSS", "LEFT OUTER", "RIGHT OUTER", "FULL OUTER");

	private final ColumnResolver resolver;

	public QueryBuilder(SchemaCatalog catalog) {
		this(new ColumnResolver(catalog));
	}

	public QueryBuilder(ColumnResolver resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver");
	}

	/**
	 * @return SQL text with filter values inlined as literals
	 * @throws QueryBuildException if the configuration cannot be turned into a statement
	 * @throws ColumnNotFoundException if a requested column does not resolve
	 * @throws org.javai.reporting.catalog.UnknownTableException if the primary table is unknown
	 */
	public String build(ReportConfig config) {
		return compose(config, new InlineLiterals()).sql();
	}

	/**
	 * Same statement as {@link #build}, with filter values replaced by placeholders.
	 */
	public BoundQuery buildBound(ReportConfig config) {
		return compose(config, new BoundParameters());
	}

	private BoundQuery compose(ReportConfig config, Literals literals) {
		if (config == null) {
			throw new QueryBuildException("Report configuration is required");
		}
		if (config.primaryTable() == null || config.primaryTable().isBlank()) {
			throw new QueryBuildException("Primary table is required");
		}
		if (config.columns().isEmpty()) {
			throw new QueryBuildException("At least one column is required");
		}
		String primaryTable = config.primaryTable();
		try {
			ResolvedColumns resolved = resolver.resolve(primaryTable, config.columns());

			List<String> clauses = new ArrayList<>();
			clauses.add("SELECT " + String.join(", ", resolved.selectExpressions()));
			clauses.add("FROM " + primaryTable);
			for (JoinDescriptor join : resolved.joins()) {
				clauses.add("LEFT JOIN %s ON %s.%s = %s.%s".formatted(
						join.targetTable(), primaryTable, join.localKey(), join.targetTable(), join.foreignKey()));
			}
			for (ExplicitJoin join : config.joins()) {
				clauses.add(explicitJoin(join));
			}

			List<String> conditions = new ArrayList<>();
			for (FilterClause filter : config.filters()) {
				conditions.add(condition(filter, literals));
			}
			if (!conditions.isEmpty()) {
				clauses.add("WHERE " + String.join(" AND ", conditions));
			}

			List<String> groupBy = config.groupBy().stream()
					.filter(g -> g != null && !g.isBlank())
					.toList();
			if (!groupBy.isEmpty()) {
				clauses.add("GROUP BY " + String.join(", ", groupBy));
			}

			String orderBy = orderBy(config);
			if (orderBy != null) {
				clauses.add(orderBy);
			}

			if (config.limit() != null && config.limit() > 0) {
				clauses.add("LIMIT " + config.limit());
			}
			return new BoundQuery(String.join(" ", clauses), literals.parameters());
		} catch (ReportQueryException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new QueryBuildException("Failed to build query for table " + primaryTable + ": " + e.getMessage(), e);
		}
	}

	private String explicitJoin(ExplicitJoin join) {
		String type = join.type() == null || join.type().isBlank()
				? "INNER"
				: join.type().trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
		if (type.endsWith(" JOIN")) {
			type = type.substring(0, type.length() - " JOIN".length());
		}
		if (!JOIN_TYPES.contains(type)) {
			throw new QueryBuildException("Unsupported join type: " + join.type());
		}
		String table = identifier(join.table(), "join table");
		if ("CROSS".equals(type)) {
			return "CROSS JOIN " + table;
		}
		if (join.condition() == null || join.condition().isBlank()) {
			throw new QueryBuildException("Join on " + table + " requires a condition");
		}
		return type + " JOIN " + table + " ON " + join.condition().trim();
	}

	private String condition(FilterClause filter, Literals literals) {
		if (filter == null || filter.operator() == null) {
			throw new QueryBuildException("Filter requires a column and an operator");
		}
		String column = identifier(filter.column(), "filter column");
		FilterOperator operator = filter.operator();
		if (operator.requiresValue() && !filter.hasValue()) {
			throw new QueryBuildException("Filter on " + column + " with operator '" + operator + "' requires a value");
		}
		if (operator.requiresSecondValue() && !filter.hasValue2()) {
			throw new QueryBuildException("Filter on " + column + " with operator 'between' requires value2");
		}
		String value = filter.value();
		return switch (operator) {
			case EQ -> column + " = " + literals.add(value);
			case NE -> column + " != " + literals.add(value);
			case GT -> column + " > " + literals.add(value);
			case GE -> column + " >= " + literals.add(value);
			case LT -> column + " < " + literals.add(value);
			case LE -> column + " <= " + literals.add(value);
			case LIKE -> column + " LIKE " + literals.add(value);
			case ILIKE -> column + " ILIKE " + literals.add(value);
			case STARTS_WITH -> column + " LIKE " + literals.add(value + "%");
			case ENDS_WITH -> column + " LIKE " + literals.add("%" + value);
			case CONTAINS -> column + " LIKE " + literals.add("%" + value + "%");
			case IN -> column + " IN (" + list(column, value, literals) + ")";
			case NOT_IN -> column + " NOT IN (" + list(column, value, literals) + ")";
			case BETWEEN -> column + " BETWEEN " + literals.add(value) + " AND " + literals.add(filter.value2());
			case IS_NULL -> column + " IS NULL";
			case IS_NOT_NULL -> column + " IS NOT NULL";
		};
	}

	private static String list(String column, String value, Literals literals) {
		List<String> items = Arrays.stream(value.split(","))
				.map(String::trim)
				.filter(item -> !item.isEmpty())
				.toList();
		if (items.isEmpty()) {
			throw new QueryBuildException("Filter on " + column + " requires at least one list value");
		}
		return items.stream().map(literals::add).collect(Collectors.joining(", "));
	}

	private static String orderBy(ReportConfig config) {
		if (config.orderBy() != null && !config.orderBy().isBlank()) {
			String direction = direction(config.direction());
			return "ORDER BY " + config.orderBy().trim() + (direction != null ? " " + direction : "");
		}
		Sorting sorting = config.sorting();
		if (sorting != null && sorting.column() != null && !sorting.column().isBlank()) {
			String column = sorting.column().trim();
			if (!column.contains(".")) {
				column = config.primaryTable() + "." + column;
			}
			String direction = direction(sorting.order());
			return "ORDER BY " + column + " " + (direction != null ? direction : "ASC");
		}
		return null;
	}

	private static String direction(String direction) {
		if (direction == null || direction.isBlank()) {
			return null;
		}
		String normalized = direction.trim().toUpperCase(Locale.ROOT);
		if (!normalized.equals("ASC") && !normalized.equals("DESC")) {
			throw new QueryBuildException("Sort direction must be ASC or DESC, got: " + direction);
		}
		return normalized;
	}

	private static String identifier(String name, String role) {
		if (name == null || !IDENTIFIER.matcher(name.trim()).matches()) {
			throw new QueryBuildException("Invalid " + role + ": " + name);
		}
		return name.trim();
	}

	/**
	 * Renders filter values into the statement.
	 */
	private interface Literals {

		String add(String value);

		List<String> parameters();
	}

	private static final class InlineLiterals implements Literals {

		@Override
		public String add(String value) {
			return "'" + value.replace("'", "''") + "'";
		}

		@Override
		public List<String> parameters() {
			return List.of();
		}
	}

	private static final class BoundParameters implements Literals {

		private final List<String> values = new ArrayList<>();

		@Override
		public String add(String value) {
			values.add(value);
			return "?";
		}

		@Override
		public List<String> parameters() {
			return values;
		}
	}
}
