package org.javai.reporting.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.reporting.query.ExplicitJoin;
import org.javai.reporting.query.FilterClause;
import org.javai.reporting.query.ReportConfig;
import org.javai.reporting.query.Sorting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks report configurations for completeness and built SQL for read-only safety.
 *
 * <p>The safety check runs in two stages. The text must start with SELECT, hold a single statement
 * and contain none of the keywords DROP, DELETE, INSERT, UPDATE, ALTER, CREATE, TRUNCATE, EXEC,
 * EXECUTE or DECLARE (as whole words, anywhere, including inside literals). The statement is then
 * parsed and must be a plain SELECT over tables; see {@link SelectStatementGuard}.</p>
 *
 * <p>This is defense in depth. Execution still binds filter values as parameters.</p>
 */
public class QueryValidator {

	private static final Logger logger = LoggerFactory.getLogger(QueryValidator.class);

	private static final Pattern STARTS_WITH_SELECT = Pattern.compile("^\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);

	private static final Pattern FORBIDDEN_KEYWORD = Pattern.compile(
			"\\b(DROP|DELETE|INSERT|UPDATE|ALTER|CREATE|TRUNCATE|EXEC|EXECUTE|DECLARE)\\b",
			Pattern.CASE_INSENSITIVE);

	private static final Pattern QUOTED_LITERAL = Pattern.compile("'(?:[^']|'')*'");

	private final SelectStatementGuard guard = new SelectStatementGuard();

	/**
	 * @return human-readable problems; empty when the configuration is usable
	 */
	public List<String> validateConfig(ReportConfig config) {
		List<String> errors = new ArrayList<>();
		if (config == null) {
			errors.add("Report configuration is required");
			return errors;
		}
		if (config.primaryTable() == null || config.primaryTable().isBlank()) {
			errors.add("Primary table is required");
		}
		if (config.columns().stream().noneMatch(c -> c != null && !c.isBlank())) {
			errors.add("At least one column must be selected");
		}

		List<FilterClause> filters = config.filters();
		for (int i = 0; i < filters.size(); i++) {
			String label = "Filter " + (i + 1);
			FilterClause filter = filters.get(i);
			if (filter == null) {
				errors.add(label + " is empty");
				continue;
			}
			if (filter.column() == null || filter.column().isBlank()) {
				errors.add(label + " is missing a column");
			}
			if (filter.operator() == null) {
				errors.add(label + " is missing an operator");
				continue;
			}
			if (filter.operator().requiresValue() && !filter.hasValue()) {
				errors.add(label + " requires a value for operator '" + filter.operator() + "'");
			}
			if (filter.operator().requiresSecondValue() && !filter.hasValue2()) {
				errors.add(label + " uses operator 'between' and requires value2");
			}
			if (!filter.operator().requiresSecondValue() && filter.hasValue2()) {
				errors.add(label + " has value2, which is only allowed for operator 'between'");
			}
		}

		List<ExplicitJoin> joins = config.joins();
		for (int i = 0; i < joins.size(); i++) {
			ExplicitJoin join = joins.get(i);
			String label = "Join " + (i + 1);
			if (join == null) {
				errors.add(label + " is empty");
				continue;
			}
			if (join.table() == null || join.table().isBlank()) {
				errors.add(label + " is missing a table");
			}
			boolean cross = join.type() != null && join.type().trim().toUpperCase(Locale.ROOT).startsWith("CROSS");
			if (!cross && (join.condition() == null || join.condition().isBlank())) {
				errors.add(label + " is missing a condition");
			}
		}

		if (config.orderBy() != null && !config.orderBy().isBlank() && !isDirection(config.direction())) {
			errors.add("Sort direction must be asc or desc");
		}
		Sorting sorting = config.sorting();
		if (sorting != null) {
			if (sorting.column() == null || sorting.column().isBlank()) {
				errors.add("Sorting is missing a column");
			}
			if (!isDirection(sorting.order())) {
				errors.add("Sort order must be asc or desc");
			}
		}
		return errors;
	}

	/**
	 * Decides whether SQL text may be executed.
	 */
	public SafetyVerdict validateQuerySafety(String sql) {
		SafetyVerdict verdict = check(sql);
		if (!verdict.safe()) {
			logger.warn("Rejected report query: {}", verdict.reason());
		}
		return verdict;
	}

	private SafetyVerdict check(String sql) {
		if (sql == null || sql.isBlank()) {
			return SafetyVerdict.rejected("Query is empty");
		}
		if (!STARTS_WITH_SELECT.matcher(sql).find()) {
			return SafetyVerdict.rejected("Only SELECT queries are allowed");
		}
		Matcher forbidden = FORBIDDEN_KEYWORD.matcher(sql);
		if (forbidden.find()) {
			return SafetyVerdict.rejected("Query contains forbidden keyword: " + forbidden.group(1).toUpperCase(Locale.ROOT));
		}

		String statement = stripTrailingSemicolon(sql.trim());
		String outsideLiterals = QUOTED_LITERAL.matcher(statement).replaceAll("''");
		if (outsideLiterals.contains(";")) {
			return SafetyVerdict.rejected("Multiple statements are not allowed");
		}

		Optional<String> structural = guard.check(statement);
		return structural.map(SafetyVerdict::rejected).orElseGet(SafetyVerdict::accepted);
	}

	private static String stripTrailingSemicolon(String sql) {
		return sql.endsWith(";") ? sql.substring(0, sql.length() - 1).trim() : sql;
	}

	private static boolean isDirection(String direction) {
		if (direction == null || direction.isBlank()) {
			return true;
		}
		String normalized = direction.trim().toLowerCase(Locale.ROOT);
		return normalized.equals("asc") || normalized.equals("desc");
	}
}
