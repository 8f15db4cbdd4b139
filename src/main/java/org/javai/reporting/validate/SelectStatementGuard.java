package org.javai.reporting.validate;

import java.util.Optional;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;

/**
 * Structural allow-list for report SQL.
 *
 * <p>The statement must parse as a single plain SELECT whose FROM item and joined items are tables.
 * Only SELECT, FROM, JOIN, WHERE, GROUP BY, ORDER BY and LIMIT are accepted: set operations,
 * WITH, INTO, HAVING and derived tables are rejected.</p>
 */
final class SelectStatementGuard {

	/** Upper bound on one parse. */
	private static final int PARSE_TIMEOUT_MILLIS = 500;

	/**
	 * @return the rejection reason, or empty if the statement is allowed
	 */
	Optional<String> check(String sql) {
		Statement stmt;
		try {
			stmt = CCJSqlParserUtil.parse(sql,
					parser -> parser.withTimeOut(PARSE_TIMEOUT_MILLIS).withAllowComplexParsing(false));
		} catch (JSQLParserException e) {
			return Optional.of("Query could not be parsed as SQL");
		}

		if (!(stmt instanceof Select select)) {
			return Optional.of("Only SELECT statements are allowed, got: " + stmt.getClass().getSimpleName());
		}
		if (select.getWithItemsList() != null && !select.getWithItemsList().isEmpty()) {
			return Optional.of("WITH clauses are not allowed");
		}
		if (!(select instanceof PlainSelect plainSelect)) {
			return Optional.of("Only plain SELECT statements are allowed, got: " + select.getClass().getSimpleName());
		}
		if (plainSelect.getIntoTables() != null && !plainSelect.getIntoTables().isEmpty()) {
			return Optional.of("SELECT INTO is not allowed");
		}
		if (plainSelect.getHaving() != null) {
			return Optional.of("HAVING clauses are not allowed");
		}
		if (!(plainSelect.getFromItem() instanceof Table)) {
			return Optional.of("FROM must name a table");
		}
		if (plainSelect.getJoins() != null) {
			for (Join join : plainSelect.getJoins()) {
				if (!(join.getRightItem() instanceof Table)) {
					return Optional.of("JOIN must name a table");
				}
			}
		}
		return Optional.empty();
	}
}
