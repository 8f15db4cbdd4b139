package org.javai.reporting.query;

import java.util.List;
import org.javai.reporting.catalog.JoinDescriptor;

/**
 * Output of {@link ColumnResolver}: qualified SELECT expressions and the distinct joins they need.
 */
public record ResolvedColumns(List<String> selectExpressions, List<JoinDescriptor> joins) {

	public ResolvedColumns {
		selectExpressions = List.copyOf(selectExpressions);
		joins = List.copyOf(joins);
	}
}
