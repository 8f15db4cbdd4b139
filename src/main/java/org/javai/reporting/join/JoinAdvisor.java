package org.javai.reporting.join;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.reporting.catalog.ForeignKeyRef;
import org.javai.reporting.catalog.SchemaCatalog;
import org.javai.reporting.catalog.TableSchema;

/**
 * Proposes joins between two tables from foreign-key metadata. Suggestions are never applied
 * automatically.
 */
public class JoinAdvisor {

	private static final String JOIN_TYPE = "LEFT";

	private final SchemaCatalog catalog;

	public JoinAdvisor(SchemaCatalog catalog) {
		this.catalog = Objects.requireNonNull(catalog, "catalog");
	}

	/**
	 * Looks for foreign keys from {@code tableA} to {@code tableB} and from {@code tableB} to
	 * {@code tableA}. Each suggestion joins {@code tableB}. A table paired with itself yields one
	 * suggestion per self-referencing key.
	 *
	 * @throws org.javai.reporting.catalog.UnknownTableException if either table is not in the catalog
	 */
	public List<JoinSuggestion> suggestJoins(String tableA, String tableB) {
		TableSchema a = catalog.table(tableA);
		TableSchema b = catalog.table(tableB);

		Map<String, JoinSuggestion> suggestions = new LinkedHashMap<>();
		for (ForeignKeyRef fk : a.foreignKeysTo(b.name())) {
			String condition = a.name() + "." + fk.localColumn() + " = " + b.name() + "." + fk.referencedColumn();
			suggestions.putIfAbsent(condition, new JoinSuggestion(b.name(), condition, JOIN_TYPE,
					a.name() + "." + fk.localColumn() + " references " + b.name() + "." + fk.referencedColumn()));
		}
		if (a.name().equals(b.name())) {
			// a self reference reads the same from both sides
			return new ArrayList<>(suggestions.values());
		}
		for (ForeignKeyRef fk : b.foreignKeysTo(a.name())) {
			String condition = a.name() + "." + fk.referencedColumn() + " = " + b.name() + "." + fk.localColumn();
			suggestions.putIfAbsent(condition, new JoinSuggestion(b.name(), condition, JOIN_TYPE,
					b.name() + "." + fk.localColumn() + " references " + a.name() + "." + fk.referencedColumn()));
		}
		return new ArrayList<>(suggestions.values());
	}
}
