package org.javai.reporting.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.reporting.catalog.JoinDescriptor;
import org.javai.reporting.testsupport.ReportingFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ColumnResolverTest {

	private ColumnResolver resolver;

	@BeforeEach
	void setUp() {
		resolver = new ColumnResolver(ReportingFixtures.workOrderCatalog());
	}

	@Test
	void qualifiesBaseColumnsWithPrimaryTable() {
		ResolvedColumns resolved = resolver.resolve("workorders", List.of("id", "title"));

		assertThat(resolved.selectExpressions()).containsExactly("workorders.id", "workorders.title");
		assertThat(resolved.joins()).isEmpty();
	}

	@Test
	void keepsEnhancedColumnsAndCollectsTheirJoinsOnce() {
		ResolvedColumns resolved = resolver.resolve("workorders",
				List.of("users.username", "id", "users.email", "statuses.name"));

		assertThat(resolved.selectExpressions())
				.containsExactly("users.username", "workorders.id", "users.email", "statuses.name");
		assertThat(resolved.joins()).extracting(JoinDescriptor::targetTable)
				.containsExactly("users", "statuses");
	}

	@Test
	void unknownColumnNamesColumnAndTable() {
		assertThatThrownBy(() -> resolver.resolve("workorders", List.of("bogus_col")))
				.isInstanceOfSatisfying(ColumnNotFoundException.class, e -> {
					assertThat(e.getMessage()).contains("bogus_col").contains("workorders");
					assertThat(e.validColumns()).contains("id", "title", "statuses.name");
				});
	}

	@Test
	void lookupColumnOfAnotherTableIsNotSelectable() {
		assertThatThrownBy(() -> resolver.resolve("statuses", List.of("users.username")))
				.isInstanceOf(ColumnNotFoundException.class)
				.hasMessageContaining("users.username");
	}

	@Test
	void blankColumnIsRejected() {
		assertThatThrownBy(() -> resolver.resolve("workorders", List.of(" ")))
				.isInstanceOf(ColumnNotFoundException.class);
	}
}
