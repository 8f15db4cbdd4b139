package org.javai.reporting.query;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A join stated in the report configuration, emitted as {@code <type> JOIN <table> ON <condition>}.
 */
public record ExplicitJoin(
		@JsonProperty("type") String type,
		@JsonProperty("table") String table,
		@JsonProperty("condition") String condition) {
}
