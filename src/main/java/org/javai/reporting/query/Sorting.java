package org.javai.reporting.query;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sort shorthand; an unqualified column is qualified with the primary table.
 *
 * @param column sort column
 * @param order {@code asc} or {@code desc}; ascending when absent
 */
public record Sorting(@JsonProperty("column") String column, @JsonProperty("order") String order) {
}
