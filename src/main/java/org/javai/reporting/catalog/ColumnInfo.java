package org.javai.reporting.catalog;

/**
 * Column description for report builder UIs.
 */
public record ColumnInfo(String name, String displayName, String type) {
}
