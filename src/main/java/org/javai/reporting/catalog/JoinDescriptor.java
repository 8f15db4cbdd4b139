package org.javai.reporting.catalog;

/**
 * How an enhanced column reaches its table: {@code LEFT JOIN targetTable ON <primary>.localKey = targetTable.foreignKey}.
 *
 * @param targetTable the joined lookup table
 * @param localKey the foreign key column of the primary table
 * @param foreignKey the referenced column of the lookup table
 * @param displayName human-readable name of the lookup table
 */
public record JoinDescriptor(String targetTable, String localKey, String foreignKey, String displayName) {

	/**
	 * Identity of the join for deduplication; the display name does not take part.
	 */
	public Key key() {
		return new Key(targetTable, localKey, foreignKey);
	}

	public record Key(String targetTable, String localKey, String foreignKey) {
	}
}
