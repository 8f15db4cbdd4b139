package org.javai.reporting.catalog;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Display name helpers.
 */
public final class Names {

	private Names() {
	}

	/**
	 * Turns {@code work_orders} into {@code Work Orders}.
	 */
	public static String humanize(String identifier) {
		if (identifier == null || identifier.isBlank()) {
			return "";
		}
		return Arrays.stream(identifier.split("_"))
				.filter(part -> !part.isEmpty())
				.map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1).toLowerCase())
				.collect(Collectors.joining(" "));
	}
}
