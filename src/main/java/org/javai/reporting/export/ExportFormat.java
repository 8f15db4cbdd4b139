package org.javai.reporting.export;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Download formats offered for report results.
 */
public enum ExportFormat {

	CSV("text/csv", "csv"),
	SPREADSHEET("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "xlsx"),
	PDF("application/pdf", "pdf");

	private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

	private final String mediaType;
	private final String extension;

	ExportFormat(String mediaType, String extension) {
		this.mediaType = mediaType;
		this.extension = extension;
	}

	public String mediaType() {
		return mediaType;
	}

	public String extension() {
		return extension;
	}

	/**
	 * @return e.g. {@code custom_report_20240131_154500.csv}
	 */
	public String fileName(String prefix, Clock clock) {
		return prefix + "_" + LocalDateTime.now(clock).format(FILE_STAMP) + "." + extension;
	}
}
