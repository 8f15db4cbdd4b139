package org.javai.reporting.config;

/**
 * @param sheetName worksheet name used for spreadsheet exports
 * @param fileNamePrefix prefix of generated export file names
 */
public record ExportSettings(String sheetName, String fileNamePrefix) {

	public ExportSettings {
		sheetName = sheetName == null || sheetName.isBlank() ? "Report" : sheetName;
		fileNamePrefix = fileNamePrefix == null || fileNamePrefix.isBlank() ? "custom_report" : fileNamePrefix;
	}

	public static ExportSettings defaults() {
		return new ExportSettings("Report", "custom_report");
	}
}
