package org.javai.reporting.config;

/**
 * Root of the engine configuration, usually read from YAML by {@link ReportingSettingsLoader}.
 */
public record ReportingSettings(CatalogSettings catalog, ExecutionSettings execution, ExportSettings export) {

	public ReportingSettings {
		catalog = catalog != null ? catalog : CatalogSettings.defaults();
		execution = execution != null ? execution : ExecutionSettings.defaults();
		export = export != null ? export : ExportSettings.defaults();
	}

	public static ReportingSettings defaults() {
		return new ReportingSettings(null, null, null);
	}
}
