package org.javai.reporting.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import org.javai.reporting.validate.ConfigValidationException;

/**
 * Reads and writes the JSON form of {@link ReportConfig}.
 */
public class ReportConfigReader {

	private static final ObjectMapper MAPPER = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

	/**
	 * @throws ConfigValidationException if the JSON is malformed or uses an unknown operator
	 */
	public ReportConfig read(String json) {
		if (json == null || json.isBlank()) {
			throw new ConfigValidationException("Report configuration is empty", null);
		}
		try {
			return MAPPER.readValue(json, ReportConfig.class);
		} catch (JsonProcessingException e) {
			throw new ConfigValidationException(describe(e), e);
		}
	}

	public ReportConfig read(InputStream json) {
		try {
			return MAPPER.readValue(json, ReportConfig.class);
		} catch (IOException e) {
			throw new ConfigValidationException(describe(e), e);
		}
	}

	public String write(ReportConfig config) {
		try {
			return MAPPER.writeValueAsString(config);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to serialize report configuration", e);
		}
	}

	private static String describe(IOException e) {
		Throwable root = e;
		while (root.getCause() != null && root.getCause() != root) {
			root = root.getCause();
		}
		if (root instanceof IllegalArgumentException) {
			return root.getMessage();
		}
		return e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
	}
}
