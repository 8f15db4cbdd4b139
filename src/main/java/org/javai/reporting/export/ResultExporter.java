package org.javai.reporting.export;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.javai.reporting.config.ExportSettings;
import org.javai.reporting.exec.QueryResult;

/**
 * Writes successful query results as CSV, as a single-sheet XLSX workbook or as a one-page PDF
 * summary.
 *
 * <p>CSV and XLSX start with a header row of column labels; a result without rows produces the
 * header alone. The PDF is a preview: it lists the first {@value #PDF_MAX_COLUMNS} columns of the
 * first {@value #PDF_MAX_ROWS} rows and states how many records were left out.</p>
 */
public class ResultExporter {

	private static final byte[] HEADER_FILL = {(byte) 0xD7, (byte) 0xE4, (byte) 0xBC};

	// largest magnitudes a spreadsheet double holds exactly
	private static final long MAX_EXACT_LONG = 1L << 53;
	private static final int MAX_EXACT_DIGITS = 15;

	static final int PDF_MAX_COLUMNS = 6;
	static final int PDF_MAX_ROWS = 20;
	private static final int PDF_MAX_CELL_CHARS = 15;
	private static final float PDF_MARGIN = 50;
	private static final float PDF_COLUMN_WIDTH = 100;
	private static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private final ExportSettings settings;
	private final Clock clock;

	public ResultExporter(ExportSettings settings, Clock clock) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	public ResultExporter(ExportSettings settings) {
		this(settings, Clock.systemDefaultZone());
	}

	public ResultExporter() {
		this(ExportSettings.defaults());
	}

	public byte[] export(QueryResult result, ExportFormat format) {
		return switch (format) {
			case CSV -> toCsv(result).getBytes(StandardCharsets.UTF_8);
			case SPREADSHEET -> toSpreadsheet(result);
			case PDF -> toPdf(result);
		};
	}

	/**
	 * RFC 4180 text, CRLF line endings, nulls written as empty fields.
	 */
	public String toCsv(QueryResult result) {
		requireExportable(result);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader(result.columns().toArray(String[]::new))
				.build();
		StringWriter out = new StringWriter();
		try (CSVPrinter printer = new CSVPrinter(out, format)) {
			for (Map<String, Object> record : result.records()) {
				List<Object> values = new ArrayList<>(result.columns().size());
				for (String column : result.columns()) {
					values.add(record.get(column));
				}
				printer.printRecord(values);
			}
		} catch (IOException e) {
			throw new ExportException("Unable to write CSV export", e);
		}
		return out.toString();
	}

	/**
	 * Numbers that a double cannot hold exactly, such as long decimals and integers beyond
	 * 2<sup>53</sup>, are written as text cells.
	 */
	public byte[] toSpreadsheet(QueryResult result) {
		requireExportable(result);
		try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
			Sheet sh = wb.createSheet(WorkbookUtil.createSafeSheetName(settings.sheetName()));

			XSSFCellStyle headerStyle = wb.createCellStyle();
			Font bold = wb.createFont();
			bold.setBold(true);
			headerStyle.setFont(bold);
			headerStyle.setFillForegroundColor(new XSSFColor(HEADER_FILL, null));
			headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);

			int r = 0;
			Row header = sh.createRow(r++);
			List<String> columns = result.columns();
			for (int c = 0; c < columns.size(); c++) {
				Cell cell = header.createCell(c);
				cell.setCellValue(columns.get(c));
				cell.setCellStyle(headerStyle);
			}

			for (Map<String, Object> record : result.records()) {
				Row row = sh.createRow(r++);
				for (int c = 0; c < columns.size(); c++) {
					Object value = record.get(columns.get(c));
					if (value != null) {
						setValue(row.createCell(c), value);
					}
				}
			}

			wb.write(out);
			return out.toByteArray();
		} catch (IOException e) {
			throw new ExportException("Unable to write spreadsheet export", e);
		}
	}

	public byte[] toPdf(QueryResult result) {
		return toPdf(result, settings.sheetName());
	}

	/**
	 * Letter-size summary headed by the title, the generation time and the record count. Headers
	 * and values are cut to {@value #PDF_MAX_CELL_CHARS} characters; characters the standard
	 * Helvetica font cannot show are printed as {@code ?}.
	 */
	public byte[] toPdf(QueryResult result, String title) {
		requireExportable(result);
		try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
			try (PdfPages pages = new PdfPages(document)) {
				pages.text(PDType1Font.HELVETICA_BOLD, 16, PDF_MARGIN, title != null ? title : settings.sheetName());

				pages.down(30);
				pages.text(PDType1Font.HELVETICA, 10, PDF_MARGIN,
						"Generated: " + LocalDateTime.now(clock).format(GENERATED_FORMAT));
				pages.down(15);
				pages.text(PDType1Font.HELVETICA, 10, PDF_MARGIN, "Records: " + result.rowCount());

				List<String> columns = result.columns().subList(0, Math.min(PDF_MAX_COLUMNS, result.columns().size()));
				pages.down(40);
				for (int c = 0; c < columns.size(); c++) {
					pages.text(PDType1Font.HELVETICA_BOLD, 10, columnX(c), truncate(columns.get(c)));
				}
				pages.down(20);

				List<Map<String, Object>> rows = result.records();
				for (Map<String, Object> record : rows.subList(0, Math.min(PDF_MAX_ROWS, rows.size()))) {
					for (int c = 0; c < columns.size(); c++) {
						Object value = record.get(columns.get(c));
						pages.text(PDType1Font.HELVETICA, 9, columnX(c), truncate(value != null ? value.toString() : ""));
					}
					pages.down(15);
					if (pages.y() < PDF_MARGIN) {
						pages.newPage();
					}
				}

				if (result.rowCount() > PDF_MAX_ROWS) {
					pages.down(20);
					pages.text(PDType1Font.HELVETICA, 9, PDF_MARGIN,
							"... and " + (result.rowCount() - PDF_MAX_ROWS) + " more records");
				}
			}
			document.save(out);
			return out.toByteArray();
		} catch (IOException e) {
			throw new ExportException("Unable to write PDF export", e);
		}
	}

	private static float columnX(int column) {
		return PDF_MARGIN + column * PDF_COLUMN_WIDTH;
	}

	private static String truncate(String text) {
		return text.length() > PDF_MAX_CELL_CHARS ? text.substring(0, PDF_MAX_CELL_CHARS) : text;
	}

	private static void setValue(Cell cell, Object value) {
		if (value instanceof Boolean flag) {
			cell.setCellValue(flag);
		} else if (value instanceof Number number && isExactAsDouble(number)) {
			cell.setCellValue(number.doubleValue());
		} else if (value instanceof BigDecimal decimal) {
			cell.setCellValue(decimal.toPlainString());
		} else {
			cell.setCellValue(value.toString());
		}
	}

	private static boolean isExactAsDouble(Number number) {
		if (number instanceof BigDecimal decimal) {
			return decimal.precision() <= MAX_EXACT_DIGITS;
		}
		if (number instanceof BigInteger integer) {
			return integer.bitLength() <= 53;
		}
		if (number instanceof Long value) {
			return value >= -MAX_EXACT_LONG && value <= MAX_EXACT_LONG;
		}
		return true;
	}

	private static void requireExportable(QueryResult result) {
		if (result == null) {
			throw new ExportException("No query result to export");
		}
		if (!result.success()) {
			throw new ExportException("Cannot export a failed query result: " + result.error());
		}
	}

	/**
	 * Letter pages written top to bottom; a new page starts when the cursor passes the bottom margin.
	 */
	private static final class PdfPages implements Closeable {

		private final PDDocument document;
		private PDPageContentStream content;
		private float y;

		PdfPages(PDDocument document) throws IOException {
			this.document = document;
			newPage();
		}

		void newPage() throws IOException {
			if (content != null) {
				content.close();
			}
			PDPage page = new PDPage(PDRectangle.LETTER);
			document.addPage(page);
			content = new PDPageContentStream(document, page);
			y = page.getMediaBox().getHeight() - PDF_MARGIN;
		}

		void text(PDFont font, float size, float x, String text) throws IOException {
			content.beginText();
			content.setFont(font, size);
			content.newLineAtOffset(x, y);
			content.showText(printable(font, text));
			content.endText();
		}

		void down(float amount) {
			y -= amount;
		}

		float y() {
			return y;
		}

		@Override
		public void close() throws IOException {
			content.close();
		}

		private static String printable(PDFont font, String text) throws IOException {
			StringBuilder out = new StringBuilder(text.length());
			for (int i = 0; i < text.length(); ) {
				int codePoint = text.codePointAt(i);
				String ch = Character.isWhitespace(codePoint) ? " " : new String(Character.toChars(codePoint));
				try {
					font.encode(ch);
					out.append(ch);
				} catch (IllegalArgumentException unencodable) {
					out.append('?');
				}
				i += Character.charCount(codePoint);
			}
			return out.toString();
		}
	}
}
