/*-
 * #%L
 * This file is part of MatComplex.
 * %%
 * Copyright (C) 2018 - 2023 QuPath developers, The University of Edinburgh
 * Copyright (C) 2026 MatComplex developers
 * %%
 * MatComplex is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * MatComplex is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with MatComplex.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package matcomplex.lib.io;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.common.GeneralTools;
import matcomplex.lib.complexity.MeasurementResult;
import matcomplex.lib.measurements.MeasurementRecord;

/**
 * Helper class for exporting measurements as delimited text.
 * <p>
 * Two layouts are supported:
 * <ul>
 * <li>a single result, with columns {@code filename,FD,L} and 4 decimal places</li>
 * <li>a history of records, with columns {@code filename,FD,L,L_raw,C,FD_label,L_label,C_label,timestamp} and 3 decimal places</li>
 * </ul>
 * The {@code L} column always holds the normalized lacunarity, which is the value the lacunarity label is based on. 
 * The unscaled gliding box lacunarity is only written to the {@code L_raw} column of a history.
 * <p>
 * Values containing the separator, a double quote or a line break are quoted.
 *
 * @author Melvin Gelbard
 */
public class MeasurementExporter {

	private static final Logger logger = LoggerFactory.getLogger(MeasurementExporter.class);

	/**
	 * Default separator to use if none is specified, and we can't determine one from a file extension.
	 */
	public static final String DEFAULT_SEPARATOR = ",";

	/**
	 * Number of decimal places used when exporting a single result.
	 */
	public static final int RESULT_DECIMAL_PLACES = 4;

	/**
	 * Number of decimal places used when exporting a history.
	 */
	public static final int HISTORY_DECIMAL_PLACES = 3;

	private static final List<String> RESULT_HEADER = List.of("filename", "FD", "L");

	private static final List<String> HISTORY_HEADER = List.of("filename", "FD", "L", "L_raw", "C", "FD_label", "L_label", "C_label", "timestamp");

	private String separator;

	/**
	 * Create an exporter that chooses the separator from the file extension, or uses {@link #DEFAULT_SEPARATOR}.
	 */
	public MeasurementExporter() {}

	/**
	 * Specify the separator used between values.
	 * To avoid unexpected behavior, it is recommended to
	 * use either tab ({@code \t}), comma ({@code ,}) or 
	 * semicolon ({@code ;}).
	 * @param sep the column separator to use
	 * @return this exporter
	 */
	public MeasurementExporter separator(String sep) {
		this.separator = sep;
		return this;
	}

	/**
	 * Returns the separator set with {@link #separator(String)}, or null if it should be determined automatically.
	 * @return separator
	 */
	public String getSeparator() {
		return separator;
	}

	private String getSeparatorToUse(String fileName) {
		if (separator != null && !separator.isEmpty())
			return separator;
		if (fileName != null) {
			String lower = fileName.toLowerCase(Locale.ROOT);
			if (lower.endsWith(".tsv") || lower.endsWith(".txt"))
				return "\t";
		}
		return DEFAULT_SEPARATOR;
	}

	/**
	 * Export a single result to a file.
	 * @param name image name written in the filename column
	 * @param result
	 * @param file
	 * @throws IOException
	 */
	public void exportResult(String name, MeasurementResult result, File file) throws IOException {
		try (var stream = new FileOutputStream(file)) {
			exportResult(name, result, stream, getSeparatorToUse(file.getName()));
		}
		logger.info("Measurement for {} written to {}", name, file);
	}

	/**
	 * Export a single result to a stream.
	 * @param name image name written in the filename column
	 * @param result
	 * @param stream
	 * @throws IOException
	 */
	public void exportResult(String name, MeasurementResult result, OutputStream stream) throws IOException {
		exportResult(name, result, stream, getSeparatorToUse(null));
	}

	/**
	 * Get a single result as a delimited string, including the header.
	 * @param name image name written in the filename column
	 * @param result
	 * @return
	 */
	public String resultToString(String name, MeasurementResult result) {
		var writer = new StringWriter();
		try (var pw = new PrintWriter(writer)) {
			writeResult(pw, name, result, getSeparatorToUse(null));
		}
		return writer.toString();
	}

	private void exportResult(String name, MeasurementResult result, OutputStream stream, String sep) throws IOException {
		try (PrintWriter writer = createWriter(stream)) {
			writeResult(writer, name, result, sep);
			if (writer.checkError())
				throw new IOException("Unable to write measurement for " + name);
		}
	}

	private void writeResult(PrintWriter writer, String name, MeasurementResult result, String sep) {
		var warning = new SeparatorWarning();
		writeRow(writer, RESULT_HEADER, sep);
		writeRow(writer, List.of(
				quoteIfNeeded(name, sep, warning),
				GeneralTools.formatNumber(result.getFractalDimension(), RESULT_DECIMAL_PLACES),
				GeneralTools.formatNumber(result.getNormalizedLacunarity(), RESULT_DECIMAL_PLACES)
				), sep);
	}

	/**
	 * Export measurement records to a file.
	 * @param records
	 * @param file
	 * @throws IOException
	 */
	public void exportHistory(Collection<MeasurementRecord> records, File file) throws IOException {
		try (var stream = new FileOutputStream(file)) {
			exportHistory(records, stream, getSeparatorToUse(file.getName()));
		}
		logger.info("{} measurements written to {}", records.size(), file);
	}

	/**
	 * Export measurement records to a stream.
	 * @param records
	 * @param stream
	 * @throws IOException
	 */
	public void exportHistory(Collection<MeasurementRecord> records, OutputStream stream) throws IOException {
		exportHistory(records, stream, getSeparatorToUse(null));
	}

	/**
	 * Get measurement records as a delimited string, including the header.
	 * @param records
	 * @return
	 */
	public String historyToString(Collection<MeasurementRecord> records) {
		var writer = new StringWriter();
		try (var pw = new PrintWriter(writer)) {
			writeHistory(pw, records, getSeparatorToUse(null));
		}
		return writer.toString();
	}

	private void exportHistory(Collection<MeasurementRecord> records, OutputStream stream, String sep) throws IOException {
		try (PrintWriter writer = createWriter(stream)) {
			writeHistory(writer, records, sep);
			if (writer.checkError())
				throw new IOException("Unable to write " + records.size() + " measurements");
		}
	}

	private void writeHistory(PrintWriter writer, Collection<MeasurementRecord> records, String sep) {
		if (records.isEmpty())
			logger.warn("No measurements to export!");
		var warning = new SeparatorWarning();
		writeRow(writer, HISTORY_HEADER, sep);
		List<String> rowValues = new ArrayList<>();
		for (var record : records) {
			var result = record.getResult();
			rowValues.clear();
			rowValues.add(quoteIfNeeded(record.getName(), sep, warning));
			rowValues.add(GeneralTools.formatNumber(result.getFractalDimension(), HISTORY_DECIMAL_PLACES));
			rowValues.add(GeneralTools.formatNumber(result.getNormalizedLacunarity(), HISTORY_DECIMAL_PLACES));
			rowValues.add(GeneralTools.formatNumber(result.getLacunarity(), HISTORY_DECIMAL_PLACES));
			rowValues.add(GeneralTools.formatNumber(result.getComposite(), HISTORY_DECIMAL_PLACES));
			rowValues.add(quoteIfNeeded(result.getFractalLabel().getDisplayName(), sep, warning));
			rowValues.add(quoteIfNeeded(result.getLacunarityLabel().getDisplayName(), sep, warning));
			rowValues.add(quoteIfNeeded(result.getCompositeLabel().getDisplayName(), sep, warning));
			rowValues.add(quoteIfNeeded(record.getTimestampString(), sep, warning));
			writeRow(writer, rowValues, sep);
		}
	}

	// Closing the writer will also close the stream
	private static PrintWriter createWriter(OutputStream stream) {
		Writer writer = new OutputStreamWriter(stream, StandardCharsets.UTF_8);
		return new PrintWriter(writer);
	}

	private static String quoteIfNeeded(String val, String sep, SeparatorWarning warning) {
		if (val == null)
			return "";
		boolean hasSeparator = val.contains(sep);
		if (!hasSeparator && val.indexOf('"') < 0 && val.indexOf('\n') < 0 && val.indexOf('\r') < 0)
			return val;
		if (hasSeparator && !warning.logged) {
			logger.warn("Separator '{}' found in cell - " +
					"this may cause the table to be misaligned in some software", sep);
			warning.logged = true;
		}
		return "\"" + val.replace("\"", "\"\"") + "\"";
	}

	private static void writeRow(PrintWriter writer, List<String> strings, String delim) {
		int n = strings.size();
		for (int i = 0; i < n; i++) {
			var val = strings.get(i);
			if (val != null)
				writer.write(val);
			if (i < n-1)
				writer.write(delim);
		}
		writer.write(System.lineSeparator());
	}

	private static class SeparatorWarning {

		private boolean logged = false;

	}

}
