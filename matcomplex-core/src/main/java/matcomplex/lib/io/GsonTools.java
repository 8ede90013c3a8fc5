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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import matcomplex.lib.complexity.ComplexityParameters;
import matcomplex.lib.complexity.InvalidConfigurationException;
import matcomplex.lib.complexity.MeasurementResult;
import matcomplex.lib.measurements.MeasurementRecord;

/**
 * Helper class for reading and writing JSON, using Gson.
 * <p>
 * The default {@link Gson} supports {@link ComplexityParameters}, {@link MeasurementResult} and {@link MeasurementRecord}.
 * Parameters read from JSON take default values for any missing fields.
 *
 * @author Pete Bankhead
 */
public class GsonTools {

	private final static Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapter(LocalDateTime.class, LocalDateTimeTypeAdapter.INSTANCE.nullSafe());

	private static final TypeToken<List<MeasurementRecord>> RECORD_LIST_TYPE = new TypeToken<>() {};

	// Suppressed default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}

	/**
	 * Get default Gson, capable of serializing/deserializing the measurement classes.
	 * @return
	 *
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 *
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 *
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

	/**
	 * Convert parameters to pretty-printed JSON.
	 * @param params
	 * @return
	 */
	public static String toJson(ComplexityParameters params) {
		return getInstance(true).toJson(params);
	}

	/**
	 * Convert a result to pretty-printed JSON.
	 * @param result
	 * @return
	 */
	public static String toJson(MeasurementResult result) {
		return getInstance(true).toJson(result);
	}

	/**
	 * Convert measurement records to pretty-printed JSON.
	 * @param records
	 * @return
	 */
	public static String toJson(Collection<MeasurementRecord> records) {
		return getInstance(true).toJson(records, RECORD_LIST_TYPE.getType());
	}

	/**
	 * Read parameters from JSON. Missing fields take their default values.
	 * @param json
	 * @return
	 * @throws InvalidConfigurationException if the JSON cannot be parsed, or the parameters are invalid
	 */
	public static ComplexityParameters parseParameters(String json) throws InvalidConfigurationException {
		ComplexityParameters params;
		try {
			params = getInstance().fromJson(json, ComplexityParameters.class);
		} catch (JsonParseException e) {
			throw new InvalidConfigurationException("Unable to parse parameters: " + e.getLocalizedMessage(), e);
		}
		if (params == null)
			throw new InvalidConfigurationException("No parameters found in JSON");
		params.validate();
		return params;
	}

	/**
	 * Read parameters from a JSON file. Missing fields take their default values.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read
	 * @throws InvalidConfigurationException if the JSON cannot be parsed, or the parameters are invalid
	 */
	public static ComplexityParameters loadParameters(Path path) throws IOException, InvalidConfigurationException {
		logger.debug("Reading parameters from {}", path);
		String json = Files.readString(path, StandardCharsets.UTF_8);
		return parseParameters(json);
	}

	/**
	 * Read a result from JSON.
	 * @param json
	 * @return
	 * @throws JsonParseException if the JSON cannot be parsed, or does not represent a valid result
	 */
	public static MeasurementResult parseResult(String json) throws JsonParseException {
		var result = getInstance().fromJson(json, MeasurementResult.class);
		if (result == null)
			throw new JsonParseException("No measurement result found in JSON");
		return validated(result);
	}

	/**
	 * Read measurement records from JSON.
	 * @param json
	 * @return
	 * @throws JsonParseException if the JSON cannot be parsed, or does not represent valid records
	 */
	public static List<MeasurementRecord> parseRecords(String json) throws JsonParseException {
		List<MeasurementRecord> records = getInstance().fromJson(json, RECORD_LIST_TYPE.getType());
		if (records == null)
			return List.of();
		try {
			return records.stream()
					.map(r -> new MeasurementRecord(r.getName(), validated(r.getResult()), r.getTimestamp()))
					.toList();
		} catch (NullPointerException e) {
			throw new JsonParseException("Incomplete measurement record: " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Gson creates instances without calling the constructor, so pass the values through it to check them.
	 */
	private static MeasurementResult validated(MeasurementResult result) throws JsonParseException {
		if (result == null)
			throw new JsonParseException("Missing measurement result");
		try {
			return new MeasurementResult(result.getFractalDimension(), result.getNormalizedFractalDimension(),
					result.getLacunarity(), result.getNormalizedLacunarity(), result.getComposite(),
					result.getFractalLabel(), result.getLacunarityLabel(), result.getCompositeLabel());
		} catch (IllegalArgumentException | NullPointerException e) {
			throw new JsonParseException("Invalid measurement result: " + e.getLocalizedMessage(), e);
		}
	}


	/**
	 * TypeAdapter for LocalDateTime, using ISO-8601 strings.
	 */
	static class LocalDateTimeTypeAdapter extends TypeAdapter<LocalDateTime> {

		static final LocalDateTimeTypeAdapter INSTANCE = new LocalDateTimeTypeAdapter();

		@Override
		public void write(JsonWriter out, LocalDateTime value) throws IOException {
			out.value(value.toString());
		}

		@Override
		public LocalDateTime read(JsonReader in) throws IOException {
			if (in.peek() != JsonToken.STRING)
				throw new JsonParseException("Expected timestamp string, but found " + in.peek());
			String value = in.nextString();
			try {
				return LocalDateTime.parse(value);
			} catch (DateTimeParseException e) {
				throw new JsonParseException("Unable to parse timestamp '" + value + "'", e);
			}
		}

	}

}
