/*-
 * #%L
 * This file is part of MatComplex.
 * %%
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

package matcomplex.lib.measurements;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import matcomplex.lib.complexity.MeasurementResult;

/**
 * A {@link MeasurementResult} for a named image, with the time at which it was measured.
 */
public final class MeasurementRecord {

	/**
	 * Format used to display and export timestamps.
	 */
	public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private final String name;
	private final MeasurementResult result;
	private final LocalDateTime timestamp;

	/**
	 * Create a record.
	 * @param name image name, usually the file name
	 * @param result
	 * @param timestamp time of measurement; this is truncated to seconds
	 */
	public MeasurementRecord(String name, MeasurementResult result, LocalDateTime timestamp) {
		this.name = Objects.requireNonNull(name, "Name must not be null");
		this.result = Objects.requireNonNull(result, "Result must not be null");
		this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must not be null").truncatedTo(ChronoUnit.SECONDS);
	}

	/**
	 * Create a record timestamped with the current time.
	 * @param name
	 * @param result
	 * @return
	 */
	public static MeasurementRecord createNow(String name, MeasurementResult result) {
		return new MeasurementRecord(name, result, LocalDateTime.now());
	}

	/**
	 * @return image name
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the measurement
	 */
	public MeasurementResult getResult() {
		return result;
	}

	/**
	 * @return time of measurement
	 */
	public LocalDateTime getTimestamp() {
		return timestamp;
	}

	/**
	 * Get the timestamp formatted with {@link #TIMESTAMP_FORMAT}.
	 * @return
	 */
	public String getTimestampString() {
		return TIMESTAMP_FORMAT.format(timestamp);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, result, timestamp);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MeasurementRecord))
			return false;
		MeasurementRecord other = (MeasurementRecord) obj;
		return name.equals(other.name) && result.equals(other.result) && timestamp.equals(other.timestamp);
	}

	@Override
	public String toString() {
		return "MeasurementRecord [" + name + ", " + getTimestampString() + ", " + result + "]";
	}

}
