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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.complexity.MeasurementResult;

/**
 * An append-only log of measurements, owned by the caller.
 * <p>
 * Records are kept in the order they were added. All methods are thread-safe.
 */
public class MeasurementHistory {

	private static final Logger logger = LoggerFactory.getLogger(MeasurementHistory.class);

	private final List<MeasurementRecord> records = new ArrayList<>();

	/**
	 * Append a record.
	 * @param record
	 */
	public synchronized void add(MeasurementRecord record) {
		Objects.requireNonNull(record, "Record must not be null");
		records.add(record);
		logger.trace("Added {} (history size {})", record, records.size());
	}

	/**
	 * Append a result for the named image, timestamped with the current time.
	 * @param name
	 * @param result
	 * @return the new record
	 */
	public MeasurementRecord add(String name, MeasurementResult result) {
		var record = MeasurementRecord.createNow(name, result);
		add(record);
		return record;
	}

	/**
	 * Get a snapshot of the records, oldest first.
	 * @return an unmodifiable copy
	 */
	public synchronized List<MeasurementRecord> getRecords() {
		return Collections.unmodifiableList(new ArrayList<>(records));
	}

	/**
	 * Number of records.
	 * @return
	 */
	public synchronized int size() {
		return records.size();
	}

	/**
	 * Query if the history has no records.
	 * @return
	 */
	public synchronized boolean isEmpty() {
		return records.isEmpty();
	}

	/**
	 * Remove all records.
	 */
	public synchronized void clear() {
		logger.debug("Clearing {} measurement records", records.size());
		records.clear();
	}

}
