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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import matcomplex.lib.complexity.CompositeLabel;
import matcomplex.lib.complexity.FractalLabel;
import matcomplex.lib.complexity.LacunarityLabel;
import matcomplex.lib.complexity.MeasurementResult;

@SuppressWarnings("javadoc")
public class TestMeasurementHistory {

	static MeasurementResult createResult(double fd) {
		return new MeasurementResult(fd, fd - 1, 0.5, 0.25, 0.5,
				FractalLabel.PREFERRED_HIGH, LacunarityLabel.UNIFORM, CompositeLabel.MODERATE);
	}

	@Test
	public void test_addInOrder() {
		var history = new MeasurementHistory();
		assertTrue(history.isEmpty());
		var first = history.add("a.png", createResult(1.5));
		history.add("b.png", createResult(1.6));
		history.add(new MeasurementRecord("a.png", createResult(1.7), LocalDateTime.of(2024, 1, 2, 3, 4, 5)));
		assertEquals(3, history.size());

		var records = history.getRecords();
		assertEquals(first, records.get(0));
		assertEquals("b.png", records.get(1).getName());
		// Repeated names are kept as separate records
		assertEquals("a.png", records.get(2).getName());
		assertEquals(1.7, records.get(2).getResult().getFractalDimension());
	}

	@Test
	public void test_recordsSnapshot() {
		var history = new MeasurementHistory();
		history.add("a.png", createResult(1.5));
		var records = history.getRecords();
		history.add("b.png", createResult(1.6));
		assertEquals(1, records.size());
		assertThrows(UnsupportedOperationException.class, () -> records.add(records.get(0)));
		history.clear();
		assertTrue(history.isEmpty());
		assertEquals(1, records.size());
	}

	@Test
	public void test_concurrentAdd() throws Exception {
		var history = new MeasurementHistory();
		int nThreads = 8;
		int nPerThread = 250;
		var pool = Executors.newFixedThreadPool(nThreads);
		try {
			var tasks = new ArrayList<Callable<Void>>();
			for (int t = 0; t < nThreads; t++) {
				String prefix = "thread" + t + "_";
				tasks.add(() -> {
					for (int i = 0; i < nPerThread; i++)
						history.add(prefix + i, createResult(1.5));
					return null;
				});
			}
			for (var future : pool.invokeAll(tasks))
				future.get();
		} finally {
			pool.shutdown();
			assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
		}
		assertEquals(nThreads * nPerThread, history.size());
	}

	@Test
	public void test_nullRecord() {
		var history = new MeasurementHistory();
		assertThrows(NullPointerException.class, () -> history.add(null));
		assertThrows(NullPointerException.class, () -> history.add(null, createResult(1.5)));
	}

}
