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


package matcomplex.lib.complexity;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@SuppressWarnings("javadoc")
public class TestThresholdTable {

	private static ThresholdTable<String> createTable() throws InvalidConfigurationException {
		return ThresholdTable.create(Arrays.asList("a", "b", "c"), 0.3, 0.6);
	}

	@ParameterizedTest
	@CsvSource({
		"-1.0, a",
		"0.0, a",
		"0.2999, a",
		"0.3, b",
		"0.5999, b",
		"0.6, c",
		"1.0, c",
		"100, c"
	})
	public void test_classify(double value, String expected) throws Exception {
		assertEquals(expected, createTable().classify(value));
	}

	@Test
	public void test_infinite() throws Exception {
		var table = createTable();
		assertEquals("a", table.classify(Double.NEGATIVE_INFINITY));
		assertEquals("c", table.classify(Double.POSITIVE_INFINITY));
		assertThrows(IllegalArgumentException.class, () -> table.classify(Double.NaN));
	}

	@Test
	public void test_singleLabel() throws Exception {
		var table = ThresholdTable.create(List.of("only"));
		assertEquals("only", table.classify(-5));
		assertEquals("only", table.classify(5));
	}

	@Test
	public void test_invalidThresholds() {
		var labels = Arrays.asList("a", "b", "c");
		assertThrows(InvalidConfigurationException.class, () -> ThresholdTable.create(labels, 0.3));
		assertThrows(InvalidConfigurationException.class, () -> ThresholdTable.create(labels, 0.3, 0.6, 0.9));
		assertThrows(InvalidConfigurationException.class, () -> ThresholdTable.create(labels, 0.6, 0.3));
		assertThrows(InvalidConfigurationException.class, () -> ThresholdTable.create(labels, 0.3, 0.3));
		assertThrows(InvalidConfigurationException.class, () -> ThresholdTable.create(labels, 0.3, Double.NaN));
		assertThrows(InvalidConfigurationException.class, () -> ThresholdTable.create(labels, (double[])null));
	}

	@Test
	public void test_copies() throws Exception {
		double[] thresholds = {0.3, 0.6};
		var table = ThresholdTable.create(Arrays.asList("a", "b", "c"), thresholds);
		thresholds[0] = 0.5;
		assertArrayEquals(new double[] {0.3, 0.6}, table.getThresholds());
		table.getThresholds()[0] = 0.5;
		assertEquals("b", table.classify(0.4));
		assertThrows(UnsupportedOperationException.class, () -> table.getLabels().add("d"));
	}

}
