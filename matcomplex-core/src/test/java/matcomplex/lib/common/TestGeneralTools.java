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

package matcomplex.lib.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {

	@Test
	public void test_clipValue() {
		assertEquals(0.0, GeneralTools.clipValue(-0.5, 0, 1));
		assertEquals(1.0, GeneralTools.clipValue(1.5, 0, 1));
		assertEquals(0.25, GeneralTools.clipValue(0.25, 0, 1));
		assertTrue(Double.isNaN(GeneralTools.clipValue(Double.NaN, 0, 1)));
		assertEquals(5, GeneralTools.clipValue(10, 0, 5));
		assertEquals(0, GeneralTools.clipValue(-10, 0, 5));
	}

	@Test
	public void test_formatNumber() {
		var previous = Locale.getDefault();
		try {
			// Decimal separator must not depend on the locale
			Locale.setDefault(Locale.GERMANY);
			assertEquals("1.2346", GeneralTools.formatNumber(1.23456, 4));
			assertEquals("1.000", GeneralTools.formatNumber(1, 3));
			assertEquals("12345.500", GeneralTools.formatNumber(12345.5, 3));
			assertEquals("-0.125", GeneralTools.formatNumber(-0.125, 3));
			assertEquals("NaN", GeneralTools.formatNumber(Double.NaN, 3));
		} finally {
			Locale.setDefault(previous);
		}
	}

	@Test
	public void test_almostTheSame() {
		assertTrue(GeneralTools.almostTheSame(1.0, 1.001, 0.01));
		assertFalse(GeneralTools.almostTheSame(1.0, 1.1, 0.01));
	}

	@Test
	public void test_arrayToString() {
		assertEquals("2,4,8", GeneralTools.arrayToString(new int[] {2, 4, 8}, ","));
		assertEquals("", GeneralTools.arrayToString(new int[0], ","));
	}

}
