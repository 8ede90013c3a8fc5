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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@SuppressWarnings("javadoc")
public class TestColorTools {

	@Test
	public void test_packAndUnpack() {
		for (int r = 0; r < 256; r += 15) {
			for (int g = 0; g < 256; g += 17) {
				for (int b = 0; b < 256; b += 51) {
					int rgb = ColorTools.packRGB(r, g, b);
					assertEquals(r, ColorTools.red(rgb));
					assertEquals(g, ColorTools.green(rgb));
					assertEquals(b, ColorTools.blue(rgb));
					assertEquals(255, rgb >>> 24);
				}
			}
		}
	}

	@Test
	public void test_luminanceOfGray() {
		// Weights sum to 1, so gray values are unchanged
		for (int v = 0; v < 256; v++)
			assertEquals(v, ColorTools.luminance(v, v, v));
	}

	@ParameterizedTest
	@CsvSource({
		"255, 0, 0, 76",
		"0, 255, 0, 150",
		"0, 0, 255, 29",
		"255, 255, 0, 226",
		"10, 20, 30, 18"
	})
	public void test_luminance(int r, int g, int b, int expected) {
		assertEquals(expected, ColorTools.luminance(r, g, b));
		assertEquals(expected, ColorTools.luminance(ColorTools.packRGB(r, g, b)));
	}

}
