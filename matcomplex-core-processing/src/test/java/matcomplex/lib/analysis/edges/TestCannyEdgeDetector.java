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

package matcomplex.lib.analysis.edges;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import matcomplex.lib.analysis.images.BinaryMask;
import matcomplex.lib.analysis.images.SimpleImages;
import matcomplex.lib.complexity.InvalidConfigurationException;
import matcomplex.lib.images.PixelImage;

@SuppressWarnings("javadoc")
public class TestCannyEdgeDetector {

	private static PixelImage createStepImage(int width, int height, int stepX, int low, int high) {
		int[] pixels = new int[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				pixels[y * width + x] = x < stepX ? low : high;
		}
		return PixelImage.createGray(pixels, width, height);
	}

	@Test
	public void test_uniformImage() {
		var image = PixelImage.createGray(new byte[64 * 64], 64, 64);
		var mask = new CannyEdgeDetector().detectEdges(image);
		assertTrue(mask.isEmpty());
		assertEquals(64, mask.getWidth());
		assertEquals(64, mask.getHeight());
	}

	@Test
	public void test_verticalStepEdge() {
		var image = createStepImage(64, 64, 32, 0, 255);
		var mask = new CannyEdgeDetector().detectEdges(image);
		// A single-pixel wide edge, on the dark side of the step
		assertEquals(64, mask.countTrue());
		for (int y = 0; y < 64; y++) {
			assertTrue(mask.get(31, y));
			assertFalse(mask.get(32, y));
		}
	}

	@Test
	public void test_horizontalStepEdge() {
		int w = 40, h = 50;
		int[] pixels = new int[w * h];
		for (int i = w * 20; i < pixels.length; i++)
			pixels[i] = 200;
		var mask = new CannyEdgeDetector().detectEdges(PixelImage.createGray(pixels, w, h));
		assertEquals(w, mask.countTrue());
		for (int x = 0; x < w; x++)
			assertTrue(mask.get(x, 19));
	}

	@Test
	public void test_weakStepIgnored() {
		// Gradient magnitude of a step of 20 is 80, which is above the low threshold but below the high threshold
		var image = createStepImage(32, 32, 16, 100, 120);
		assertTrue(new CannyEdgeDetector().detectEdges(image).isEmpty());
		assertEquals(32, new CannyEdgeDetector(50, 60).detectEdges(image).countTrue());
	}

	@Test
	public void test_isolatedWeakResponse() {
		int[] pixels = new int[32 * 32];
		pixels[10 * 32 + 10] = 30;
		var image = PixelImage.createGray(pixels, 32, 32);
		// Gradient magnitudes never exceed 60, so nothing is strong enough to seed an edge
		assertTrue(new CannyEdgeDetector().detectEdges(image).isEmpty());
		assertFalse(new CannyEdgeDetector(10, 50).detectEdges(image).isEmpty());
	}

	@Test
	public void test_hysteresis() {
		// A step of 155 above row 16 and a step of 20 below it, both at column 16
		int w = 32, h = 32;
		int[] pixels = new int[w * h];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				if (x < 16)
					pixels[y * w + x] = 100;
				else
					pixels[y * w + x] = y < 16 ? 255 : 120;
			}
		}
		var image = PixelImage.createGray(pixels, w, h);
		var mask = new CannyEdgeDetector().detectEdges(image);
		// The weak lower part of the edge is kept because it is connected to the strong upper part
		assertTrue(mask.get(15, 5));
		for (int y = 20; y < h; y++)
			assertTrue(mask.get(15, y), "Expected edge at (15, " + y + ")");

		// Without the strong part, nothing is found
		var weakOnly = createStepImage(w, h, 16, 100, 120);
		assertTrue(new CannyEdgeDetector().detectEdges(weakOnly).isEmpty());
	}

	@Test
	public void test_floatInputRounded() {
		// Values are rounded to 8 bits before edge detection, so a sub-unit step is invisible
		float[] pixels = new float[32 * 32];
		for (int y = 0; y < 32; y++) {
			for (int x = 16; x < 32; x++)
				pixels[y * 32 + x] = 0.4f;
		}
		var image = SimpleImages.createFloatImage(pixels, 32, 32);
		assertTrue(new CannyEdgeDetector(0, 0).detectEdges(image).isEmpty());
	}

	@Test
	public void test_smoothedStepEdge() {
		var image = createStepImage(64, 64, 32, 0, 255);
		var detector = new CannyEdgeDetector(50, 150, 1.5, false);
		BinaryMask mask = detector.detectEdges(SimpleImages.createGrayscaleImage(image));
		assertEquals(64, mask.countTrue());
		for (int y = 0; y < 64; y++)
			assertTrue(mask.get(31, y) || mask.get(32, y));
	}

	@Test
	public void test_l2Gradient() {
		var image = createStepImage(64, 64, 32, 0, 255);
		var detector = new CannyEdgeDetector(50, 150, 0, true);
		assertTrue(detector.isL2Gradient());
		// For a vertical edge the two norms agree
		assertEquals(new CannyEdgeDetector().detectEdges(image), detector.detectEdges(image));
	}

	@Test
	public void test_invalidParameters() {
		assertThrows(InvalidConfigurationException.class, () -> new CannyEdgeDetector(-1, 100));
		assertThrows(InvalidConfigurationException.class, () -> new CannyEdgeDetector(150, 50));
		assertThrows(InvalidConfigurationException.class, () -> new CannyEdgeDetector(50, Double.NaN));
		assertThrows(InvalidConfigurationException.class, () -> new CannyEdgeDetector(50, 150, -1, false));
		// Equal thresholds are allowed
		assertEquals(100, new CannyEdgeDetector(100, 100).getLowThreshold());
	}

}
