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


package matcomplex.lib.analysis.fractal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import matcomplex.lib.analysis.images.SimpleImages;
import matcomplex.lib.complexity.InvalidConfigurationException;

@SuppressWarnings("javadoc")
public class TestGlidingBoxLacunarity {

	@Test
	public void test_allZero() throws Exception {
		var image = SimpleImages.createFloatImage(64, 64);
		var result = new GlidingBoxLacunarity().estimate(image);
		assertEquals(0.0, result.getLacunarity());
		var sample = result.getSamples().get(0);
		assertEquals(33L * 33L, sample.getNumPositions());
		assertEquals(0.0, sample.getMean());
	}

	@Test
	public void test_uniform() throws Exception {
		float[] pixels = new float[64 * 64];
		Arrays.fill(pixels, 1f);
		var image = SimpleImages.createFloatImage(pixels, 64, 64);
		var result = new GlidingBoxLacunarity(new int[] {4, 16}, 1).estimate(image);
		assertEquals(0.0, result.getLacunarity(), 1e-12);
		assertEquals(16.0, result.getSamples().get(0).getMean(), 1e-12);
		assertEquals(256.0, result.getSamples().get(1).getMean(), 1e-12);
	}

	@Test
	public void test_singlePixel() throws Exception {
		var image = SimpleImages.createFloatImage(new float[] {1, 0, 0, 0}, 2, 2);
		var result = new GlidingBoxLacunarity(new int[] {1, 2}, 1).estimate(image);

		// Masses 1, 0, 0, 0 give mean 0.25 and population variance 0.1875
		var small = result.getSamples().get(0);
		assertEquals(4, small.getNumPositions());
		assertEquals(0.25, small.getMean(), 1e-12);
		assertEquals(Math.sqrt(0.1875), small.getStdDev(), 1e-12);
		assertEquals(0.0, small.getMin());
		assertEquals(1.0, small.getMax());
		assertEquals(3.0, small.getLacunarity(), 1e-12);

		// A single window position has no variation
		var large = result.getSamples().get(1);
		assertEquals(1, large.getNumPositions());
		assertEquals(0.0, large.getLacunarity());

		assertEquals(1.5, result.getLacunarity(), 1e-12);
	}

	@Test
	public void test_stride() throws Exception {
		var image = SimpleImages.createFloatImage(4, 4);
		assertEquals(9, new GlidingBoxLacunarity(new int[] {2}, 1).estimate(image).getSamples().get(0).getNumPositions());
		assertEquals(4, new GlidingBoxLacunarity(new int[] {2}, 2).estimate(image).getSamples().get(0).getNumPositions());
		assertEquals(1, new GlidingBoxLacunarity(new int[] {2}, 3).estimate(image).getSamples().get(0).getNumPositions());
	}

	@Test
	public void test_strideWarnedOnce() {
		assertFalse(GlidingBoxLacunarity.warnIfSubsampled(1));
		assertTrue(GlidingBoxLacunarity.warnIfSubsampled(7));
		assertFalse(GlidingBoxLacunarity.warnIfSubsampled(7));
		assertTrue(GlidingBoxLacunarity.warnIfSubsampled(11));
	}

	@Test
	public void test_matchesDirectSum() throws Exception {
		var rng = new Random(42);
		int width = 23;
		int height = 17;
		float[] pixels = new float[width * height];
		for (int i = 0; i < pixels.length; i++)
			pixels[i] = rng.nextInt(256);
		var image = SimpleImages.createFloatImage(pixels, width, height);

		int windowSize = 5;
		var sample = new GlidingBoxLacunarity(new int[] {windowSize}, 1).estimate(image).getSamples().get(0);

		double sum = 0;
		double sumSquares = 0;
		int n = 0;
		for (int y = 0; y + windowSize <= height; y++) {
			for (int x = 0; x + windowSize <= width; x++) {
				double mass = 0;
				for (int yy = y; yy < y + windowSize; yy++) {
					for (int xx = x; xx < x + windowSize; xx++)
						mass += pixels[yy * width + xx];
				}
				sum += mass;
				sumSquares += mass * mass;
				n++;
			}
		}
		double mean = sum / n;
		double variance = sumSquares / n - mean * mean;
		assertEquals(n, sample.getNumPositions());
		assertEquals(mean, sample.getMean(), 1e-6);
		assertEquals(variance / (mean * mean), sample.getLacunarity(), 1e-6);
	}

	@Test
	public void test_clusteredIsMoreLacunar() throws Exception {
		int size = 64;
		float[] clustered = new float[size * size];
		for (int y = 0; y < 16; y++) {
			for (int x = 0; x < 16; x++)
				clustered[y * size + x] = 1f;
		}
		float[] spread = new float[size * size];
		for (int y = 0; y < size; y += 2) {
			for (int x = 0; x < size; x += 8)
				spread[y * size + x] = 1f;
		}
		var lacunarity = new GlidingBoxLacunarity(new int[] {8}, 1);
		double lClustered = lacunarity.estimate(SimpleImages.createFloatImage(clustered, size, size)).getLacunarity();
		double lSpread = lacunarity.estimate(SimpleImages.createFloatImage(spread, size, size)).getLacunarity();
		assertTrue(lClustered > lSpread, "Expected " + lClustered + " > " + lSpread);
	}

	@Test
	public void test_windowTooLarge() {
		var image = SimpleImages.createFloatImage(64, 16);
		assertThrows(InvalidConfigurationException.class, () -> new GlidingBoxLacunarity().estimate(image));
	}

	@Test
	public void test_invalidConfiguration() {
		assertThrows(InvalidConfigurationException.class, () -> new GlidingBoxLacunarity(new int[0], 1));
		assertThrows(InvalidConfigurationException.class, () -> new GlidingBoxLacunarity(new int[] {0, 4}, 1));
		assertThrows(InvalidConfigurationException.class, () -> new GlidingBoxLacunarity(new int[] {8, 4}, 1));
		assertThrows(InvalidConfigurationException.class, () -> new GlidingBoxLacunarity(new int[] {8}, 0));
	}

}
