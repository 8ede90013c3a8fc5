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

package matcomplex.lib.analysis.images;

import java.util.Objects;

import matcomplex.lib.images.PixelImage;

/**
 * Create {@link SimpleImage SimpleImage} instances for basic pixel processing.
 *
 * @author Pete Bankhead
 */
public final class SimpleImages {

	// Suppressed default constructor for non-instantiability
	private SimpleImages() {
		throw new AssertionError();
	}

	/**
	 * Get the pixel values for the image.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static float[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof SimpleModifiableImage)
			return ((SimpleModifiableImage)image).getArray(direct);
		int n = image.getWidth() * image.getHeight();
		int w = image.getWidth();
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}

	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 *
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleModifiableImage createFloatImage(float[] data, int width, int height) {
		Objects.requireNonNull(data);
		if (data.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + data.length + " does not match " + width + "x" + height);
		return new FloatArraySimpleImage(data, width, height);
	}

	/**
	 * Create a {@link SimpleImage} backed by a float array of pixels.
	 *
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleModifiableImage createFloatImage(int width, int height) {
		return new FloatArraySimpleImage(new float[width * height], width, height);
	}

	/**
	 * Create a single-channel intensity image from a {@link PixelImage}.
	 * Grayscale images are passed through unchanged; RGB images are converted using luminance weights.
	 *
	 * @param image
	 * @return a new image with values in the range 0-255
	 * @see matcomplex.lib.common.ColorTools#luminance(int)
	 */
	public static SimpleModifiableImage createGrayscaleImage(PixelImage image) {
		int w = image.getWidth();
		int h = image.getHeight();
		float[] pixels = new float[w * h];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++)
				pixels[y * w + x] = image.getGray(x, y);
		}
		return new FloatArraySimpleImage(pixels, w, h);
	}


	/**
	 * Implementation of a SimpleImage backed by an array of floats.
	 *
	 * @author Pete Bankhead
	 */
	static class FloatArraySimpleImage implements SimpleModifiableImage {

		private float[] data;
		private int width;
		private int height;

		FloatArraySimpleImage(float[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
		}

		@Override
		public float getValue(int x, int y) {
			return data[y * width + x];
		}

		@Override
		public void setValue(int x, int y, float val) {
			data[y * width + x] = val;
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

		@Override
		public float[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}

	}
}
