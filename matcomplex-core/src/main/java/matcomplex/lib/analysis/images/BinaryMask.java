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

package matcomplex.lib.analysis.images;

import java.util.BitSet;
import java.util.Objects;

/**
 * An immutable 2D grid of boolean values, e.g. the edges detected within an image.
 * <p>
 * Values are stored in row-major order in a {@link BitSet}, so that set pixels can be visited 
 * without scanning the whole grid.
 */
public final class BinaryMask {

	private final int width;
	private final int height;
	private final BitSet bits;

	private BinaryMask(int width, int height, BitSet bits) {
		this.width = width;
		this.height = height;
		this.bits = bits;
	}

	/**
	 * Create a mask from a bitset, where bit {@code y * width + x} gives the value at (x, y).
	 * The bitset is copied.
	 *
	 * @param bits
	 * @param width
	 * @param height
	 * @return
	 */
	public static BinaryMask create(BitSet bits, int width, int height) {
		Objects.requireNonNull(bits);
		checkDimensions(width, height);
		if (bits.length() > width * height)
			throw new IllegalArgumentException("Bitset has values beyond the end of a " + width + "x" + height + " mask");
		return new BinaryMask(width, height, (BitSet)bits.clone());
	}

	/**
	 * Create a mask from a boolean array, stored in row-major order.
	 *
	 * @param values
	 * @param width
	 * @param height
	 * @return
	 */
	public static BinaryMask create(boolean[] values, int width, int height) {
		Objects.requireNonNull(values);
		checkDimensions(width, height);
		if (values.length != width * height)
			throw new IllegalArgumentException("Array length " + values.length + " does not match " + width + "x" + height);
		var bits = new BitSet(values.length);
		for (int i = 0; i < values.length; i++) {
			if (values[i])
				bits.set(i);
		}
		return new BinaryMask(width, height, bits);
	}

	/**
	 * Create a mask that is true wherever an image value is strictly above a threshold.
	 *
	 * @param image
	 * @param threshold
	 * @return
	 */
	public static BinaryMask createThresholded(SimpleImage image, double threshold) {
		int w = image.getWidth();
		int h = image.getHeight();
		checkDimensions(w, h);
		var bits = new BitSet(w * h);
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				if (image.getValue(x, y) > threshold)
					bits.set(y * w + x);
			}
		}
		return new BinaryMask(w, h, bits);
	}

	/**
	 * Create a mask with every value false.
	 * @param width
	 * @param height
	 * @return
	 */
	public static BinaryMask createEmpty(int width, int height) {
		checkDimensions(width, height);
		return new BinaryMask(width, height, new BitSet());
	}

	private static void checkDimensions(int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Mask dimensions must be positive, but were " + width + "x" + height);
	}

	/**
	 * Width of the mask, in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Height of the mask, in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the value at a specified pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean get(int x, int y) {
		if (x < 0 || x >= width || y < 0 || y >= height)
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside " + width + "x" + height + " mask");
		return bits.get(y * width + x);
	}

	/**
	 * Index of the next true value at or after {@code fromIndex}, in row-major order, or -1 if there is none.
	 * @param fromIndex
	 * @return
	 * @see BitSet#nextSetBit(int)
	 */
	public int nextSetIndex(int fromIndex) {
		return bits.nextSetBit(fromIndex);
	}

	/**
	 * Number of true values in the mask.
	 * @return
	 */
	public int countTrue() {
		return bits.cardinality();
	}

	/**
	 * Query if every value in the mask is false.
	 * @return
	 */
	public boolean isEmpty() {
		return bits.isEmpty();
	}

	/**
	 * Create a {@link SimpleImage} view of this mask, with true values as 1 and false values as 0.
	 * @return
	 */
	public SimpleImage asSimpleImage() {
		return new SimpleImage() {

			@Override
			public float getValue(int x, int y) {
				return get(x, y) ? 1f : 0f;
			}

			@Override
			public int getWidth() {
				return width;
			}

			@Override
			public int getHeight() {
				return height;
			}

		};
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, bits);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof BinaryMask))
			return false;
		BinaryMask other = (BinaryMask)obj;
		return width == other.width && height == other.height && bits.equals(other.bits);
	}

	@Override
	public String toString() {
		return "BinaryMask (" + width + "x" + height + ", " + countTrue() + " set)";
	}

}
