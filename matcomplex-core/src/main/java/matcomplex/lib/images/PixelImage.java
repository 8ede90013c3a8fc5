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

package matcomplex.lib.images;

import java.util.Arrays;
import java.util.Objects;

import matcomplex.lib.common.ColorTools;
import matcomplex.lib.complexity.InvalidInputException;

/**
 * An immutable 2D grid of 8-bit pixels, either single-channel grayscale or packed RGB.
 * <p>
 * This is the input to the measurement pipeline. Decoding files into a {@code PixelImage} 
 * is the responsibility of the caller.
 */
public final class PixelImage {

	/**
	 * Pixel representation of a {@link PixelImage}.
	 */
	public enum ColorType {
		/**
		 * One 8-bit intensity per pixel.
		 */
		GRAY,
		/**
		 * Packed 8-bit red, green and blue values per pixel; alpha is ignored.
		 */
		RGB
	}

	private final int width;
	private final int height;
	private final ColorType colorType;
	private final int[] data;

	private PixelImage(int width, int height, ColorType colorType, int[] data) {
		this.width = width;
		this.height = height;
		this.colorType = colorType;
		this.data = data;
	}

	/**
	 * Create a grayscale image from unsigned 8-bit values, stored in row-major order.
	 * The array is copied.
	 *
	 * @param pixels
	 * @param width
	 * @param height
	 * @return
	 * @throws InvalidInputException if the pixels are missing or the image has zero area
	 */
	public static PixelImage createGray(byte[] pixels, int width, int height) throws InvalidInputException {
		checkDimensions(pixels == null ? -1 : pixels.length, width, height);
		int[] data = new int[pixels.length];
		for (int i = 0; i < data.length; i++)
			data[i] = pixels[i] & 0xff;
		return new PixelImage(width, height, ColorType.GRAY, data);
	}

	/**
	 * Create a grayscale image from int values in the range 0-255, stored in row-major order.
	 * The array is copied.
	 *
	 * @param pixels
	 * @param width
	 * @param height
	 * @return
	 * @throws InvalidInputException if the pixels are missing, outside 0-255, or the image has zero area
	 */
	public static PixelImage createGray(int[] pixels, int width, int height) throws InvalidInputException {
		checkDimensions(pixels == null ? -1 : pixels.length, width, height);
		for (int v : pixels) {
			if (v < 0 || v > 255)
				throw new InvalidInputException("Gray value " + v + " is outside the range 0-255");
		}
		return new PixelImage(width, height, ColorType.GRAY, pixels.clone());
	}

	/**
	 * Create an RGB image from packed (A)RGB values, stored in row-major order.
	 * The array is copied; any alpha component is ignored.
	 *
	 * @param rgb
	 * @param width
	 * @param height
	 * @return
	 * @throws InvalidInputException if the pixels are missing or the image has zero area
	 * @see ColorTools#packRGB(int, int, int)
	 */
	public static PixelImage createRGB(int[] rgb, int width, int height) throws InvalidInputException {
		checkDimensions(rgb == null ? -1 : rgb.length, width, height);
		int[] data = new int[rgb.length];
		for (int i = 0; i < data.length; i++)
			data[i] = rgb[i] & 0xffffff;
		return new PixelImage(width, height, ColorType.RGB, data);
	}

	private static void checkDimensions(int length, int width, int height) {
		if (length < 0)
			throw new InvalidInputException("No pixels available");
		if (width <= 0 || height <= 0)
			throw new InvalidInputException("Image has zero area (" + width + "x" + height + ")");
		if ((long)width * height != length)
			throw new InvalidInputException("Expected " + ((long)width * height) + " pixels for " + width + "x" + height + " image, but found " + length);
	}

	/**
	 * Width of the image, in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Height of the image, in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the pixel representation.
	 * @return
	 */
	public ColorType getColorType() {
		return colorType;
	}

	/**
	 * Query if the image stores RGB values.
	 * @return
	 */
	public boolean isRGB() {
		return colorType == ColorType.RGB;
	}

	/**
	 * Get the grayscale intensity of a pixel.
	 * For RGB images this is the luminance.
	 *
	 * @param x
	 * @param y
	 * @return intensity in the range 0-255
	 * @see ColorTools#luminance(int)
	 */
	public int getGray(int x, int y) {
		int v = data[index(x, y)];
		return colorType == ColorType.RGB ? ColorTools.luminance(v) : v;
	}

	/**
	 * Get a packed RGB value for a pixel. Gray pixels are returned with equal red, green and blue.
	 * @param x
	 * @param y
	 * @return
	 */
	public int getRGB(int x, int y) {
		int v = data[index(x, y)];
		if (colorType == ColorType.RGB)
			return ColorTools.packRGB(ColorTools.red(v), ColorTools.green(v), ColorTools.blue(v));
		return ColorTools.packRGB(v, v, v);
	}

	private int index(int x, int y) {
		if (x < 0 || x >= width || y < 0 || y >= height)
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside " + width + "x" + height + " image");
		return y * width + x;
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, colorType) * 31 + Arrays.hashCode(data);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PixelImage))
			return false;
		PixelImage other = (PixelImage)obj;
		return width == other.width && height == other.height && colorType == other.colorType && Arrays.equals(data, other.data);
	}

	@Override
	public String toString() {
		return "PixelImage (" + colorType + ", " + width + "x" + height + ")";
	}

}
