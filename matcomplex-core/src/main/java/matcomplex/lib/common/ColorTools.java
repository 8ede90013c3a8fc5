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

package matcomplex.lib.common;

/**
 * Static functions to help work with packed RGB values.
 *
 * @author Pete Bankhead
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}

	/**
	 * Mask for use when extracting the red component from a packed RGB int.
	 */
	public static final int MASK_RED = 0xff0000;

	/**
	 * Mask for use when extracting the green component from a packed RGB int.
	 */
	public static final int MASK_GREEN = 0xff00;

	/**
	 * Mask for use when extracting the blue component from a packed RGB int.
	 */
	public static final int MASK_BLUE = 0xff;

	// Fixed-point luminance weights (0.299, 0.587, 0.114) scaled by 2^14
	private static final int SHIFT = 14;
	private static final int WEIGHT_R = 4899;
	private static final int WEIGHT_G = 9617;
	private static final int WEIGHT_B = 1868;
	private static final int ROUND = 1 << (SHIFT - 1);

	/**
	 * Make a packed RGB representation of a specified color.
	 * The alpha value is always 255.
	 *
	 * @param r red (0-255)
	 * @param g green (0-255)
	 * @param b blue (0-255)
	 * @return packed ARGB value
	 */
	public static int packRGB(int r, int g, int b) {
		return (255<<24) + (r<<16) + (g<<8) + b;
	}

	/**
	 * Extract the 8-bit red value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb & MASK_RED) >> 16;
	}

	/**
	 * Extract the 8-bit green value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb & MASK_GREEN) >> 8;
	}

	/**
	 * Extract the 8-bit blue value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & MASK_BLUE;
	}

	/**
	 * Compute the luminance of a packed RGB value, using the weights
	 * 0.299 R + 0.587 G + 0.114 B and rounding to the nearest integer.
	 * <p>
	 * Fixed-point arithmetic is used so that the result is identical on every platform.
	 *
	 * @param rgb packed RGB value (alpha is ignored)
	 * @return an intensity value in the range 0-255
	 */
	public static int luminance(int rgb) {
		return luminance(red(rgb), green(rgb), blue(rgb));
	}

	/**
	 * Compute the luminance of separate 8-bit red, green and blue values.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return an intensity value in the range 0-255
	 * @see #luminance(int)
	 */
	public static int luminance(int r, int g, int b) {
		return (r * WEIGHT_R + g * WEIGHT_G + b * WEIGHT_B + ROUND) >> SHIFT;
	}

}
