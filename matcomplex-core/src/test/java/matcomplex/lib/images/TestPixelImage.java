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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import matcomplex.lib.common.ColorTools;
import matcomplex.lib.complexity.InvalidInputException;

@SuppressWarnings("javadoc")
public class TestPixelImage {

	@Test
	public void test_gray() {
		var image = PixelImage.createGray(new byte[] {0, 1, (byte)128, (byte)255, 7, 9}, 3, 2);
		assertEquals(3, image.getWidth());
		assertEquals(2, image.getHeight());
		assertFalse(image.isRGB());
		assertEquals(PixelImage.ColorType.GRAY, image.getColorType());
		// Bytes are unsigned
		assertEquals(128, image.getGray(2, 0));
		assertEquals(255, image.getGray(0, 1));
		assertEquals(ColorTools.packRGB(255, 255, 255), image.getRGB(0, 1));

		var image2 = PixelImage.createGray(new int[] {0, 1, 128, 255, 7, 9}, 3, 2);
		assertEquals(image, image2);
		assertEquals(image.hashCode(), image2.hashCode());
	}

	@Test
	public void test_rgb() {
		int[] rgb = {ColorTools.packRGB(10, 20, 30), ColorTools.packRGB(200, 100, 50)};
		var image = PixelImage.createRGB(rgb, 2, 1);
		assertTrue(image.isRGB());
		assertEquals(rgb[1], image.getRGB(1, 0));
		assertEquals(ColorTools.luminance(200, 100, 50), image.getGray(1, 0));

		// Alpha is ignored
		int[] rgbTransparent = {rgb[0] & 0xffffff, (128 << 24) | (rgb[1] & 0xffffff)};
		assertEquals(image, PixelImage.createRGB(rgbTransparent, 2, 1));
	}

	@Test
	public void test_copiesInput() {
		int[] pixels = {1, 2, 3, 4};
		var image = PixelImage.createGray(pixels, 2, 2);
		pixels[0] = 100;
		assertEquals(1, image.getGray(0, 0));
	}

	@Test
	public void test_invalid() {
		assertThrows(InvalidInputException.class, () -> PixelImage.createGray((byte[])null, 2, 2));
		assertThrows(InvalidInputException.class, () -> PixelImage.createGray(new byte[0], 0, 0));
		assertThrows(InvalidInputException.class, () -> PixelImage.createGray(new byte[3], 2, 2));
		assertThrows(InvalidInputException.class, () -> PixelImage.createGray(new int[] {0, 256}, 2, 1));
		assertThrows(InvalidInputException.class, () -> PixelImage.createGray(new int[] {-1, 0}, 2, 1));
		assertThrows(InvalidInputException.class, () -> PixelImage.createRGB(new int[4], 4, 0));

		var image = PixelImage.createGray(new byte[4], 2, 2);
		assertThrows(IndexOutOfBoundsException.class, () -> image.getGray(2, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> image.getRGB(0, -1));
	}

	@Test
	public void test_notEqual() {
		var gray = PixelImage.createGray(new int[] {10, 10}, 2, 1);
		var rgb = PixelImage.createRGB(new int[] {ColorTools.packRGB(10, 10, 10), ColorTools.packRGB(10, 10, 10)}, 2, 1);
		// Same intensities, but different representations
		assertEquals(gray.getGray(0, 0), rgb.getGray(0, 0));
		assertNotEquals(gray, rgb);
	}

}
