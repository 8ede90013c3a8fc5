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


package matcomplex.lib.awt.images;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

import matcomplex.lib.images.PixelImage;

@SuppressWarnings("javadoc")
public class TestBufferedImageTools {

	private static BufferedImage createGradientGray(int width, int height) {
		var img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
		var raster = img.getRaster();
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				raster.setSample(x, y, 0, (x * 7 + y * 3) % 256);
		}
		return img;
	}

	@Test
	public void test_grayToPixelImage() {
		var img = createGradientGray(20, 10);
		var pixelImage = BufferedImageTools.toPixelImage(img);
		assertEquals(PixelImage.ColorType.GRAY, pixelImage.getColorType());
		assertFalse(pixelImage.isRGB());
		assertEquals(20, pixelImage.getWidth());
		assertEquals(10, pixelImage.getHeight());
		for (int y = 0; y < 10; y++) {
			for (int x = 0; x < 20; x++)
				assertEquals(img.getRaster().getSample(x, y, 0), pixelImage.getGray(x, y));
		}
	}

	@Test
	public void test_rgbToPixelImage() {
		var img = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
		img.setRGB(0, 0, 0xFF0000);
		img.setRGB(1, 0, 0x00FF00);
		img.setRGB(2, 0, 0x0000FF);
		img.setRGB(0, 1, 0x0A141E);
		var pixelImage = BufferedImageTools.toPixelImage(img);
		assertTrue(pixelImage.isRGB());
		for (int y = 0; y < 2; y++) {
			for (int x = 0; x < 3; x++)
				assertEquals(img.getRGB(x, y), pixelImage.getRGB(x, y));
		}
		assertEquals(76, pixelImage.getGray(0, 0));
		assertEquals(18, pixelImage.getGray(0, 1));
	}

	@Test
	public void test_indexedToPixelImage() {
		var img = new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_INDEXED);
		img.setRGB(1, 1, 0xFFFFFF);
		var pixelImage = BufferedImageTools.toPixelImage(img);
		assertTrue(pixelImage.isRGB());
		assertEquals(img.getRGB(1, 1), pixelImage.getRGB(1, 1));
	}

	@Test
	public void test_computeDownsampledSize() {
		assertArrayEquals(new int[] {100, 50}, BufferedImageTools.computeDownsampledSize(100, 50, 1024));
		assertArrayEquals(new int[] {1024, 1024}, BufferedImageTools.computeDownsampledSize(1024, 1024, 1024));
		assertArrayEquals(new int[] {1024, 512}, BufferedImageTools.computeDownsampledSize(2000, 1000, 1024));
		assertArrayEquals(new int[] {341, 1024}, BufferedImageTools.computeDownsampledSize(1000, 3000, 1024));
		assertArrayEquals(new int[] {100, 1}, BufferedImageTools.computeDownsampledSize(5000, 1, 100));
		assertThrows(IllegalArgumentException.class, () -> BufferedImageTools.computeDownsampledSize(100, 100, 0));
	}

	@Test
	public void test_resizeToMaxDimension() {
		var small = createGradientGray(64, 32);
		assertSame(small, BufferedImageTools.resizeToMaxDimension(small, 64));

		var large = createGradientGray(256, 128);
		var resized = BufferedImageTools.resizeToMaxDimension(large, 64);
		assertEquals(64, resized.getWidth());
		assertEquals(32, resized.getHeight());
		assertEquals(BufferedImage.TYPE_BYTE_GRAY, resized.getType());
	}

	@Test
	public void test_resizeKeepsType() {
		var rgb = new BufferedImage(40, 40, BufferedImage.TYPE_3BYTE_BGR);
		assertEquals(BufferedImage.TYPE_INT_RGB, BufferedImageTools.resize(rgb, 20, 20).getType());
		var argb = new BufferedImage(40, 40, BufferedImage.TYPE_INT_ARGB);
		assertEquals(BufferedImage.TYPE_INT_ARGB, BufferedImageTools.resize(argb, 20, 20).getType());
		assertSame(rgb, BufferedImageTools.resize(rgb, 40, 40));
	}

	@Test
	public void test_resizeUniform() {
		var img = new BufferedImage(100, 60, BufferedImage.TYPE_BYTE_GRAY);
		var raster = img.getRaster();
		for (int y = 0; y < 60; y++) {
			for (int x = 0; x < 100; x++)
				raster.setSample(x, y, 0, 200);
		}
		var resized = BufferedImageTools.resize(img, 50, 30);
		for (int y = 0; y < 30; y++) {
			for (int x = 0; x < 50; x++)
				assertEquals(200, resized.getRaster().getSample(x, y, 0), 1);
		}
	}

	@Test
	public void test_ensureType() {
		var img = createGradientGray(8, 8);
		assertSame(img, BufferedImageTools.ensureBufferedImageType(img, BufferedImage.TYPE_BYTE_GRAY));
		var rgb = BufferedImageTools.ensureBufferedImageType(img, BufferedImage.TYPE_INT_RGB);
		assertEquals(BufferedImage.TYPE_INT_RGB, rgb.getType());
		assertEquals(8, rgb.getWidth());
	}

}
