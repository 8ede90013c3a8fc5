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

package matcomplex.lib.awt.images;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.common.GeneralTools;
import matcomplex.lib.images.PixelImage;

/**
 * Static methods for converting and resizing {@link BufferedImage BufferedImages}.
 *
 * @author Pete Bankhead
 */
public final class BufferedImageTools {

	private static final Logger logger = LoggerFactory.getLogger(BufferedImageTools.class);

	// Suppressed default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Convert a {@link BufferedImage} to a {@link PixelImage}.
	 * <p>
	 * Single-band images become grayscale (converted to 8-bit if needed); all others, including 
	 * indexed color images, become RGB. Any alpha channel is ignored.
	 *
	 * @param img
	 * @return
	 */
	public static PixelImage toPixelImage(BufferedImage img) {
		Objects.requireNonNull(img, "Image must not be null");
		int w = img.getWidth();
		int h = img.getHeight();
		if (isGray(img)) {
			var imgGray = ensureBufferedImageType(img, BufferedImage.TYPE_BYTE_GRAY);
			int[] pixels = imgGray.getRaster().getSamples(0, 0, w, h, 0, (int[])null);
			return PixelImage.createGray(pixels, w, h);
		}
		int[] rgb = img.getRGB(0, 0, w, h, null, 0, w);
		return PixelImage.createRGB(rgb, w, h);
	}

	private static boolean isGray(BufferedImage img) {
		return img.getRaster().getNumBands() == 1 && !(img.getColorModel() instanceof IndexColorModel);
	}

	/**
	 * Ensure that an RGB image is the same kind of RGB, so that we can access the pixels and know what they mean.
	 * <p>
	 * This makes use of {@code Graphics2D.drawImage}, which imposes limits on supported types 
	 * (i.e. RGB or 8-bit grayscale), and is therefore <b>not</b> suitable for arbitrary type conversion.
	 * <p>
	 * Images that already have the same type are returned unchanged.
	 *
	 * @param img the input image
	 * @param requestedType the type to which the image should be converted
	 * @return the (possibly-new) output image
	 */
	public static BufferedImage ensureBufferedImageType(final BufferedImage img, int requestedType) {
		if (img.getType() != requestedType) {
			BufferedImage img2 = new BufferedImage(img.getWidth(), img.getHeight(), requestedType);
			Graphics2D g2d = img2.createGraphics();
			g2d.drawImage(img, 0, 0, null);
			g2d.dispose();
			return img2;
		}
		return img;
	}

	/**
	 * Calculate the size of an image after downsampling so that neither side exceeds a maximum dimension.
	 * The aspect ratio is preserved as closely as possible, and neither side becomes smaller than 1.
	 *
	 * @param width
	 * @param height
	 * @param maxDimension
	 * @return {width, height}, unchanged if the image is already small enough
	 */
	public static int[] computeDownsampledSize(int width, int height, int maxDimension) {
		if (maxDimension <= 0)
			throw new IllegalArgumentException("Maximum dimension must be > 0, but was " + maxDimension);
		int maxSide = Math.max(width, height);
		if (maxSide <= maxDimension)
			return new int[] {width, height};
		double scale = (double)maxDimension / maxSide;
		int w2 = GeneralTools.clipValue((int)Math.round(width * scale), 1, maxDimension);
		int h2 = GeneralTools.clipValue((int)Math.round(height * scale), 1, maxDimension);
		return new int[] {w2, h2};
	}

	/**
	 * Downsample an image if needed so that neither side exceeds a maximum dimension.
	 *
	 * @param img
	 * @param maxDimension
	 * @return the original image if it is small enough, otherwise a resized copy
	 * @see #resize(BufferedImage, int, int)
	 */
	public static BufferedImage resizeToMaxDimension(BufferedImage img, int maxDimension) {
		int[] size = computeDownsampledSize(img.getWidth(), img.getHeight(), maxDimension);
		if (size[0] == img.getWidth() && size[1] == img.getHeight())
			return img;
		logger.info("Downsampling {}x{} image to {}x{}", img.getWidth(), img.getHeight(), size[0], size[1]);
		return resize(img, size[0], size[1]);
	}

	/**
	 * Resize the image to have the requested width/height, using bilinear interpolation.
	 * <p>
	 * Grayscale images are returned as 8-bit grayscale, other images as (A)RGB.
	 *
	 * @param img input image to be resized
	 * @param finalWidth target output width
	 * @param finalHeight target output height
	 * @return resized image
	 */
	public static BufferedImage resize(final BufferedImage img, final int finalWidth, final int finalHeight) {
		if (img.getWidth() == finalWidth && img.getHeight() == finalHeight)
			return img;

		logger.trace("Resizing {} x {} -> {} x {}", img.getWidth(), img.getHeight(), finalWidth, finalHeight);

		double aspectRatio = (double)img.getWidth()/img.getHeight();
		double finalAspectRatio = (double)finalWidth/finalHeight;
		if (!GeneralTools.almostTheSame(aspectRatio, finalAspectRatio, 0.05))
			logger.debug("Substantial difference in aspect ratio for resized image: {}x{} -> {}x{} ({}, {})", img.getWidth(), img.getHeight(), finalWidth, finalHeight, aspectRatio, finalAspectRatio);

		int type;
		if (isGray(img))
			type = BufferedImage.TYPE_BYTE_GRAY;
		else if (img.getColorModel().hasAlpha())
			type = BufferedImage.TYPE_INT_ARGB;
		else
			type = BufferedImage.TYPE_INT_RGB;

		BufferedImage imgResult = new BufferedImage(finalWidth, finalHeight, type);
		Graphics2D g2d = imgResult.createGraphics();
		// Interpolate, since we are usually downsampling
		g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
		g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
		g2d.drawImage(img, 0, 0, finalWidth, finalHeight, null);
		g2d.dispose();
		return imgResult;
	}

}
