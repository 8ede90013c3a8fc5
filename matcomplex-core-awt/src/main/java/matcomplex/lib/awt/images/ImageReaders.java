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

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.complexity.InvalidInputException;
import matcomplex.lib.images.PixelImage;

/**
 * Read images from files using {@link ImageIO}.
 * <p>
 * Large images can be downsampled on reading, so that measurements are made at a bounded working resolution.
 */
public final class ImageReaders {

	private static final Logger logger = LoggerFactory.getLogger(ImageReaders.class);

	/**
	 * Default maximum width or height of an image after reading.
	 */
	public static final int DEFAULT_MAX_DIMENSION = 1024;

	// Suppressed default constructor for non-instantiability
	private ImageReaders() {
		throw new AssertionError();
	}

	/**
	 * Read an image, downsampling it if either side exceeds {@link #DEFAULT_MAX_DIMENSION}.
	 * @param path
	 * @return
	 * @throws InvalidInputException if the file does not exist or cannot be decoded
	 * @throws IOException if the file cannot be read
	 */
	public static PixelImage readImage(Path path) throws InvalidInputException, IOException {
		return readImage(path, DEFAULT_MAX_DIMENSION);
	}

	/**
	 * Read an image, downsampling it if either side exceeds the specified maximum.
	 * @param path
	 * @param maxDimension maximum width or height; use {@link Integer#MAX_VALUE} to keep the original size
	 * @return
	 * @throws InvalidInputException if the file does not exist or cannot be decoded
	 * @throws IOException if the file cannot be read
	 */
	public static PixelImage readImage(Path path, int maxDimension) throws InvalidInputException, IOException {
		var img = readBufferedImage(path);
		img = BufferedImageTools.resizeToMaxDimension(img, maxDimension);
		return BufferedImageTools.toPixelImage(img);
	}

	/**
	 * Read a {@link BufferedImage}, without resizing.
	 * @param path
	 * @return
	 * @throws InvalidInputException if the file does not exist or cannot be decoded
	 * @throws IOException if the file cannot be read
	 */
	public static BufferedImage readBufferedImage(Path path) throws InvalidInputException, IOException {
		if (path == null || !Files.isRegularFile(path))
			throw new InvalidInputException("Image file not found: " + path);
		File file = path.toFile();
		BufferedImage img;
		try {
			img = ImageIO.read(file);
		} catch (IIOException e) {
			throw new InvalidInputException("Unable to decode image " + path + ": " + e.getLocalizedMessage(), e);
		}
		if (img == null)
			throw new InvalidInputException("Unable to decode image " + path + " - supported formats are " + String.join(", ", ImageIO.getReaderFormatNames()));
		if (img.getWidth() == 0 || img.getHeight() == 0)
			throw new InvalidInputException("Image " + path + " is empty");
		logger.debug("Read {}x{} image from {} (type {})", img.getWidth(), img.getHeight(), path, img.getType());
		return img;
	}

}
