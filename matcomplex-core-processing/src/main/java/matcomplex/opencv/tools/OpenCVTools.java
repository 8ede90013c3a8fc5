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


package matcomplex.opencv.tools;

import java.util.BitSet;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import matcomplex.lib.analysis.images.BinaryMask;
import matcomplex.lib.analysis.images.SimpleImage;
import matcomplex.lib.analysis.images.SimpleImages;

/**
 * Static methods to move pixels between MatComplex images and OpenCV.
 * <p>
 * Mats returned by these methods are owned by the caller, and should be closed 
 * (or created within a {@link org.bytedeco.javacpp.PointerScope}).
 * 
 * @author Pete Bankhead
 */
public class OpenCVTools {

	// Suppress default constructor for non-instantiability
	private OpenCVTools() {
		throw new AssertionError();
	}

	/**
	 * Convert a {@link SimpleImage} to a single-channel 32-bit floating point Mat.
	 * @param image
	 * @return
	 */
	public static Mat simpleImageToMat(SimpleImage image) {
		var mat = new Mat(image.getHeight(), image.getWidth(), opencv_core.CV_32FC1);
		putPixelsFloat(mat, SimpleImages.getPixels(image, true));
		return mat;
	}

	/**
	 * Convert a single-channel Mat to a {@link SimpleImage}.
	 * @param mat
	 * @return
	 */
	public static SimpleImage matToSimpleImage(Mat mat) {
		if (mat.channels() != 1)
			throw new IllegalArgumentException("Expected a single-channel Mat, but it has " + mat.channels() + " channels");
		return SimpleImages.createFloatImage(extractFloats(mat), mat.cols(), mat.rows());
	}

	/**
	 * Create a {@link BinaryMask} that is true wherever a single-channel Mat is non-zero.
	 * @param mat
	 * @return
	 */
	public static BinaryMask matToBinaryMask(Mat mat) {
		if (mat.channels() != 1)
			throw new IllegalArgumentException("Expected a single-channel Mat, but it has " + mat.channels() + " channels");
		float[] pixels = extractFloats(mat);
		var bits = new BitSet(pixels.length);
		for (int i = 0; i < pixels.length; i++) {
			if (pixels[i] != 0f)
				bits.set(i);
		}
		return BinaryMask.create(bits, mat.cols(), mat.rows());
	}

	/**
	 * Set pixels from a float array.
	 * <p>
	 * The Mat is expected to be continuous, 32-bit floating point and to have the same number of pixels as the array.
	 * 
	 * @param mat
	 * @param pixels
	 */
	public static void putPixelsFloat(Mat mat, float[] pixels) {
		Indexer indexer = mat.createIndexer();
		try {
			if (indexer instanceof FloatIndexer)
				((FloatIndexer) indexer).put(0L, pixels);
			else
				throw new IllegalArgumentException("Expected a FloatIndexer, but instead got " + indexer.getClass());
		} finally {
			indexer.release();
		}
	}

	/**
	 * Extract pixels as a float array, converting the Mat if needed.
	 * @param mat
	 * @return
	 */
	public static float[] extractFloats(Mat mat) {
		float[] pixels = new float[(int)totalPixels(mat)];
		Mat mat2;
		if (mat.depth() != opencv_core.CV_32F) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_32F);
		} else
			mat2 = ensureContinuous(mat);
		
		FloatIndexer idx = mat2.createIndexer();
		idx.get(0L, pixels);
		idx.release();
		if (mat2 != mat)
			mat2.close();
		return pixels;
	}

	/**
	 * Extract pixels as a double array, converting the Mat if needed.
	 * @param mat
	 * @return
	 */
	public static double[] extractDoubles(Mat mat) {
		double[] pixels = new double[(int)totalPixels(mat)];
		Mat mat2;
		if (mat.depth() != opencv_core.CV_64F) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_64F);
		} else
			mat2 = ensureContinuous(mat);
		
		DoubleIndexer idx = mat2.createIndexer();
		idx.get(0L, pixels);
		idx.release();
		if (mat2 != mat)
			mat2.close();
		return pixels;
	}

	/**
	 * Get a continuous version of a Mat, cloning the data only if needed.
	 * @param mat
	 * @return the original Mat if it is already continuous, otherwise a continuous clone
	 */
	static Mat ensureContinuous(Mat mat) {
		if (mat.isContinuous())
			return mat;
		return mat.clone();
	}

	/**
	 * Total number of pixels in a Mat, counting each channel separately.
	 */
	static long totalPixels(Mat mat) {
		int nChannels = mat.channels();
		if (nChannels > 0)
			return mat.total() * nChannels;
		return mat.total();
	}

	/**
	 * Apply a 2D Gaussian filter in-place, replicating border pixels.
	 * <p>
	 * The kernel extends to 4 sigma on each side of the center.
	 * 
	 * @param mat input image
	 * @param sigma filter sigma value
	 */
	public static void gaussianFilter(Mat mat, double sigma) {
		int s = (int)Math.ceil(sigma * 4) * 2 + 1;
		try (var size = new Size(s, s)) {
			opencv_imgproc.GaussianBlur(mat, mat, size, sigma, sigma, opencv_core.BORDER_REPLICATE);
		}
	}

	/**
	 * Create a summed-area table for a single-channel image.
	 * <p>
	 * The table has one extra row and column of zeros at the top and left, 
	 * so that entry {@code (y+1)*(width+1) + (x+1)} is the sum of all pixels in the rectangle from (0, 0) to (x, y) inclusive.
	 * 
	 * @param image
	 * @return a 64-bit table with {@code (width+1)*(height+1)} entries
	 */
	public static double[] createIntegralImage(SimpleImage image) {
		try (var mat = simpleImageToMat(image);
				var sum = new Mat()) {
			opencv_imgproc.integral(mat, sum, opencv_core.CV_64F);
			return extractDoubles(sum);
		}
	}

}
