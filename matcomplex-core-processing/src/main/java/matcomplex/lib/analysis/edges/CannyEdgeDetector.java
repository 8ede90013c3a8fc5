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

package matcomplex.lib.analysis.edges;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.analysis.images.BinaryMask;
import matcomplex.lib.analysis.images.SimpleImage;
import matcomplex.lib.analysis.images.SimpleImages;
import matcomplex.lib.complexity.ComplexityParameters;
import matcomplex.lib.complexity.InvalidConfigurationException;
import matcomplex.lib.images.PixelImage;
import matcomplex.opencv.tools.OpenCVTools;

/**
 * Canny edge detector, producing a {@link BinaryMask} of single-pixel-wide edges.
 * <p>
 * Edges are found with OpenCV's {@code Canny} function, using a 3x3 Sobel aperture. 
 * Pixels with a gradient magnitude above the high threshold are edges, as are pixels above the 
 * low threshold that are 8-connected to an edge pixel.
 * <p>
 * The input is optionally smoothed with a Gaussian filter first (disabled by default), 
 * and is then rounded and saturated to 8 bits.
 * By default the gradient magnitude is the L1 norm {@code |gx| + |gy|}.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class CannyEdgeDetector {

	private static final Logger logger = LoggerFactory.getLogger(CannyEdgeDetector.class);

	private static final int APERTURE_SIZE = 3;

	private final double lowThreshold;
	private final double highThreshold;
	private final double sigma;
	private final boolean l2Gradient;

	/**
	 * Create an edge detector with the default thresholds, no smoothing and an L1 gradient magnitude.
	 * @see ComplexityParameters#DEFAULT_CANNY_LOW_THRESHOLD
	 * @see ComplexityParameters#DEFAULT_CANNY_HIGH_THRESHOLD
	 */
	public CannyEdgeDetector() {
		this(ComplexityParameters.DEFAULT_CANNY_LOW_THRESHOLD, ComplexityParameters.DEFAULT_CANNY_HIGH_THRESHOLD);
	}

	/**
	 * Create an edge detector with the specified thresholds, no smoothing and an L1 gradient magnitude.
	 * @param lowThreshold
	 * @param highThreshold
	 */
	public CannyEdgeDetector(double lowThreshold, double highThreshold) {
		this(lowThreshold, highThreshold, 0, false);
	}

	/**
	 * Create an edge detector.
	 *
	 * @param lowThreshold lower hysteresis threshold, applied to the gradient magnitude
	 * @param highThreshold upper hysteresis threshold, applied to the gradient magnitude
	 * @param sigma Gaussian sigma for smoothing before computing gradients, or 0 to skip smoothing
	 * @param l2Gradient if true, use {@code sqrt(gx*gx + gy*gy)} as the gradient magnitude rather than {@code |gx| + |gy|}
	 * @throws InvalidConfigurationException if the thresholds are negative, not finite or in the wrong order, or sigma is negative
	 */
	public CannyEdgeDetector(double lowThreshold, double highThreshold, double sigma, boolean l2Gradient) throws InvalidConfigurationException {
		if (!Double.isFinite(lowThreshold) || !Double.isFinite(highThreshold) || lowThreshold < 0)
			throw new InvalidConfigurationException("Edge thresholds must be finite and non-negative, but were " + lowThreshold + " and " + highThreshold);
		if (lowThreshold > highThreshold)
			throw new InvalidConfigurationException("Low edge threshold " + lowThreshold + " must not exceed high threshold " + highThreshold);
		if (!Double.isFinite(sigma) || sigma < 0)
			throw new InvalidConfigurationException("Gaussian sigma must be finite and >= 0, but was " + sigma);
		this.lowThreshold = lowThreshold;
		this.highThreshold = highThreshold;
		this.sigma = sigma;
		this.l2Gradient = l2Gradient;
	}

	/**
	 * Lower hysteresis threshold.
	 * @return
	 */
	public double getLowThreshold() {
		return lowThreshold;
	}

	/**
	 * Upper hysteresis threshold.
	 * @return
	 */
	public double getHighThreshold() {
		return highThreshold;
	}

	/**
	 * Gaussian sigma used for smoothing, or 0 if no smoothing is applied.
	 * @return
	 */
	public double getSigma() {
		return sigma;
	}

	/**
	 * Query if the L2 norm is used for the gradient magnitude.
	 * @return
	 */
	public boolean isL2Gradient() {
		return l2Gradient;
	}

	/**
	 * Detect edges in an image, after converting it to grayscale if needed.
	 * @param image
	 * @return
	 * @see SimpleImages#createGrayscaleImage(PixelImage)
	 */
	public BinaryMask detectEdges(PixelImage image) {
		return detectEdges(SimpleImages.createGrayscaleImage(image));
	}

	/**
	 * Detect edges in a single-channel image.
	 * @param image
	 * @return
	 */
	public BinaryMask detectEdges(SimpleImage image) {
		long startTime = System.currentTimeMillis();
		BinaryMask mask;
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.simpleImageToMat(image);
			if (sigma > 0)
				OpenCVTools.gaussianFilter(mat, sigma);
			var mat8 = new Mat();
			mat.convertTo(mat8, opencv_core.CV_8U);
			var matEdges = new Mat();
			opencv_imgproc.Canny(mat8, matEdges, lowThreshold, highThreshold, APERTURE_SIZE, l2Gradient);
			mask = OpenCVTools.matToBinaryMask(matEdges);
		}
		logger.debug("Detected {} edge pixels in {}x{} image in {} ms", mask.countTrue(), 
				image.getWidth(), image.getHeight(), System.currentTimeMillis() - startTime);
		return mask;
	}

	@Override
	public String toString() {
		return "CannyEdgeDetector [low=" + lowThreshold + ", high=" + highThreshold + ", sigma=" + sigma + ", l2Gradient=" + l2Gradient + "]";
	}

}
