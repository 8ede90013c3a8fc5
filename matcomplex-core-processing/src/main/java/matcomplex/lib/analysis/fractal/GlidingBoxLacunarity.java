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

package matcomplex.lib.analysis.fractal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.analysis.images.SimpleImage;
import matcomplex.lib.analysis.stats.RunningStatistics;
import matcomplex.lib.complexity.ComplexityParameters;
import matcomplex.lib.complexity.InvalidConfigurationException;
import matcomplex.opencv.tools.OpenCVTools;

/**
 * Estimate lacunarity using the gliding box method.
 * <p>
 * A square window is swept across every valid position of a mass image, and the total mass 
 * within the window is recorded. The lacunarity for the window size is {@code (sigma / mu)^2}, 
 * where {@code mu} and {@code sigma} are the mean and population standard deviation of the masses.
 * <p>
 * Window masses are computed from a summed-area table created by OpenCV, and summarized as they are produced 
 * (using {@link RunningStatistics}) rather than being stored.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class GlidingBoxLacunarity {

	private static final Logger logger = LoggerFactory.getLogger(GlidingBoxLacunarity.class);

	// Strides that have already been warned about, so that a batch logs the warning only once
	private static final Set<Integer> warnedStrides = ConcurrentHashMap.newKeySet();

	private final int[] windowSizes;
	private final int stride;

	/**
	 * Create an estimator with a single window of the default size, visiting every position.
	 * @see ComplexityParameters#DEFAULT_WINDOW_SIZE
	 */
	public GlidingBoxLacunarity() {
		this(new int[] {ComplexityParameters.DEFAULT_WINDOW_SIZE}, 1);
	}

	/**
	 * Create an estimator.
	 *
	 * @param windowSizes strictly increasing, positive window sizes
	 * @param stride step between window positions in x and y; 1 visits every position
	 * @throws InvalidConfigurationException if the window sizes or stride are invalid
	 */
	public GlidingBoxLacunarity(int[] windowSizes, int stride) throws InvalidConfigurationException {
		ComplexityParameters.checkWindowSizes(windowSizes);
		if (stride < 1)
			throw new InvalidConfigurationException("Gliding box stride must be >= 1, but was " + stride);
		this.windowSizes = windowSizes.clone();
		this.stride = stride;
	}

	/**
	 * Get a copy of the window sizes.
	 * @return
	 */
	public int[] getWindowSizes() {
		return windowSizes.clone();
	}

	/**
	 * Largest window size.
	 * @return
	 */
	public int getMaxWindowSize() {
		return windowSizes[windowSizes.length - 1];
	}

	/**
	 * Step between window positions.
	 * @return
	 */
	public int getStride() {
		return stride;
	}

	/**
	 * Estimate lacunarity for every window size.
	 *
	 * @param massImage image giving the mass of each pixel
	 * @return
	 * @throws InvalidConfigurationException if the largest window exceeds the width or height of the image
	 */
	public LacunarityResult estimate(SimpleImage massImage) throws InvalidConfigurationException {
		int width = massImage.getWidth();
		int height = massImage.getHeight();
		int maxWindow = getMaxWindowSize();
		if (maxWindow > width || maxWindow > height)
			throw new InvalidConfigurationException("Window size " + maxWindow + " exceeds the " + width + "x" + height + " image");
		warnIfSubsampled(stride);

		double[] integral = OpenCVTools.createIntegralImage(massImage);
		var samples = new ArrayList<GlidingBoxSample>();
		for (int windowSize : windowSizes) {
			var sample = computeSample(integral, width, height, windowSize, stride);
			logger.debug("{}", sample);
			samples.add(sample);
		}
		return new LacunarityResult(samples);
	}

	/**
	 * Sweep a window across a summed-area table and summarize the masses.
	 */
	static GlidingBoxSample computeSample(double[] integral, int width, int height, int windowSize, int stride) {
		int stride1 = width + 1;
		var stats = new RunningStatistics();
		for (int y = 0; y + windowSize <= height; y += stride) {
			int rowTop = y * stride1;
			int rowBottom = (y + windowSize) * stride1;
			for (int x = 0; x + windowSize <= width; x += stride) {
				double mass = integral[rowBottom + x + windowSize] - integral[rowTop + x + windowSize]
						- integral[rowBottom + x] + integral[rowTop + x];
				stats.addValue(mass);
			}
		}
		if (stats.size() == 0)
			return new GlidingBoxSample(windowSize, 0, 0, 0, 0, 0);
		return new GlidingBoxSample(windowSize, stats.size(), stats.getMean(), stats.getPopulationStdDev(), stats.getMin(), stats.getMax());
	}

	/**
	 * Warn the first time a stride greater than 1 is used.
	 * @return true if a warning was logged
	 */
	static boolean warnIfSubsampled(int stride) {
		if (stride > 1 && warnedStrides.add(stride)) {
			logger.warn("Gliding box stride is {} - not every window position will be sampled", stride);
			return true;
		}
		return false;
	}

	@Override
	public String toString() {
		return "GlidingBoxLacunarity [windowSizes=" + Arrays.toString(windowSizes) + ", stride=" + stride + "]";
	}

}
