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

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.analysis.images.BinaryMask;
import matcomplex.lib.analysis.stats.RegressionResult;
import matcomplex.lib.common.GeneralTools;
import matcomplex.lib.complexity.InsufficientDataException;
import matcomplex.lib.complexity.InvalidConfigurationException;

/**
 * Estimate the fractal dimension of a {@link BinaryMask} by box counting.
 * <p>
 * For each box size, the mask is tiled with square boxes starting from the top left corner, 
 * and the number of boxes containing at least one set pixel is counted. 
 * Partial boxes at the right and bottom boundaries are ignored, for every box size.
 * <p>
 * The fractal dimension is the slope of a least-squares line through the points 
 * {@code (log(1/boxSize), log(count))}, clamped to a fixed domain (by default [1, 2]).
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class BoxCounter {

	private static final Logger logger = LoggerFactory.getLogger(BoxCounter.class);

	/**
	 * Default box sizes.
	 */
	public static final int[] DEFAULT_BOX_SIZES = {2, 4, 8, 16, 32, 64};

	/**
	 * Default minimum fractal dimension (a smooth curve).
	 */
	public static final double DEFAULT_MIN_DIMENSION = 1.0;

	/**
	 * Default maximum fractal dimension (a space-filling pattern).
	 */
	public static final double DEFAULT_MAX_DIMENSION = 2.0;

	private final int[] boxSizes;
	private final double minDimension;
	private final double maxDimension;
	private final boolean parallel;

	/**
	 * Create a box counter with the default box sizes and fractal dimension domain.
	 */
	public BoxCounter() {
		this(DEFAULT_BOX_SIZES, DEFAULT_MIN_DIMENSION, DEFAULT_MAX_DIMENSION, false);
	}

	/**
	 * Create a box counter.
	 *
	 * @param boxSizes strictly increasing box sizes, all at least 2
	 * @param minDimension minimum fractal dimension; estimates below this are clamped
	 * @param maxDimension maximum fractal dimension; estimates above this are clamped
	 * @param parallel if true, count boxes for different sizes in parallel
	 * @throws InvalidConfigurationException if the box sizes or domain are invalid
	 */
	public BoxCounter(int[] boxSizes, double minDimension, double maxDimension, boolean parallel) throws InvalidConfigurationException {
		checkBoxSizes(boxSizes);
		if (!Double.isFinite(minDimension) || !Double.isFinite(maxDimension) || minDimension >= maxDimension)
			throw new InvalidConfigurationException("Fractal dimension domain [" + minDimension + ", " + maxDimension + "] is invalid");
		this.boxSizes = boxSizes.clone();
		this.minDimension = minDimension;
		this.maxDimension = maxDimension;
		this.parallel = parallel;
	}

	/**
	 * Check that box sizes are non-empty, strictly increasing and all at least 2.
	 * @param boxSizes
	 * @throws InvalidConfigurationException if the box sizes are invalid
	 */
	public static void checkBoxSizes(int[] boxSizes) throws InvalidConfigurationException {
		if (boxSizes == null || boxSizes.length == 0)
			throw new InvalidConfigurationException("At least one box size is required");
		for (int i = 0; i < boxSizes.length; i++) {
			if (boxSizes[i] < 2)
				throw new InvalidConfigurationException("Box sizes must be >= 2, but found " + boxSizes[i]);
			if (i > 0 && boxSizes[i] <= boxSizes[i-1])
				throw new InvalidConfigurationException("Box sizes must be strictly increasing: " + Arrays.toString(boxSizes));
		}
	}

	/**
	 * Get a copy of the box sizes.
	 * @return
	 */
	public int[] getBoxSizes() {
		return boxSizes.clone();
	}

	/**
	 * Largest box size.
	 * @return
	 */
	public int getMaxBoxSize() {
		return boxSizes[boxSizes.length - 1];
	}

	/**
	 * Minimum of the fractal dimension domain.
	 * @return
	 */
	public double getMinDimension() {
		return minDimension;
	}

	/**
	 * Maximum of the fractal dimension domain.
	 * @return
	 */
	public double getMaxDimension() {
		return maxDimension;
	}

	/**
	 * Estimate the fractal dimension of a mask.
	 *
	 * @param mask
	 * @return
	 * @throws InvalidConfigurationException if the largest box size exceeds the width or height of the mask
	 * @throws InsufficientDataException if the mask is not empty, but fewer than 2 box sizes have non-zero counts
	 */
	public FractalDimensionResult estimate(BinaryMask mask) throws InvalidConfigurationException, InsufficientDataException {
		var samples = countBoxes(mask);
		var valid = samples.stream().filter(BoxCountSample::isValid).collect(Collectors.toList());

		if (valid.isEmpty()) {
			logger.debug("No edge pixels found - fractal dimension set to {}", minDimension);
			return new FractalDimensionResult(samples, null, minDimension);
		}
		if (valid.size() < 2) {
			throw new InsufficientDataException("Only " + valid.size() + " of " + samples.size() + 
					" box sizes contain edge pixels, at least 2 are needed to estimate a fractal dimension: " + samples);
		}
		int firstCount = valid.get(0).count();
		if (valid.stream().allMatch(s -> s.count() == firstCount)) {
			logger.debug("Box count {} is the same at every scale - fractal dimension set to {}", firstCount, minDimension);
			return new FractalDimensionResult(samples, null, minDimension);
		}

		double[] x = valid.stream().mapToDouble(BoxCountSample::getLogInverseBoxSize).toArray();
		double[] y = valid.stream().mapToDouble(BoxCountSample::getLogCount).toArray();
		var regression = RegressionResult.fitLine(x, y);

		double slope = regression.getSlope();
		double fd = GeneralTools.clipValue(slope, minDimension, maxDimension);
		if (fd != slope)
			logger.debug("Fractal dimension {} clamped to {}", slope, fd);
		logger.debug("Box counting: {}, {}", samples, regression);
		return new FractalDimensionResult(samples, regression, fd);
	}

	/**
	 * Count occupied boxes for every box size.
	 *
	 * @param mask
	 * @return one sample per box size, in increasing order of box size
	 * @throws InvalidConfigurationException if the largest box size exceeds the width or height of the mask
	 */
	public List<BoxCountSample> countBoxes(BinaryMask mask) throws InvalidConfigurationException {
		int maxBoxSize = getMaxBoxSize();
		if (maxBoxSize > Math.min(mask.getWidth(), mask.getHeight()))
			throw new InvalidConfigurationException("Largest box size " + maxBoxSize + " exceeds the " + mask.getWidth() + "x" + mask.getHeight() + " mask");
		var stream = IntStream.of(boxSizes);
		if (parallel)
			stream = stream.parallel();
		// Encounter order is preserved, so the result does not depend on scheduling
		return stream.mapToObj(s -> new BoxCountSample(s, countOccupiedBoxes(mask, s))).collect(Collectors.toList());
	}

	/**
	 * Count the number of complete boxes of a given size that contain at least one set pixel.
	 * Only set pixels are visited, so the cost depends on the number of edge pixels rather than the mask size.
	 *
	 * @param mask
	 * @param boxSize
	 * @return
	 */
	public static int countOccupiedBoxes(BinaryMask mask, int boxSize) {
		if (boxSize < 1)
			throw new IllegalArgumentException("Box size must be positive, but was " + boxSize);
		int width = mask.getWidth();
		int nx = width / boxSize;
		int ny = mask.getHeight() / boxSize;
		if (nx == 0 || ny == 0)
			return 0;
		boolean[] occupied = new boolean[nx * ny];
		int count = 0;
		int usedWidth = nx * boxSize;
		for (int y = 0; y < ny * boxSize; y++) {
			int rowStart = y * width;
			int rowEnd = rowStart + usedWidth;
			int by = y / boxSize;
			for (int i = mask.nextSetIndex(rowStart); i >= 0 && i < rowEnd; i = mask.nextSetIndex(i + 1)) {
				int ind = by * nx + (i - rowStart) / boxSize;
				if (!occupied[ind]) {
					occupied[ind] = true;
					count++;
				}
			}
		}
		return count;
	}

	@Override
	public String toString() {
		return "BoxCounter [boxSizes=" + GeneralTools.arrayToString(boxSizes, ",") + ", domain=[" + minDimension + ", " + maxDimension + "]]";
	}

}
