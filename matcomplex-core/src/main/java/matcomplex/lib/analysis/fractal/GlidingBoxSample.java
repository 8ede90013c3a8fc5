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

/**
 * Summary of the box masses found by sweeping a window of one size across an image.
 */
public final class GlidingBoxSample {

	private final int windowSize;
	private final long numPositions;
	private final double mean;
	private final double stdDev;
	private final double min;
	private final double max;

	GlidingBoxSample(int windowSize, long numPositions, double mean, double stdDev, double min, double max) {
		this.windowSize = windowSize;
		this.numPositions = numPositions;
		this.mean = mean;
		this.stdDev = stdDev;
		this.min = min;
		this.max = max;
	}

	/**
	 * Side length of the square window, in pixels.
	 * @return
	 */
	public int getWindowSize() {
		return windowSize;
	}

	/**
	 * Number of window positions that were sampled.
	 * @return
	 */
	public long getNumPositions() {
		return numPositions;
	}

	/**
	 * Mean box mass.
	 * @return
	 */
	public double getMean() {
		return mean;
	}

	/**
	 * Population standard deviation of the box masses.
	 * @return
	 */
	public double getStdDev() {
		return stdDev;
	}

	/**
	 * Smallest box mass.
	 * @return
	 */
	public double getMin() {
		return min;
	}

	/**
	 * Largest box mass.
	 * @return
	 */
	public double getMax() {
		return max;
	}

	/**
	 * Lacunarity for this window size, {@code (stdDev / mean)^2}.
	 * This is 0 if the mean mass is 0.
	 * @return
	 */
	public double getLacunarity() {
		if (numPositions == 0 || mean == 0)
			return 0.0;
		double ratio = stdDev / mean;
		return ratio * ratio;
	}

	@Override
	public String toString() {
		return String.format("GlidingBoxSample [window=%d, n=%d, mean=%.3f, std=%.3f, L=%.4f]", windowSize, numPositions, mean, stdDev, getLacunarity());
	}

}
