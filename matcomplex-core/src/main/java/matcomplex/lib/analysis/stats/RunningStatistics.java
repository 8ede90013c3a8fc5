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

package matcomplex.lib.analysis.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper class for computing basic statistics from values as they are added.
 * <p>
 * This is useful e.g. when sweeping a window across an image, since the values do not need to be stored.
 * Both the sample and population variance are available.
 * <p>
 * Warning! This maintains a sum as a double - for many large values this may lead to imprecision. 
 * A warning is logged for particularly large values.
 *
 * @author Pete Bankhead
 */
public class RunningStatistics {

	private static final Logger logger = LoggerFactory.getLogger(RunningStatistics.class);

	// See http://www.johndcook.com/standard_deviation.html

	private static final double LARGE_DOUBLE_THRESHOLD = Math.pow(2, 53) - 1;

	private int numNaNs = 0;

	protected long size = 0;
	private double sum = 0, min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;

	private double m1 = 0, s1 = 0;

	/**
	 * Default constructor.
	 */
	public RunningStatistics() {}

	/**
	 * Get count of the number of non-NaN values added.
	 * @return
	 *
	 * @see #getNumNaNs()
	 */
	public long size() {
		return size;
	}

	/**
	 * Add another value; NaN values are counted but do not contribute to the statistics.
	 *
	 * @param val
	 *
	 * @see #getNumNaNs()
	 */
	public void addValue(double val) {
		if (Double.isNaN(val)) {
			numNaNs++;
			return;
		}
		size++;
		sum += val;
		if (val < min)
			min = val;
		if (val > max)
			max = val;
		// Welford's update
		if (size == 1) {
			m1 = val;
		} else {
			double mNew = m1 + (val - m1) / size;
			s1 = s1 + (val - m1)*(val - mNew);
			m1 = mNew;
		}
	}

	/**
	 * Get count of the number of NaN values added.
	 * @return
	 *
	 * @see #size()
	 */
	public long getNumNaNs() {
		return numNaNs;
	}

	/**
	 * Get the sum of all non-NaN values that were added.
	 * @return
	 */
	public double getSum() {
		if (Math.abs(sum) > LARGE_DOUBLE_THRESHOLD)
			logger.warn("Sum in {} is particularly large ({}), beware imprecision!", getClass().getSimpleName(), sum);
		return sum;
	}

	/**
	 * Get the mean of all non-NaN values that were added.
	 * @return the mean, or NaN if no values are available
	 */
	public double getMean() {
		return (size == 0) ? Double.NaN : getSum() / size;
	}

	/**
	 * Get the sample variance (normalized by n-1) of all non-NaN values that were added.
	 * @return the variance, or NaN if fewer than 2 values are available
	 */
	public double getVariance() {
		checkVarianceParameter();
		return (size <= 1) ? Double.NaN : s1 / (size - 1);
	}

	/**
	 * Get the population variance (normalized by n) of all non-NaN values that were added.
	 * @return the variance, or NaN if no values are available
	 */
	public double getPopulationVariance() {
		checkVarianceParameter();
		return (size == 0) ? Double.NaN : s1 / size;
	}

	private void checkVarianceParameter() {
		if (Math.abs(s1) > LARGE_DOUBLE_THRESHOLD)
			logger.warn("Variance parameter s1 in {} is particularly large ({}), beware imprecision!", getClass().getSimpleName(), s1);
	}

	/**
	 * Get the sample standard deviation of all non-NaN values that were added.
	 * @return
	 * @see #getVariance()
	 */
	public double getStdDev() {
		return Math.sqrt(getVariance());
	}

	/**
	 * Get the population standard deviation of all non-NaN values that were added.
	 * @return
	 * @see #getPopulationVariance()
	 */
	public double getPopulationStdDev() {
		return Math.sqrt(getPopulationVariance());
	}

	/**
	 * Get the minimum non-NaN value added.
	 * @return the minimum value, or NaN if no values are available.
	 */
	public double getMin() {
		return (size == 0) ? Double.NaN : min;
	}

	/**
	 * Get the maximum non-NaN value added.
	 * @return the maximum value, or NaN if no values are available.
	 */
	public double getMax() {
		return (size == 0) ? Double.NaN : max;
	}

	/**
	 * Get the range, i.e. maximum - minimum values.
	 * @return
	 */
	public double getRange() {
		return (size == 0) ? Double.NaN : max - min;
	}

	@Override
	public String toString() {
		return String.format("%s Mean: %.2f, Std.dev: %.2f, Min: %.2f, Max: %.2f", RunningStatistics.class.getSimpleName(), getMean(), getPopulationStdDev(), getMin(), getMax());
	}

}
