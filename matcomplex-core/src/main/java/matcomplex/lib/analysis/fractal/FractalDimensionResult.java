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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import matcomplex.lib.analysis.stats.RegressionResult;

/**
 * Result of estimating a fractal dimension by box counting.
 * <p>
 * For a degenerate mask (no set pixels, or the same count at every scale) no regression is performed, 
 * and the fractal dimension is the minimum of the allowed domain.
 */
public final class FractalDimensionResult {

	private final List<BoxCountSample> samples;
	private final RegressionResult regression;
	private final double fractalDimension;

	FractalDimensionResult(List<BoxCountSample> samples, RegressionResult regression, double fractalDimension) {
		this.samples = Collections.unmodifiableList(samples);
		this.regression = regression;
		this.fractalDimension = fractalDimension;
	}

	/**
	 * Box counts for every box size, in increasing order of box size (including counts of zero).
	 * @return
	 */
	public List<BoxCountSample> getSamples() {
		return samples;
	}

	/**
	 * The log-log regression, if one was performed.
	 * @return
	 */
	public Optional<RegressionResult> getRegression() {
		return Optional.ofNullable(regression);
	}

	/**
	 * Query if the mask was degenerate, so that no regression was performed.
	 * @return
	 */
	public boolean isDegenerate() {
		return regression == null;
	}

	/**
	 * The estimated fractal dimension, clamped to the allowed domain.
	 * @return
	 */
	public double getFractalDimension() {
		return fractalDimension;
	}

	@Override
	public String toString() {
		return "FractalDimensionResult [FD=" + fractalDimension + ", samples=" + samples + ", regression=" + regression + "]";
	}

}
