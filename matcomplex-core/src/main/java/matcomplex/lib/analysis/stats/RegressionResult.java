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

package matcomplex.lib.analysis.stats;

import java.util.Objects;

import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Result of an ordinary least-squares straight-line fit {@code y = intercept + slope * x}.
 */
public final class RegressionResult {

	private final double slope;
	private final double intercept;
	private final double rSquared;
	private final long nPoints;

	private RegressionResult(double slope, double intercept, double rSquared, long nPoints) {
		this.slope = slope;
		this.intercept = intercept;
		this.rSquared = rSquared;
		this.nPoints = nPoints;
	}

	/**
	 * Fit a straight line through the points (x[i], y[i]).
	 *
	 * @param x
	 * @param y
	 * @return
	 * @throws IllegalArgumentException if the arrays differ in length, or fewer than 2 points are available
	 */
	public static RegressionResult fitLine(double[] x, double[] y) throws IllegalArgumentException {
		Objects.requireNonNull(x);
		Objects.requireNonNull(y);
		if (x.length != y.length)
			throw new IllegalArgumentException("Expected the same number of x and y values, but found " + x.length + " and " + y.length);
		if (x.length < 2)
			throw new IllegalArgumentException("At least 2 points are needed to fit a line, but only " + x.length + " available");
		var regression = new SimpleRegression(true);
		for (int i = 0; i < x.length; i++)
			regression.addData(x[i], y[i]);
		return new RegressionResult(regression.getSlope(), regression.getIntercept(), regression.getRSquare(), regression.getN());
	}

	/**
	 * Slope of the fitted line.
	 * @return
	 */
	public double getSlope() {
		return slope;
	}

	/**
	 * Intercept of the fitted line.
	 * @return
	 */
	public double getIntercept() {
		return intercept;
	}

	/**
	 * Coefficient of determination for the fit.
	 * This is NaN if all the y values are identical.
	 * @return
	 */
	public double getRSquared() {
		return rSquared;
	}

	/**
	 * Number of points used for the fit.
	 * @return
	 */
	public long getNumPoints() {
		return nPoints;
	}

	@Override
	public String toString() {
		return String.format("RegressionResult [slope=%.4f, intercept=%.4f, R²=%.4f, n=%d]", slope, intercept, rSquared, nPoints);
	}

}
