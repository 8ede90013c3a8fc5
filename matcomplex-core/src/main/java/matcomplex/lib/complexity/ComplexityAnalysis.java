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

package matcomplex.lib.complexity;

import java.util.Objects;

import matcomplex.lib.analysis.fractal.FractalDimensionResult;
import matcomplex.lib.analysis.fractal.LacunarityResult;
import matcomplex.lib.analysis.images.BinaryMask;

/**
 * A {@link MeasurementResult} together with the intermediate results used to compute it.
 * <p>
 * This is mostly useful for diagnostics, e.g. to inspect the box counts or the edge mask.
 */
public final class ComplexityAnalysis {

	private final MeasurementResult result;
	private final FractalDimensionResult fractalDimensionResult;
	private final LacunarityResult lacunarityResult;
	private final BinaryMask edgeMask;

	/**
	 * Constructor.
	 * @param result the final measurement
	 * @param fractalDimensionResult box counting result for the edge mask
	 * @param lacunarityResult gliding box result for the mass image
	 * @param edgeMask the detected edges
	 */
	public ComplexityAnalysis(MeasurementResult result, FractalDimensionResult fractalDimensionResult,
			LacunarityResult lacunarityResult, BinaryMask edgeMask) {
		this.result = Objects.requireNonNull(result);
		this.fractalDimensionResult = Objects.requireNonNull(fractalDimensionResult);
		this.lacunarityResult = Objects.requireNonNull(lacunarityResult);
		this.edgeMask = Objects.requireNonNull(edgeMask);
	}

	/**
	 * @return the final measurement
	 */
	public MeasurementResult getResult() {
		return result;
	}

	/**
	 * @return box counts and regression used to estimate the fractal dimension
	 */
	public FractalDimensionResult getFractalDimensionResult() {
		return fractalDimensionResult;
	}

	/**
	 * @return gliding box statistics used to estimate lacunarity
	 */
	public LacunarityResult getLacunarityResult() {
		return lacunarityResult;
	}

	/**
	 * @return the detected edges
	 */
	public BinaryMask getEdgeMask() {
		return edgeMask;
	}

	@Override
	public String toString() {
		return "ComplexityAnalysis [" + result + ", " + fractalDimensionResult + ", " + lacunarityResult + "]";
	}

}
