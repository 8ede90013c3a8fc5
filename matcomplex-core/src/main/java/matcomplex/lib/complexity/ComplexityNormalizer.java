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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.common.GeneralTools;

/**
 * Map raw fractal dimension and lacunarity values into [0, 1], and combine them into a composite score.
 * <p>
 * The composite score is a weighted sum of the <i>normalized</i> fractal dimension and the <i>normalized</i> lacunarity, 
 * so that both terms share the same range.
 */
public class ComplexityNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(ComplexityNormalizer.class);

	private final double minFractalDimension;
	private final double maxFractalDimension;
	private final double lacunarityScale;
	private final double fractalWeight;
	private final double lacunarityWeight;

	/**
	 * Create a normalizer using the domain, scale and weights from the specified parameters.
	 * @param params
	 */
	public ComplexityNormalizer(ComplexityParameters params) {
		this(params.getMinFractalDimension(), params.getMaxFractalDimension(), params.getLacunarityScale(),
				params.getFractalWeight(), params.getLacunarityWeight());
	}

	/**
	 * Create a normalizer.
	 *
	 * @param minFractalDimension minimum of the fractal dimension domain
	 * @param maxFractalDimension maximum of the fractal dimension domain
	 * @param lacunarityScale raw lacunarity is divided by this before clamping
	 * @param fractalWeight weight of the normalized fractal dimension
	 * @param lacunarityWeight weight of the normalized lacunarity
	 * @throws InvalidConfigurationException if the domain is empty, the scale is not positive, 
	 *                                       or the weights are negative or do not sum to 1
	 */
	public ComplexityNormalizer(double minFractalDimension, double maxFractalDimension, double lacunarityScale,
			double fractalWeight, double lacunarityWeight) throws InvalidConfigurationException {
		if (!Double.isFinite(minFractalDimension) || !Double.isFinite(maxFractalDimension) || minFractalDimension >= maxFractalDimension)
			throw new InvalidConfigurationException("Fractal dimension domain [" + minFractalDimension + ", " + maxFractalDimension + "] is invalid");
		if (!Double.isFinite(lacunarityScale) || lacunarityScale <= 0)
			throw new InvalidConfigurationException("Lacunarity scale must be finite and > 0, but was " + lacunarityScale);
		if (!(fractalWeight >= 0) || !(lacunarityWeight >= 0) || Math.abs(fractalWeight + lacunarityWeight - 1.0) > ComplexityParameters.WEIGHT_TOLERANCE)
			throw new InvalidConfigurationException("Weights must be >= 0 and sum to 1, but were " + fractalWeight + " and " + lacunarityWeight);
		this.minFractalDimension = minFractalDimension;
		this.maxFractalDimension = maxFractalDimension;
		this.lacunarityScale = lacunarityScale;
		this.fractalWeight = fractalWeight;
		this.lacunarityWeight = lacunarityWeight;
	}

	/**
	 * Rescale a raw fractal dimension from the domain to [0, 1].
	 * NaN is treated as the minimum of the domain.
	 *
	 * @param fractalDimension
	 * @return
	 */
	public double normalizeFractalDimension(double fractalDimension) {
		if (Double.isNaN(fractalDimension)) {
			logger.warn("Fractal dimension is NaN - normalized value set to 0");
			return 0;
		}
		return GeneralTools.clipValue((fractalDimension - minFractalDimension) / (maxFractalDimension - minFractalDimension), 0, 1);
	}

	/**
	 * Scale a raw lacunarity to [0, 1].
	 * NaN is treated as 0.
	 *
	 * @param lacunarity
	 * @return
	 */
	public double normalizeLacunarity(double lacunarity) {
		if (Double.isNaN(lacunarity)) {
			logger.warn("Lacunarity is NaN - normalized value set to 0");
			return 0;
		}
		return GeneralTools.clipValue(lacunarity / lacunarityScale, 0, 1);
	}

	/**
	 * Compute the composite score from normalized values.
	 *
	 * @param normalizedFractalDimension
	 * @param normalizedLacunarity
	 * @return weighted sum, clamped to [0, 1]
	 */
	public double computeComposite(double normalizedFractalDimension, double normalizedLacunarity) {
		double fd = Double.isNaN(normalizedFractalDimension) ? 0 : normalizedFractalDimension;
		double lac = Double.isNaN(normalizedLacunarity) ? 0 : normalizedLacunarity;
		double composite = fractalWeight * fd + lacunarityWeight * lac;
		return GeneralTools.clipValue(composite, 0, 1);
	}

	/**
	 * Minimum of the fractal dimension domain.
	 * @return
	 */
	public double getMinFractalDimension() {
		return minFractalDimension;
	}

	/**
	 * Maximum of the fractal dimension domain.
	 * @return
	 */
	public double getMaxFractalDimension() {
		return maxFractalDimension;
	}

	/**
	 * Scale used to normalize lacunarity.
	 * @return
	 */
	public double getLacunarityScale() {
		return lacunarityScale;
	}

	/**
	 * Weight of the normalized fractal dimension.
	 * @return
	 */
	public double getFractalWeight() {
		return fractalWeight;
	}

	/**
	 * Weight of the normalized lacunarity.
	 * @return
	 */
	public double getLacunarityWeight() {
		return lacunarityWeight;
	}

	@Override
	public String toString() {
		return "ComplexityNormalizer [fdDomain=[" + minFractalDimension + ", " + maxFractalDimension + "], lacunarityScale="
				+ lacunarityScale + ", weights=" + fractalWeight + "/" + lacunarityWeight + "]";
	}

}
