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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flat, immutable result of measuring the visual complexity of one image.
 */
public final class MeasurementResult {

	/**
	 * Key for the raw fractal dimension in {@link #toMap()}.
	 */
	public static final String KEY_FRACTAL_DIMENSION = "Fractal dimension";

	/**
	 * Key for the normalized fractal dimension in {@link #toMap()}.
	 */
	public static final String KEY_FRACTAL_DIMENSION_NORMALIZED = "Fractal dimension (normalized)";

	/**
	 * Key for the raw lacunarity in {@link #toMap()}.
	 */
	public static final String KEY_LACUNARITY = "Lacunarity";

	/**
	 * Key for the normalized lacunarity in {@link #toMap()}.
	 */
	public static final String KEY_LACUNARITY_NORMALIZED = "Lacunarity (normalized)";

	/**
	 * Key for the composite score in {@link #toMap()}.
	 */
	public static final String KEY_COMPOSITE = "Composite";

	private final double fractalDimension;
	private final double normalizedFractalDimension;
	private final double lacunarity;
	private final double normalizedLacunarity;
	private final double composite;
	private final FractalLabel fractalLabel;
	private final LacunarityLabel lacunarityLabel;
	private final CompositeLabel compositeLabel;

	/**
	 * Create a result.
	 *
	 * @param fractalDimension raw fractal dimension, clamped to its domain
	 * @param normalizedFractalDimension fractal dimension in [0, 1]
	 * @param lacunarity raw lacunarity, &ge; 0
	 * @param normalizedLacunarity lacunarity in [0, 1]
	 * @param composite composite score in [0, 1]
	 * @param fractalLabel
	 * @param lacunarityLabel
	 * @param compositeLabel
	 * @throws IllegalArgumentException if a normalized value is outside [0, 1], or the raw lacunarity is negative or NaN
	 */
	public MeasurementResult(double fractalDimension, double normalizedFractalDimension,
			double lacunarity, double normalizedLacunarity, double composite,
			FractalLabel fractalLabel, LacunarityLabel lacunarityLabel, CompositeLabel compositeLabel) throws IllegalArgumentException {
		checkUnitInterval("Normalized fractal dimension", normalizedFractalDimension);
		checkUnitInterval("Normalized lacunarity", normalizedLacunarity);
		checkUnitInterval("Composite", composite);
		if (!(lacunarity >= 0))
			throw new IllegalArgumentException("Lacunarity must be >= 0, but was " + lacunarity);
		if (Double.isNaN(fractalDimension))
			throw new IllegalArgumentException("Fractal dimension must not be NaN");
		this.fractalDimension = fractalDimension;
		this.normalizedFractalDimension = normalizedFractalDimension;
		this.lacunarity = lacunarity;
		this.normalizedLacunarity = normalizedLacunarity;
		this.composite = composite;
		this.fractalLabel = Objects.requireNonNull(fractalLabel);
		this.lacunarityLabel = Objects.requireNonNull(lacunarityLabel);
		this.compositeLabel = Objects.requireNonNull(compositeLabel);
	}

	private static void checkUnitInterval(String name, double value) {
		if (!(value >= 0 && value <= 1))
			throw new IllegalArgumentException(name + " must be in the range [0, 1], but was " + value);
	}

	/**
	 * Raw fractal dimension of the edge mask, clamped to the fractal dimension domain.
	 * @return
	 */
	public double getFractalDimension() {
		return fractalDimension;
	}

	/**
	 * Fractal dimension rescaled to [0, 1].
	 * @return
	 */
	public double getNormalizedFractalDimension() {
		return normalizedFractalDimension;
	}

	/**
	 * Raw gliding-box lacunarity.
	 * @return
	 */
	public double getLacunarity() {
		return lacunarity;
	}

	/**
	 * Lacunarity scaled to [0, 1].
	 * @return
	 */
	public double getNormalizedLacunarity() {
		return normalizedLacunarity;
	}

	/**
	 * Weighted composite of the normalized fractal dimension and lacunarity.
	 * @return
	 */
	public double getComposite() {
		return composite;
	}

	/**
	 * @return label for the raw fractal dimension
	 */
	public FractalLabel getFractalLabel() {
		return fractalLabel;
	}

	/**
	 * @return label for the normalized lacunarity
	 */
	public LacunarityLabel getLacunarityLabel() {
		return lacunarityLabel;
	}

	/**
	 * @return label for the composite score
	 */
	public CompositeLabel getCompositeLabel() {
		return compositeLabel;
	}

	/**
	 * Get the numeric values as an ordered map, using the {@code KEY_} constants.
	 * @return
	 */
	public Map<String, Double> toMap() {
		var map = new LinkedHashMap<String, Double>();
		map.put(KEY_FRACTAL_DIMENSION, fractalDimension);
		map.put(KEY_FRACTAL_DIMENSION_NORMALIZED, normalizedFractalDimension);
		map.put(KEY_LACUNARITY, lacunarity);
		map.put(KEY_LACUNARITY_NORMALIZED, normalizedLacunarity);
		map.put(KEY_COMPOSITE, composite);
		return map;
	}

	@Override
	public int hashCode() {
		return Objects.hash(fractalDimension, normalizedFractalDimension, lacunarity, normalizedLacunarity, composite,
				fractalLabel, lacunarityLabel, compositeLabel);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MeasurementResult))
			return false;
		MeasurementResult other = (MeasurementResult) obj;
		return Double.compare(fractalDimension, other.fractalDimension) == 0
				&& Double.compare(normalizedFractalDimension, other.normalizedFractalDimension) == 0
				&& Double.compare(lacunarity, other.lacunarity) == 0
				&& Double.compare(normalizedLacunarity, other.normalizedLacunarity) == 0
				&& Double.compare(composite, other.composite) == 0
				&& fractalLabel == other.fractalLabel
				&& lacunarityLabel == other.lacunarityLabel
				&& compositeLabel == other.compositeLabel;
	}

	@Override
	public String toString() {
		return "MeasurementResult [FD=" + fractalDimension + " (" + fractalLabel + "), L=" + lacunarity 
				+ " (" + lacunarityLabel + "), C=" + composite + " (" + compositeLabel + ")]";
	}

}
