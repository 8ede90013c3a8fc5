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

import java.util.Arrays;

/**
 * Assign discrete labels to fractal dimension, lacunarity and composite values.
 * <p>
 * The fractal dimension table is applied to the raw (clamped) fractal dimension, 
 * while the lacunarity table is applied to the normalized lacunarity.
 */
public class ComplexityClassifier {

	private final ThresholdTable<FractalLabel> fractalTable;
	private final ThresholdTable<LacunarityLabel> lacunarityTable;
	private final ThresholdTable<CompositeLabel> compositeTable;

	/**
	 * Create a classifier with the default thresholds.
	 */
	public ComplexityClassifier() {
		this(ComplexityParameters.getDefaultInstance());
	}

	/**
	 * Create a classifier using the thresholds from the specified parameters.
	 * @param params
	 * @throws InvalidConfigurationException if any thresholds are invalid
	 */
	public ComplexityClassifier(ComplexityParameters params) throws InvalidConfigurationException {
		this.fractalTable = createFractalTable(params.getFractalThresholds());
		this.lacunarityTable = createLacunarityTable(params.getLacunarityThresholds());
		this.compositeTable = createCompositeTable(params.getCompositeThresholds());
	}

	static ThresholdTable<FractalLabel> createFractalTable(double[] thresholds) throws InvalidConfigurationException {
		return ThresholdTable.create(Arrays.asList(FractalLabel.values()), thresholds);
	}

	static ThresholdTable<LacunarityLabel> createLacunarityTable(double[] thresholds) throws InvalidConfigurationException {
		return ThresholdTable.create(Arrays.asList(LacunarityLabel.values()), thresholds);
	}

	static ThresholdTable<CompositeLabel> createCompositeTable(double[] thresholds) throws InvalidConfigurationException {
		return ThresholdTable.create(Arrays.asList(CompositeLabel.values()), thresholds);
	}

	/**
	 * Label a raw fractal dimension.
	 * @param fractalDimension
	 * @return
	 * @throws IllegalArgumentException if the value is NaN
	 */
	public FractalLabel classifyFractalDimension(double fractalDimension) throws IllegalArgumentException {
		return fractalTable.classify(fractalDimension);
	}

	/**
	 * Label a normalized lacunarity.
	 * @param normalizedLacunarity
	 * @return
	 * @throws IllegalArgumentException if the value is NaN
	 */
	public LacunarityLabel classifyLacunarity(double normalizedLacunarity) throws IllegalArgumentException {
		return lacunarityTable.classify(normalizedLacunarity);
	}

	/**
	 * Label a composite score.
	 * @param composite
	 * @return
	 * @throws IllegalArgumentException if the value is NaN
	 */
	public CompositeLabel classifyComposite(double composite) throws IllegalArgumentException {
		return compositeTable.classify(composite);
	}

	/**
	 * Get the table used to label fractal dimensions.
	 * @return
	 */
	public ThresholdTable<FractalLabel> getFractalTable() {
		return fractalTable;
	}

	/**
	 * Get the table used to label normalized lacunarity.
	 * @return
	 */
	public ThresholdTable<LacunarityLabel> getLacunarityTable() {
		return lacunarityTable;
	}

	/**
	 * Get the table used to label composite scores.
	 * @return
	 */
	public ThresholdTable<CompositeLabel> getCompositeTable() {
		return compositeTable;
	}

}
