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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Map a numeric value to one of an ordered list of labels, using half-open intervals.
 * <p>
 * For thresholds {@code t[0] < t[1] < ... < t[n-1]} and labels {@code l[0] ... l[n]}, 
 * values below {@code t[0]} get {@code l[0]}, values in {@code [t[i-1], t[i])} get {@code l[i]}, 
 * and values of at least {@code t[n-1]} get {@code l[n]}. 
 * Every value except NaN therefore maps to exactly one label.
 *
 * @param <T> label type
 */
public final class ThresholdTable<T> {

	private final double[] thresholds;
	private final List<T> labels;

	private ThresholdTable(double[] thresholds, List<T> labels) {
		this.thresholds = thresholds;
		this.labels = labels;
	}

	/**
	 * Create a table.
	 *
	 * @param <T>
	 * @param labels ordered labels; there must be one more label than thresholds
	 * @param thresholds strictly increasing, finite thresholds
	 * @return
	 * @throws InvalidConfigurationException if the thresholds are invalid, or do not match the number of labels
	 */
	public static <T> ThresholdTable<T> create(List<T> labels, double... thresholds) throws InvalidConfigurationException {
		Objects.requireNonNull(labels);
		if (thresholds == null || thresholds.length != labels.size() - 1)
			throw new InvalidConfigurationException("Expected " + (labels.size() - 1) + " thresholds for labels " + labels +
					", but found " + (thresholds == null ? "none" : Arrays.toString(thresholds)));
		checkThresholds(thresholds);
		return new ThresholdTable<>(thresholds.clone(), Collections.unmodifiableList(new ArrayList<>(labels)));
	}

	/**
	 * Check that thresholds are finite and strictly increasing.
	 * @param thresholds
	 * @throws InvalidConfigurationException if the thresholds are invalid
	 */
	static void checkThresholds(double[] thresholds) throws InvalidConfigurationException {
		for (int i = 0; i < thresholds.length; i++) {
			if (!Double.isFinite(thresholds[i]))
				throw new InvalidConfigurationException("Thresholds must be finite: " + Arrays.toString(thresholds));
			if (i > 0 && thresholds[i] <= thresholds[i-1])
				throw new InvalidConfigurationException("Thresholds must be strictly increasing: " + Arrays.toString(thresholds));
		}
	}

	/**
	 * Get the label for a value.
	 * @param value
	 * @return
	 * @throws IllegalArgumentException if the value is NaN
	 */
	public T classify(double value) throws IllegalArgumentException {
		if (Double.isNaN(value))
			throw new IllegalArgumentException("Cannot classify NaN");
		for (int i = thresholds.length - 1; i >= 0; i--) {
			if (value >= thresholds[i])
				return labels.get(i + 1);
		}
		return labels.get(0);
	}

	/**
	 * Get a copy of the thresholds.
	 * @return
	 */
	public double[] getThresholds() {
		return thresholds.clone();
	}

	/**
	 * Get the labels, in order.
	 * @return
	 */
	public List<T> getLabels() {
		return labels;
	}

	@Override
	public String toString() {
		var sb = new StringBuilder("ThresholdTable [");
		for (int i = 0; i < labels.size(); i++) {
			sb.append(labels.get(i));
			if (i < thresholds.length)
				sb.append(" < ").append(thresholds[i]).append(" <= ");
		}
		return sb.append("]").toString();
	}

}
