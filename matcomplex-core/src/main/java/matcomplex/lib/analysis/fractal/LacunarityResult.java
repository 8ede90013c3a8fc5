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

/**
 * Result of a gliding box lacunarity estimate, with one {@link GlidingBoxSample} per window size.
 */
public final class LacunarityResult {

	private final List<GlidingBoxSample> samples;

	LacunarityResult(List<GlidingBoxSample> samples) {
		if (samples.isEmpty())
			throw new IllegalArgumentException("At least one gliding box sample is required");
		this.samples = Collections.unmodifiableList(samples);
	}

	/**
	 * Samples for each window size, in increasing order of window size.
	 * @return
	 */
	public List<GlidingBoxSample> getSamples() {
		return samples;
	}

	/**
	 * The combined lacunarity: the mean of the lacunarity for each window size.
	 * @return
	 */
	public double getLacunarity() {
		double sum = 0;
		for (var sample : samples)
			sum += sample.getLacunarity();
		return sum / samples.size();
	}

	@Override
	public String toString() {
		return "LacunarityResult [L=" + getLacunarity() + ", samples=" + samples + "]";
	}

}
