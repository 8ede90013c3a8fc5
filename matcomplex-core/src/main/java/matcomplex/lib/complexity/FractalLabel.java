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

/**
 * Labels for the fractal dimension of an edge pattern.
 * <p>
 * Fractal dimensions between 1.2 and 1.7 are the range commonly reported as preferred by viewers.
 */
public enum FractalLabel implements MeasurementLabel {

	/**
	 * FD below 1.2, e.g. a plain color or a regular grid.
	 */
	VERY_SIMPLE("Very simple", "Simple pattern", LabelTone.LOW),

	/**
	 * FD from 1.2 to 1.4.
	 */
	PREFERRED_LOW("Preferred (lower)", "Comfortable complexity", LabelTone.PREFERRED),

	/**
	 * FD from 1.4 to 1.7.
	 */
	PREFERRED_HIGH("Preferred (upper)", "Engaging complexity", LabelTone.PREFERRED),

	/**
	 * FD from 1.7 to 1.8.
	 */
	COMPLEX("Complex", "High complexity", LabelTone.HIGH),

	/**
	 * FD of 1.8 or more.
	 */
	VERY_COMPLEX("Very complex", "Very high complexity", LabelTone.HIGH);

	private final String displayName;
	private final String description;
	private final LabelTone tone;

	FractalLabel(String displayName, String description, LabelTone tone) {
		this.displayName = displayName;
		this.description = description;
		this.tone = tone;
	}

	@Override
	public String getDisplayName() {
		return displayName;
	}

	@Override
	public String getDescription() {
		return description;
	}

	@Override
	public LabelTone getTone() {
		return tone;
	}

	/**
	 * Query if the label falls within the preferred range.
	 * @return
	 */
	public boolean isPreferred() {
		return tone == LabelTone.PREFERRED;
	}

	@Override
	public String toString() {
		return displayName;
	}

}
