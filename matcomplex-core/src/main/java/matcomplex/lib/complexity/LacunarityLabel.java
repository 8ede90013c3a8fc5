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
 * Labels for the normalized lacunarity of a pattern.
 */
public enum LacunarityLabel implements MeasurementLabel {

	/**
	 * Regular, repeating arrangement.
	 */
	UNIFORM("Uniform", "Regular arrangement", LabelTone.LOW),

	/**
	 * Moderately irregular arrangement.
	 */
	MEDIUM("Medium", "Moderately irregular", LabelTone.MEDIUM),

	/**
	 * Gappy, irregular arrangement.
	 */
	IRREGULAR("Irregular", "Irregular arrangement", LabelTone.HIGH);

	private final String displayName;
	private final String description;
	private final LabelTone tone;

	LacunarityLabel(String displayName, String description, LabelTone tone) {
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

	@Override
	public String toString() {
		return displayName;
	}

}
