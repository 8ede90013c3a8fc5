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
 * A discrete label assigned to a measurement value.
 */
public interface MeasurementLabel {

	/**
	 * Short name to display, e.g. "Preferred (lower)".
	 * @return
	 */
	String getDisplayName();

	/**
	 * One-line human-readable description.
	 * @return
	 */
	String getDescription();

	/**
	 * Broad category of the label, which may be used to style its display.
	 * @return
	 */
	LabelTone getTone();

}
