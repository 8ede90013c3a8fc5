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

import java.util.Locale;

/**
 * Broad category shared by labels of different measurements.
 */
public enum LabelTone {

	/**
	 * Low value (simple or uniform).
	 */
	LOW,

	/**
	 * Within the range that is usually preferred by viewers.
	 */
	PREFERRED,

	/**
	 * Intermediate value.
	 */
	MEDIUM,

	/**
	 * High value (complex or irregular).
	 */
	HIGH;

	/**
	 * Lowercase name, suitable for use as a style class.
	 * @return
	 */
	public String getStyleName() {
		return name().toLowerCase(Locale.ROOT);
	}

}
