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

/**
 * Number of occupied boxes found when tiling a mask with boxes of a single size.
 *
 * @param boxSize side length of each (square) box, in pixels
 * @param count number of boxes containing at least one set pixel
 */
public record BoxCountSample(int boxSize, int count) {

	/**
	 * Query if the sample can contribute to a log-log fit, i.e. if at least one box was occupied.
	 * @return
	 */
	public boolean isValid() {
		return count > 0;
	}

	/**
	 * The x-coordinate for a log-log fit, {@code log(1/boxSize)}.
	 * @return
	 */
	public double getLogInverseBoxSize() {
		return -Math.log(boxSize);
	}

	/**
	 * The y-coordinate for a log-log fit, {@code log(count)}.
	 * @return
	 */
	public double getLogCount() {
		return Math.log(count);
	}

}
