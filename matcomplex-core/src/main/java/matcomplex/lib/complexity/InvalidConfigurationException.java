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
 * Thrown when measurement parameters are invalid, either in themselves 
 * (e.g. box sizes not strictly increasing) or for a specific image (e.g. a window larger than the image).
 * <p>
 * This is always thrown before any computation is attempted.
 */
public class InvalidConfigurationException extends ComplexityException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param message
	 */
	public InvalidConfigurationException(String message) {
		super(message);
	}

	/**
	 * Constructor with a cause, e.g. a parsing failure.
	 * @param message
	 * @param cause
	 */
	public InvalidConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

}
