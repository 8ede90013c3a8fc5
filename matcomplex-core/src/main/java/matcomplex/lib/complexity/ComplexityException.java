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
 * Base class for failures reported by the measurement pipeline.
 * <p>
 * Every failure is one of the subclasses {@link InvalidInputException}, {@link InvalidConfigurationException} 
 * or {@link InsufficientDataException}. Degenerate images (e.g. a uniform color) are not failures.
 */
public abstract class ComplexityException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	protected ComplexityException(String message) {
		super(message);
	}

	protected ComplexityException(String message, Throwable cause) {
		super(message, cause);
	}

}
