/*-
 * #%L
 * This file is part of MatComplex.
 * %%
 * Copyright (C) 2018 - 2023 QuPath developers, The University of Edinburgh
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

package matcomplex.lib.common;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.apache.commons.math3.util.Precision;

/**
 * A collection of generally useful static methods.
 *
 * @author Pete Bankhead
 */
public final class GeneralTools {

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Clip a value to be within a specific range.
	 * <p>
	 * NaN is returned unchanged; callers that need a finite result must handle it first.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Test if two doubles are approximately equal, within a specified relative tolerance.
	 *
	 * @param n1
	 * @param n2
	 * @param tolerance
	 * @return
	 */
	public static boolean almostTheSame(double n1, double n2, double tolerance) {
		return Precision.equalsWithRelativeTolerance(n1, n2, tolerance);
	}

	/**
	 * Cache of NumberFormat objects, keyed by decimal places.
	 * These always use {@link Locale#US} so that exported values are machine-readable.
	 */
	private static Map<Integer, ThreadLocal<NumberFormat>> formatters = new ConcurrentHashMap<>();

	/**
	 * Format a value with a fixed number of decimal places, using a '.' as the decimal separator
	 * and no grouping.
	 *
	 * @param value
	 * @param nDecimalPlaces
	 * @return
	 */
	public static String formatNumber(final double value, final int nDecimalPlaces) {
		if (Double.isNaN(value))
			return "NaN";
		var formatter = formatters.computeIfAbsent(nDecimalPlaces, n -> ThreadLocal.withInitial(() -> createFormatter(n)));
		return formatter.get().format(value);
	}

	private static NumberFormat createFormatter(final int nDecimalPlaces) {
		var nf = new DecimalFormat("0", DecimalFormatSymbols.getInstance(Locale.US));
		nf.setGroupingUsed(false);
		nf.setMinimumFractionDigits(nDecimalPlaces);
		nf.setMaximumFractionDigits(nDecimalPlaces);
		return nf;
	}

	/**
	 * Convert an int array to a String, using the specified delimiter.
	 * @param array
	 * @param delimiter
	 * @return
	 */
	public static String arrayToString(final int[] array, final String delimiter) {
		return Arrays.stream(array).mapToObj(Integer::toString).collect(Collectors.joining(delimiter));
	}

}
