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

import java.util.Objects;

import matcomplex.lib.analysis.images.BinaryMask;
import matcomplex.lib.analysis.images.SimpleImage;

/**
 * The representation of an image used to compute gliding box masses for lacunarity.
 * <p>
 * The same representation is used for every window position and window size.
 */
public enum LacunaritySource {

	/**
	 * Each pixel contributes 1 if its grayscale intensity is strictly above a threshold, otherwise 0.
	 */
	BINARY_INTENSITY {
		@Override
		public SimpleImage createMassImage(SimpleImage intensity, BinaryMask edges, double threshold) {
			Objects.requireNonNull(intensity, "Intensity image is required for " + this);
			return BinaryMask.createThresholded(intensity, threshold).asSimpleImage();
		}
	},

	/**
	 * Each pixel contributes 1 if it is an edge pixel, otherwise 0.
	 */
	EDGE_MASK {
		@Override
		public SimpleImage createMassImage(SimpleImage intensity, BinaryMask edges, double threshold) {
			Objects.requireNonNull(edges, "Edge mask is required for " + this);
			return edges.asSimpleImage();
		}
	},

	/**
	 * Each pixel contributes its grayscale intensity.
	 */
	INTENSITY {
		@Override
		public SimpleImage createMassImage(SimpleImage intensity, BinaryMask edges, double threshold) {
			Objects.requireNonNull(intensity, "Intensity image is required for " + this);
			return intensity;
		}
	};

	/**
	 * Create an image giving the mass of each pixel.
	 *
	 * @param intensity grayscale intensity image (required unless this is {@link #EDGE_MASK})
	 * @param edges edge mask (required only for {@link #EDGE_MASK})
	 * @param threshold intensity threshold (used only for {@link #BINARY_INTENSITY})
	 * @return
	 */
	public abstract SimpleImage createMassImage(SimpleImage intensity, BinaryMask edges, double threshold);

	/**
	 * Query if this representation requires an edge mask.
	 * @return
	 */
	public boolean requiresEdges() {
		return this == EDGE_MASK;
	}

}
