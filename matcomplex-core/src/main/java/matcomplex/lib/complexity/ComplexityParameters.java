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

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.analysis.fractal.BoxCounter;
import matcomplex.lib.analysis.fractal.LacunaritySource;

/**
 * Parameters controlling a complexity measurement.
 * <p>
 * Instances are immutable, and should be created with a {@link Builder}. 
 * The default values are:
 * <ul>
 * <li>box sizes: 2, 4, 8, 16, 32, 64</li>
 * <li>Canny thresholds: 50 and 150, no smoothing, L1 gradient magnitude</li>
 * <li>gliding box: a single 32x32 window, stride 1, binary intensity mass with threshold 128</li>
 * <li>fractal dimension domain: [1.0, 2.0]</li>
 * <li>lacunarity scale: 2.0, i.e. {@code L_norm = min(L / 2, 1)}</li>
 * <li>weights: 0.7 for the fractal dimension and 0.3 for lacunarity</li>
 * </ul>
 * Parameters may also be read from JSON, in which case any missing fields take their default values; 
 * {@link #validate()} should be called after reading.
 */
public final class ComplexityParameters {

	private static final Logger logger = LoggerFactory.getLogger(ComplexityParameters.class);

	/**
	 * Tolerance used when checking that the weights sum to 1.
	 */
	public static final double WEIGHT_TOLERANCE = 1e-9;

	/**
	 * Default lower hysteresis threshold for Canny edge detection.
	 */
	public static final double DEFAULT_CANNY_LOW_THRESHOLD = 50;

	/**
	 * Default upper hysteresis threshold for Canny edge detection.
	 */
	public static final double DEFAULT_CANNY_HIGH_THRESHOLD = 150;

	/**
	 * Default gliding box window size.
	 */
	public static final int DEFAULT_WINDOW_SIZE = 32;

	private static final ComplexityParameters DEFAULT_INSTANCE = new ComplexityParameters();

	private int[] boxSizes = BoxCounter.DEFAULT_BOX_SIZES.clone();

	private double cannyLowThreshold = DEFAULT_CANNY_LOW_THRESHOLD;
	private double cannyHighThreshold = DEFAULT_CANNY_HIGH_THRESHOLD;
	private double gaussianSigma = 0;
	private boolean l2Gradient = false;

	private int[] windowSizes = {DEFAULT_WINDOW_SIZE};
	private int windowStride = 1;
	private LacunaritySource lacunaritySource = LacunaritySource.BINARY_INTENSITY;
	private double intensityThreshold = 128;

	private double minFractalDimension = BoxCounter.DEFAULT_MIN_DIMENSION;
	private double maxFractalDimension = BoxCounter.DEFAULT_MAX_DIMENSION;
	private double lacunarityScale = 2.0;

	private double fractalWeight = 0.7;
	private double lacunarityWeight = 0.3;

	private double[] fractalThresholds = {1.2, 1.4, 1.7, 1.8};
	private double[] lacunarityThresholds = {0.3, 0.6};
	private double[] compositeThresholds = {0.33, 0.66};

	private boolean parallel = false;

	// Used by the builder and for JSON deserialization
	private ComplexityParameters() {}

	private ComplexityParameters(ComplexityParameters params) {
		this.boxSizes = params.boxSizes == null ? null : params.boxSizes.clone();
		this.cannyLowThreshold = params.cannyLowThreshold;
		this.cannyHighThreshold = params.cannyHighThreshold;
		this.gaussianSigma = params.gaussianSigma;
		this.l2Gradient = params.l2Gradient;
		this.windowSizes = params.windowSizes == null ? null : params.windowSizes.clone();
		this.windowStride = params.windowStride;
		this.lacunaritySource = params.lacunaritySource;
		this.intensityThreshold = params.intensityThreshold;
		this.minFractalDimension = params.minFractalDimension;
		this.maxFractalDimension = params.maxFractalDimension;
		this.lacunarityScale = params.lacunarityScale;
		this.fractalWeight = params.fractalWeight;
		this.lacunarityWeight = params.lacunarityWeight;
		this.fractalThresholds = params.fractalThresholds == null ? null : params.fractalThresholds.clone();
		this.lacunarityThresholds = params.lacunarityThresholds == null ? null : params.lacunarityThresholds.clone();
		this.compositeThresholds = params.compositeThresholds == null ? null : params.compositeThresholds.clone();
		this.parallel = params.parallel;
	}

	/**
	 * Get the default parameters.
	 * @return
	 */
	public static ComplexityParameters getDefaultInstance() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Check that gliding box window sizes are non-empty, strictly increasing and positive.
	 * @param windowSizes
	 * @throws InvalidConfigurationException if the window sizes are invalid
	 */
	public static void checkWindowSizes(int[] windowSizes) throws InvalidConfigurationException {
		if (windowSizes == null || windowSizes.length == 0)
			throw new InvalidConfigurationException("At least one gliding box window size is required");
		for (int i = 0; i < windowSizes.length; i++) {
			if (windowSizes[i] < 1)
				throw new InvalidConfigurationException("Window sizes must be >= 1, but found " + windowSizes[i]);
			if (i > 0 && windowSizes[i] <= windowSizes[i-1])
				throw new InvalidConfigurationException("Window sizes must be strictly increasing: " + Arrays.toString(windowSizes));
		}
	}

	/**
	 * Check that the parameters are valid in themselves, independently of any image.
	 * @throws InvalidConfigurationException if any parameter is invalid
	 */
	public void validate() throws InvalidConfigurationException {
		BoxCounter.checkBoxSizes(boxSizes);
		checkWindowSizes(windowSizes);
		if (windowStride < 1)
			throw new InvalidConfigurationException("Gliding box stride must be >= 1, but was " + windowStride);
		if (!Double.isFinite(cannyLowThreshold) || !Double.isFinite(cannyHighThreshold) || cannyLowThreshold < 0 || cannyLowThreshold > cannyHighThreshold)
			throw new InvalidConfigurationException("Edge thresholds must satisfy 0 <= low <= high, but were " + cannyLowThreshold + " and " + cannyHighThreshold);
		if (!Double.isFinite(gaussianSigma) || gaussianSigma < 0)
			throw new InvalidConfigurationException("Gaussian sigma must be finite and >= 0, but was " + gaussianSigma);
		if (lacunaritySource == null)
			throw new InvalidConfigurationException("Lacunarity source must be specified");
		if (!Double.isFinite(intensityThreshold))
			throw new InvalidConfigurationException("Intensity threshold must be finite, but was " + intensityThreshold);
		if (!Double.isFinite(minFractalDimension) || !Double.isFinite(maxFractalDimension) || minFractalDimension >= maxFractalDimension)
			throw new InvalidConfigurationException("Fractal dimension domain [" + minFractalDimension + ", " + maxFractalDimension + "] is invalid");
		if (!Double.isFinite(lacunarityScale) || lacunarityScale <= 0)
			throw new InvalidConfigurationException("Lacunarity scale must be finite and > 0, but was " + lacunarityScale);
		if (!Double.isFinite(fractalWeight) || !Double.isFinite(lacunarityWeight) || fractalWeight < 0 || lacunarityWeight < 0)
			throw new InvalidConfigurationException("Weights must be finite and >= 0, but were " + fractalWeight + " and " + lacunarityWeight);
		if (Math.abs(fractalWeight + lacunarityWeight - 1.0) > WEIGHT_TOLERANCE)
			throw new InvalidConfigurationException("Weights must sum to 1, but " + fractalWeight + " + " + lacunarityWeight + " = " + (fractalWeight + lacunarityWeight));
		// Check that the label tables can be created
		ComplexityClassifier.createFractalTable(fractalThresholds);
		ComplexityClassifier.createLacunarityTable(lacunarityThresholds);
		ComplexityClassifier.createCompositeTable(compositeThresholds);
	}

	/**
	 * Check that the parameters can be applied to an image of the specified size, 
	 * i.e. that no box or window is larger than the image.
	 *
	 * @param width
	 * @param height
	 * @throws InvalidConfigurationException if a box or window is too large
	 */
	public void validateForImage(int width, int height) throws InvalidConfigurationException {
		int maxBox = boxSizes[boxSizes.length - 1];
		if (maxBox > Math.min(width, height))
			throw new InvalidConfigurationException("Largest box size " + maxBox + " exceeds the " + width + "x" + height + " image");
		int maxWindow = windowSizes[windowSizes.length - 1];
		if (maxWindow > Math.min(width, height))
			throw new InvalidConfigurationException("Window size " + maxWindow + " exceeds the " + width + "x" + height + " image");
	}

	/**
	 * Get a copy of the box sizes used for box counting.
	 * @return
	 */
	public int[] getBoxSizes() {
		return boxSizes.clone();
	}

	/**
	 * Lower hysteresis threshold for Canny edge detection.
	 * @return
	 */
	public double getCannyLowThreshold() {
		return cannyLowThreshold;
	}

	/**
	 * Upper hysteresis threshold for Canny edge detection.
	 * @return
	 */
	public double getCannyHighThreshold() {
		return cannyHighThreshold;
	}

	/**
	 * Gaussian sigma used to smooth before edge detection, or 0 for no smoothing.
	 * @return
	 */
	public double getGaussianSigma() {
		return gaussianSigma;
	}

	/**
	 * Query if the L2 norm is used for the gradient magnitude during edge detection.
	 * @return
	 */
	public boolean isL2Gradient() {
		return l2Gradient;
	}

	/**
	 * Get a copy of the gliding box window sizes.
	 * @return
	 */
	public int[] getWindowSizes() {
		return windowSizes.clone();
	}

	/**
	 * Step between gliding box positions.
	 * @return
	 */
	public int getWindowStride() {
		return windowStride;
	}

	/**
	 * Representation of the image used for gliding box masses.
	 * @return
	 */
	public LacunaritySource getLacunaritySource() {
		return lacunaritySource;
	}

	/**
	 * Intensity threshold used with {@link LacunaritySource#BINARY_INTENSITY}.
	 * @return
	 */
	public double getIntensityThreshold() {
		return intensityThreshold;
	}

	/**
	 * Minimum of the fractal dimension domain.
	 * @return
	 */
	public double getMinFractalDimension() {
		return minFractalDimension;
	}

	/**
	 * Maximum of the fractal dimension domain.
	 * @return
	 */
	public double getMaxFractalDimension() {
		return maxFractalDimension;
	}

	/**
	 * Scale factor for lacunarity normalization; raw lacunarity is divided by this before clamping to [0, 1].
	 * @return
	 */
	public double getLacunarityScale() {
		return lacunarityScale;
	}

	/**
	 * Weight of the normalized fractal dimension in the composite score.
	 * @return
	 */
	public double getFractalWeight() {
		return fractalWeight;
	}

	/**
	 * Weight of the normalized lacunarity in the composite score.
	 * @return
	 */
	public double getLacunarityWeight() {
		return lacunarityWeight;
	}

	/**
	 * Get a copy of the thresholds applied to the raw fractal dimension, separating the {@link FractalLabel}s.
	 * @return
	 */
	public double[] getFractalThresholds() {
		return fractalThresholds.clone();
	}

	/**
	 * Get a copy of the thresholds applied to the normalized lacunarity, separating the {@link LacunarityLabel}s.
	 * @return
	 */
	public double[] getLacunarityThresholds() {
		return lacunarityThresholds.clone();
	}

	/**
	 * Get a copy of the thresholds applied to the composite score, separating the {@link CompositeLabel}s.
	 * @return
	 */
	public double[] getCompositeThresholds() {
		return compositeThresholds.clone();
	}

	/**
	 * Query if box counting for different box sizes may run in parallel.
	 * @return
	 */
	public boolean isParallel() {
		return parallel;
	}

	@Override
	public int hashCode() {
		int result = Objects.hash(cannyLowThreshold, cannyHighThreshold, gaussianSigma, l2Gradient, windowStride, lacunaritySource,
				intensityThreshold, minFractalDimension, maxFractalDimension, lacunarityScale, fractalWeight, lacunarityWeight, parallel);
		result = 31 * result + Arrays.hashCode(boxSizes);
		result = 31 * result + Arrays.hashCode(windowSizes);
		result = 31 * result + Arrays.hashCode(fractalThresholds);
		result = 31 * result + Arrays.hashCode(lacunarityThresholds);
		result = 31 * result + Arrays.hashCode(compositeThresholds);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ComplexityParameters))
			return false;
		ComplexityParameters other = (ComplexityParameters) obj;
		return Arrays.equals(boxSizes, other.boxSizes)
				&& Double.compare(cannyLowThreshold, other.cannyLowThreshold) == 0
				&& Double.compare(cannyHighThreshold, other.cannyHighThreshold) == 0
				&& Double.compare(gaussianSigma, other.gaussianSigma) == 0
				&& l2Gradient == other.l2Gradient
				&& Arrays.equals(windowSizes, other.windowSizes)
				&& windowStride == other.windowStride
				&& lacunaritySource == other.lacunaritySource
				&& Double.compare(intensityThreshold, other.intensityThreshold) == 0
				&& Double.compare(minFractalDimension, other.minFractalDimension) == 0
				&& Double.compare(maxFractalDimension, other.maxFractalDimension) == 0
				&& Double.compare(lacunarityScale, other.lacunarityScale) == 0
				&& Double.compare(fractalWeight, other.fractalWeight) == 0
				&& Double.compare(lacunarityWeight, other.lacunarityWeight) == 0
				&& Arrays.equals(fractalThresholds, other.fractalThresholds)
				&& Arrays.equals(lacunarityThresholds, other.lacunarityThresholds)
				&& Arrays.equals(compositeThresholds, other.compositeThresholds)
				&& parallel == other.parallel;
	}

	@Override
	public String toString() {
		return "ComplexityParameters [boxSizes=" + Arrays.toString(boxSizes)
				+ ", canny=" + cannyLowThreshold + "/" + cannyHighThreshold
				+ ", sigma=" + gaussianSigma
				+ ", l2Gradient=" + l2Gradient
				+ ", windowSizes=" + Arrays.toString(windowSizes)
				+ ", stride=" + windowStride
				+ ", lacunaritySource=" + lacunaritySource
				+ ", intensityThreshold=" + intensityThreshold
				+ ", fdDomain=[" + minFractalDimension + ", " + maxFractalDimension + "]"
				+ ", lacunarityScale=" + lacunarityScale
				+ ", weights=" + fractalWeight + "/" + lacunarityWeight
				+ ", parallel=" + parallel + "]";
	}

	/**
	 * Create a new builder, initialized with the default parameters.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(DEFAULT_INSTANCE);
	}

	/**
	 * Create a new builder, initialized with existing parameters.
	 * @param params
	 * @return
	 */
	public static Builder builder(ComplexityParameters params) {
		return new Builder(params);
	}


	/**
	 * Builder for {@link ComplexityParameters}.
	 */
	public static class Builder {

		private ComplexityParameters params;

		private Builder(ComplexityParameters params) {
			this.params = new ComplexityParameters(Objects.requireNonNull(params));
		}

		/**
		 * Box sizes for box counting; these must be strictly increasing and all at least 2.
		 * @param boxSizes
		 * @return this builder
		 */
		public Builder boxSizes(int... boxSizes) {
			params.boxSizes = boxSizes == null ? null : boxSizes.clone();
			return this;
		}

		/**
		 * Hysteresis thresholds for Canny edge detection.
		 * @param low
		 * @param high
		 * @return this builder
		 */
		public Builder cannyThresholds(double low, double high) {
			params.cannyLowThreshold = low;
			params.cannyHighThreshold = high;
			return this;
		}

		/**
		 * Gaussian sigma for smoothing before edge detection; 0 disables smoothing.
		 * @param sigma
		 * @return this builder
		 */
		public Builder gaussianSigma(double sigma) {
			params.gaussianSigma = sigma;
			return this;
		}

		/**
		 * Use the L2 norm rather than the L1 norm for the gradient magnitude.
		 * @param l2Gradient
		 * @return this builder
		 */
		public Builder l2Gradient(boolean l2Gradient) {
			params.l2Gradient = l2Gradient;
			return this;
		}

		/**
		 * Gliding box window sizes; these must be strictly increasing and positive.
		 * @param windowSizes
		 * @return this builder
		 */
		public Builder windowSizes(int... windowSizes) {
			params.windowSizes = windowSizes == null ? null : windowSizes.clone();
			return this;
		}

		/**
		 * Step between gliding box positions. 
		 * Values other than 1 skip positions, and therefore change the statistic.
		 * @param stride
		 * @return this builder
		 */
		public Builder windowStride(int stride) {
			params.windowStride = stride;
			return this;
		}

		/**
		 * Representation of the image used for gliding box masses.
		 * @param source
		 * @return this builder
		 */
		public Builder lacunaritySource(LacunaritySource source) {
			params.lacunaritySource = source;
			return this;
		}

		/**
		 * Intensity threshold used with {@link LacunaritySource#BINARY_INTENSITY}.
		 * @param threshold
		 * @return this builder
		 */
		public Builder intensityThreshold(double threshold) {
			params.intensityThreshold = threshold;
			return this;
		}

		/**
		 * Domain of the fractal dimension; raw estimates are clamped to this, and it is rescaled to [0, 1] for normalization.
		 * @param min
		 * @param max
		 * @return this builder
		 */
		public Builder fractalDimensionDomain(double min, double max) {
			params.minFractalDimension = min;
			params.maxFractalDimension = max;
			return this;
		}

		/**
		 * Scale factor for lacunarity normalization.
		 * @param scale
		 * @return this builder
		 */
		public Builder lacunarityScale(double scale) {
			params.lacunarityScale = scale;
			return this;
		}

		/**
		 * Weights for the composite score; these must be non-negative and sum to 1.
		 * @param fractalWeight
		 * @param lacunarityWeight
		 * @return this builder
		 */
		public Builder weights(double fractalWeight, double lacunarityWeight) {
			params.fractalWeight = fractalWeight;
			params.lacunarityWeight = lacunarityWeight;
			return this;
		}

		/**
		 * Thresholds separating the {@link FractalLabel}s, applied to the raw fractal dimension.
		 * @param thresholds
		 * @return this builder
		 */
		public Builder fractalThresholds(double... thresholds) {
			params.fractalThresholds = thresholds == null ? null : thresholds.clone();
			return this;
		}

		/**
		 * Thresholds separating the {@link LacunarityLabel}s, applied to the normalized lacunarity.
		 * @param thresholds
		 * @return this builder
		 */
		public Builder lacunarityThresholds(double... thresholds) {
			params.lacunarityThresholds = thresholds == null ? null : thresholds.clone();
			return this;
		}

		/**
		 * Thresholds separating the {@link CompositeLabel}s, applied to the composite score.
		 * @param thresholds
		 * @return this builder
		 */
		public Builder compositeThresholds(double... thresholds) {
			params.compositeThresholds = thresholds == null ? null : thresholds.clone();
			return this;
		}

		/**
		 * Request that box counting for different box sizes runs in parallel.
		 * The result is the same either way.
		 * @param parallel
		 * @return this builder
		 */
		public Builder parallel(boolean parallel) {
			params.parallel = parallel;
			return this;
		}

		/**
		 * Build validated parameters.
		 * @return
		 * @throws InvalidConfigurationException if any parameter is invalid
		 */
		public ComplexityParameters build() throws InvalidConfigurationException {
			var built = new ComplexityParameters(params);
			built.validate();
			logger.trace("Built {}", built);
			return built;
		}

	}

}
