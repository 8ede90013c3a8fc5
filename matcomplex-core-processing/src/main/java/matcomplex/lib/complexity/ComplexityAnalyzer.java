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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.analysis.edges.CannyEdgeDetector;
import matcomplex.lib.analysis.fractal.BoxCounter;
import matcomplex.lib.analysis.fractal.GlidingBoxLacunarity;
import matcomplex.lib.analysis.images.SimpleImages;
import matcomplex.lib.images.PixelImage;

/**
 * Measure the visual complexity of an image.
 * <p>
 * Edges are detected with a Canny edge detector and their fractal dimension is estimated by box counting. 
 * Independently, the lacunarity of the image is estimated with a gliding box. 
 * Both values are normalized, combined into a composite score, and labelled.
 * <p>
 * An analyzer holds no state besides its parameters, and may be used from multiple threads.
 */
public class ComplexityAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

	private final ComplexityParameters params;
	private final CannyEdgeDetector edgeDetector;
	private final BoxCounter boxCounter;
	private final GlidingBoxLacunarity lacunarity;
	private final ComplexityNormalizer normalizer;
	private final ComplexityClassifier classifier;

	/**
	 * Create an analyzer with the default parameters.
	 */
	public ComplexityAnalyzer() {
		this(ComplexityParameters.getDefaultInstance());
	}

	/**
	 * Create an analyzer with the specified parameters.
	 * @param params
	 * @throws InvalidConfigurationException if the parameters are invalid
	 */
	public ComplexityAnalyzer(ComplexityParameters params) throws InvalidConfigurationException {
		Objects.requireNonNull(params, "Parameters must not be null");
		params.validate();
		this.params = params;
		this.edgeDetector = new CannyEdgeDetector(params.getCannyLowThreshold(), params.getCannyHighThreshold(),
				params.getGaussianSigma(), params.isL2Gradient());
		this.boxCounter = new BoxCounter(params.getBoxSizes(), params.getMinFractalDimension(), params.getMaxFractalDimension(), params.isParallel());
		this.lacunarity = new GlidingBoxLacunarity(params.getWindowSizes(), params.getWindowStride());
		this.normalizer = new ComplexityNormalizer(params);
		this.classifier = new ComplexityClassifier(params);
	}

	/**
	 * Convenience method to measure an image with the specified parameters.
	 *
	 * @param image
	 * @param params
	 * @return
	 * @throws ComplexityException if the image or parameters are invalid, or the fractal dimension cannot be estimated
	 */
	public static MeasurementResult measure(PixelImage image, ComplexityParameters params) throws ComplexityException {
		return new ComplexityAnalyzer(params).measure(image);
	}

	/**
	 * Measure an image.
	 *
	 * @param image
	 * @return
	 * @throws InvalidInputException if the image is null
	 * @throws InvalidConfigurationException if a box or window is larger than the image
	 * @throws InsufficientDataException if the edges are too sparse to estimate a fractal dimension
	 */
	public MeasurementResult measure(PixelImage image) throws ComplexityException {
		return analyze(image).getResult();
	}

	/**
	 * Measure an image, retaining the intermediate results.
	 *
	 * @param image
	 * @return
	 * @throws InvalidInputException if the image is null
	 * @throws InvalidConfigurationException if a box or window is larger than the image
	 * @throws InsufficientDataException if the edges are too sparse to estimate a fractal dimension
	 */
	public ComplexityAnalysis analyze(PixelImage image) throws ComplexityException {
		if (image == null)
			throw new InvalidInputException("No image to measure");
		params.validateForImage(image.getWidth(), image.getHeight());

		long startTime = System.currentTimeMillis();
		var intensity = SimpleImages.createGrayscaleImage(image);

		var edges = edgeDetector.detectEdges(intensity);
		var fdResult = boxCounter.estimate(edges);
		if (fdResult.isDegenerate())
			logger.warn("No usable edge structure in {} - fractal dimension set to {}", image, fdResult.getFractalDimension());

		var massImage = params.getLacunaritySource().createMassImage(intensity, edges, params.getIntensityThreshold());
		var lacResult = lacunarity.estimate(massImage);

		double fd = fdResult.getFractalDimension();
		double lac = lacResult.getLacunarity();
		double fdNorm = normalizer.normalizeFractalDimension(fd);
		double lacNorm = normalizer.normalizeLacunarity(lac);
		double composite = normalizer.computeComposite(fdNorm, lacNorm);

		var result = new MeasurementResult(fd, fdNorm, lac, lacNorm, composite,
				classifier.classifyFractalDimension(fd),
				classifier.classifyLacunarity(lacNorm),
				classifier.classifyComposite(composite));

		logger.debug("Measured {} in {} ms: {}", image, System.currentTimeMillis() - startTime, result);
		return new ComplexityAnalysis(result, fdResult, lacResult, edges);
	}

	/**
	 * Get the parameters used by this analyzer.
	 * @return
	 */
	public ComplexityParameters getParameters() {
		return params;
	}

	/**
	 * Get the normalizer used by this analyzer.
	 * @return
	 */
	public ComplexityNormalizer getNormalizer() {
		return normalizer;
	}

	/**
	 * Get the classifier used by this analyzer.
	 * @return
	 */
	public ComplexityClassifier getClassifier() {
		return classifier;
	}

}
