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

package matcomplex;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.lib.analysis.fractal.LacunaritySource;
import matcomplex.lib.awt.images.ImageReaders;
import matcomplex.lib.common.GeneralTools;
import matcomplex.lib.complexity.ComplexityAnalyzer;
import matcomplex.lib.complexity.ComplexityException;
import matcomplex.lib.complexity.ComplexityParameters;
import matcomplex.lib.io.GsonTools;
import matcomplex.lib.io.MeasurementExporter;
import matcomplex.lib.measurements.MeasurementHistory;
import matcomplex.lib.measurements.MeasurementRecord;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Measure one or more image files and report the results.
 * <p>
 * Each image is measured independently; a failure is logged and the remaining images are still measured.
 */
@Command(name = "measure", description = {
		"Measure the fractal dimension, lacunarity and composite complexity of one or more images.",
		"Parameters are read from --params if given, and then overridden by any other options."},
		sortOptions = false)
class MeasureCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(MeasureCommand.class);

	@Spec
	private CommandSpec spec;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Parameters(arity = "1..*", paramLabel = "image", description = "Image files to measure.")
	private List<Path> images;

	@Option(names = {"-p", "--params"}, paramLabel = "json", description = "JSON file containing measurement parameters; missing fields take default values.")
	private Path paramsFile;

	@Option(names = {"--csv"}, paramLabel = "file", description = "Write all measurements to a CSV file.")
	private Path csvFile;

	@Option(names = {"--json"}, description = "Print measurements as JSON, rather than as text.")
	private boolean json;

	@Option(names = {"--max-dimension"}, paramLabel = "pixels", description = "Downsample images so that neither side exceeds this (default = ${DEFAULT-VALUE}).")
	private int maxDimension = ImageReaders.DEFAULT_MAX_DIMENSION;

	@Option(names = {"--box-sizes"}, split = ",", paramLabel = "size", description = "Box sizes for box counting, strictly increasing (default = 2,4,8,16,32,64).")
	private int[] boxSizes;

	@Option(names = {"--canny-low"}, paramLabel = "threshold", description = "Lower hysteresis threshold for edge detection (default = 50).")
	private Double cannyLow;

	@Option(names = {"--canny-high"}, paramLabel = "threshold", description = "Upper hysteresis threshold for edge detection (default = 150).")
	private Double cannyHigh;

	@Option(names = {"--sigma"}, paramLabel = "sigma", description = "Gaussian sigma for smoothing before edge detection; 0 for no smoothing (default = 0).")
	private Double sigma;

	@Option(names = {"--l2-gradient"}, negatable = true, description = "Use the L2 norm for the gradient magnitude, rather than L1.")
	private Boolean l2Gradient;

	@Option(names = {"--window-sizes"}, split = ",", paramLabel = "size", description = "Gliding box window sizes, strictly increasing (default = 32).")
	private int[] windowSizes;

	@Option(names = {"--stride"}, paramLabel = "pixels", description = "Step between gliding box positions (default = 1).")
	private Integer stride;

	@Option(names = {"--lacunarity-source"}, paramLabel = "source", description = "Pixel masses used for lacunarity: ${COMPLETION-CANDIDATES} (default = BINARY_INTENSITY).")
	private LacunaritySource lacunaritySource;

	@Option(names = {"--intensity-threshold"}, paramLabel = "value", description = "Intensity threshold for BINARY_INTENSITY lacunarity (default = 128).")
	private Double intensityThreshold;

	@Option(names = {"--fd-min"}, paramLabel = "value", description = "Minimum of the fractal dimension domain (default = 1.0).")
	private Double fdMin;

	@Option(names = {"--fd-max"}, paramLabel = "value", description = "Maximum of the fractal dimension domain (default = 2.0).")
	private Double fdMax;

	@Option(names = {"--lacunarity-scale"}, paramLabel = "value", description = "Lacunarity is divided by this before clamping to [0, 1] (default = 2.0).")
	private Double lacunarityScale;

	@Option(names = {"--fd-weight"}, paramLabel = "weight", description = "Weight of the fractal dimension in the composite score (default = 0.7).")
	private Double fdWeight;

	@Option(names = {"--lacunarity-weight"}, paramLabel = "weight", description = "Weight of lacunarity in the composite score (default = 0.3).")
	private Double lacunarityWeight;

	@Option(names = {"--fd-thresholds"}, split = ",", paramLabel = "value", description = "Four thresholds separating the fractal dimension labels (default = 1.2,1.4,1.7,1.8).")
	private double[] fdThresholds;

	@Option(names = {"--lacunarity-thresholds"}, split = ",", paramLabel = "value", description = "Two thresholds separating the lacunarity labels (default = 0.3,0.6).")
	private double[] lacunarityThresholds;

	@Option(names = {"--composite-thresholds"}, split = ",", paramLabel = "value", description = "Two thresholds separating the composite labels (default = 0.33,0.66).")
	private double[] compositeThresholds;

	@Option(names = {"--parallel"}, description = "Count boxes for different box sizes in parallel.")
	private boolean parallel;

	@Override
	public Integer call() throws Exception {
		ComplexityParameters params;
		try {
			params = buildParameters();
		} catch (ComplexityException | IOException e) {
			logger.error("Invalid parameters: {}", e.getLocalizedMessage());
			return 1;
		}
		logger.debug("Measuring with {}", params);

		var analyzer = new ComplexityAnalyzer(params);
		var history = new MeasurementHistory();
		int nFailed = 0;
		for (var path : images) {
			String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
			try {
				var image = ImageReaders.readImage(path, maxDimension);
				var result = analyzer.measure(image);
				var record = history.add(name, result);
				if (!json)
					printRecord(record);
			} catch (ComplexityException | IOException e) {
				logger.error("Unable to measure {}: {}", path, e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
				nFailed++;
			}
		}

		var records = history.getRecords();
		if (json)
			spec.commandLine().getOut().println(GsonTools.toJson(records));
		spec.commandLine().getOut().flush();

		if (csvFile != null) {
			try {
				new MeasurementExporter().exportHistory(records, csvFile.toFile());
			} catch (IOException e) {
				logger.error("Unable to write " + csvFile, e);
				return 1;
			}
		}

		if (nFailed > 0) {
			logger.warn("{} of {} images could not be measured", nFailed, images.size());
			return 1;
		}
		logger.info("Measured {} images", records.size());
		return 0;
	}

	/**
	 * Combine parameters from the JSON file (if any) with the options.
	 */
	ComplexityParameters buildParameters() throws IOException, ComplexityException {
		var base = paramsFile == null ? ComplexityParameters.getDefaultInstance() : GsonTools.loadParameters(paramsFile);
		var builder = ComplexityParameters.builder(base);
		if (boxSizes != null)
			builder.boxSizes(boxSizes);
		if (cannyLow != null || cannyHigh != null)
			builder.cannyThresholds(
					cannyLow == null ? base.getCannyLowThreshold() : cannyLow,
					cannyHigh == null ? base.getCannyHighThreshold() : cannyHigh);
		if (sigma != null)
			builder.gaussianSigma(sigma);
		if (l2Gradient != null)
			builder.l2Gradient(l2Gradient);
		if (windowSizes != null)
			builder.windowSizes(windowSizes);
		if (stride != null)
			builder.windowStride(stride);
		if (lacunaritySource != null)
			builder.lacunaritySource(lacunaritySource);
		if (intensityThreshold != null)
			builder.intensityThreshold(intensityThreshold);
		if (fdMin != null || fdMax != null)
			builder.fractalDimensionDomain(
					fdMin == null ? base.getMinFractalDimension() : fdMin,
					fdMax == null ? base.getMaxFractalDimension() : fdMax);
		if (lacunarityScale != null)
			builder.lacunarityScale(lacunarityScale);
		if (fdWeight != null || lacunarityWeight != null) {
			// A single weight implies the other
			double wFD = fdWeight != null ? fdWeight : 1.0 - lacunarityWeight;
			double wL = lacunarityWeight != null ? lacunarityWeight : 1.0 - fdWeight;
			builder.weights(wFD, wL);
		}
		if (fdThresholds != null)
			builder.fractalThresholds(fdThresholds);
		if (lacunarityThresholds != null)
			builder.lacunarityThresholds(lacunarityThresholds);
		if (compositeThresholds != null)
			builder.compositeThresholds(compositeThresholds);
		if (parallel)
			builder.parallel(true);
		return builder.build();
	}

	private void printRecord(MeasurementRecord record) {
		printRecord(spec.commandLine().getOut(), record);
	}

	/**
	 * Print a measurement. The lacunarity shown beside its label is the normalized value, since that is what the label describes.
	 */
	static void printRecord(PrintWriter out, MeasurementRecord record) {
		var result = record.getResult();
		out.println(record.getName());
		out.println("  Fractal dimension: " + GeneralTools.formatNumber(result.getFractalDimension(), 3)
				+ " (" + result.getFractalLabel().getDisplayName() + " - " + result.getFractalLabel().getDescription() + ")");
		out.println("  Lacunarity:        " + GeneralTools.formatNumber(result.getNormalizedLacunarity(), 3)
				+ " (" + result.getLacunarityLabel().getDisplayName() + " - " + result.getLacunarityLabel().getDescription() + ")");
		out.println("  Raw lacunarity:    " + GeneralTools.formatNumber(result.getLacunarity(), 3));
		out.println("  Composite:         " + GeneralTools.formatNumber(result.getComposite(), 3)
				+ " (" + result.getCompositeLabel().getDisplayName() + " - " + result.getCompositeLabel().getDescription() + ")");
	}

}
