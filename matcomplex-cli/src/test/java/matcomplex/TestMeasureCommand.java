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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import matcomplex.lib.analysis.fractal.LacunaritySource;
import matcomplex.lib.complexity.ComplexityParameters;
import matcomplex.lib.complexity.CompositeLabel;
import matcomplex.lib.complexity.FractalLabel;
import matcomplex.lib.complexity.InvalidConfigurationException;
import matcomplex.lib.complexity.LacunarityLabel;
import matcomplex.lib.complexity.MeasurementResult;
import matcomplex.lib.measurements.MeasurementRecord;
import picocli.CommandLine;

@SuppressWarnings("javadoc")
public class TestMeasureCommand {

	private static MeasureCommand parse(String... args) {
		var command = new MeasureCommand();
		var cmd = new CommandLine(command);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.parseArgs(args);
		return command;
	}

	@Test
	public void test_printedLacunarityIsNormalized() {
		var result = new MeasurementResult(1.5, 0.5, 1.0, 0.5, 0.5,
				FractalLabel.PREFERRED_HIGH, LacunarityLabel.MEDIUM, CompositeLabel.MODERATE);
		var writer = new StringWriter();
		try (var out = new PrintWriter(writer)) {
			MeasureCommand.printRecord(out, new MeasurementRecord("a.png", result, LocalDateTime.of(2024, 1, 2, 3, 4, 5)));
		}
		String text = writer.toString();
		assertTrue(text.contains("Lacunarity:        0.500 (Medium"), text);
		assertTrue(text.contains("Raw lacunarity:    1.000"), text);
	}

	@Test
	public void test_defaults() throws Exception {
		var params = parse("image.png").buildParameters();
		assertEquals(ComplexityParameters.getDefaultInstance(), params);
	}

	@Test
	public void test_options() throws Exception {
		var params = parse(
				"--box-sizes", "4,8,16",
				"--canny-high", "120",
				"--sigma", "1.5",
				"--l2-gradient",
				"--window-sizes", "8,16",
				"--stride", "2",
				"--lacunarity-source", "edge_mask",
				"--intensity-threshold", "100",
				"--fd-max", "1.9",
				"--lacunarity-scale", "3",
				"--composite-thresholds", "0.25,0.75",
				"--parallel",
				"image.png").buildParameters();
		assertArrayEquals(new int[] {4, 8, 16}, params.getBoxSizes());
		assertEquals(50.0, params.getCannyLowThreshold());
		assertEquals(120.0, params.getCannyHighThreshold());
		assertEquals(1.5, params.getGaussianSigma());
		assertTrue(params.isL2Gradient());
		assertArrayEquals(new int[] {8, 16}, params.getWindowSizes());
		assertEquals(2, params.getWindowStride());
		assertEquals(LacunaritySource.EDGE_MASK, params.getLacunaritySource());
		assertEquals(100.0, params.getIntensityThreshold());
		assertEquals(1.0, params.getMinFractalDimension());
		assertEquals(1.9, params.getMaxFractalDimension());
		assertEquals(3.0, params.getLacunarityScale());
		assertArrayEquals(new double[] {0.25, 0.75}, params.getCompositeThresholds());
		assertTrue(params.isParallel());
	}

	@Test
	public void test_singleWeight() throws Exception {
		var params = parse("--fd-weight", "0.6", "image.png").buildParameters();
		assertEquals(0.6, params.getFractalWeight());
		assertEquals(0.4, params.getLacunarityWeight(), 1e-12);

		params = parse("--lacunarity-weight", "0.5", "image.png").buildParameters();
		assertEquals(0.5, params.getFractalWeight(), 1e-12);
		assertEquals(0.5, params.getLacunarityWeight());

		assertThrows(InvalidConfigurationException.class, () -> parse("--fd-weight", "0.6", "--lacunarity-weight", "0.6", "image.png").buildParameters());
	}

	@Test
	public void test_optionsOverrideFile(@TempDir Path dir) throws Exception {
		var file = dir.resolve("params.json");
		Files.writeString(file, "{\"gaussianSigma\": 2.0, \"windowStride\": 4}", StandardCharsets.UTF_8);
		var params = parse("--params", file.toString(), "--stride", "3", "image.png").buildParameters();
		assertEquals(2.0, params.getGaussianSigma());
		assertEquals(3, params.getWindowStride());
	}

}
