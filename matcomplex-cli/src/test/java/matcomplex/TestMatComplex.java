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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import matcomplex.lib.io.GsonTools;
import matcomplex.logging.LogManager;
import matcomplex.logging.LogManager.LogLevel;

@SuppressWarnings("javadoc")
public class TestMatComplex {

	@TempDir
	Path dir;

	private StringWriter out;
	private StringWriter err;

	@BeforeEach
	public void createWriters() {
		out = new StringWriter();
		err = new StringWriter();
	}

	@AfterEach
	public void resetLogging() {
		LogManager.setRootLogLevel(LogLevel.WARN);
	}

	private int run(String... args) {
		return MatComplex.execute(new PrintWriter(out, true), new PrintWriter(err, true), args);
	}

	private Path writeCheckerboard(String name, int size, int squareSize) throws IOException {
		var img = new BufferedImage(size, size, BufferedImage.TYPE_BYTE_GRAY);
		var raster = img.getRaster();
		for (int y = 0; y < size; y++) {
			for (int x = 0; x < size; x++)
				raster.setSample(x, y, 0, (x / squareSize + y / squareSize) % 2 == 0 ? 0 : 255);
		}
		var path = dir.resolve(name);
		assertTrue(ImageIO.write(img, "png", path.toFile()));
		return path;
	}

	@Test
	public void test_noArguments() {
		assertEquals(2, run());
		assertTrue(out.toString().contains("measure"));
	}

	@Test
	public void test_help() {
		assertEquals(0, run("--help"));
		assertTrue(out.toString().contains("Usage: matcomplex"));
		assertEquals(0, run("measure", "--help"));
		assertTrue(out.toString().contains("--box-sizes"));
	}

	@Test
	public void test_unknownOption() {
		assertEquals(2, run("measure", "--not-an-option", "image.png"));
	}

	@Test
	public void test_measure() throws Exception {
		var path = writeCheckerboard("checks.png", 256, 32);
		assertEquals(0, run("measure", path.toString()));
		String text = out.toString();
		assertTrue(text.contains("checks.png"), text);
		assertTrue(text.contains("Fractal dimension:"), text);
		assertTrue(text.contains("Composite:"), text);
	}

	@Test
	public void test_json() throws Exception {
		var first = writeCheckerboard("first.png", 128, 16);
		var second = writeCheckerboard("second.png", 128, 8);
		assertEquals(0, run("--log", "error", "measure", "--json", first.toString(), second.toString()));
		var records = GsonTools.parseRecords(out.toString());
		assertEquals(2, records.size());
		assertEquals("first.png", records.get(0).getName());
		assertEquals("second.png", records.get(1).getName());
	}

	@Test
	public void test_csv() throws Exception {
		var path = writeCheckerboard("checks.png", 128, 16);
		var csv = dir.resolve("results.csv");
		assertEquals(0, run("measure", "--csv", csv.toString(), path.toString(), path.toString()));
		var lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
		assertEquals(3, lines.size());
		assertEquals("filename,FD,L,C,FD_label,L_label,C_label,timestamp", lines.get(0));
		assertTrue(lines.get(1).startsWith("checks.png,"));
	}

	@Test
	public void test_failureContinues() throws Exception {
		var path = writeCheckerboard("checks.png", 128, 16);
		var missing = dir.resolve("missing.png");
		var csv = dir.resolve("results.csv");
		assertEquals(1, run("measure", "--csv", csv.toString(), missing.toString(), path.toString()));
		assertTrue(out.toString().contains("checks.png"));
		assertEquals(2, Files.readAllLines(csv, StandardCharsets.UTF_8).size());
	}

	@Test
	public void test_imageTooSmall() throws Exception {
		var path = writeCheckerboard("small.png", 32, 4);
		assertEquals(1, run("measure", path.toString()));
		assertEquals(0, run("measure", "--box-sizes", "2,4,8", "--window-sizes", "8", path.toString()));
	}

	@Test
	public void test_invalidParameters() throws Exception {
		var path = writeCheckerboard("checks.png", 128, 16);
		assertEquals(1, run("measure", "--canny-low", "200", path.toString()));
		assertEquals(1, run("measure", "--fd-weight", "1.5", path.toString()));
		assertFalse(out.toString().contains("checks.png"));
	}

	@Test
	public void test_paramsFile() throws Exception {
		var path = writeCheckerboard("checks.png", 48, 6);
		var params = dir.resolve("params.json");
		Files.writeString(params, "{\"boxSizes\": [2, 4, 8, 16], \"windowSizes\": [8, 16]}", StandardCharsets.UTF_8);
		assertEquals(0, run("measure", "-p", params.toString(), path.toString()));

		Files.writeString(params, "{\"boxSizes\": [16, 8]}", StandardCharsets.UTF_8);
		assertEquals(1, run("measure", "-p", params.toString(), path.toString()));
	}

	@Test
	public void test_logLevel() throws Exception {
		var path = writeCheckerboard("checks.png", 128, 16);
		assertEquals(0, run("--log", "DEBUG", "measure", path.toString()));
		assertEquals(LogLevel.DEBUG, LogManager.getRootLogLevel());
	}

}
