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

package matcomplex;

import java.io.PrintWriter;
import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import matcomplex.logging.LogManager;
import matcomplex.logging.LogManager.LogLevel;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main MatComplex launcher.
 *
 * @author Pete Bankhead
 */
@Command(name = "matcomplex", subcommands = {HelpCommand.class, MeasureCommand.class},
	description = "Measure the visual complexity of material surface images.",
	footer = {"",
			"Copyright(c) MatComplex developers (2026)"
			}, mixinStandardHelpOptions = true, versionProvider = MatComplex.VersionProvider.class)
public class MatComplex {

	private final static Logger logger = LoggerFactory.getLogger(MatComplex.class);

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel = LogLevel.INFO;

	/**
	 * Main class to launch MatComplex.
	 *
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = execute(new PrintWriter(System.out, true), new PrintWriter(System.err, true), args);
		if (exitCode != 0)
			logger.warn("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}

	/**
	 * Parse the arguments and run the requested command.
	 *
	 * @param out writer for normal output
	 * @param err writer for error and usage messages
	 * @param args command line arguments
	 * @return exit code; 0 indicates success
	 */
	static int execute(PrintWriter out, PrintWriter err, String... args) {
		MatComplex matcomplex = new MatComplex();
		CommandLine cmd = createCommandLine(matcomplex);
		cmd.setOut(out);
		cmd.setErr(err);

		ParseResult pr;
		try {
			pr = cmd.parseArgs(args);
		} catch (Exception e) {
			logger.error("An error has occurred, please type -h to display help message.\n" + e.getLocalizedMessage());
			return CommandLine.ExitCode.USAGE;
		}

		// Catch -h/--help and -V/--version
		if (cmd.isUsageHelpRequested()) {
			cmd.usage(out);
			return CommandLine.ExitCode.OK;
		} else if (cmd.isVersionHelpRequested()) {
			cmd.printVersionHelp(out);
			return CommandLine.ExitCode.OK;
		}

		// Set log level
		if (matcomplex.logLevel != null)
			LogManager.setRootLogLevel(matcomplex.logLevel);

		if (!pr.hasSubcommand()) {
			cmd.usage(out);
			return CommandLine.ExitCode.USAGE;
		}

		// Parse and execute subcommand with args
		return cmd.execute(args);
	}

	static CommandLine createCommandLine(MatComplex matcomplex) {
		CommandLine cmd = new CommandLine(matcomplex);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		return cmd;
	}


	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = MatComplex.class.getPackage().getImplementationVersion();
			var strings = new ArrayList<String>();
			if (version != null) {
				if (!version.startsWith("v"))
					version = "v" + version;
				strings.add("MatComplex " + version);
			}
			if (strings.isEmpty())
				return new String[] {"Unknown MatComplex version!"};
			return strings.toArray(String[]::new);
		}

	}

}
