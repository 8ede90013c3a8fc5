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

package matcomplex.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Manage the logback configuration used by the command line.
 *
 * @author Pete Bankhead
 */
public class LogManager {

	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);

	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes wrong)
		 */
		ERROR,
		/**
		 * Log everything
		 */
		ALL,
		/**
		 * Log nothing
		 */
		OFF
	}

	// Suppressed default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}

	static Level getLevel(LogLevel logLevel) {
		switch(logLevel) {
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case INFO:
			return Level.INFO;
		case ALL:
			return Level.ALL;
		case OFF:
			return Level.OFF;
		case TRACE:
			return Level.TRACE;
		case WARN:
			return Level.WARN;
		default:
			return Level.INFO;
		}
	}

	/**
	 * Set the root log level.
	 * @param logLevel
	 * @return true if the level was set, false if logback is not the logging backend
	 */
	public static boolean setRootLogLevel(LogLevel logLevel) {
		var root = getRootLogger();
		if (root == null) {
			logger.warn("Cannot get root logger!");
			return false;
		}
		root.setLevel(getLevel(logLevel));
		return true;
	}

	/**
	 * Get the current root log level, or null if logback is not the logging backend.
	 * @return
	 */
	public static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null || root.getLevel() == null)
			return null;
		var level = root.getLevel();
		for (var logLevel : LogLevel.values()) {
			if (getLevel(logLevel).equals(level))
				return logLevel;
		}
		return null;
	}

	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		} else
			return null;
	}

	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}

}
