package com.hackerhermanos.wordmerge.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the Logback root level from command-line options.
 */
final class LogLevelConfigurer {

	private LogLevelConfigurer() {
	}

	/**
	 * Pick the level: an explicit {@code --log-level} wins, then {@code -vv} (trace), then
	 * {@code -v} or debug mode (debug). Otherwise the level from logback.xml stays.
	 * @return the level applied, or null if unchanged
	 */
	static Level apply(String logLevel, int verbosity, boolean debug) {
		Level level = resolve(logLevel, verbosity, debug);
		if (level == null) {
			return null;
		}
		ILoggerFactory factory = LoggerFactory.getILoggerFactory();
		if (factory instanceof LoggerContext context) {
			Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
			root.setLevel(level);
		}
		return level;
	}

	static Level resolve(String logLevel, int verbosity, boolean debug) {
		if (logLevel != null) {
			return Level.toLevel(logLevel, Level.INFO);
		}
		if (verbosity >= 2) {
			return Level.TRACE;
		}
		if (verbosity == 1 || debug) {
			return Level.DEBUG;
		}
		return null;
	}

}
