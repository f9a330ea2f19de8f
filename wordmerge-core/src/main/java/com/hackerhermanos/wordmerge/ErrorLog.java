package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Append-only error file, one {@code [yyyy-MM-dd HH:mm:ss] message} line per error.
 *
 * <p>
 * Every entry is also logged at WARN. Failing to write the file is logged and does not
 * interrupt the run.
 */
public class ErrorLog {

	private static final Logger logger = LoggerFactory.getLogger(ErrorLog.class);

	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private final Path file;

	private final Clock clock;

	public ErrorLog(Path file) {
		this(file, Clock.systemDefaultZone());
	}

	public ErrorLog(Path file, Clock clock) {
		this.file = file;
		this.clock = clock;
	}

	public synchronized void record(String message) {
		logger.warn(message);
		String line = "[" + LocalDateTime.now(clock).format(TIMESTAMP) + "] " + message + System.lineSeparator();
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
					StandardOpenOption.APPEND);
		}
		catch (IOException e) {
			logger.error("Failed to append to error log {}: {}", file, e.getMessage());
		}
	}

	public Path file() {
		return file;
	}

}
