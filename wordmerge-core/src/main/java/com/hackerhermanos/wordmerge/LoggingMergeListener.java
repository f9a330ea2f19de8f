package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Reports merge progress as log lines.
 */
public class LoggingMergeListener implements MergeListener {

	private static final Logger logger = LoggerFactory.getLogger(LoggingMergeListener.class);

	@Override
	public void onFileStarted(Path file, EncodingProfile profile) {
		logger.info("Processing {} ({})", file, profile);
	}

	@Override
	public void onFileCompleted(Path file, long lines) {
		logger.info("Completed {}: {} lines", file, lines);
	}

	@Override
	public void onFileFailed(Path file, Exception error) {
		logger.warn("Skipped {}: {}", file, error.getMessage());
	}

	@Override
	public void onBatchMerged(long uniqueLines, long totalLines) {
		logger.debug("Merged batch: {} unique of {} lines", uniqueLines, totalLines);
	}

}
