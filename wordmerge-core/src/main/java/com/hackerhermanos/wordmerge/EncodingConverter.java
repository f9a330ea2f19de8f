package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Converts input files to UTF-8 text using a resolved {@link EncodingProfile}.
 */
public class EncodingConverter {

	private static final Logger logger = LoggerFactory.getLogger(EncodingConverter.class);

	private final EncodingStats stats;

	public EncodingConverter(EncodingStats stats) {
		this.stats = stats;
	}

	/**
	 * Open a streaming line reader for a file.
	 * @param file file to read
	 * @param profile resolved encoding
	 * @return reader the caller must close and pass to {@link #complete}
	 * @throws IOException if the file cannot be opened
	 */
	public ConvertedLineReader open(Path file, EncodingProfile profile) throws IOException {
		return new ConvertedLineReader(file, profile);
	}

	/**
	 * Record a fully read file in the statistics and warn about lossy conversion.
	 */
	public void complete(ConvertedLineReader reader) {
		long replacements = reader.replacementCount();
		if (replacements > 0) {
			logger.warn("Decoding {} as {} produced {} replacement characters", reader.file(),
					reader.profile().name(), replacements);
		}
		stats.recordConversion(reader.bytesRead(), replacements);
	}

}
