package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads one input file into bounded {@link LineBatch}es.
 *
 * <p>
 * Lines are trimmed and empty lines dropped. A batch is sent when it reaches the line or
 * byte limit, and once more at end of file.
 */
public class FileIngestor {

	private static final Logger logger = LoggerFactory.getLogger(FileIngestor.class);

	private final EncodingResolver resolver;

	private final EncodingConverter converter;

	private final EncodingStrategy strategy;

	private final BatchLimits limits;

	private final MergeListener listener;

	public FileIngestor(EncodingResolver resolver, EncodingConverter converter, EncodingStrategy strategy,
			BatchLimits limits, MergeListener listener) {
		this.resolver = resolver;
		this.converter = converter;
		this.strategy = strategy;
		this.limits = limits;
		this.listener = listener;
	}

	/**
	 * Ingest a whole file.
	 * @param file input file
	 * @param channel channel to send batches to
	 * @return number of non-empty lines read
	 * @throws IOException if the file cannot be opened or read
	 * @throws InterruptedException if interrupted while waiting on a full channel
	 */
	public long ingest(Path file, BatchChannel channel) throws IOException, InterruptedException {
		EncodingProfile profile = resolver.resolve(file, strategy);
		listener.onFileStarted(file, profile);

		long lines = 0;
		int batches = 0;
		Set<String> batch = new HashSet<>();
		long batchBytes = 0;
		try (ConvertedLineReader reader = converter.open(file, profile)) {
			String line;
			while ((line = reader.readLine()) != null) {
				batchBytes += utf8Length(line) + 1;
				String trimmed = line.strip();
				if (trimmed.isEmpty()) {
					continue;
				}
				lines++;
				batch.add(trimmed);
				if (batch.size() >= limits.maxLines() || batchBytes >= limits.maxBytes()) {
					channel.send(new LineBatch(file, batch, batchBytes));
					batches++;
					batch = new HashSet<>();
					batchBytes = 0;
				}
			}
			if (!batch.isEmpty()) {
				channel.send(new LineBatch(file, batch, batchBytes));
				batches++;
			}
			converter.complete(reader);
		}
		logger.debug("Ingested {}: {} lines in {} batches", file, lines, batches);
		return lines;
	}

	static long utf8Length(String line) {
		long bytes = 0;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (c < 0x80) {
				bytes++;
			}
			else if (c < 0x800) {
				bytes += 2;
			}
			else if (Character.isHighSurrogate(c) && i + 1 < line.length()
					&& Character.isLowSurrogate(line.charAt(i + 1))) {
				bytes += 4;
				i++;
			}
			else {
				bytes += 3;
			}
		}
		return bytes;
	}

}
