package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Set;

/**
 * Streams a set of unique lines to the output file, one line per element with a
 * trailing newline.
 */
public class UniqueLineWriter {

	private static final Logger logger = LoggerFactory.getLogger(UniqueLineWriter.class);

	private final int bufferBytes;

	public UniqueLineWriter(int bufferBytes) {
		if (bufferBytes <= 0) {
			throw new IllegalArgumentException("Buffer size must be positive: " + bufferBytes);
		}
		this.bufferBytes = bufferBytes;
	}

	/**
	 * Replace the output file with the given lines.
	 * @return number of lines written
	 */
	public long write(Path output, Set<String> lines) throws IOException {
		long written = writeLines(output, lines, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
				StandardOpenOption.WRITE);
		logger.info("Wrote {} unique lines to {}", written, output);
		return written;
	}

	/**
	 * Append the lines not already present in the output file. Lines found in the file are
	 * removed from {@code lines}.
	 * @return number of lines appended
	 */
	public long appendUnique(Path output, Set<String> lines) throws IOException {
		if (Files.exists(output)) {
			long existing = 0;
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(output),
					StandardCharsets.UTF_8.newDecoder()
						.onMalformedInput(CodingErrorAction.REPLACE)
						.onUnmappableCharacter(CodingErrorAction.REPLACE)))) {
				String line;
				while ((line = reader.readLine()) != null) {
					lines.remove(line);
					existing++;
				}
			}
			logger.debug("Output {} already holds {} lines", output, existing);
		}
		long written = writeLines(output, lines, StandardOpenOption.CREATE, StandardOpenOption.APPEND,
				StandardOpenOption.WRITE);
		logger.info("Appended {} new unique lines to {}", written, output);
		return written;
	}

	private long writeLines(Path output, Set<String> lines, OpenOption... options) throws IOException {
		Path parent = output.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		long written = 0;
		StringBuilder buffer = new StringBuilder();
		try (OutputStream out = Files.newOutputStream(output, options);
				Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
			for (String line : lines) {
				buffer.append(line).append('\n');
				written++;
				if (buffer.length() >= bufferBytes) {
					writer.write(buffer.toString());
					buffer.setLength(0);
				}
			}
			writer.write(buffer.toString());
			writer.flush();
		}
		return written;
	}

}
