package com.hackerhermanos.wordmerge;

import org.jspecify.annotations.Nullable;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Line reader over a file decoded with a resolved charset. Malformed or unmappable input
 * becomes U+FFFD and is counted; a leading byte order mark is dropped.
 */
public class ConvertedLineReader implements Closeable {

	static final char REPLACEMENT = '\uFFFD';

	private static final char BOM = '\uFEFF';

	private final Path file;

	private final EncodingProfile profile;

	private final CountingInputStream counter;

	private final BufferedReader reader;

	private long replacements;

	private boolean firstLine = true;

	ConvertedLineReader(Path file, EncodingProfile profile) throws IOException {
		this.file = file;
		this.profile = profile;
		this.counter = new CountingInputStream(Files.newInputStream(file));
		CharsetDecoder decoder = profile.charset()
			.newDecoder()
			.onMalformedInput(CodingErrorAction.REPLACE)
			.onUnmappableCharacter(CodingErrorAction.REPLACE);
		this.reader = new BufferedReader(new InputStreamReader(counter, decoder));
	}

	/**
	 * @return the next line without its terminator, or null at end of file
	 */
	public @Nullable String readLine() throws IOException {
		String line = reader.readLine();
		if (line == null) {
			return null;
		}
		if (firstLine) {
			firstLine = false;
			if (!line.isEmpty() && line.charAt(0) == BOM) {
				line = line.substring(1);
			}
		}
		for (int i = 0; i < line.length(); i++) {
			if (line.charAt(i) == REPLACEMENT) {
				replacements++;
			}
		}
		return line;
	}

	public Path file() {
		return file;
	}

	public EncodingProfile profile() {
		return profile;
	}

	public long bytesRead() {
		return counter.count;
	}

	public long replacementCount() {
		return replacements;
	}

	@Override
	public void close() throws IOException {
		reader.close();
	}

	private static final class CountingInputStream extends FilterInputStream {

		private long count;

		CountingInputStream(InputStream in) {
			super(in);
		}

		@Override
		public int read() throws IOException {
			int b = super.read();
			if (b != -1) {
				count++;
			}
			return b;
		}

		@Override
		public int read(byte[] buffer, int offset, int length) throws IOException {
			int n = super.read(buffer, offset, length);
			if (n > 0) {
				count += n;
			}
			return n;
		}

		@Override
		public long skip(long n) throws IOException {
			long skipped = super.skip(n);
			count += skipped;
			return skipped;
		}

	}

}
