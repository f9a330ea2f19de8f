package com.hackerhermanos.wordmerge;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Prefix of a file used for encoding detection, together with the full file size.
 *
 * @param bytes up to the configured sample size of leading bytes
 * @param fileSize size of the whole file in bytes
 */
public record DetectionSample(byte[] bytes, long fileSize) {

	/**
	 * Read the leading {@code sampleSize} bytes of a file.
	 * @param file file to sample
	 * @param sampleSize maximum number of bytes to read
	 * @return the sample
	 * @throws IOException if the file cannot be read
	 */
	public static DetectionSample read(Path file, int sampleSize) throws IOException {
		long size = Files.size(file);
		try (InputStream in = Files.newInputStream(file)) {
			return new DetectionSample(in.readNBytes(sampleSize), size);
		}
	}

	public static DetectionSample of(byte[] bytes) {
		return new DetectionSample(bytes, bytes.length);
	}

	public boolean startsWithUtf8Bom() {
		return bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB
				&& (bytes[2] & 0xFF) == 0xBF;
	}

	public boolean hasHighBytes() {
		for (byte b : bytes) {
			if ((b & 0x80) != 0) {
				return true;
			}
		}
		return false;
	}

}
