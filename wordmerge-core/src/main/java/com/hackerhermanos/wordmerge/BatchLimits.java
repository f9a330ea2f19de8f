package com.hackerhermanos.wordmerge;

/**
 * Bounds for one {@link LineBatch}.
 *
 * @param maxLines unique lines after which a batch is sent
 * @param maxBytes UTF-8 bytes of decoded text after which a batch is sent
 */
public record BatchLimits(int maxLines, long maxBytes) {

	public BatchLimits {
		if (maxLines <= 0) {
			throw new IllegalArgumentException("maxLines must be positive: " + maxLines);
		}
		if (maxBytes <= 0) {
			throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
		}
	}

}
