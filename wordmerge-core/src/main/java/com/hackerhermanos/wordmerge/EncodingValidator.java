package com.hackerhermanos.wordmerge;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.Optional;

/**
 * Checks whether a byte sample decodes to plausible wordlist text under a charset.
 */
public class EncodingValidator {

	private static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

	private final double maxNullRatio;

	public EncodingValidator() {
		this(0.05);
	}

	/**
	 * @param maxNullRatio fraction of NUL chars above which decoded text is rejected
	 */
	public EncodingValidator(double maxNullRatio) {
		this.maxNullRatio = maxNullRatio;
	}

	/**
	 * Strictly decode a sample. A multi-byte sequence cut off at the end of the sample
	 * is ignored rather than reported.
	 * @param sample bytes to decode
	 * @param charset charset to decode with
	 * @return decoded text, or empty if the sample contains malformed or unmappable input
	 */
	public Optional<String> decodeStrict(byte[] sample, Charset charset) {
		CharsetDecoder decoder = charset.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		ByteBuffer in = ByteBuffer.wrap(sample);
		int capacity = (int) Math.ceil(sample.length * (double) decoder.maxCharsPerByte()) + 1;
		CharBuffer out = CharBuffer.allocate(capacity);
		CoderResult result = decoder.decode(in, out, false);
		if (result.isError()) {
			return Optional.empty();
		}
		out.flip();
		return Optional.of(out.toString());
	}

	public boolean decodes(byte[] sample, Charset charset) {
		return decodeStrict(sample, charset).isPresent();
	}

	/**
	 * Whether the sample decodes cleanly, is not dominated by NUL characters and
	 * contains at least one ASCII letter, digit, punctuation mark or whitespace.
	 * @param sample bytes to check
	 * @param charset candidate charset
	 * @return true if the charset is acceptable for this sample
	 */
	public boolean isValid(byte[] sample, Charset charset) {
		if (sample.length == 0) {
			return true;
		}
		Optional<String> decoded = decodeStrict(sample, charset);
		if (decoded.isEmpty()) {
			return false;
		}
		String text = decoded.get();
		if (text.isEmpty()) {
			// only a truncated sequence
			return true;
		}
		long nulls = text.chars().filter(c -> c == 0).count();
		if ((double) nulls / text.length() > maxNullRatio) {
			return false;
		}
		return text.chars().anyMatch(EncodingValidator::isPlausible);
	}

	/**
	 * Fraction of decoded characters that are printable, or whitespace used in text.
	 * @param sample bytes to score
	 * @param charset charset to decode with
	 * @return 1.0 for an empty sample, 0.0 if the sample does not decode
	 */
	public double confidence(byte[] sample, Charset charset) {
		if (sample.length == 0) {
			return 1.0;
		}
		Optional<String> decoded = decodeStrict(sample, charset);
		if (decoded.isEmpty() || decoded.get().isEmpty()) {
			return 0.0;
		}
		String text = decoded.get();
		long printable = text.chars().filter(c -> !Character.isISOControl(c) || c == '\n' || c == '\r' || c == '\t')
			.count();
		return (double) printable / text.length();
	}

	private static boolean isPlausible(int c) {
		if (c >= 128) {
			return false;
		}
		return Character.isLetterOrDigit(c) || Character.isWhitespace(c) || ASCII_PUNCTUATION.indexOf(c) >= 0;
	}

}
