package com.hackerhermanos.wordmerge;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * How the charset of each input file is chosen.
 *
 * @param mode resolution mode
 * @param charsets the forced charset (one element) or the ordered try-sequence; empty
 * for auto-detection
 */
public record EncodingStrategy(Mode mode, List<Charset> charsets) {

	public enum Mode {

		AUTO_DETECT, FORCE, TRY_SEQUENCE

	}

	public EncodingStrategy {
		charsets = List.copyOf(charsets);
		if (mode == Mode.FORCE && charsets.size() != 1) {
			throw new IllegalArgumentException("Forced encoding needs exactly one charset");
		}
		if (mode == Mode.TRY_SEQUENCE && charsets.isEmpty()) {
			throw new IllegalArgumentException("Try-sequence needs at least one charset");
		}
	}

	public static EncodingStrategy autoDetect() {
		return new EncodingStrategy(Mode.AUTO_DETECT, List.of());
	}

	public static EncodingStrategy force(Charset charset) {
		return new EncodingStrategy(Mode.FORCE, List.of(charset));
	}

	public static EncodingStrategy trySequence(List<Charset> charsets) {
		return new EncodingStrategy(Mode.TRY_SEQUENCE, charsets);
	}

	/**
	 * UTF-8, then the common single-byte Western and Central European charsets.
	 */
	public static EncodingStrategy wordlistDefault() {
		return trySequence(WordlistEncodings.COMMON);
	}

	/**
	 * Parse a strategy from its command-line form: {@code auto}, {@code wordlist}, a
	 * single charset name (forced) or a comma-separated list (try-sequence).
	 * @param value strategy text
	 * @return parsed strategy
	 * @throws MergeException if a charset name is not supported
	 */
	public static EncodingStrategy parse(String value) {
		String trimmed = value.trim();
		if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("auto") || trimmed.equalsIgnoreCase("auto-detect")) {
			return autoDetect();
		}
		if (trimmed.equalsIgnoreCase("wordlist")) {
			return wordlistDefault();
		}
		List<Charset> parsed = Arrays.stream(trimmed.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.map(WordlistEncodings::lookup)
			.toList();
		if (parsed.size() == 1) {
			return force(parsed.get(0));
		}
		return trySequence(parsed);
	}

	@Override
	public String toString() {
		return switch (mode) {
			case AUTO_DETECT -> "auto-detect";
			case FORCE -> "force " + charsets.get(0).name();
			case TRY_SEQUENCE -> "try sequence: "
					+ charsets.stream().map(Charset::name).collect(Collectors.joining(" → "));
		};
	}

}
