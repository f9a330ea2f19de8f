package com.hackerhermanos.wordmerge;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;

/**
 * Charsets commonly found in password wordlists and rule files.
 */
public final class WordlistEncodings {

	public static final Charset UTF_8 = StandardCharsets.UTF_8;

	/**
	 * Lossless variant of the JDK's windows-1252, see {@link Windows1252Charset}.
	 */
	public static final Charset WINDOWS_1252 = new Windows1252Charset();

	public static final Charset ISO_8859_15 = Charset.forName("ISO-8859-15");

	public static final Charset ISO_8859_2 = Charset.forName("ISO-8859-2");

	/**
	 * Candidate list, in preference order.
	 */
	public static final List<Charset> COMMON = List.of(UTF_8, WINDOWS_1252, ISO_8859_15, ISO_8859_2);

	/**
	 * Used when nothing else validates. Every byte value decodes to a distinct char.
	 */
	public static final Charset LEGACY_FALLBACK = WINDOWS_1252;

	private WordlistEncodings() {
	}

	/**
	 * Look up a charset by name or alias.
	 * @param name charset name such as {@code utf-8} or {@code cp1252}
	 * @return the charset
	 * @throws MergeException of kind {@link ErrorKind#CONFIGURATION} if the name is not
	 * supported by this JVM
	 */
	public static Charset lookup(String name) {
		String trimmed = name.trim();
		try {
			return canonical(Charset.forName(trimmed));
		}
		catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			throw new MergeException(ErrorKind.CONFIGURATION, "Unsupported encoding: " + trimmed, e);
		}
	}

	/**
	 * Swap the JDK's windows-1252 for {@link #WINDOWS_1252}; other charsets pass through.
	 */
	static Charset canonical(Charset charset) {
		return charset.name().equals(WINDOWS_1252.name()) ? WINDOWS_1252 : charset;
	}

}
