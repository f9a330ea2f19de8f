package com.hackerhermanos.wordmerge;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * windows-1252 as browsers and legacy wordlist tools decode it: the five bytes the JDK
 * table leaves undefined (0x81, 0x8D, 0x8F, 0x90, 0x9D) map to the C1 control with the
 * same value instead of U+FFFD. Every byte decodes, and distinct byte strings stay
 * distinct after conversion.
 */
final class Windows1252Charset extends Charset {

	private static final char[] TO_CHAR = new char[256];

	private static final Map<Character, Byte> TO_BYTE = new HashMap<>();

	static {
		CharsetDecoder jdk = Charset.forName("windows-1252")
			.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		for (int b = 0; b < 256; b++) {
			char c;
			try {
				c = jdk.decode(ByteBuffer.wrap(new byte[] { (byte) b })).charAt(0);
			}
			catch (CharacterCodingException e) {
				// undefined in the JDK table
				c = (char) b;
			}
			TO_CHAR[b] = c;
			TO_BYTE.put(c, (byte) b);
		}
	}

	Windows1252Charset() {
		super("windows-1252", new String[] { "cp1252" });
	}

	@Override
	public boolean contains(Charset cs) {
		return cs.name().equals(name()) || cs.equals(StandardCharsets.US_ASCII);
	}

	@Override
	public CharsetDecoder newDecoder() {
		return new Decoder(this);
	}

	@Override
	public CharsetEncoder newEncoder() {
		return new Encoder(this);
	}

	private static final class Decoder extends CharsetDecoder {

		Decoder(Charset charset) {
			super(charset, 1.0f, 1.0f);
		}

		@Override
		protected CoderResult decodeLoop(ByteBuffer in, CharBuffer out) {
			while (in.hasRemaining()) {
				if (!out.hasRemaining()) {
					return CoderResult.OVERFLOW;
				}
				out.put(TO_CHAR[in.get() & 0xFF]);
			}
			return CoderResult.UNDERFLOW;
		}

	}

	private static final class Encoder extends CharsetEncoder {

		Encoder(Charset charset) {
			super(charset, 1.0f, 1.0f);
		}

		@Override
		protected CoderResult encodeLoop(CharBuffer in, ByteBuffer out) {
			while (in.hasRemaining()) {
				Byte b = TO_BYTE.get(in.get(in.position()));
				if (b == null) {
					return CoderResult.unmappableForLength(1);
				}
				if (!out.hasRemaining()) {
					return CoderResult.OVERFLOW;
				}
				out.put(b);
				in.position(in.position() + 1);
			}
			return CoderResult.UNDERFLOW;
		}

	}

}
