package com.hackerhermanos.wordmerge;

import java.nio.charset.Charset;

/**
 * Resolved encoding of one input file.
 *
 * @param charset charset used to decode the file
 * @param basis how the charset was chosen
 * @param confidence 0-100, detector confidence where one exists
 */
public record EncodingProfile(Charset charset, ResolutionBasis basis, int confidence) {

	public static EncodingProfile of(Charset charset, ResolutionBasis basis) {
		return new EncodingProfile(charset, basis, 100);
	}

	public String name() {
		return charset.name();
	}

	@Override
	public String toString() {
		return charset.name() + " (" + basis.name().toLowerCase() + ", " + confidence + "%)";
	}

}
