package com.hackerhermanos.wordmerge;

import java.nio.charset.Charset;
import java.util.List;

/**
 * Statistical charset guessing over a byte sample.
 */
public interface CharsetGuesser {

	/**
	 * Guess the charset of a sample, restricted to the given candidates.
	 * @param sample leading bytes of a file
	 * @param candidates charsets the caller is willing to accept
	 * @return guesses ordered by descending confidence, possibly empty
	 */
	List<Guess> guess(byte[] sample, List<Charset> candidates);

	/**
	 * One candidate charset with the guesser's confidence.
	 *
	 * @param charset guessed charset
	 * @param confidence 0-100
	 */
	record Guess(Charset charset, int confidence) {
	}

}
