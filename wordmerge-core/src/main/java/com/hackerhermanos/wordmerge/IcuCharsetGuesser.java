package com.hackerhermanos.wordmerge;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link CharsetGuesser} backed by the ICU4J {@link CharsetDetector}.
 *
 * <p>
 * ICU reports plain Latin-1 as {@code ISO-8859-1}; that guess is mapped to
 * {@code windows-1252}, which decodes the same printable range plus the C1 block.
 */
public class IcuCharsetGuesser implements CharsetGuesser {

	private static final Logger logger = LoggerFactory.getLogger(IcuCharsetGuesser.class);

	@Override
	public List<Guess> guess(byte[] sample, List<Charset> candidates) {
		if (sample.length == 0) {
			return List.of();
		}
		CharsetDetector detector = new CharsetDetector();
		detector.setText(sample);
		CharsetMatch[] matches = detector.detectAll();

		List<Guess> guesses = new ArrayList<>();
		for (CharsetMatch match : matches) {
			Optional<Charset> charset = toCharset(match.getName());
			if (charset.isEmpty() || !candidates.contains(charset.get())) {
				continue;
			}
			boolean alreadyListed = guesses.stream().anyMatch(g -> g.charset().equals(charset.get()));
			if (!alreadyListed) {
				guesses.add(new Guess(charset.get(), match.getConfidence()));
			}
		}
		guesses.sort(Comparator.comparingInt(Guess::confidence).reversed());
		logger.trace("ICU guesses: {}", guesses);
		return guesses;
	}

	private static Optional<Charset> toCharset(String icuName) {
		if ("ISO-8859-1".equalsIgnoreCase(icuName)) {
			return Optional.of(WordlistEncodings.WINDOWS_1252);
		}
		try {
			if (Charset.isSupported(icuName)) {
				return Optional.of(WordlistEncodings.canonical(Charset.forName(icuName)));
			}
		}
		catch (IllegalCharsetNameException e) {
			logger.debug("ICU reported an unusable charset name: {}", icuName);
		}
		return Optional.empty();
	}

}
