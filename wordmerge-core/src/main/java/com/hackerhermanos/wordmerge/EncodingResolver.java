package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * Applies an {@link EncodingStrategy} to a file and records the result in
 * {@link EncodingStats}.
 */
public class EncodingResolver {

	private static final Logger logger = LoggerFactory.getLogger(EncodingResolver.class);

	private final EncodingDetector detector;

	private final EncodingStats stats;

	public EncodingResolver(EncodingDetector detector, EncodingStats stats) {
		this.detector = detector;
		this.stats = stats;
	}

	/**
	 * Resolve the charset of one file.
	 * @param file input file
	 * @param strategy how to choose the charset
	 * @return resolved profile, never a failure for undecidable input
	 * @throws IOException if the file cannot be sampled
	 */
	public EncodingProfile resolve(Path file, EncodingStrategy strategy) throws IOException {
		EncodingProfile profile = switch (strategy.mode()) {
			case AUTO_DETECT -> detector.detect(file);
			case FORCE -> EncodingProfile.of(strategy.charsets().get(0), ResolutionBasis.FORCED);
			case TRY_SEQUENCE -> trySequence(file, strategy);
		};
		stats.recordResolution(profile);
		logger.debug("Resolved {} as {}", file, profile);
		return profile;
	}

	private EncodingProfile trySequence(Path file, EncodingStrategy strategy) throws IOException {
		DetectionSample sample = detector.sample(file);
		EncodingValidator validator = detector.validator();
		for (Charset candidate : strategy.charsets()) {
			if (validator.isValid(sample.bytes(), candidate)) {
				int confidence = (int) Math.round(validator.confidence(sample.bytes(), candidate) * 100);
				return new EncodingProfile(candidate, ResolutionBasis.SEQUENCE, confidence);
			}
		}
		logger.debug("No charset of {} validated for {}, falling back to {}", strategy, file,
				WordlistEncodings.LEGACY_FALLBACK.name());
		return new EncodingProfile(WordlistEncodings.LEGACY_FALLBACK, ResolutionBasis.FALLBACK, 0);
	}

	public EncodingStats stats() {
		return stats;
	}

}
