package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Detects the charset of a file from a prefix sample.
 *
 * <p>
 * Detection is an ordered list of rules evaluated first match wins:
 * <ol>
 * <li>empty file: UTF-8</li>
 * <li>file above the detection ceiling: legacy charset, no sampling</li>
 * <li>statistical guess that validates against the sample</li>
 * <li>UTF-8 byte order mark</li>
 * <li>strictly valid UTF-8 (including pure ASCII)</li>
 * <li>any high byte: legacy charset</li>
 * </ol>
 * Detection never fails; only reading the sample can throw.
 */
public class EncodingDetector {

	private static final Logger logger = LoggerFactory.getLogger(EncodingDetector.class);

	private final EncodingValidator validator;

	private final int sampleSize;

	private final long detectionCeiling;

	private final List<EncodingRule> rules;

	public EncodingDetector(CharsetGuesser guesser, EncodingValidator validator, List<Charset> candidates,
			int sampleSize, long detectionCeiling) {
		this.validator = validator;
		this.sampleSize = sampleSize;
		this.detectionCeiling = detectionCeiling;
		this.rules = List.of(
				sample -> sample.fileSize() == 0
						? Optional.of(EncodingProfile.of(WordlistEncodings.UTF_8, ResolutionBasis.EMPTY_FILE))
						: Optional.empty(),
				sample -> sample.fileSize() > detectionCeiling
						? Optional.of(new EncodingProfile(WordlistEncodings.LEGACY_FALLBACK,
								ResolutionBasis.SIZE_CEILING, 0))
						: Optional.empty(),
				sample -> guesser.guess(sample.bytes(), candidates)
					.stream()
					.filter(guess -> validator.isValid(sample.bytes(), guess.charset()))
					.findFirst()
					.map(guess -> new EncodingProfile(guess.charset(), ResolutionBasis.DETECTED, guess.confidence())),
				sample -> sample.startsWithUtf8Bom()
						? Optional.of(EncodingProfile.of(WordlistEncodings.UTF_8, ResolutionBasis.BYTE_ORDER_MARK))
						: Optional.empty(),
				sample -> validator.decodes(sample.bytes(), WordlistEncodings.UTF_8)
						? Optional.of(new EncodingProfile(WordlistEncodings.UTF_8, ResolutionBasis.HEURISTIC, 80))
						: Optional.empty(),
				sample -> sample.hasHighBytes()
						? Optional.of(new EncodingProfile(WordlistEncodings.LEGACY_FALLBACK, ResolutionBasis.HEURISTIC,
								50))
						: Optional.empty());
	}

	/**
	 * Sample a file and detect its charset.
	 * @param file file to inspect
	 * @return resolved profile
	 * @throws IOException if the sample cannot be read
	 */
	public EncodingProfile detect(Path file) throws IOException {
		EncodingProfile profile = detect(sample(file));
		logger.debug("Detected {} for {}", profile, file);
		return profile;
	}

	public EncodingProfile detect(DetectionSample sample) {
		for (EncodingRule rule : rules) {
			Optional<EncodingProfile> match = rule.apply(sample);
			if (match.isPresent()) {
				return match.get();
			}
		}
		return new EncodingProfile(WordlistEncodings.UTF_8, ResolutionBasis.FALLBACK, 0);
	}

	/**
	 * Read the detection sample of a file. Files above the ceiling are not read.
	 */
	public DetectionSample sample(Path file) throws IOException {
		long size = Files.size(file);
		if (size > detectionCeiling) {
			return new DetectionSample(new byte[0], size);
		}
		return DetectionSample.read(file, sampleSize);
	}

	public EncodingValidator validator() {
		return validator;
	}

}
