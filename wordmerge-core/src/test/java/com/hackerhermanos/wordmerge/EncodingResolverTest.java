package com.hackerhermanos.wordmerge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link EncodingResolver}.
 *
 * Tests strategy handling and statistics recording.
 */
@DisplayName("EncodingResolver Tests")
class EncodingResolverTest {

	@TempDir
	Path tempDir;

	private EncodingStats stats;

	private EncodingResolver resolver;

	private Path legacyFile;

	@BeforeEach
	void setUp() throws IOException {
		stats = new EncodingStats();
		EncodingDetector detector = new EncodingDetector((sample, candidates) -> List.of(), new EncodingValidator(),
				WordlistEncodings.COMMON, 8192, 100L * 1024 * 1024);
		resolver = new EncodingResolver(detector, stats);
		legacyFile = tempDir.resolve("legacy.txt");
		Files.write(legacyFile, "café\npass1\n".getBytes(WordlistEncodings.WINDOWS_1252));
	}

	@Test
	@DisplayName("Should use the forced charset without sampling")
	void shouldUseForcedCharset() throws IOException {
		EncodingProfile profile = resolver.resolve(legacyFile, EncodingStrategy.force(StandardCharsets.UTF_8));

		assertThat(profile.charset()).isEqualTo(StandardCharsets.UTF_8);
		assertThat(profile.basis()).isEqualTo(ResolutionBasis.FORCED);
		assertThat(stats.forcedCounts()).containsEntry("UTF-8", 1L);
	}

	@Test
	@DisplayName("Should pick the first charset of a sequence that validates")
	void shouldPickFirstValidInSequence() throws IOException {
		EncodingProfile profile = resolver.resolve(legacyFile, EncodingStrategy.wordlistDefault());

		assertThat(profile.charset()).isEqualTo(WordlistEncodings.WINDOWS_1252);
		assertThat(profile.basis()).isEqualTo(ResolutionBasis.SEQUENCE);
		assertThat(stats.detectedCounts()).containsEntry("windows-1252", 1L);
	}

	@Test
	@DisplayName("Should fall back to windows-1252 when no charset in the sequence validates")
	void shouldFallBackWhenSequenceFails() throws IOException {
		EncodingProfile profile = resolver.resolve(legacyFile,
				EncodingStrategy.trySequence(List.of(StandardCharsets.UTF_8)));

		assertThat(profile.charset()).isEqualTo(WordlistEncodings.WINDOWS_1252);
		assertThat(profile.basis()).isEqualTo(ResolutionBasis.FALLBACK);
		assertThat(stats.fallbackCounts()).containsEntry("windows-1252", 1L);
	}

	@Test
	@DisplayName("Should delegate auto-detection to the detector")
	void shouldAutoDetect() throws IOException {
		EncodingProfile profile = resolver.resolve(legacyFile, EncodingStrategy.autoDetect());

		assertThat(profile.charset()).isEqualTo(WordlistEncodings.WINDOWS_1252);
		assertThat(stats.filesProcessed()).isEqualTo(1);
	}

	@Test
	@DisplayName("Should propagate I/O errors for missing files")
	void shouldPropagateIoErrors() {
		assertThatThrownBy(() -> resolver.resolve(tempDir.resolve("missing.txt"), EncodingStrategy.autoDetect()))
			.isInstanceOf(IOException.class);
	}

}
