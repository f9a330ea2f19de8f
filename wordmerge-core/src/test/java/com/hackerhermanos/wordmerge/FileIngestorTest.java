package com.hackerhermanos.wordmerge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link FileIngestor}.
 *
 * Tests line normalization, batch boundaries and listener callbacks.
 */
@DisplayName("FileIngestor Tests")
class FileIngestorTest {

	@TempDir
	Path tempDir;

	private EncodingStats stats;

	private EncodingResolver resolver;

	private EncodingConverter converter;

	@BeforeEach
	void setUp() {
		stats = new EncodingStats();
		EncodingDetector detector = new EncodingDetector((sample, candidates) -> List.of(), new EncodingValidator(),
				WordlistEncodings.COMMON, 8192, 100L * 1024 * 1024);
		resolver = new EncodingResolver(detector, stats);
		converter = new EncodingConverter(stats);
	}

	private FileIngestor ingestor(int maxLines, long maxBytes, MergeListener listener) {
		return new FileIngestor(resolver, converter, EncodingStrategy.autoDetect(), new BatchLimits(maxLines, maxBytes),
				listener);
	}

	private static List<LineBatch> drain(BatchChannel channel) throws InterruptedException {
		channel.close(1, TimeUnit.SECONDS);
		List<LineBatch> batches = new ArrayList<>();
		LineBatch batch;
		while ((batch = channel.receive()) != null) {
			batches.add(batch);
		}
		return batches;
	}

	@Test
	@DisplayName("Should trim lines and drop empty ones")
	void shouldTrimAndDropEmptyLines() throws Exception {
		Path file = tempDir.resolve("words.txt");
		Files.writeString(file, "  pass1  \n\n   \n\tpass2\r\npass1\n");
		BatchChannel channel = new BatchChannel(16);

		long lines = ingestor(1000, 1024 * 1024, MergeListener.NONE).ingest(file, channel);

		assertThat(lines).isEqualTo(3);
		List<LineBatch> batches = drain(channel);
		assertThat(batches).hasSize(1);
		assertThat(batches.get(0).lines()).containsExactlyInAnyOrder("pass1", "pass2");
		assertThat(batches.get(0).source()).isEqualTo(file);
	}

	@Test
	@DisplayName("Should split batches at the line limit")
	void shouldSplitAtLineLimit() throws Exception {
		Path file = tempDir.resolve("words.txt");
		Files.writeString(file, "a\nb\nc\nd\ne\n");
		BatchChannel channel = new BatchChannel(16);

		ingestor(2, 1024 * 1024, MergeListener.NONE).ingest(file, channel);

		List<LineBatch> batches = drain(channel);
		assertThat(batches).hasSize(3);
		assertThat(batches).allSatisfy(batch -> assertThat(batch.lines()).hasSizeLessThanOrEqualTo(2));
		Set<String> all = new HashSet<>();
		batches.forEach(batch -> all.addAll(batch.lines()));
		assertThat(all).containsExactlyInAnyOrder("a", "b", "c", "d", "e");
	}

	@Test
	@DisplayName("Should split batches at the byte limit")
	void shouldSplitAtByteLimit() throws Exception {
		Path file = tempDir.resolve("words.txt");
		Files.writeString(file, "aaaa\nbbbb\ncccc\n");
		BatchChannel channel = new BatchChannel(16);

		ingestor(1000, 10, MergeListener.NONE).ingest(file, channel);

		List<LineBatch> batches = drain(channel);
		assertThat(batches).hasSize(2);
		assertThat(batches.get(0).lines()).containsExactlyInAnyOrder("aaaa", "bbbb");
		assertThat(batches.get(0).bytesConsumed()).isEqualTo(10);
	}

	@Test
	@DisplayName("Should count multi-byte characters by their UTF-8 size")
	void shouldCountUtf8Bytes() throws Exception {
		Path file = tempDir.resolve("words.txt");
		Files.writeString(file, "éé\nüü\nöö\n", StandardCharsets.UTF_8);
		BatchChannel channel = new BatchChannel(16);

		ingestor(1000, 10, MergeListener.NONE).ingest(file, channel);

		List<LineBatch> batches = drain(channel);
		assertThat(batches).hasSize(2);
		assertThat(batches.get(0).lines()).containsExactlyInAnyOrder("éé", "üü");
		assertThat(batches.get(0).bytesConsumed()).isEqualTo(10);
		assertThat(FileIngestor.utf8Length("a\u00E9\u20AC\uD83D\uDE00")).isEqualTo(10);
	}

	@Test
	@DisplayName("Should send nothing for a file with only blank lines")
	void shouldSendNothingForBlankFile() throws Exception {
		Path file = tempDir.resolve("blank.txt");
		Files.writeString(file, "\n  \n\n");
		BatchChannel channel = new BatchChannel(4);

		assertThat(ingestor(10, 1024, MergeListener.NONE).ingest(file, channel)).isZero();
		assertThat(drain(channel)).isEmpty();
	}

	@Test
	@DisplayName("Should notify the listener and record statistics")
	void shouldNotifyListener() throws Exception {
		Path file = tempDir.resolve("words.txt");
		Files.writeString(file, "pass1\n", StandardCharsets.UTF_8);
		MergeListener listener = mock(MergeListener.class);

		ingestor(10, 1024, listener).ingest(file, new BatchChannel(4));

		verify(listener).onFileStarted(eq(file), any(EncodingProfile.class));
		assertThat(stats.filesProcessed()).isEqualTo(1);
		assertThat(stats.bytesProcessed()).isEqualTo(6);
	}

	@Test
	@DisplayName("Should propagate I/O errors for missing files")
	void shouldFailForMissingFile() {
		assertThatThrownBy(() -> ingestor(10, 1024, MergeListener.NONE).ingest(tempDir.resolve("missing.txt"),
				new BatchChannel(4)))
			.isInstanceOf(IOException.class);
	}

}
