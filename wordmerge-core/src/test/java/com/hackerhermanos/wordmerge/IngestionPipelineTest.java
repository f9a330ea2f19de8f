package com.hackerhermanos.wordmerge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link IngestionPipeline}.
 *
 * Tests the worker pool against a real channel and aggregator.
 */
@DisplayName("IngestionPipeline Tests")
class IngestionPipelineTest {

	@TempDir
	Path tempDir;

	private CheckpointStore store;

	private ProgressTracker tracker;

	private ShutdownFlag flag;

	private ErrorLog errorLog;

	@BeforeEach
	void setUp() {
		store = mock(CheckpointStore.class);
		tracker = new ProgressTracker(new ProgressState(Path.of("list.txt"), Path.of("out.txt"), 2, null), store);
		flag = new ShutdownFlag();
		errorLog = new ErrorLog(tempDir.resolve("error.log"));
	}

	private IngestionPipeline pipeline(int maxLines, int threads, MergeListener listener) {
		EncodingStats stats = new EncodingStats();
		EncodingDetector detector = new EncodingDetector((sample, candidates) -> List.of(), new EncodingValidator(),
				WordlistEncodings.COMMON, 8192, 100L * 1024 * 1024);
		FileIngestor ingestor = new FileIngestor(new EncodingResolver(detector, stats), new EncodingConverter(stats),
				EncodingStrategy.autoDetect(), new BatchLimits(maxLines, 1024 * 1024), listener);
		return new IngestionPipeline(ingestor, tracker, flag, errorLog, listener, threads);
	}

	private Path file(String name, String content) throws IOException {
		Path file = tempDir.resolve(name);
		Files.writeString(file, content);
		return file;
	}

	@Test
	@DisplayName("Should ingest every file and record it in the checkpoint")
	void shouldIngestAllFiles() throws Exception {
		List<Path> files = List.of(file("a.txt", "pass1\npass2\n"), file("b.txt", "pass2\npass3\n"),
				file("c.txt", "pass4\n"));
		BatchChannel channel = new BatchChannel(4);
		ExecutorService consumer = Executors.newSingleThreadExecutor();
		try {
			Future<Set<String>> aggregation = consumer.submit(new DedupAggregator(channel, MergeListener.NONE));

			PipelineResult result = pipeline(1, 3, MergeListener.NONE).run(files, channel, aggregation);
			channel.close(1, TimeUnit.SECONDS);

			assertThat(result).isEqualTo(new PipelineResult(3, 0, 5, false));
			assertThat(aggregation.get(5, TimeUnit.SECONDS)).containsExactlyInAnyOrder("pass1", "pass2", "pass3",
					"pass4");
			assertThat(tracker.snapshot().getProcessedFiles()).hasSize(3);
			assertThat(tracker.snapshot().getCurrentPosition()).isEqualTo(5);
		}
		finally {
			consumer.shutdownNow();
		}
	}

	@Test
	@DisplayName("Should log and skip files that fail to read")
	void shouldSkipFailedFiles() throws Exception {
		Path good = file("good.txt", "pass1\n");
		Path missing = tempDir.resolve("missing.txt");
		MergeListener listener = mock(MergeListener.class);
		BatchChannel channel = new BatchChannel(4);

		PipelineResult result = pipeline(10, 1, listener).run(List.of(missing, good), channel,
				new CompletableFuture<>());

		assertThat(result.filesCompleted()).isEqualTo(1);
		assertThat(result.filesFailed()).isEqualTo(1);
		assertThat(tracker.isProcessed(missing)).isFalse();
		assertThat(Files.readString(errorLog.file())).contains("Failed to process " + missing);
		verify(listener).onFileFailed(eq(missing), any(IOException.class));
		verify(listener).onFileCompleted(good, 1);
	}

	@Test
	@DisplayName("Should stop before taking files once shutdown is requested")
	void shouldStopOnShutdown() throws Exception {
		List<Path> files = List.of(file("a.txt", "pass1\n"), file("b.txt", "pass2\n"));
		flag.set();

		PipelineResult result = pipeline(10, 2, MergeListener.NONE).run(files, new BatchChannel(4),
				new CompletableFuture<>());

		assertThat(result.interrupted()).isTrue();
		assertThat(result.filesCompleted()).isZero();
		verifyNoInteractions(store);
	}

	@Test
	@DisplayName("Should fail with a channel error when the consumer stops early")
	void shouldFailWhenConsumerStops() throws Exception {
		StringBuilder content = new StringBuilder();
		for (int i = 0; i < 20; i++) {
			content.append("line").append(i).append('\n');
		}
		Path file = file("big.txt", content.toString());

		assertThatThrownBy(() -> pipeline(1, 1, MergeListener.NONE).run(List.of(file), new BatchChannel(1),
				CompletableFuture.completedFuture(new HashSet<String>())))
			.isInstanceOfSatisfying(MergeException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.CHANNEL));
		assertThat(tracker.isProcessed(file)).isFalse();
	}

}
