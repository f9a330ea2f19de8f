package com.hackerhermanos.wordmerge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ProgressTracker}.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProgressTracker Tests")
class ProgressTrackerTest {

	private static final Instant NOW = Instant.parse("2024-01-02T03:04:05Z");

	@Mock
	private CheckpointStore store;

	private ProgressState state;

	private ProgressTracker tracker;

	@BeforeEach
	void setUp() {
		state = new ProgressState(Path.of("list.txt"), Path.of("out.txt"), 2, Path.of("out.txt.checkpoint.json"));
		tracker = new ProgressTracker(state, store, Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@Test
	@DisplayName("Should record a completed file and save the checkpoint")
	void shouldRecordCompletedFile() {
		tracker.recordFileCompleted(Path.of("a.txt"), 2);

		ProgressState snapshot = tracker.snapshot();
		assertThat(snapshot.getProcessedFiles()).containsExactly("a.txt");
		assertThat(snapshot.getCurrentPosition()).isEqualTo(2);
		assertThat(snapshot.getUpdatedAt()).isEqualTo(NOW);
		assertThat(tracker.isProcessed(Path.of("a.txt"))).isTrue();
		assertThat(tracker.isProcessed(Path.of("b.txt"))).isFalse();
		verify(store).save(state);
	}

	@Test
	@DisplayName("Should not list a file twice")
	void shouldNotDuplicateFiles() {
		tracker.recordFileCompleted(Path.of("a.txt"), 2);
		tracker.recordFileCompleted(Path.of("a.txt"), 3);

		assertThat(tracker.snapshot().getProcessedFiles()).containsExactly("a.txt");
		assertThat(tracker.snapshot().getCurrentPosition()).isEqualTo(5);
	}

	@Test
	@DisplayName("Should know files recorded by a loaded checkpoint")
	void shouldKnowPreviouslyProcessedFiles() {
		state.setProcessedFiles(List.of("a.txt"));

		ProgressTracker resumed = new ProgressTracker(state, store);

		assertThat(resumed.isProcessed(Path.of("a.txt"))).isTrue();
	}

	@Test
	@DisplayName("Should return snapshots independent of later updates")
	void shouldReturnIndependentSnapshots() {
		ProgressState before = tracker.snapshot();

		tracker.recordFileCompleted(Path.of("a.txt"), 1);

		assertThat(before.getProcessedFiles()).isEmpty();
		assertThat(before.getCurrentPosition()).isZero();
	}

	@Test
	@DisplayName("Should forget files completed after the baseline when rolled back")
	void shouldRollBackToBaseline() {
		tracker.recordFileCompleted(Path.of("a.txt"), 2);
		ProgressState baseline = tracker.snapshot();
		tracker.recordFileCompleted(Path.of("b.txt"), 3);

		tracker.rollBackTo(baseline);

		ProgressState snapshot = tracker.snapshot();
		assertThat(snapshot.getProcessedFiles()).containsExactly("a.txt");
		assertThat(snapshot.getCurrentPosition()).isEqualTo(2);
		assertThat(tracker.isProcessed(Path.of("a.txt"))).isTrue();
		assertThat(tracker.isProcessed(Path.of("b.txt"))).isFalse();
	}

	@Test
	@DisplayName("Should keep a consistent state under concurrent completions")
	void shouldHandleConcurrentCompletions() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(8);
		List<Future<?>> futures = new ArrayList<>();
		try {
			for (int t = 0; t < 8; t++) {
				int thread = t;
				futures.add(executor.submit(() -> {
					for (int i = 0; i < 50; i++) {
						tracker.recordFileCompleted(Path.of("file-" + thread + "-" + i), 3);
					}
				}));
			}
			for (Future<?> future : futures) {
				future.get();
			}
		}
		finally {
			executor.shutdownNow();
		}

		ProgressState snapshot = tracker.snapshot();
		assertThat(snapshot.getProcessedFiles()).hasSize(400).doesNotHaveDuplicates();
		assertThat(snapshot.getCurrentPosition()).isEqualTo(1200);
		verify(store, times(400)).save(any(ProgressState.class));
	}

	@Test
	@DisplayName("Should propagate checkpoint save failures")
	void shouldPropagateSaveFailure() {
		doThrow(new MergeException(ErrorKind.IO, "disk full")).when(store).save(any(ProgressState.class));

		assertThatThrownBy(tracker::save).isInstanceOf(MergeException.class).hasMessageContaining("disk full");
	}

}
