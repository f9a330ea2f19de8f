package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Runs a fixed pool of ingestion workers over a queue of input files.
 *
 * <p>
 * Each worker checks the {@link ShutdownFlag} before taking the next file, so a file that
 * has started is always finished. Unreadable files are logged and skipped.
 */
public class IngestionPipeline {

	private static final Logger logger = LoggerFactory.getLogger(IngestionPipeline.class);

	private static final long POLL_MILLIS = 100;

	private final FileIngestor ingestor;

	private final ProgressTracker tracker;

	private final ShutdownFlag shutdownFlag;

	private final ErrorLog errorLog;

	private final MergeListener listener;

	private final int threads;

	public IngestionPipeline(FileIngestor ingestor, ProgressTracker tracker, ShutdownFlag shutdownFlag,
			ErrorLog errorLog, MergeListener listener, int threads) {
		if (threads <= 0) {
			throw new IllegalArgumentException("Thread count must be positive: " + threads);
		}
		this.ingestor = ingestor;
		this.tracker = tracker;
		this.shutdownFlag = shutdownFlag;
		this.errorLog = errorLog;
		this.listener = listener;
		this.threads = threads;
	}

	/**
	 * Ingest all files and wait for the workers to finish. The channel is not closed.
	 * @param files files in processing order
	 * @param channel channel the workers send batches to
	 * @param consumer the aggregator task; if it ends early the workers are cancelled
	 * @return counts for the stage
	 * @throws MergeException of kind {@link ErrorKind#CHANNEL} if the consumer died, and
	 * of kind {@link ErrorKind#IO} if a worker failed outside the per-file boundary
	 */
	public PipelineResult run(List<Path> files, BatchChannel channel, Future<?> consumer) {
		Queue<Path> pending = new ConcurrentLinkedQueue<>(files);
		AtomicInteger completed = new AtomicInteger();
		AtomicInteger failed = new AtomicInteger();
		LongAdder linesRead = new LongAdder();
		AtomicBoolean stoppedEarly = new AtomicBoolean();

		ExecutorService workers = Executors.newFixedThreadPool(threads, new NamedThreadFactory("wordmerge-worker"));
		List<Future<?>> futures = new ArrayList<>(threads);
		logger.info("Starting {} workers for {} files", threads, files.size());
		try {
			for (int i = 0; i < threads; i++) {
				futures.add(workers.submit(() -> {
					work(pending, channel, completed, failed, linesRead, stoppedEarly);
					return null;
				}));
			}
			workers.shutdown();
			awaitWorkers(workers, consumer);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			workers.shutdownNow();
			throw new MergeException(ErrorKind.CHANNEL, "Interrupted while waiting for ingestion workers", e);
		}

		for (Future<?> future : futures) {
			try {
				future.get();
			}
			catch (ExecutionException e) {
				if (e.getCause() instanceof InterruptedException) {
					throw new MergeException(ErrorKind.CHANNEL, "Ingestion worker was interrupted", e.getCause());
				}
				if (e.getCause() instanceof MergeException mergeException) {
					throw mergeException;
				}
				throw new MergeException(ErrorKind.IO, "Ingestion worker failed", e.getCause());
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new MergeException(ErrorKind.CHANNEL, "Interrupted while collecting worker results", e);
			}
			catch (CancellationException e) {
				throw new MergeException(ErrorKind.CHANNEL, "Ingestion worker was cancelled", e);
			}
		}

		boolean interrupted = stoppedEarly.get() || (shutdownFlag.isSet() && !pending.isEmpty());
		return new PipelineResult(completed.get(), failed.get(), linesRead.sum(), interrupted);
	}

	private void awaitWorkers(ExecutorService workers, Future<?> consumer) throws InterruptedException {
		while (!workers.awaitTermination(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
			if (consumer.isDone()) {
				logger.error("Aggregator stopped while workers were running, cancelling workers");
				workers.shutdownNow();
				workers.awaitTermination(POLL_MILLIS * 50, TimeUnit.MILLISECONDS);
				throw new MergeException(ErrorKind.CHANNEL, "Aggregator stopped before ingestion finished");
			}
		}
	}

	private void work(Queue<Path> pending, BatchChannel channel, AtomicInteger completed, AtomicInteger failed,
			LongAdder linesRead, AtomicBoolean stoppedEarly) throws InterruptedException {
		while (true) {
			if (shutdownFlag.isSet()) {
				if (!pending.isEmpty()) {
					stoppedEarly.set(true);
					logger.info("Shutdown requested, worker {} stopping", Thread.currentThread().getName());
				}
				return;
			}
			Path file = pending.poll();
			if (file == null) {
				return;
			}
			long lines;
			try {
				lines = ingestor.ingest(file, channel);
			}
			catch (IOException e) {
				failed.incrementAndGet();
				errorLog.record("Failed to process " + file + ": " + e.getMessage());
				listener.onFileFailed(file, e);
				continue;
			}
			tracker.recordFileCompleted(file, lines);
			completed.incrementAndGet();
			linesRead.add(lines);
			listener.onFileCompleted(file, lines);
		}
	}

}
