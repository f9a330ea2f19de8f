package com.hackerhermanos.wordmerge;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One prepared merge run. Executes at most once.
 *
 * <p>
 * The output is written whenever the aggregator produced a set, including interrupted
 * runs, and the checkpoint is saved on every exit path. If the output could not be
 * written, the checkpoint falls back to the files recorded before this run started.
 */
public class MergeRun {

	private static final Logger logger = LoggerFactory.getLogger(MergeRun.class);

	private static final long CLOSE_POLL_MILLIS = 100;

	private final MergeRequest request;

	private final List<Path> inputs;

	private final ProgressTracker tracker;

	private final ShutdownFlag flag;

	private final ShutdownCoordinator coordinator;

	private final ErrorLog errorLog;

	private final MergeProperties properties;

	private final BatchStrategy batchStrategy;

	private final EncodingDetector detector;

	private final MergeListener listener;

	private final AtomicBoolean executed = new AtomicBoolean();

	MergeRun(MergeRequest request, List<Path> inputs, ProgressTracker tracker, ShutdownFlag flag,
			ShutdownCoordinator coordinator, ErrorLog errorLog, MergeProperties properties,
			BatchStrategy batchStrategy, EncodingDetector detector, MergeListener listener) {
		this.request = request;
		this.inputs = List.copyOf(inputs);
		this.tracker = tracker;
		this.flag = flag;
		this.coordinator = coordinator;
		this.errorLog = errorLog;
		this.properties = properties;
		this.batchStrategy = batchStrategy;
		this.detector = detector;
		this.listener = listener;
	}

	public MergeRequest request() {
		return request;
	}

	public ShutdownCoordinator coordinator() {
		return coordinator;
	}

	public ProgressTracker tracker() {
		return tracker;
	}

	/**
	 * Run ingestion, aggregation and output writing.
	 * @return run statistics
	 * @throws MergeException if the run cannot complete; partial output and the
	 * checkpoint are still written where possible
	 */
	public MergeResult execute() {
		if (!executed.compareAndSet(false, true)) {
			throw new IllegalStateException("Merge run has already been executed");
		}
		long started = System.nanoTime();
		ProgressState baseline = tracker.snapshot();
		boolean outputWritten = false;
		List<Path> pending = inputs.stream().filter(file -> !tracker.isProcessed(file)).toList();
		int skipped = inputs.size() - pending.size();
		if (skipped > 0) {
			logger.info("Skipping {} files already recorded in {}", skipped, request.checkpoint());
		}

		ExecutorService aggregatorExecutor = Executors
			.newSingleThreadExecutor(new NamedThreadFactory("wordmerge-aggregator"));
		try {
			List<Path> ordered = FileOrderOptimizer
				.optimize(FileOrderOptimizer.collectMetadata(pending, errorLog))
				.stream()
				.map(FileDescriptor::path)
				.toList();
			int missing = pending.size() - ordered.size();
			BatchLimits limits = batchStrategy.computeLimits();

			EncodingStats stats = new EncodingStats();
			FileIngestor ingestor = new FileIngestor(new EncodingResolver(detector, stats),
					new EncodingConverter(stats), request.encoding(), limits, listener);
			IngestionPipeline pipeline = new IngestionPipeline(ingestor, tracker, flag, errorLog, listener,
					request.threads());
			BatchChannel channel = new BatchChannel(properties.getChannelCapacity());
			DedupAggregator aggregator = new DedupAggregator(channel, listener);
			Future<Set<String>> aggregation = aggregatorExecutor.submit(aggregator);

			PipelineResult pipelineResult = null;
			RuntimeException failure = null;
			try {
				pipelineResult = pipeline.run(ordered, channel, aggregation);
			}
			catch (RuntimeException e) {
				failure = e;
			}
			closeChannel(channel, aggregation);
			Set<String> unique = awaitAggregation(aggregation, failure);
			long uniqueCount = unique.size();
			long written = writeOutput(unique);
			outputWritten = true;
			if (failure != null) {
				throw failure;
			}

			stats.logSummary();
			logger.debug(stats.summary());
			return new MergeResult(pipelineResult.filesCompleted(), skipped,
					pipelineResult.filesFailed() + missing, pipelineResult.linesRead(), uniqueCount, written,
					tracker.snapshot().getCurrentPosition(), pipelineResult.interrupted(), request.output(),
					request.checkpoint(), Duration.ofNanos(System.nanoTime() - started));
		}
		finally {
			if (!outputWritten) {
				tracker.rollBackTo(baseline);
			}
			saveCheckpoint();
			coordinator.markStopped();
			aggregatorExecutor.shutdownNow();
		}
	}

	private void closeChannel(BatchChannel channel, Future<?> aggregation) {
		try {
			while (!channel.close(CLOSE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
				if (aggregation.isDone()) {
					return;
				}
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new MergeException(ErrorKind.CHANNEL, "Interrupted while closing the batch channel", e);
		}
	}

	private Set<String> awaitAggregation(Future<Set<String>> aggregation, @Nullable RuntimeException failure) {
		try {
			return aggregation.get();
		}
		catch (ExecutionException e) {
			MergeException aggregatorFailure = new MergeException(ErrorKind.CHANNEL, "Aggregator failed",
					e.getCause());
			if (failure != null) {
				failure.addSuppressed(aggregatorFailure);
				throw failure;
			}
			throw aggregatorFailure;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new MergeException(ErrorKind.CHANNEL, "Interrupted while waiting for the aggregator", e);
		}
	}

	private long writeOutput(Set<String> unique) {
		UniqueLineWriter writer = new UniqueLineWriter(properties.getWriteBufferBytes());
		try {
			if (request.resume()) {
				return writer.appendUnique(request.output(), unique);
			}
			return writer.write(request.output(), unique);
		}
		catch (IOException e) {
			throw new MergeException(ErrorKind.IO, "Failed to write output " + request.output(), e);
		}
	}

	private void saveCheckpoint() {
		try {
			tracker.save();
		}
		catch (MergeException e) {
			logger.error("Failed to save final checkpoint: {}", e.getMessage());
		}
	}

}
