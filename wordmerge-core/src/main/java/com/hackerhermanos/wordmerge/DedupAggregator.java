package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single consumer that merges every {@link LineBatch} into one deduplicated set.
 *
 * <p>
 * The set is only touched by the thread running {@link #call()}; running counts are
 * published through atomics for other threads.
 */
public class DedupAggregator implements Callable<Set<String>> {

	private static final Logger logger = LoggerFactory.getLogger(DedupAggregator.class);

	private final BatchChannel channel;

	private final MergeListener listener;

	private final AtomicLong uniqueLines = new AtomicLong();

	private final AtomicLong totalLines = new AtomicLong();

	private final AtomicLong batches = new AtomicLong();

	public DedupAggregator(BatchChannel channel, MergeListener listener) {
		this.channel = channel;
		this.listener = listener;
	}

	/**
	 * Drain the channel until it is closed.
	 * @return every unique line received
	 */
	@Override
	public Set<String> call() throws InterruptedException {
		Set<String> unique = new HashSet<>();
		LineBatch batch;
		while ((batch = channel.receive()) != null) {
			unique.addAll(batch.lines());
			uniqueLines.set(unique.size());
			totalLines.addAndGet(batch.lines().size());
			batches.incrementAndGet();
			listener.onBatchMerged(uniqueLines.get(), totalLines.get());
		}
		logger.info("Aggregated {} batches into {} unique lines", batches.get(), unique.size());
		return unique;
	}

	public long uniqueLines() {
		return uniqueLines.get();
	}

	/**
	 * Lines received, counted after per-batch deduplication.
	 */
	public long totalLines() {
		return totalLines.get();
	}

}
