package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared holder of the run's {@link ProgressState}, guarded by a single read/write lock.
 *
 * <p>
 * Completing a file appends it, advances the position and persists the checkpoint in one
 * write-locked step. The lock is never held while sending to the channel.
 */
public class ProgressTracker {

	private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

	private final ProgressState state;

	private final CheckpointStore store;

	private final Clock clock;

	private final Set<String> processed;

	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	public ProgressTracker(ProgressState state, CheckpointStore store) {
		this(state, store, Clock.systemUTC());
	}

	public ProgressTracker(ProgressState state, CheckpointStore store, Clock clock) {
		this.state = state;
		this.store = store;
		this.clock = clock;
		this.processed = new HashSet<>(state.getProcessedFiles());
	}

	/**
	 * Record a fully ingested file and persist the checkpoint.
	 * @param file completed file
	 * @param lines non-empty lines read from it
	 */
	public void recordFileCompleted(Path file, long lines) {
		lock.writeLock().lock();
		try {
			String key = file.toString();
			if (processed.add(key)) {
				state.getProcessedFiles().add(key);
			}
			state.setCurrentPosition(state.getCurrentPosition() + lines);
			state.setUpdatedAt(Instant.now(clock));
			store.save(state);
		}
		finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Forget files completed since {@code baseline} was taken. Used when their lines never
	 * reached the output, so a resume reads them again.
	 * @param baseline earlier snapshot of this tracker
	 */
	public void rollBackTo(ProgressState baseline) {
		lock.writeLock().lock();
		try {
			int dropped = state.getProcessedFiles().size() - baseline.getProcessedFiles().size();
			state.setProcessedFiles(baseline.getProcessedFiles());
			state.setCurrentPosition(baseline.getCurrentPosition());
			state.setUpdatedAt(Instant.now(clock));
			processed.clear();
			processed.addAll(baseline.getProcessedFiles());
			if (dropped > 0) {
				logger.warn("Output was not written, {} completed files will be read again on resume", dropped);
			}
		}
		finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Persist the current state.
	 */
	public void save() {
		lock.readLock().lock();
		try {
			store.save(state);
			logger.debug("Checkpoint saved: {} files, position {}", state.getProcessedFiles().size(),
					state.getCurrentPosition());
		}
		finally {
			lock.readLock().unlock();
		}
	}

	public boolean isProcessed(Path file) {
		lock.readLock().lock();
		try {
			return processed.contains(file.toString());
		}
		finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * @return an independent copy of the current state
	 */
	public ProgressState snapshot() {
		lock.readLock().lock();
		try {
			return state.copy();
		}
		finally {
			lock.readLock().unlock();
		}
	}

}
