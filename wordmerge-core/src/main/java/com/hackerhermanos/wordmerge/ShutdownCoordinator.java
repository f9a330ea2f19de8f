package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns an external stop request into a saved checkpoint and a raised
 * {@link ShutdownFlag}.
 *
 * <p>
 * States move {@code RUNNING -> SHUTDOWN_REQUESTED -> STOPPED}. A request after the run
 * has stopped is ignored.
 */
public class ShutdownCoordinator {

	private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

	public enum State {

		RUNNING, SHUTDOWN_REQUESTED, STOPPED

	}

	private final ProgressTracker tracker;

	private final ShutdownFlag flag;

	private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

	private final CountDownLatch stopped = new CountDownLatch(1);

	public ShutdownCoordinator(ProgressTracker tracker, ShutdownFlag flag) {
		this.tracker = tracker;
		this.flag = flag;
	}

	/**
	 * Save progress and ask all workers to stop after their current file.
	 * @return true if this call performed the transition
	 */
	public boolean requestShutdown() {
		if (!state.compareAndSet(State.RUNNING, State.SHUTDOWN_REQUESTED)) {
			return false;
		}
		logger.info("Shutdown requested, saving progress");
		try {
			tracker.save();
		}
		catch (MergeException e) {
			logger.error("Failed to save progress on shutdown: {}", e.getMessage());
		}
		flag.set();
		return true;
	}

	public void markStopped() {
		state.set(State.STOPPED);
		stopped.countDown();
	}

	/**
	 * Wait for the run to reach {@link State#STOPPED}.
	 * @return false if the timeout elapsed first
	 */
	public boolean awaitStopped(Duration timeout) throws InterruptedException {
		return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	public State state() {
		return state.get();
	}

	/**
	 * Register a JVM shutdown hook that requests shutdown and blocks until the run has
	 * stopped, so the output and final checkpoint are written before the JVM exits.
	 * @param noticeInterval how often the hook logs that it is still waiting
	 * @return the registered hook thread
	 */
	public Thread installShutdownHook(Duration noticeInterval) {
		Thread hook = new Thread(() -> stopAndWait(noticeInterval), "wordmerge-shutdown");
		Runtime.getRuntime().addShutdownHook(hook);
		return hook;
	}

	void stopAndWait(Duration noticeInterval) {
		requestShutdown();
		try {
			while (!awaitStopped(noticeInterval)) {
				logger.warn("Waiting for the current files to finish before exiting");
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

}
