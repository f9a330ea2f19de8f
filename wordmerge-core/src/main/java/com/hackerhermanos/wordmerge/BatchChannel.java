package com.hackerhermanos.wordmerge;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded multiple-producer, single-consumer channel of {@link LineBatch}es.
 *
 * <p>
 * {@link #send} blocks while the channel is full. Closing enqueues an end marker after
 * which {@link #receive} returns null.
 */
public class BatchChannel {

	private static final LineBatch END = new LineBatch(Path.of(""), Set.of(), 0);

	private final BlockingQueue<LineBatch> queue;

	private final AtomicBoolean closed = new AtomicBoolean();

	public BatchChannel(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
		}
		this.queue = new ArrayBlockingQueue<>(capacity);
	}

	public void send(LineBatch batch) throws InterruptedException {
		if (closed.get()) {
			throw new IllegalStateException("Channel is closed");
		}
		queue.put(batch);
	}

	/**
	 * @return next batch in arrival order, or null once the channel is closed and drained
	 */
	public @Nullable LineBatch receive() throws InterruptedException {
		LineBatch batch = queue.take();
		if (batch == END) {
			return null;
		}
		return batch;
	}

	/**
	 * Signal end of stream. Must be called after every producer has finished.
	 * @return false if the end marker could not be enqueued within the timeout
	 */
	public boolean close(long timeout, TimeUnit unit) throws InterruptedException {
		closed.set(true);
		return queue.offer(END, timeout, unit);
	}

	public int size() {
		return queue.size();
	}

}
