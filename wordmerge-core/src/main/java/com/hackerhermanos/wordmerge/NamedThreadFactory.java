package com.hackerhermanos.wordmerge;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory producing {@code prefix-N} named threads.
 */
final class NamedThreadFactory implements ThreadFactory {

	private final String prefix;

	private final AtomicInteger counter = new AtomicInteger(1);

	NamedThreadFactory(String prefix) {
		this.prefix = prefix;
	}

	@Override
	public Thread newThread(Runnable task) {
		return new Thread(task, prefix + "-" + counter.getAndIncrement());
	}

}
