package com.hackerhermanos.wordmerge;

/**
 * Simple fixed-size batch strategy.
 *
 * <p>
 * Always returns the configured limits without looking at the machine.
 */
public class FixedBatchStrategy implements BatchStrategy {

	private final BatchLimits limits;

	public FixedBatchStrategy(int maxLines, long maxBytes) {
		this.limits = new BatchLimits(maxLines, maxBytes);
	}

	@Override
	public BatchLimits computeLimits() {
		return limits;
	}

}
