package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;

/**
 * Batch strategy that sizes batches from available memory.
 *
 * <p>
 * Half of the available memory is divided by an estimated per-line cost, and the result
 * is capped at a line ceiling.
 */
public class MemoryAwareBatchStrategy implements BatchStrategy {

	private static final Logger logger = LoggerFactory.getLogger(MemoryAwareBatchStrategy.class);

	private final MemoryProbe memoryProbe;

	private final long perLineOverheadBytes;

	private final int lineCeiling;

	private final long chunkBytes;

	public MemoryAwareBatchStrategy(MemoryProbe memoryProbe, MergeProperties properties) {
		this(memoryProbe, properties.getPerLineOverheadBytes(), properties.getLineCeiling(),
				properties.getChunkBytes());
	}

	public MemoryAwareBatchStrategy(MemoryProbe memoryProbe, long perLineOverheadBytes, int lineCeiling,
			long chunkBytes) {
		if (perLineOverheadBytes <= 0) {
			throw new IllegalArgumentException("Per-line overhead must be positive: " + perLineOverheadBytes);
		}
		this.memoryProbe = memoryProbe;
		this.perLineOverheadBytes = perLineOverheadBytes;
		this.lineCeiling = lineCeiling;
		this.chunkBytes = chunkBytes;
	}

	@Override
	public BatchLimits computeLimits() {
		OptionalLong available = memoryProbe.availableBytes();
		if (available.isEmpty()) {
			throw new MergeException(ErrorKind.SYSTEM_RESOURCE, "Unable to determine available memory");
		}
		long byMemory = (available.getAsLong() / 2) / perLineOverheadBytes;
		int maxLines = (int) Math.max(1, Math.min(byMemory, lineCeiling));
		logger.info("Batch size: {} lines per batch ({} available)", maxLines,
				EncodingStats.formatBytes(available.getAsLong()));
		return new BatchLimits(maxLines, chunkBytes);
	}

}
