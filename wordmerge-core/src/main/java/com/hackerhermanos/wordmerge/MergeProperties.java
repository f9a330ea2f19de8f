package com.hackerhermanos.wordmerge;

/**
 * Tuning properties for merge runs.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link WordMergeBuilder}.
 * Default values are suitable for most wordlist collections; lower the chunk and buffer
 * sizes on small machines.
 */
public class MergeProperties {

	/**
	 * Number of ingestion workers when neither the command line nor the config sets one.
	 */
	private int defaultThreads = 10;

	/**
	 * Capacity of the channel between ingestion workers and the aggregator, in batches.
	 */
	private int channelCapacity = 256;

	/**
	 * Estimated memory cost of one deduplicated line, in bytes.
	 */
	private long perLineOverheadBytes = 100;

	/**
	 * Upper bound on lines per batch regardless of available memory.
	 */
	private int lineCeiling = 10 * 1024 * 1024;

	/**
	 * Consumed bytes after which a batch is sent (default: 10MB).
	 */
	private long chunkBytes = 10L * 1024 * 1024;

	/**
	 * Output buffer size at which pending lines are flushed to disk (default: 10MB).
	 */
	private int writeBufferBytes = 10 * 1024 * 1024;

	/**
	 * Leading bytes read from each file for encoding detection.
	 */
	private int sampleSize = 8192;

	/**
	 * Files larger than this skip detection and are read as windows-1252 (default:
	 * 100MB).
	 */
	private long detectionCeiling = 100L * 1024 * 1024;

	/**
	 * Append-only log of per-file errors.
	 */
	private String errorLogFile = "error.log";

	/**
	 * Seconds between notices while the shutdown hook waits for a running merge to stop.
	 */
	private int shutdownNoticeSeconds = 30;

	public int getDefaultThreads() {
		return defaultThreads;
	}

	public void setDefaultThreads(int defaultThreads) {
		this.defaultThreads = defaultThreads;
	}

	public int getChannelCapacity() {
		return channelCapacity;
	}

	public void setChannelCapacity(int channelCapacity) {
		this.channelCapacity = channelCapacity;
	}

	public long getPerLineOverheadBytes() {
		return perLineOverheadBytes;
	}

	public void setPerLineOverheadBytes(long perLineOverheadBytes) {
		this.perLineOverheadBytes = perLineOverheadBytes;
	}

	public int getLineCeiling() {
		return lineCeiling;
	}

	public void setLineCeiling(int lineCeiling) {
		this.lineCeiling = lineCeiling;
	}

	public long getChunkBytes() {
		return chunkBytes;
	}

	public void setChunkBytes(long chunkBytes) {
		this.chunkBytes = chunkBytes;
	}

	public int getWriteBufferBytes() {
		return writeBufferBytes;
	}

	public void setWriteBufferBytes(int writeBufferBytes) {
		this.writeBufferBytes = writeBufferBytes;
	}

	public int getSampleSize() {
		return sampleSize;
	}

	public void setSampleSize(int sampleSize) {
		this.sampleSize = sampleSize;
	}

	public long getDetectionCeiling() {
		return detectionCeiling;
	}

	public void setDetectionCeiling(long detectionCeiling) {
		this.detectionCeiling = detectionCeiling;
	}

	public String getErrorLogFile() {
		return errorLogFile;
	}

	public void setErrorLogFile(String errorLogFile) {
		this.errorLogFile = errorLogFile;
	}

	public int getShutdownNoticeSeconds() {
		return shutdownNoticeSeconds;
	}

	public void setShutdownNoticeSeconds(int shutdownNoticeSeconds) {
		this.shutdownNoticeSeconds = shutdownNoticeSeconds;
	}

}
