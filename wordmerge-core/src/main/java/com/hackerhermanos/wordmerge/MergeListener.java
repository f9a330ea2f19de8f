package com.hackerhermanos.wordmerge;

import java.nio.file.Path;

/**
 * Callbacks for merge progress. Methods may be called from worker threads and the
 * aggregator thread concurrently.
 */
public interface MergeListener {

	MergeListener NONE = new MergeListener() {
	};

	default void onFileStarted(Path file, EncodingProfile profile) {
	}

	/**
	 * Called after the file has been recorded in the checkpoint.
	 */
	default void onFileCompleted(Path file, long lines) {
	}

	default void onFileFailed(Path file, Exception error) {
	}

	default void onBatchMerged(long uniqueLines, long totalLines) {
	}

}
