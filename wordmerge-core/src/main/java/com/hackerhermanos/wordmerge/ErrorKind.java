package com.hackerhermanos.wordmerge;

/**
 * Classification of run-level failures raised as {@link MergeException}.
 */
public enum ErrorKind {

	/**
	 * Input list unreadable or output write failure.
	 */
	IO,

	/**
	 * Invalid thread count, missing or equal paths, unwritable output directory, unknown
	 * charset.
	 */
	CONFIGURATION,

	/**
	 * Checkpoint missing, corrupted, or referencing input files that changed.
	 */
	RESUME,

	/**
	 * Memory information could not be obtained.
	 */
	SYSTEM_RESOURCE,

	/**
	 * Failure in the plumbing between ingestion workers and the aggregator.
	 */
	CHANNEL

}
