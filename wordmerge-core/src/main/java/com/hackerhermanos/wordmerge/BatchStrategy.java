package com.hackerhermanos.wordmerge;

/**
 * Strategy interface for sizing line batches.
 *
 * <p>
 * Allows different sizing strategies (fixed limits, limits derived from available memory,
 * etc.)
 */
public interface BatchStrategy {

	/**
	 * Compute the batch limits for a run. Called once before ingestion starts.
	 * @return limits applied to every batch of the run
	 * @throws MergeException if the inputs needed to size batches are unavailable
	 */
	BatchLimits computeLimits();

}
