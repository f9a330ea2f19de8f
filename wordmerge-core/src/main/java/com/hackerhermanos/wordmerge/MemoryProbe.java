package com.hackerhermanos.wordmerge;

import java.util.OptionalLong;

/**
 * Source of the amount of memory a run may use for batching.
 */
public interface MemoryProbe {

	/**
	 * @return available bytes, or empty if the platform does not report it
	 */
	OptionalLong availableBytes();

}
