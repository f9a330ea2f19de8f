package com.hackerhermanos.wordmerge;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal, set at most once per run and read at every loop boundary.
 */
public class ShutdownFlag {

	private final AtomicBoolean set = new AtomicBoolean();

	public void set() {
		set.set(true);
	}

	public boolean isSet() {
		return set.get();
	}

}
