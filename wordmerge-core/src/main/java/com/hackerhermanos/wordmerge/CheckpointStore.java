package com.hackerhermanos.wordmerge;

import java.nio.file.Path;

/**
 * Persistence of {@link ProgressState} checkpoints.
 *
 * <p>
 * Abstracts storage to enable testability and alternative storage implementations.
 */
public interface CheckpointStore {

	/**
	 * Persist a state to its save path. Does nothing when the state has no save path.
	 * @param state state to persist
	 * @throws MergeException of kind {@link ErrorKind#IO} if the write fails
	 */
	void save(ProgressState state);

	/**
	 * Load a checkpoint and attach {@code path} as its save path.
	 * @param path checkpoint location
	 * @return loaded state
	 * @throws MergeException of kind {@link ErrorKind#RESUME} if the checkpoint is
	 * missing, corrupted or incomplete
	 */
	ProgressState load(Path path);

}
