package com.hackerhermanos.wordmerge;

import java.nio.file.Path;

/**
 * Parameters of one merge run.
 *
 * @param inputList file listing the input paths, one per line
 * @param output merged output file
 * @param threads number of ingestion workers (1-100)
 * @param encoding charset strategy applied to every input file
 * @param checkpoint checkpoint file location
 * @param resume continue from the checkpoint instead of starting fresh
 */
public record MergeRequest(Path inputList, Path output, int threads, EncodingStrategy encoding, Path checkpoint,
		boolean resume) {

	public static final int MAX_THREADS = 100;

	public MergeRequest {
		if (threads < 1 || threads > MAX_THREADS) {
			throw new MergeException(ErrorKind.CONFIGURATION,
					"Invalid thread count " + threads + ": must be between 1 and " + MAX_THREADS);
		}
	}

	/**
	 * Fresh run with the default checkpoint location next to the output.
	 */
	public static MergeRequest of(Path inputList, Path output, int threads, EncodingStrategy encoding) {
		return new MergeRequest(inputList, output, threads, encoding, defaultCheckpoint(output), false);
	}

	/**
	 * {@code <output>.checkpoint.json}, next to the output file.
	 */
	public static Path defaultCheckpoint(Path output) {
		return output.resolveSibling(output.getFileName() + ".checkpoint.json");
	}

}
