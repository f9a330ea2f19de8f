package com.hackerhermanos.wordmerge;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Result of a merge run.
 *
 * @param filesCompleted files ingested in this run
 * @param filesSkipped files skipped because a checkpoint already recorded them
 * @param filesFailed files that could not be read
 * @param linesRead non-empty lines read in this run
 * @param uniqueLines unique lines aggregated in this run
 * @param linesWritten lines written or appended to the output
 * @param totalPosition cumulative line position recorded in the checkpoint
 * @param interrupted whether the run stopped on a shutdown request
 * @param output output file
 * @param checkpoint checkpoint file
 * @param elapsed wall-clock time of the run
 */
public record MergeResult(int filesCompleted, int filesSkipped, int filesFailed, long linesRead, long uniqueLines,
		long linesWritten, long totalPosition, boolean interrupted, Path output, Path checkpoint, Duration elapsed) {
}
