package com.hackerhermanos.wordmerge;

/**
 * Outcome of the ingestion stage.
 *
 * @param filesCompleted files fully ingested and checkpointed
 * @param filesFailed files skipped because they could not be read
 * @param linesRead non-empty lines read from completed files
 * @param interrupted whether workers stopped on a shutdown request before the queue was
 * drained
 */
public record PipelineResult(int filesCompleted, int filesFailed, long linesRead, boolean interrupted) {
}
