package com.hackerhermanos.wordmerge;

import java.nio.file.Path;
import java.util.Set;

/**
 * Unique trimmed lines read from one file, sent to the aggregator as a unit.
 *
 * @param source file the lines came from
 * @param lines unique non-empty lines
 * @param bytesConsumed UTF-8 bytes of the decoded lines the batch covers, blank lines and
 * one terminator byte per line included
 */
public record LineBatch(Path source, Set<String> lines, long bytesConsumed) {
}
