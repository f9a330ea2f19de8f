package com.hackerhermanos.wordmerge;

import java.nio.file.Path;

/**
 * Input file with its size, used only for ordering.
 *
 * @param path input file path
 * @param size size in bytes at the time metadata was read
 */
public record FileDescriptor(Path path, long size) {
}
