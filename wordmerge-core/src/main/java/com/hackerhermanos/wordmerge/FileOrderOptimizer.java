package com.hackerhermanos.wordmerge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders input files so the largest start first.
 *
 * <p>
 * Files are sorted by size descending, then grouped into large, medium and small buckets
 * which are emitted in that order.
 */
public final class FileOrderOptimizer {

	private static final Logger logger = LoggerFactory.getLogger(FileOrderOptimizer.class);

	/** Files below this size are small (100 MiB). */
	public static final long SMALL_LIMIT = 100L * 1024 * 1024;

	/** Files below this size are medium (1000 MiB). */
	public static final long MEDIUM_LIMIT = 1000L * 1024 * 1024;

	private FileOrderOptimizer() {
	}

	/**
	 * @param files files with their sizes, in any order
	 * @return new list: large bucket, then medium, then small, each descending by size
	 */
	public static List<FileDescriptor> optimize(List<FileDescriptor> files) {
		List<FileDescriptor> sorted = new ArrayList<>(files);
		sorted.sort(Comparator.comparingLong(FileDescriptor::size).reversed());

		List<FileDescriptor> large = new ArrayList<>();
		List<FileDescriptor> medium = new ArrayList<>();
		List<FileDescriptor> small = new ArrayList<>();
		for (FileDescriptor file : sorted) {
			if (file.size() < SMALL_LIMIT) {
				small.add(file);
			}
			else if (file.size() < MEDIUM_LIMIT) {
				medium.add(file);
			}
			else {
				large.add(file);
			}
		}

		List<FileDescriptor> ordered = new ArrayList<>(sorted.size());
		ordered.addAll(large);
		ordered.addAll(medium);
		ordered.addAll(small);
		logger.debug("Ordered {} files: {} large, {} medium, {} small", ordered.size(), large.size(), medium.size(),
				small.size());
		return ordered;
	}

	/**
	 * Read the size of each path. Files that are missing or unreadable are reported to the
	 * error log and left out.
	 */
	public static List<FileDescriptor> collectMetadata(List<Path> paths, ErrorLog errorLog) {
		List<FileDescriptor> descriptors = new ArrayList<>(paths.size());
		for (Path path : paths) {
			if (!Files.isRegularFile(path)) {
				errorLog.record("Input file not found, skipping: " + path);
				continue;
			}
			try {
				descriptors.add(new FileDescriptor(path, Files.size(path)));
			}
			catch (IOException e) {
				errorLog.record("Failed to read metadata for " + path + ": " + e.getMessage());
			}
		}
		return descriptors;
	}

}
