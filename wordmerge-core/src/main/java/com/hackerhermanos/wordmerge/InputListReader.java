package com.hackerhermanos.wordmerge;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the list of input files: one path per line, blank lines ignored.
 */
public final class InputListReader {

	private InputListReader() {
	}

	public static List<Path> read(Path listFile) {
		if (!Files.isRegularFile(listFile)) {
			throw new MergeException(ErrorKind.CONFIGURATION, "Input file list not found: " + listFile);
		}
		try {
			return Files.readAllLines(listFile, StandardCharsets.UTF_8)
				.stream()
				.map(String::strip)
				.filter(line -> !line.isEmpty())
				.map(Path::of)
				.toList();
		}
		catch (IOException e) {
			throw new MergeException(ErrorKind.IO, "Failed to read input file list " + listFile, e);
		}
	}

}
