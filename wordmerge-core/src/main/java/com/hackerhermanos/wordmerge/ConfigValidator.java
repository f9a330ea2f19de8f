package com.hackerhermanos.wordmerge;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks merge settings before any file is processed.
 */
public class ConfigValidator {

	/**
	 * Collect every problem with the given settings.
	 * @param inputList file listing the inputs, null if not set
	 * @param output output file, null if not set
	 * @param threads worker count
	 * @return error messages, empty if the settings are valid
	 */
	public List<String> validate(@Nullable Path inputList, @Nullable Path output, int threads) {
		List<String> errors = new ArrayList<>();

		if (threads < 1 || threads > MergeRequest.MAX_THREADS) {
			errors.add("Invalid thread count " + threads + ": must be between 1 and " + MergeRequest.MAX_THREADS);
		}

		if (inputList == null) {
			errors.add("Input file list is not specified");
		}
		else if (!Files.isRegularFile(inputList)) {
			errors.add("Input file list not found: " + inputList);
		}

		if (output == null) {
			errors.add("Output file is not specified");
		}
		else {
			if (inputList != null && inputList.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
				errors.add("Input and output paths must differ: " + output);
			}
			Path directory = nearestExistingDirectory(output);
			if (directory == null || !isWritable(directory)) {
				errors.add("Output directory is not writable: " + output.toAbsolutePath().getParent());
			}
		}
		return errors;
	}

	/**
	 * @throws MergeException of kind {@link ErrorKind#CONFIGURATION} listing every error
	 */
	public void validateOrThrow(@Nullable Path inputList, @Nullable Path output, int threads) {
		List<String> errors = validate(inputList, output, threads);
		if (!errors.isEmpty()) {
			throw new MergeException(ErrorKind.CONFIGURATION, String.join("; ", errors));
		}
	}

	private static @Nullable Path nearestExistingDirectory(Path output) {
		Path current = output.toAbsolutePath().getParent();
		while (current != null && !Files.exists(current)) {
			current = current.getParent();
		}
		return current != null && Files.isDirectory(current) ? current : null;
	}

	// create and delete a probe file
	private static boolean isWritable(Path directory) {
		try {
			Path probe = Files.createTempFile(directory, ".wordmerge", ".probe");
			Files.delete(probe);
			return true;
		}
		catch (IOException e) {
			return false;
		}
	}

}
