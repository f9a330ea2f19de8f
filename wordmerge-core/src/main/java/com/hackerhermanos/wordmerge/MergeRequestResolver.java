package com.hackerhermanos.wordmerge;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Combines command-line arguments, an optional config file and defaults into a
 * {@link MergeRequest}.
 *
 * <p>
 * Precedence for each setting: explicit argument, then config file, then default. Input is
 * taken from {@code --wordlists-file}, then {@code --rules-file}, then the config's
 * {@code input_files}; output likewise.
 */
public class MergeRequestResolver {

	private final MergeProperties properties;

	private final ConfigValidator validator;

	public MergeRequestResolver(MergeProperties properties, ConfigValidator validator) {
		this.properties = properties;
		this.validator = validator;
	}

	/**
	 * @param arguments parsed {@code merge} arguments
	 * @param config config file contents, or null when no config was given
	 * @return validated request for a fresh run
	 * @throws IllegalArgumentException if no input or output was specified
	 * @throws MergeException of kind {@link ErrorKind#CONFIGURATION} if the settings are
	 * invalid
	 */
	public MergeRequest resolve(ParsedConfiguration arguments, @Nullable MergeConfig config) {
		String input = firstNonNull(arguments.wordlistsFile, arguments.rulesFile,
				config != null ? config.getInputFiles() : null);
		if (input == null) {
			throw new IllegalArgumentException("No input file specified (use --wordlists-file or --rules-file)");
		}
		String output = firstNonNull(arguments.outputWordlist, arguments.outputRules,
				config != null ? config.getOutputFiles() : null);
		if (output == null) {
			throw new IllegalArgumentException("No output file specified (use --output-wordlist or --output-rules)");
		}

		int threads;
		if (arguments.threads != null) {
			threads = arguments.threads;
		}
		else if (config != null) {
			threads = config.getThreads();
		}
		else {
			threads = properties.getDefaultThreads();
		}

		String encodingSpec = firstNonNull(arguments.encoding, config != null ? config.getEncoding() : null);
		EncodingStrategy encoding = encodingSpec != null ? EncodingStrategy.parse(encodingSpec)
				: EncodingStrategy.autoDetect();

		Path inputList = Path.of(input);
		Path outputFile = Path.of(output);
		validator.validateOrThrow(inputList, outputFile, threads);

		String progress = firstNonNull(arguments.progressFile, config != null ? config.getProgressFile() : null);
		Path checkpoint = progress != null ? Path.of(progress) : MergeRequest.defaultCheckpoint(outputFile);
		return new MergeRequest(inputList, outputFile, threads, encoding, checkpoint, false);
	}

	private static @Nullable String firstNonNull(@Nullable String... values) {
		for (String value : values) {
			if (value != null && !value.isBlank()) {
				return value;
			}
		}
		return null;
	}

}
