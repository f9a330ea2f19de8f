package com.hackerhermanos.wordmerge.cli;

import com.hackerhermanos.wordmerge.MergeConfig;
import com.hackerhermanos.wordmerge.MergeRequest;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Interactive creation of a {@link MergeConfig}. Every prompt has a default that an empty
 * answer accepts.
 */
class GuidedSetup {

	static final String DEFAULT_INPUT = "/tmp/wordlists_to_merge.txt";

	static final String DEFAULT_OUTPUT = "/tmp/merged_wordlist.txt";

	static final int DEFAULT_THREADS = 50;

	private final BufferedReader in;

	private final PrintStream out;

	GuidedSetup(InputStream in, PrintStream out) {
		this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		this.out = out;
	}

	/**
	 * @throws IOException if the input cannot be read
	 * @throws IllegalArgumentException if the thread count is not a number between 1 and
	 * 100
	 */
	MergeConfig run() throws IOException {
		MergeConfig config = new MergeConfig();
		config.setInputFiles(ask("Enter path to input files list", DEFAULT_INPUT));
		config.setOutputFiles(ask("Enter path for output file", DEFAULT_OUTPUT));

		String threads = ask("Enter number of threads", String.valueOf(DEFAULT_THREADS));
		int threadCount;
		try {
			threadCount = Integer.parseInt(threads);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid thread count '" + threads + "'");
		}
		if (threadCount < 1 || threadCount > MergeRequest.MAX_THREADS) {
			throw new IllegalArgumentException(
					"Invalid thread count " + threadCount + ": must be between 1 and " + MergeRequest.MAX_THREADS);
		}
		config.setThreads(threadCount);

		config.setVerbose(confirm("Enable verbose logging?", true));
		config.setDebug(confirm("Enable debug logging?", false));
		return config;
	}

	private String ask(String prompt, String defaultValue) throws IOException {
		out.print(prompt + " [" + defaultValue + "]: ");
		out.flush();
		String answer = in.readLine();
		if (answer == null || answer.isBlank()) {
			return defaultValue;
		}
		return answer.trim();
	}

	private boolean confirm(String prompt, boolean defaultValue) throws IOException {
		String answer = ask(prompt + " (y/n)", defaultValue ? "y" : "n").toLowerCase();
		return answer.startsWith("y");
	}

}
