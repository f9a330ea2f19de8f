package com.hackerhermanos.wordmerge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Reusable merge settings stored as a JSON config file.
 *
 * <p>
 * Keys are snake_case: {@code input_files}, {@code output_files}, {@code threads},
 * {@code verbose}, {@code debug}, {@code encoding}, {@code progress_file}. Absent keys keep
 * their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MergeConfig {

	/**
	 * File listing the input paths.
	 */
	private @Nullable String inputFiles;

	/**
	 * Merged output file.
	 */
	private @Nullable String outputFiles;

	private int threads = 10;

	private boolean verbose = true;

	private boolean debug = true;

	/**
	 * Encoding strategy in command-line form, see {@link EncodingStrategy#parse}.
	 */
	private String encoding = "auto";

	private @Nullable String progressFile;

	/**
	 * Defaults written by {@code generate-config}.
	 */
	public static MergeConfig template() {
		return new MergeConfig();
	}

	public @Nullable String getInputFiles() {
		return inputFiles;
	}

	public void setInputFiles(@Nullable String inputFiles) {
		this.inputFiles = inputFiles;
	}

	public @Nullable String getOutputFiles() {
		return outputFiles;
	}

	public void setOutputFiles(@Nullable String outputFiles) {
		this.outputFiles = outputFiles;
	}

	public int getThreads() {
		return threads;
	}

	public void setThreads(int threads) {
		this.threads = threads;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	public String getEncoding() {
		return encoding;
	}

	public void setEncoding(@Nullable String encoding) {
		this.encoding = encoding != null ? encoding : "auto";
	}

	public @Nullable String getProgressFile() {
		return progressFile;
	}

	public void setProgressFile(@Nullable String progressFile) {
		this.progressFile = progressFile;
	}

}
