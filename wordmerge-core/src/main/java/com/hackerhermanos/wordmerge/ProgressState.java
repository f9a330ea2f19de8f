package com.hackerhermanos.wordmerge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Resumable progress of a merge run, persisted as the checkpoint file.
 *
 * <p>
 * Every path in {@code processedFiles} was fully ingested; partially read files are never
 * recorded. {@code savePath} is where the state is persisted and is not itself written.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgressState {

	private @Nullable String inputFile;

	private @Nullable String outputFile;

	private int threadCount;

	private List<String> processedFiles = new ArrayList<>();

	private long currentPosition;

	private @Nullable Instant updatedAt;

	@JsonIgnore
	private @Nullable Path savePath;

	public ProgressState() {
	}

	public ProgressState(Path inputFile, Path outputFile, int threadCount, @Nullable Path savePath) {
		this.inputFile = inputFile.toString();
		this.outputFile = outputFile.toString();
		this.threadCount = threadCount;
		this.savePath = savePath;
	}

	/**
	 * Deep copy, including the save path.
	 */
	public ProgressState copy() {
		ProgressState copy = new ProgressState();
		copy.inputFile = inputFile;
		copy.outputFile = outputFile;
		copy.threadCount = threadCount;
		copy.processedFiles = new ArrayList<>(processedFiles);
		copy.currentPosition = currentPosition;
		copy.updatedAt = updatedAt;
		copy.savePath = savePath;
		return copy;
	}

	public @Nullable String getInputFile() {
		return inputFile;
	}

	public void setInputFile(@Nullable String inputFile) {
		this.inputFile = inputFile;
	}

	public @Nullable String getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(@Nullable String outputFile) {
		this.outputFile = outputFile;
	}

	public int getThreadCount() {
		return threadCount;
	}

	public void setThreadCount(int threadCount) {
		this.threadCount = threadCount;
	}

	public List<String> getProcessedFiles() {
		return processedFiles;
	}

	public void setProcessedFiles(@Nullable List<String> processedFiles) {
		this.processedFiles = processedFiles != null ? new ArrayList<>(processedFiles) : new ArrayList<>();
	}

	public long getCurrentPosition() {
		return currentPosition;
	}

	public void setCurrentPosition(long currentPosition) {
		this.currentPosition = currentPosition;
	}

	public @Nullable Instant getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(@Nullable Instant updatedAt) {
		this.updatedAt = updatedAt;
	}

	@JsonIgnore
	public @Nullable Path getSavePath() {
		return savePath;
	}

	@JsonIgnore
	public void setSavePath(@Nullable Path savePath) {
		this.savePath = savePath;
	}

}
