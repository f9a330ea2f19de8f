package com.hackerhermanos.wordmerge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File system implementation of {@link CheckpointStore}.
 *
 * <p>
 * Checkpoints are written as pretty-printed JSON to a temporary file next to the target
 * and then moved over it, so a crash never leaves a half-written checkpoint.
 */
public class FileSystemCheckpointStore implements CheckpointStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCheckpointStore.class);

	private final ObjectMapper objectMapper;

	public FileSystemCheckpointStore(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public void save(ProgressState state) {
		Path target = state.getSavePath();
		if (target == null) {
			return;
		}
		Path directory = target.toAbsolutePath().getParent();
		@Nullable
		Path temp = null;
		try {
			Files.createDirectories(directory);
			temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
			try {
				Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
			logger.debug("Saved checkpoint to {} ({} files processed)", target, state.getProcessedFiles().size());
		}
		catch (IOException e) {
			deleteQuietly(temp);
			throw new MergeException(ErrorKind.IO, "Failed to save checkpoint " + target, e);
		}
	}

	@Override
	public ProgressState load(Path path) {
		if (!Files.isRegularFile(path)) {
			throw new MergeException(ErrorKind.RESUME, "Checkpoint not found: " + path);
		}
		ProgressState state;
		try {
			state = objectMapper.readValue(path.toFile(), ProgressState.class);
		}
		catch (JsonProcessingException e) {
			throw new MergeException(ErrorKind.RESUME, "Checkpoint is corrupted: " + path, e);
		}
		catch (IOException e) {
			throw new MergeException(ErrorKind.RESUME, "Failed to read checkpoint " + path, e);
		}
		if (state == null || state.getInputFile() == null || state.getOutputFile() == null) {
			throw new MergeException(ErrorKind.RESUME,
					"Checkpoint has an invalid format, input_file and output_file are required: " + path);
		}
		state.setSavePath(path);
		logger.info("Loaded checkpoint {}: {} files processed, position {}", path, state.getProcessedFiles().size(),
				state.getCurrentPosition());
		return state;
	}

	private static void deleteQuietly(@Nullable Path temp) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		}
		catch (IOException e) {
			logger.warn("Failed to delete temporary checkpoint {}", temp);
		}
	}

}
