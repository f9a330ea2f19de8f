package com.hackerhermanos.wordmerge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves {@link MergeConfig} JSON files.
 */
public class MergeConfigRepository {

	private static final Logger logger = LoggerFactory.getLogger(MergeConfigRepository.class);

	private final ObjectMapper objectMapper;

	public MergeConfigRepository(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * @throws MergeException of kind {@link ErrorKind#IO} if the file cannot be read and
	 * of kind {@link ErrorKind#CONFIGURATION} if it is not a valid config
	 */
	public MergeConfig load(Path path) {
		if (!Files.isRegularFile(path)) {
			throw new MergeException(ErrorKind.IO, "Config file not found: " + path);
		}
		try {
			MergeConfig config = objectMapper.readValue(path.toFile(), MergeConfig.class);
			logger.debug("Loaded config from {}", path);
			return config;
		}
		catch (JsonProcessingException e) {
			throw new MergeException(ErrorKind.CONFIGURATION,
					"Invalid config format in " + path + ": " + e.getOriginalMessage(), e);
		}
		catch (IOException e) {
			throw new MergeException(ErrorKind.IO, "Failed to read config " + path, e);
		}
	}

	public void save(MergeConfig config, Path path) {
		try {
			Path parent = path.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), config);
			logger.info("Saved config to {}", path);
		}
		catch (JsonProcessingException e) {
			throw new MergeException(ErrorKind.CONFIGURATION, "Failed to serialize config", e);
		}
		catch (IOException e) {
			throw new MergeException(ErrorKind.IO, "Failed to write config " + path, e);
		}
	}

}
