package com.hackerhermanos.wordmerge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MergeRequestResolver}.
 *
 * Tests precedence between arguments, config file and defaults.
 */
@DisplayName("MergeRequestResolver Tests")
class MergeRequestResolverTest {

	@TempDir
	Path tempDir;

	private MergeProperties properties;

	private MergeRequestResolver resolver;

	private Path inputList;

	@BeforeEach
	void setUp() throws IOException {
		properties = new MergeProperties();
		resolver = new MergeRequestResolver(properties, new ConfigValidator());
		inputList = tempDir.resolve("lists.txt");
		Files.writeString(inputList, "a.txt\n");
	}

	private ParsedConfiguration merge() {
		ParsedConfiguration arguments = new ParsedConfiguration();
		arguments.command = ParsedConfiguration.MERGE;
		return arguments;
	}

	@Test
	@DisplayName("Should use defaults when only input and output are given")
	void shouldUseDefaults() {
		ParsedConfiguration arguments = merge();
		arguments.wordlistsFile = inputList.toString();
		arguments.outputWordlist = tempDir.resolve("out.txt").toString();

		MergeRequest request = resolver.resolve(arguments, null);

		assertThat(request.threads()).isEqualTo(properties.getDefaultThreads());
		assertThat(request.encoding()).isEqualTo(EncodingStrategy.autoDetect());
		assertThat(request.checkpoint()).isEqualTo(tempDir.resolve("out.txt.checkpoint.json"));
		assertThat(request.resume()).isFalse();
	}

	@Test
	@DisplayName("Should prefer arguments over config values")
	void shouldPreferArguments() {
		MergeConfig config = new MergeConfig();
		config.setInputFiles(tempDir.resolve("other.txt").toString());
		config.setOutputFiles(tempDir.resolve("config-out.txt").toString());
		config.setThreads(3);
		config.setEncoding("utf-8");
		ParsedConfiguration arguments = merge();
		arguments.rulesFile = inputList.toString();
		arguments.outputRules = tempDir.resolve("out.rule").toString();
		arguments.threads = 8;
		arguments.encoding = "wordlist";

		MergeRequest request = resolver.resolve(arguments, config);

		assertThat(request.inputList()).isEqualTo(inputList);
		assertThat(request.output()).isEqualTo(tempDir.resolve("out.rule"));
		assertThat(request.threads()).isEqualTo(8);
		assertThat(request.encoding()).isEqualTo(EncodingStrategy.wordlistDefault());
	}

	@Test
	@DisplayName("Should fall back to config values")
	void shouldUseConfigValues() {
		MergeConfig config = new MergeConfig();
		config.setInputFiles(inputList.toString());
		config.setOutputFiles(tempDir.resolve("out.txt").toString());
		config.setThreads(3);
		config.setEncoding("utf-8");
		config.setProgressFile(tempDir.resolve("progress.json").toString());

		MergeRequest request = resolver.resolve(merge(), config);

		assertThat(request.threads()).isEqualTo(3);
		assertThat(request.encoding()).isEqualTo(EncodingStrategy.force(StandardCharsets.UTF_8));
		assertThat(request.checkpoint()).isEqualTo(tempDir.resolve("progress.json"));
	}

	@Test
	@DisplayName("Should require an input and an output")
	void shouldRequireInputAndOutput() {
		assertThatThrownBy(() -> resolver.resolve(merge(), null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("No input file specified");

		ParsedConfiguration arguments = merge();
		arguments.wordlistsFile = inputList.toString();
		assertThatThrownBy(() -> resolver.resolve(arguments, null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("No output file specified");
	}

	@Test
	@DisplayName("Should report a missing input list as a configuration error")
	void shouldValidateInputList() {
		ParsedConfiguration arguments = merge();
		arguments.wordlistsFile = tempDir.resolve("missing.txt").toString();
		arguments.outputWordlist = tempDir.resolve("out.txt").toString();

		assertThatThrownBy(() -> resolver.resolve(arguments, null))
			.isInstanceOfSatisfying(MergeException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFIGURATION))
			.hasMessageContaining("Input file list not found");
	}

}
