package com.hackerhermanos.wordmerge.cli;

import com.hackerhermanos.wordmerge.ArgumentParser;
import com.hackerhermanos.wordmerge.ConfigValidator;
import com.hackerhermanos.wordmerge.EncodingStrategy;
import com.hackerhermanos.wordmerge.LoggingMergeListener;
import com.hackerhermanos.wordmerge.MergeConfig;
import com.hackerhermanos.wordmerge.MergeConfigRepository;
import com.hackerhermanos.wordmerge.MergeException;
import com.hackerhermanos.wordmerge.MergeProperties;
import com.hackerhermanos.wordmerge.MergeRequest;
import com.hackerhermanos.wordmerge.MergeRequestResolver;
import com.hackerhermanos.wordmerge.MergeResult;
import com.hackerhermanos.wordmerge.MergeRun;
import com.hackerhermanos.wordmerge.MergeService;
import com.hackerhermanos.wordmerge.ParsedConfiguration;
import com.hackerhermanos.wordmerge.WordMergeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Wordmerge CLI Application
 *
 * Plain Java command-line application that merges wordlists or rule files into one
 * deduplicated output. Uses WordMergeBuilder for service wiring.
 *
 * Usage: java -jar wordmerge-cli.jar [GLOBAL OPTIONS] COMMAND [OPTIONS]
 *
 * Exit codes: 0 success, 1 merge failure, 2 usage error, 130 interrupted.
 */
public class WordMergeCli {

	private static final Logger logger = LoggerFactory.getLogger(WordMergeCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	static final int EXIT_INTERRUPTED = 130;

	public static void main(String[] args) {
		try {
			int exitCode = run(args, System.in, System.out);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Merge failed: {}", e.getMessage(), e);
			System.exit(EXIT_FAILURE);
		}
	}

	public static int run(String[] args) {
		return run(args, System.in, System.out);
	}

	static int run(String[] args, InputStream in, PrintStream out) {
		MergeProperties properties = new MergeProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			out.println("Use --help for usage");
			return EXIT_USAGE;
		}

		LogLevelConfigurer.apply(config.logLevel, config.verbosity, config.debug);
		WordMergeBuilder builder = WordMergeBuilder.create()
			.properties(properties)
			.listener(new LoggingMergeListener());

		try {
			return switch (config.command) {
				case ParsedConfiguration.GENERATE_CONFIG -> generateConfig(builder, config);
				case ParsedConfiguration.GUIDED_SETUP -> guidedSetup(builder, config, in, out);
				case ParsedConfiguration.RESUME -> resume(builder, properties, config);
				default -> merge(builder, properties, config);
			};
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			out.println("Use --help for usage");
			return EXIT_USAGE;
		}
		catch (MergeException e) {
			logger.error("Merge failed: {}", e.getMessage());
			if (e.getCause() != null) {
				logger.debug("Cause", e.getCause());
			}
			return EXIT_FAILURE;
		}
	}

	private static int merge(WordMergeBuilder builder, MergeProperties properties, ParsedConfiguration config) {
		MergeConfig fileConfig = null;
		if (config.configFile != null) {
			fileConfig = builder.buildConfigRepository().load(Path.of(config.configFile));
			if (fileConfig.isDebug() && config.logLevel == null) {
				LogLevelConfigurer.apply(null, config.verbosity, true);
			}
		}
		MergeRequest request = new MergeRequestResolver(properties, new ConfigValidator()).resolve(config,
				fileConfig);
		logConfiguration(request);
		MergeService service = builder.buildMergeService();
		return execute(service.prepare(request), properties);
	}

	private static int resume(WordMergeBuilder builder, MergeProperties properties, ParsedConfiguration config) {
		EncodingStrategy encoding = config.encoding != null ? EncodingStrategy.parse(config.encoding)
				: EncodingStrategy.autoDetect();
		logger.info("Resuming from checkpoint: {}", config.targetFile);
		MergeRun run = builder.buildMergeService().prepareResume(Path.of(config.targetFile), encoding);
		logConfiguration(run.request());
		return execute(run, properties);
	}

	private static int execute(MergeRun run, MergeProperties properties) {
		run.coordinator().installShutdownHook(Duration.ofSeconds(properties.getShutdownNoticeSeconds()));
		MergeResult result = run.execute();
		logResults(result);
		if (result.interrupted()) {
			logger.warn("Merge interrupted. Continue with: wordmerge resume {}", result.checkpoint());
			return EXIT_INTERRUPTED;
		}
		return EXIT_OK;
	}

	private static int generateConfig(WordMergeBuilder builder, ParsedConfiguration config) {
		MergeConfigRepository repository = builder.buildConfigRepository();
		repository.save(MergeConfig.template(), Path.of(config.targetFile));
		logger.info("Configuration file generated at: {}", config.targetFile);
		return EXIT_OK;
	}

	private static int guidedSetup(WordMergeBuilder builder, ParsedConfiguration config, InputStream in,
			PrintStream out) {
		MergeConfig mergeConfig;
		try {
			mergeConfig = new GuidedSetup(in, out).run();
		}
		catch (IOException e) {
			logger.error("Failed to read guided setup answers: {}", e.getMessage());
			return EXIT_FAILURE;
		}
		builder.buildConfigRepository().save(mergeConfig, Path.of(config.targetFile));
		logger.info("Configuration saved to: {}", config.targetFile);
		return EXIT_OK;
	}

	private static void logConfiguration(MergeRequest request) {
		logger.info("Configuration:");
		logger.info("  Input list: {}", request.inputList());
		logger.info("  Output: {}", request.output());
		logger.info("  Threads: {}", request.threads());
		logger.info("  Encoding: {}", request.encoding());
		logger.info("  Checkpoint: {}", request.checkpoint());
		logger.info("  Resume: {}", request.resume());
	}

	private static void logResults(MergeResult result) {
		logger.info("Merge {}", result.interrupted() ? "stopped early" : "completed successfully!");
		logger.info("Files processed: {}", result.filesCompleted());
		logger.info("Files skipped (already processed): {}", result.filesSkipped());
		logger.info("Files failed: {}", result.filesFailed());
		logger.info("Lines read: {}", result.linesRead());
		logger.info("Unique lines: {}", result.uniqueLines());
		logger.info("Lines written: {}", result.linesWritten());
		logger.info("Output file: {}", result.output());
		logger.info("Elapsed: {} ms", result.elapsed().toMillis());
	}

}
