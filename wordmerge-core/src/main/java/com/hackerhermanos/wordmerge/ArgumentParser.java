package com.hackerhermanos.wordmerge;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the wordmerge application. Pure Java implementation
 * with no framework dependencies.
 */
public class ArgumentParser {

	private static final List<String> COMMANDS = List.of(ParsedConfiguration.MERGE,
			ParsedConfiguration.GENERATE_CONFIG, ParsedConfiguration.GUIDED_SETUP, ParsedConfiguration.RESUME);

	private static final List<String> LOG_LEVELS = List.of("trace", "debug", "info", "warn", "error", "off");

	private final MergeProperties defaultProperties;

	public ArgumentParser(MergeProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-w", "--wordlists-file":
					config.wordlistsFile = getRequiredValue(args, i, "wordlists-file");
					i++; // Skip next argument since we consumed it
					break;

				case "-r", "--rules-file":
					config.rulesFile = getRequiredValue(args, i, "rules-file");
					i++;
					break;

				case "--output-wordlist":
					config.outputWordlist = getRequiredValue(args, i, "output-wordlist");
					i++;
					break;

				case "--output-rules":
					config.outputRules = getRequiredValue(args, i, "output-rules");
					i++;
					break;

				case "-c", "--config":
					config.configFile = getRequiredValue(args, i, "config");
					i++;
					break;

				case "--progress-file":
					config.progressFile = getRequiredValue(args, i, "progress-file");
					i++;
					break;

				case "-e", "--encoding":
					config.encoding = getRequiredValue(args, i, "encoding");
					i++;
					break;

				case "-t", "--threads", "--template":
					// -t means --template for generate-config and --threads everywhere else
					if ("--template".equals(arg)
							|| ("-t".equals(arg) && ParsedConfiguration.GENERATE_CONFIG.equals(config.command))) {
						config.template = true;
						break;
					}
					String threadsStr = getRequiredValue(args, i, "threads");
					try {
						config.threads = Integer.parseInt(threadsStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid thread count '" + threadsStr + "': must be a positive integer");
					}
					i++;
					break;

				case "-d", "--debug":
					config.debug = true;
					break;

				case "-v", "--verbose":
					config.verbosity++;
					break;

				case "--log-level":
					String level = getRequiredValue(args, i, "log-level").toLowerCase();
					if (!LOG_LEVELS.contains(level)) {
						throw new IllegalArgumentException(
								"Invalid log level '" + level + "': must be one of " + String.join(", ", LOG_LEVELS));
					}
					config.logLevel = level;
					i++;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.matches("-v{2,}")) {
						config.verbosity += arg.length() - 1;
					}
					else if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					else if (config.command == null) {
						if (!COMMANDS.contains(arg)) {
							throw new IllegalArgumentException(
									"Unknown command '" + arg + "': must be one of " + String.join(", ", COMMANDS));
						}
						config.command = arg;
					}
					else if (config.targetFile == null) {
						config.targetFile = arg;
					}
					else {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					break;
			}
		}

		// Validate configuration
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		if (args.length == 0) {
			return true;
		}
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: wordmerge [GLOBAL OPTIONS] COMMAND [OPTIONS]\n");
		help.append("\n");
		help.append("Merge wordlists or rule files into one deduplicated file.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    merge                      Merge the files listed in an input list\n");
		help.append("    generate-config FILE       Write a JSON configuration file\n");
		help.append("    guided-setup FILE          Create a configuration file interactively\n");
		help.append("    resume CHECKPOINT          Continue an interrupted merge\n");
		help.append("\n");
		help.append("GLOBAL OPTIONS:\n");
		help.append("    -h, --help                 Show this help message\n");
		help.append("    -v, --verbose              Increase logging (repeat for more)\n");
		help.append("    --log-level LEVEL          trace, debug, info, warn, error, off\n");
		help.append("\n");
		help.append("MERGE OPTIONS:\n");
		help.append("    -w, --wordlists-file FILE  File listing the wordlists to merge\n");
		help.append("    -r, --rules-file FILE      File listing the rule files to merge\n");
		help.append("    --output-wordlist FILE     Merged wordlist output\n");
		help.append("    --output-rules FILE        Merged rules output\n");
		help.append("    -c, --config FILE          Load settings from a configuration file\n");
		help.append("    --progress-file FILE       Checkpoint file (default: <output>.checkpoint.json)\n");
		help.append("    -t, --threads N            Worker threads, 1-100 (default: ")
			.append(defaultProperties.getDefaultThreads())
			.append(")\n");
		help.append("    -e, --encoding SPEC        auto, wordlist, a charset, or a comma-separated list\n");
		help.append("                               (default: auto)\n");
		help.append("    -d, --debug                Enable debug logging\n");
		help.append("\n");
		help.append("GENERATE-CONFIG OPTIONS:\n");
		help.append("    -t, --template             Write the default template\n");
		help.append("\n");
		help.append("CONFIGURATION:\n");
		help.append("    Command-line arguments take precedence over the configuration file.\n");
		help.append("    Per-file errors are appended to ")
			.append(defaultProperties.getErrorLogFile())
			.append(".\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    wordmerge merge -w lists.txt --output-wordlist merged.txt\n");
		help.append("    wordmerge merge -r rules.txt --output-rules merged.rule -t 4\n");
		help.append("    wordmerge merge -c config.json -e utf-8,windows-1252\n");
		help.append("    wordmerge generate-config config.json --template\n");
		help.append("    wordmerge guided-setup config.json\n");
		help.append("    wordmerge resume merged.txt.checkpoint.json\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("No command given: use one of " + String.join(", ", COMMANDS));
		}
		else if (!ParsedConfiguration.MERGE.equals(config.command) && config.targetFile == null) {
			errors.add("Command '" + config.command + "' requires a file argument");
		}
		else if (ParsedConfiguration.MERGE.equals(config.command) && config.targetFile != null) {
			errors.add("Unexpected argument for merge: " + config.targetFile);
		}

		if (config.threads != null && (config.threads < 1 || config.threads > MergeRequest.MAX_THREADS)) {
			errors.add("Invalid thread count " + config.threads + ": must be between 1 and " + MergeRequest.MAX_THREADS);
		}

		if (config.encoding != null && config.encoding.isBlank()) {
			errors.add("Encoding cannot be empty");
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration errors: " + String.join(", ", errors));
		}
	}

}
