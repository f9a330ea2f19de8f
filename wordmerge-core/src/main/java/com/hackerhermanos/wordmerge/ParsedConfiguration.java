package com.hackerhermanos.wordmerge;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	public static final String MERGE = "merge";

	public static final String GENERATE_CONFIG = "generate-config";

	public static final String GUIDED_SETUP = "guided-setup";

	public static final String RESUME = "resume";

	// Subcommand, null when only help was requested
	public String command;

	// Positional file of generate-config, guided-setup and resume
	public String targetFile;

	// Merge inputs and outputs
	public String wordlistsFile;

	public String rulesFile;

	public String outputWordlist;

	public String outputRules;

	public String configFile;

	public String progressFile;

	public Integer threads; // null = config or default

	public String encoding; // null = config or auto

	// Mode flags
	public boolean debug = false;

	public boolean template = false;

	public boolean helpRequested = false;

	// Global logging options
	public int verbosity = 0;

	public String logLevel;

}
