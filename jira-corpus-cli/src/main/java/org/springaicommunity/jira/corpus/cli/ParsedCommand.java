package org.springaicommunity.jira.corpus.cli;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command result from command-line arguments.
 */
public class ParsedCommand {

	public static final String SCRAPE = "scrape";

	public static final String TRANSFORM = "transform";

	public String command;

	// Both commands
	public List<String> projects = new ArrayList<>(); // empty = configured defaults (scrape) or all (transform)

	// scrape
	@Nullable
	public LocalDate startDate;

	@Nullable
	public Integer maxIssues; // null = unlimited

	// transform
	public String outputPath;

	public String inputDir;

	public ParsedCommand(String command, String outputPath, String inputDir) {
		this.command = command;
		this.outputPath = outputPath;
		this.inputDir = inputDir;
	}

}
