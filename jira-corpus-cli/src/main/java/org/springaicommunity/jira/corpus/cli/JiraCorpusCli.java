package org.springaicommunity.jira.corpus.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.jira.corpus.CorpusProperties;
import org.springaicommunity.jira.corpus.IngestionRequest;
import org.springaicommunity.jira.corpus.IngestionResult;
import org.springaicommunity.jira.corpus.JiraCorpusBuilder;
import org.springaicommunity.jira.corpus.ProjectIngestionResult;

import java.nio.file.Path;

/**
 * Jira Corpus CLI Application
 *
 * Plain Java command-line application that ingests Apache Jira issues into a raw record
 * store and transforms them into a JSON Lines corpus. Uses JiraCorpusBuilder for service
 * wiring.
 *
 * Usage: java -jar jira-corpus-cli.jar scrape|transform [OPTIONS]
 *
 * Exit codes: 0 success, 1 failure, 2 usage error.
 */
public class JiraCorpusCli {

	private static final Logger logger = LoggerFactory.getLogger(JiraCorpusCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		int exitCode;
		try {
			exitCode = run(args);
		}
		catch (Exception e) {
			logger.error("Command failed: {}", e.getMessage(), e);
			exitCode = EXIT_FAILURE;
		}
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		CorpusProperties properties;
		try {
			properties = new EnvironmentConfiguration().load();
		}
		catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		}
		return run(args, properties, JiraCorpusBuilder.create());
	}

	/**
	 * Run with explicit configuration and wiring.
	 * @param args command-line arguments
	 * @param properties configuration (defaults for options not given on the command line)
	 * @param builder builder used to create services; its properties are replaced
	 * @return process exit code
	 */
	static int run(String[] args, CorpusProperties properties, JiraCorpusBuilder builder) {
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedCommand command;
		try {
			command = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			System.err.println();
			System.err.println(argumentParser.generateHelpText());
			return EXIT_USAGE;
		}

		builder.properties(properties);
		try {
			if (ParsedCommand.SCRAPE.equals(command.command)) {
				return scrape(command, builder);
			}
			return transform(command, builder);
		}
		catch (RuntimeException e) {
			logger.error("{} failed: {}", command.command, e.getMessage(), e);
			return EXIT_FAILURE;
		}
	}

	private static int scrape(ParsedCommand command, JiraCorpusBuilder builder) {
		logger.info("Configuration:");
		logger.info("  Projects: {}", command.projects.isEmpty() ? "(defaults)" : command.projects);
		logger.info("  Start date: {}", command.startDate != null ? command.startDate : "(not set)");
		logger.info("  Max issues: {}", command.maxIssues != null ? command.maxIssues : "unlimited");

		IngestionRequest request = new IngestionRequest(command.projects, command.startDate, command.maxIssues);
		IngestionResult result = builder.buildIngestionService().ingest(request);

		logger.info("Scrape completed: {} issues stored", result.totalStored());
		for (ProjectIngestionResult project : result.projects()) {
			logger.info("  {}: examined={}, stored={}, duplicates={}, invalid={}, failedFetches={}, watermark={}{}",
					project.project(), project.examined(), project.stored(), project.duplicatesSkipped(),
					project.invalidSkipped(), project.failedFetches(), project.watermark(),
					project.aborted() ? " ABORTED: " + project.abortReason() : "");
		}
		return result.hasAbortedProjects() ? EXIT_FAILURE : EXIT_OK;
	}

	private static int transform(ParsedCommand command, JiraCorpusBuilder builder) {
		logger.info("Configuration:");
		logger.info("  Input directory: {}", command.inputDir);
		logger.info("  Output: {}", command.outputPath);
		logger.info("  Projects: {}", command.projects.isEmpty() ? "(all)" : command.projects);

		int written = builder.buildTransformPipeline()
			.transform(Path.of(command.inputDir), Path.of(command.outputPath), command.projects);

		logger.info("Transform completed: {} corpus entries written to {}", written, command.outputPath);
		return EXIT_OK;
	}

}
