package org.springaicommunity.jira.corpus.cli;

import org.springaicommunity.jira.corpus.CorpusProperties;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Command-line argument parser for the {@code scrape} and {@code transform} commands.
 */
public class ArgumentParser {

	private static final Set<String> SCRAPE_OPTIONS = Set.of("--projects", "--start-date", "--max-issues");

	private static final Set<String> TRANSFORM_OPTIONS = Set.of("--projects", "--output", "--input-dir");

	private final CorpusProperties defaultProperties;

	public ArgumentParser(CorpusProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments.
	 * @param args Command-line arguments, command first
	 * @return Parsed command
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedCommand parseAndValidate(String[] args) {
		if (args.length == 0) {
			throw new IllegalArgumentException("Missing command: expected 'scrape' or 'transform'");
		}

		String command = args[0];
		Set<String> allowed = switch (command) {
			case ParsedCommand.SCRAPE -> SCRAPE_OPTIONS;
			case ParsedCommand.TRANSFORM -> TRANSFORM_OPTIONS;
			default -> throw new IllegalArgumentException(
					"Unknown command '" + command + "': expected 'scrape' or 'transform'");
		};

		ParsedCommand parsed = new ParsedCommand(command, defaultProperties.getCorpusOutput(),
				defaultProperties.getRawDir());

		for (int i = 1; i < args.length; i++) {
			String arg = args[i];
			if (!allowed.contains(arg)) {
				throw new IllegalArgumentException("Unknown option '" + arg + "' for " + command);
			}

			switch (arg) {
				case "--projects":
					// Accepts "--projects A,B" as well as "--projects A B"
					int first = i + 1;
					while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
						parsed.projects.addAll(EnvironmentConfiguration.splitList(args[i + 1]));
						i++;
					}
					if (i < first || parsed.projects.isEmpty()) {
						throw new IllegalArgumentException("Missing value for projects option");
					}
					break;

				case "--start-date":
					String startDate = getRequiredValue(args, i, "start-date");
					try {
						parsed.startDate = LocalDate.parse(startDate);
					}
					catch (DateTimeParseException e) {
						throw new IllegalArgumentException(
								"Invalid start date '" + startDate + "': expected format YYYY-MM-DD");
					}
					i++; // Skip next argument since we consumed it
					break;

				case "--max-issues":
					String maxIssues = getRequiredValue(args, i, "max-issues");
					try {
						parsed.maxIssues = Integer.parseInt(maxIssues);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid max issues '" + maxIssues + "': must be a positive integer");
					}
					if (parsed.maxIssues <= 0) {
						throw new IllegalArgumentException("Max issues must be positive: " + parsed.maxIssues);
					}
					i++; // Skip next argument since we consumed it
					break;

				case "--output":
					parsed.outputPath = getRequiredValue(args, i, "output");
					i++; // Skip next argument since we consumed it
					break;

				case "--input-dir":
					parsed.inputDir = getRequiredValue(args, i, "input-dir");
					i++; // Skip next argument since we consumed it
					break;

				default:
					throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}

		return parsed;
	}

	/**
	 * Check if help was requested.
	 */
	public boolean isHelpRequested(String[] args) {
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
		help.append("Usage: jira-corpus <command> [OPTIONS]\n");
		help.append("\n");
		help.append("Ingest Apache Jira issues and build a JSON Lines training corpus.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    scrape                  Fetch new and updated issues into the raw store\n");
		help.append("    transform               Build the corpus from the raw store\n");
		help.append("\n");
		help.append("SCRAPE OPTIONS:\n");
		help.append("    --projects P1,P2        Project keys, comma or space separated (default: ")
			.append(String.join(",", defaultProperties.getDefaultProjects()))
			.append(")\n");
		help.append("    --start-date DATE       Ignore issues updated before DATE (YYYY-MM-DD)\n");
		help.append("    --max-issues N          Examine at most N search results per project (default: unlimited)\n");
		help.append("\n");
		help.append("TRANSFORM OPTIONS:\n");
		help.append("    --output PATH           Corpus file (default: ").append(defaultProperties.getCorpusOutput()).append(")\n");
		help.append("    --input-dir DIR         Raw record directory (default: ").append(defaultProperties.getRawDir()).append(")\n");
		help.append("    --projects P1,P2        Only include these projects (default: all)\n");
		help.append("\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES (also read from .env):\n");
		help.append("    JIRA_BASE_URL           Jira instance (default: ").append(defaultProperties.getBaseUrl()).append(")\n");
		help.append("    JIRA_PROJECTS           Default project keys\n");
		help.append("    JIRA_PAGE_SIZE          Search page size\n");
		help.append("    REQUEST_DELAY_MS        Delay between requests\n");
		help.append("    RETRY_MAX_ATTEMPTS      Attempts per request\n");
		help.append("    RETRY_BASE_DELAY_MS     Base backoff delay\n");
		help.append("    RETRY_MAX_DELAY_MS      Maximum backoff delay\n");
		help.append("    CONNECT_TIMEOUT_SECONDS, REQUEST_TIMEOUT_SECONDS  HTTP timeouts\n");
		help.append("    RAW_DIR, STATE_DIR      Raw record and checkpoint directories\n");
		help.append("    CORPUS_OUTPUT           Default corpus file\n");
		help.append("    CHECKPOINT_INTERVAL     Stored issues between checkpoint flushes\n");
		help.append("    VALIDATION_STRICT_MODE  Abort a project on the first invalid issue\n");
		help.append("    JIRA_QUERY_ZONE         Time zone of the JQL date bound\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    jira-corpus scrape --projects KAFKA,SPARK --start-date 2024-01-01\n");
		help.append("    jira-corpus scrape --projects HADOOP --max-issues 200\n");
		help.append("    jira-corpus transform --output data/corpus/kafka.jsonl --projects KAFKA\n");
		help.append("\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length || args[currentIndex + 1].startsWith("--")) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

}
