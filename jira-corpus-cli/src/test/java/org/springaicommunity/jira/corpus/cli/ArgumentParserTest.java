package org.springaicommunity.jira.corpus.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springaicommunity.jira.corpus.CorpusProperties;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only.
 */
@DisplayName("ArgumentParser Tests")
class ArgumentParserTest {

	private CorpusProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new CorpusProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Scrape Command Tests")
	class ScrapeCommandTest {

		@Test
		@DisplayName("Should parse comma separated projects")
		void shouldParseCommaSeparatedProjects() {
			ParsedCommand command = argumentParser.parseAndValidate(new String[] { "scrape", "--projects", "KAFKA,SPARK" });

			assertThat(command.command).isEqualTo(ParsedCommand.SCRAPE);
			assertThat(command.projects).containsExactly("KAFKA", "SPARK");
		}

		@Test
		@DisplayName("Should parse space separated projects")
		void shouldParseSpaceSeparatedProjects() {
			ParsedCommand command = argumentParser
				.parseAndValidate(new String[] { "scrape", "--projects", "KAFKA", "SPARK", "--max-issues", "5" });

			assertThat(command.projects).containsExactly("KAFKA", "SPARK");
			assertThat(command.maxIssues).isEqualTo(5);
		}

		@Test
		@DisplayName("Should parse start date")
		void shouldParseStartDate() {
			ParsedCommand command = argumentParser
				.parseAndValidate(new String[] { "scrape", "--start-date", "2024-01-15" });

			assertThat(command.startDate).isEqualTo(LocalDate.of(2024, 1, 15));
		}

		@Test
		@DisplayName("Should use default values for unparsed arguments")
		void shouldUseDefaultValues() {
			ParsedCommand command = argumentParser.parseAndValidate(new String[] { "scrape" });

			assertThat(command.projects).isEmpty();
			assertThat(command.startDate).isNull();
			assertThat(command.maxIssues).isNull();
		}

		@ParameterizedTest
		@ValueSource(strings = { "2024/01/15", "15-01-2024", "yesterday", "2024-13-01" })
		@DisplayName("Should reject invalid start dates")
		void shouldRejectInvalidStartDates(String date) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "scrape", "--start-date", date }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid start date");
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-5" })
		@DisplayName("Should reject non-positive max issues")
		void shouldRejectNonPositiveMaxIssues(String value) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "scrape", "--max-issues", value }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must be positive");
		}

		@Test
		@DisplayName("Should reject non-numeric max issues")
		void shouldRejectNonNumericMaxIssues() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "scrape", "--max-issues", "many" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("positive integer");
		}

		@Test
		@DisplayName("Should reject transform options")
		void shouldRejectTransformOptions() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "scrape", "--output", "x.jsonl" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown option '--output' for scrape");
		}

	}

	@Nested
	@DisplayName("Transform Command Tests")
	class TransformCommandTest {

		@Test
		@DisplayName("Should default paths from properties")
		void shouldDefaultPaths() {
			ParsedCommand command = argumentParser.parseAndValidate(new String[] { "transform" });

			assertThat(command.command).isEqualTo(ParsedCommand.TRANSFORM);
			assertThat(command.outputPath).isEqualTo(defaultProperties.getCorpusOutput());
			assertThat(command.inputDir).isEqualTo(defaultProperties.getRawDir());
		}

		@Test
		@DisplayName("Should parse output, input directory and projects")
		void shouldParseOptions() {
			ParsedCommand command = argumentParser.parseAndValidate(new String[] { "transform", "--output",
					"out/corpus.jsonl", "--input-dir", "raw", "--projects", "HIVE" });

			assertThat(command.outputPath).isEqualTo("out/corpus.jsonl");
			assertThat(command.inputDir).isEqualTo("raw");
			assertThat(command.projects).containsExactly("HIVE");
		}

		@Test
		@DisplayName("Should reject scrape options")
		void shouldRejectScrapeOptions() {
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "transform", "--start-date", "2024-01-01" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown option");
		}

	}

	@Nested
	@DisplayName("Error Handling Tests")
	class ErrorHandlingTest {

		@Test
		@DisplayName("Should require a command")
		void shouldRequireCommand() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[0]))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing command");
		}

		@Test
		@DisplayName("Should reject unknown commands")
		void shouldRejectUnknownCommands() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "collect" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown command 'collect'");
		}

		@Test
		@DisplayName("Should require option values")
		void shouldRequireOptionValues() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "transform", "--output" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing value for output option");
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "scrape", "--projects", "--max-issues", "3" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing value for projects option");
		}

	}

	@Nested
	@DisplayName("Help Tests")
	class HelpTest {

		@Test
		@DisplayName("Should detect help flags anywhere")
		void shouldDetectHelpFlags() {
			assertThat(argumentParser.isHelpRequested(new String[] { "--help" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "scrape", "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "scrape" })).isFalse();
		}

		@Test
		@DisplayName("Should describe commands and defaults")
		void shouldDescribeCommands() {
			String help = argumentParser.generateHelpText();

			assertThat(help).contains("scrape", "transform", "--projects", "--start-date", "--max-issues", "--output",
					"--input-dir", "HADOOP,SPARK,KAFKA", defaultProperties.getCorpusOutput());
		}

	}

}
