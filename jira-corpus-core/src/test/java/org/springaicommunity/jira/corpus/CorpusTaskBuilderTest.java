package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CorpusTaskBuilder}.
 */
@DisplayName("CorpusTaskBuilder Tests")
class CorpusTaskBuilderTest {

	private final CorpusTaskBuilder builder = new CorpusTaskBuilder(new KeywordIssueTypeClassifier(),
			new KeywordResolutionExtractor());

	private static Issue bareIssue(String description) {
		Instant created = Instant.parse("2024-01-01T00:00:00Z");
		return new Issue("HADOOP-1", "HADOOP", "Bare", description, "", "", "", "Unknown", null, created, created, null,
				null, List.of());
	}

	@Nested
	@DisplayName("Entry Tests")
	class EntryTest {

		@Test
		@DisplayName("Should emit an empty description when the issue has none")
		void shouldDefaultDescription() {
			CorpusEntry entry = builder.build(TestIssues.issue("KAFKA-1", "Title", null, List.of()));

			assertThat(entry.description()).isEmpty();
			assertThat(entry.tasks().summarization().input()).isEmpty();
		}

		@Test
		@DisplayName("Should normalize whitespace in description and comments")
		void shouldNormalizeWhitespace() {
			CorpusEntry entry = builder.build(TestIssues.issue("KAFKA-1", "Title", "  line one\r\n\tline   two ",
					List.of(TestIssues.comment("1", "a\n\nb", "2024-01-11T00:00:00Z"))));

			assertThat(entry.description()).isEqualTo("line one line two");
			assertThat(entry.comments().get(0).body()).isEqualTo("a b");
			assertThat(entry.comments().get(0).author()).isEqualTo("Commenter 1");
		}

		@Test
		@DisplayName("Should carry metadata and omit absent optional fields in JSON")
		void shouldSerializeMetadata() throws Exception {
			CorpusEntry entry = builder.build(bareIssue("text"));

			JsonNode json = TestIssues.MAPPER.valueToTree(entry);

			JsonNode metadata = json.path("metadata");
			assertThat(metadata.path("issue_key").asText()).isEqualTo("HADOOP-1");
			assertThat(metadata.path("project").asText()).isEqualTo("HADOOP");
			assertThat(metadata.path("created").asText()).isEqualTo("2024-01-01T00:00:00Z");
			assertThat(metadata.has("assignee")).isFalse();
			assertThat(metadata.has("resolution")).isFalse();
			assertThat(json.path("tasks").fieldNames()).toIterable()
				.containsExactly("summarization", "classification", "qa");
		}

		@Test
		@DisplayName("Should include assignee and resolution when present")
		void shouldIncludeOptionalMetadata() {
			CorpusEntry entry = builder.build(TestIssues.issue("KAFKA-1", "Title", "Body", List.of()));

			assertThat(entry.metadata().assignee()).isEqualTo("Bob Builder");
			assertThat(entry.metadata().resolution()).isEqualTo("Fixed");
		}

	}

	@Nested
	@DisplayName("Summarization Tests")
	class SummarizationTest {

		@Test
		@DisplayName("Should combine description with the first five comments")
		void shouldCombineDescriptionAndComments() {
			List<Comment> comments = new ArrayList<>();
			for (int i = 1; i <= 7; i++) {
				comments.add(TestIssues.comment(String.valueOf(i), "comment " + i, "2024-01-1" + i + "T00:00:00Z"));
			}

			TextTask task = builder.build(TestIssues.issue("KAFKA-1", "Title", "The description", comments))
				.tasks()
				.summarization();

			assertThat(task.task()).isEqualTo("summarization");
			assertThat(task.input()).startsWith("The description\n\nComments:\ncomment 1\n\ncomment 2")
				.contains("comment 5")
				.doesNotContain("comment 6");
		}

		@Test
		@DisplayName("Should summarize as title, status and resolution")
		void shouldFormatOutput() {
			TextTask task = builder.build(TestIssues.issue("KAFKA-1", "Consumer hangs", "Body", List.of()))
				.tasks()
				.summarization();

			assertThat(task.output()).isEqualTo("Consumer hangs - Resolved: Fixed");
		}

		@Test
		@DisplayName("Should keep the separator when unresolved")
		void shouldFormatOutputWithoutResolution() {
			TextTask task = builder.build(bareIssue("text")).tasks().summarization();

			assertThat(task.output()).isEqualTo("Bare - : ");
		}

		@Test
		@DisplayName("Should limit the input to 2000 characters")
		void shouldTruncateInput() {
			TextTask task = builder.build(TestIssues.issue("KAFKA-1", "Title", "x".repeat(5000), List.of()))
				.tasks()
				.summarization();

			assertThat(task.input()).hasSize(CorpusTaskBuilder.MAX_INPUT_LENGTH);
		}

	}

	@Nested
	@DisplayName("Classification Tests")
	class ClassificationTest {

		@Test
		@DisplayName("Should label type, priority, status and resolution")
		void shouldLabelAllParts() {
			TextTask task = builder.build(TestIssues.issue("KAFKA-1", "Title", "Body", List.of()))
				.tasks()
				.classification();

			assertThat(task.input()).isEqualTo("Title: Title\n\nDescription: Body");
			assertThat(task.output()).isEqualTo("Type: Bug | Priority: Major | Status: Resolved | Resolution: Fixed");
		}

		@Test
		@DisplayName("Should omit empty parts")
		void shouldOmitEmptyParts() {
			TextTask task = builder.build(bareIssue("Add support for Kerberos")).tasks().classification();

			assertThat(task.output()).isEqualTo("Type: New Feature");
		}

		@Test
		@DisplayName("Should fall back to Unclassified when every part is empty")
		void shouldFallBackToUnclassified() {
			CorpusTaskBuilder noType = new CorpusTaskBuilder(issue -> "", new KeywordResolutionExtractor());

			TextTask task = noType.build(bareIssue("text")).tasks().classification();

			assertThat(task.output()).isEqualTo("Unclassified");
		}

	}

	@Nested
	@DisplayName("Q&A Tests")
	class QaTest {

		@Test
		@DisplayName("Should template the question from the title")
		void shouldTemplateQuestion() {
			QaTask task = builder.build(TestIssues.issue("KAFKA-1", "Consumer hangs", "Body", List.of())).tasks().qa();

			assertThat(task.task()).isEqualTo("qa");
			assertThat(task.question()).isEqualTo("What is the issue with 'Consumer hangs' and how was it resolved?");
			assertThat(task.context()).isEqualTo("Title: Consumer hangs\n\nDescription: Body");
		}

		@Test
		@DisplayName("Should answer from resolution comments")
		void shouldAnswerFromComments() {
			Issue issue = TestIssues.issue("KAFKA-1", "Title", "Body",
					List.of(TestIssues.comment("1", "Can reproduce", "2024-01-11T00:00:00Z"),
							TestIssues.comment("2", "Patch attached, the cause was a race", "2024-01-12T00:00:00Z")));

			QaTask task = builder.build(issue).tasks().qa();

			assertThat(task.answer()).isEqualTo("Patch attached, the cause was a race");
		}

		@Test
		@DisplayName("Should fall back to the resolution name")
		void shouldFallBackToResolution() {
			QaTask task = builder.build(TestIssues.issue("KAFKA-1", "Title", "Body", List.of())).tasks().qa();

			assertThat(task.answer()).isEqualTo("The issue was resolved as: Fixed");
		}

		@Test
		@DisplayName("Should use a placeholder without comments or resolution")
		void shouldUsePlaceholder() {
			QaTask task = builder.build(bareIssue("")).tasks().qa();

			assertThat(task.answer()).isEqualTo(CorpusTaskBuilder.NO_RESOLUTION_ANSWER);
			assertThat(task.context()).isEqualTo("Title: Bare");
		}

		@Test
		@DisplayName("Should limit the answer to 1000 characters")
		void shouldTruncateAnswer() {
			CorpusTaskBuilder verbose = new CorpusTaskBuilder(new KeywordIssueTypeClassifier(),
					issue -> Optional.of("y".repeat(3000)));

			QaTask task = verbose.build(bareIssue("")).tasks().qa();

			assertThat(task.answer()).hasSize(CorpusTaskBuilder.MAX_ANSWER_LENGTH);
		}

	}

}
