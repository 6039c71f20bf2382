package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives a {@link CorpusEntry} and its training tasks from a validated issue.
 *
 * <p>
 * Tasks:
 * <ul>
 * <li>summarization: description plus the first comments, summarized as
 * {@code "<title> - <status>: <resolution>"}</li>
 * <li>classification: title and description, labelled
 * {@code "Type: T | Priority: P | Status: S | Resolution: R"}</li>
 * <li>qa: a templated question about the title, answered from resolution comments</li>
 * </ul>
 */
public class CorpusTaskBuilder {

	static final int MAX_INPUT_LENGTH = 2000;

	static final int MAX_ANSWER_LENGTH = 1000;

	static final int SUMMARIZATION_COMMENTS = 5;

	static final String NO_RESOLUTION_ANSWER = "The issue status and resolution details are not available.";

	private final IssueTypeClassifier typeClassifier;

	private final ResolutionExtractor resolutionExtractor;

	public CorpusTaskBuilder(IssueTypeClassifier typeClassifier, ResolutionExtractor resolutionExtractor) {
		this.typeClassifier = typeClassifier;
		this.resolutionExtractor = resolutionExtractor;
	}

	public CorpusEntry build(Issue issue) {
		String description = TextNormalizer.normalize(issue.description());

		List<CorpusComment> comments = issue.comments()
			.stream()
			.map(c -> new CorpusComment(c.author(), TextNormalizer.normalize(c.body()), c.created()))
			.collect(Collectors.toList());

		CorpusMetadata metadata = new CorpusMetadata(issue.key(), issue.project(), issue.title(), issue.status(),
				issue.priority(), issue.issueType(), issue.reporter(), issue.created(), issue.updated(),
				issue.assignee(), issue.resolution());

		CorpusTasks tasks = new CorpusTasks(summarization(issue, description, comments),
				classification(issue, description), qa(issue, description));

		return new CorpusEntry(metadata, description, comments, tasks);
	}

	TextTask summarization(Issue issue, String description, List<CorpusComment> comments) {
		String input = description;
		if (!comments.isEmpty()) {
			String commentText = comments.stream()
				.limit(SUMMARIZATION_COMMENTS)
				.map(CorpusComment::body)
				.collect(Collectors.joining("\n\n"));
			input = (description + "\n\nComments:\n" + commentText).trim();
		}

		String output = issue.title() + " - " + issue.status() + ": " + orEmpty(issue.resolution());
		return new TextTask("summarization", TextNormalizer.truncate(input, MAX_INPUT_LENGTH), output);
	}

	TextTask classification(Issue issue, String description) {
		String input = ("Title: " + issue.title() + "\n\nDescription: " + description).trim();

		List<String> labels = new ArrayList<>();
		addLabel(labels, "Type", typeClassifier.classify(issue));
		addLabel(labels, "Priority", issue.priority());
		addLabel(labels, "Status", issue.status());
		addLabel(labels, "Resolution", orEmpty(issue.resolution()));
		String output = labels.isEmpty() ? "Unclassified" : String.join(" | ", labels);

		return new TextTask("classification", TextNormalizer.truncate(input, MAX_INPUT_LENGTH), output);
	}

	QaTask qa(Issue issue, String description) {
		String question = "What is the issue with '" + issue.title() + "' and how was it resolved?";

		String context = "Title: " + issue.title();
		if (!description.isEmpty()) {
			context += "\n\nDescription: " + description;
		}

		String answer = resolutionExtractor.extractAnswer(issue).orElseGet(() -> fallbackAnswer(issue));

		return new QaTask("qa", question, TextNormalizer.truncate(context, MAX_INPUT_LENGTH),
				TextNormalizer.truncate(answer, MAX_ANSWER_LENGTH));
	}

	private static String fallbackAnswer(Issue issue) {
		String resolution = orEmpty(issue.resolution());
		return resolution.isBlank() ? NO_RESOLUTION_ANSWER : "The issue was resolved as: " + resolution;
	}

	private static void addLabel(List<String> labels, String name, String value) {
		if (!value.isBlank()) {
			labels.add(name + ": " + value);
		}
	}

	private static String orEmpty(@Nullable String value) {
		return value == null ? "" : value;
	}

}
