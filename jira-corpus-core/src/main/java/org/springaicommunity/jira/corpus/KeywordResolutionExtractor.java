package org.springaicommunity.jira.corpus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Default {@link ResolutionExtractor}.
 *
 * <p>
 * Selects comments mentioning a fix, patch, cause, pull request, solution or resolution,
 * newest first, and joins the first {@value #MAX_COMMENTS} with blank lines.
 */
public class KeywordResolutionExtractor implements ResolutionExtractor {

	static final int MAX_COMMENTS = 2;

	private static final Pattern RESOLUTION_KEYWORDS = Pattern.compile(
			"\\b(?:fix\\w*|patch\\w*|cause\\w*|pr|pull request\\w*|solution\\w*|resolved)\\b",
			Pattern.CASE_INSENSITIVE);

	@Override
	public Optional<String> extractAnswer(Issue issue) {
		List<Comment> candidates = issue.comments()
			.stream()
			.filter(comment -> isResolutionComment(comment.body()))
			.sorted(Comparator.comparing(Comment::created,
					Comparator.<Instant>nullsLast(Comparator.<Instant>reverseOrder())))
			.limit(MAX_COMMENTS)
			.collect(Collectors.toList());

		String answer = candidates.stream()
			.map(comment -> TextNormalizer.normalize(comment.body()))
			.filter(body -> !body.isEmpty())
			.collect(Collectors.joining("\n\n"));
		return answer.isEmpty() ? Optional.empty() : Optional.of(answer);
	}

	static boolean isResolutionComment(String body) {
		return RESOLUTION_KEYWORDS.matcher(body).find();
	}

}
