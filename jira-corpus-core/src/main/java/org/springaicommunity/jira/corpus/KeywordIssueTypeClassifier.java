package org.springaicommunity.jira.corpus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Default {@link IssueTypeClassifier}.
 *
 * <p>
 * Keeps the type declared in Jira. Issues without one are matched against keyword groups
 * over title and description, in the order Bug, New Feature, Improvement, Documentation,
 * Test; the first group with a match wins and {@code Task} is used when none matches.
 */
public class KeywordIssueTypeClassifier implements IssueTypeClassifier {

	static final String FALLBACK_TYPE = "Task";

	private static final Map<String, Pattern> KEYWORD_GROUPS = new LinkedHashMap<>();

	static {
		KEYWORD_GROUPS.put("Bug", words("bug", "error", "exception", "crash\\w*", "fail\\w*", "broken", "npe",
				"incorrect", "wrong"));
		KEYWORD_GROUPS.put("New Feature", words("add support", "new feature", "feature request", "support for",
				"implement\\w*", "introduce\\w*"));
		KEYWORD_GROUPS.put("Improvement", words("improve\\w*", "optimi[sz]\\w*", "performance", "refactor\\w*",
				"enhance\\w*", "speed up", "clean ?up"));
		KEYWORD_GROUPS.put("Documentation", words("docs?", "documentation", "javadocs?", "readme", "typos?"));
		KEYWORD_GROUPS.put("Test", words("tests?", "flaky", "unit tests?", "test cases?"));
	}

	@Override
	public String classify(Issue issue) {
		if (!issue.issueType().isBlank()) {
			return issue.issueType();
		}

		String text = issue.title() + " " + (issue.description() != null ? issue.description() : "");
		for (Map.Entry<String, Pattern> group : KEYWORD_GROUPS.entrySet()) {
			if (group.getValue().matcher(text).find()) {
				return group.getKey();
			}
		}
		return FALLBACK_TYPE;
	}

	private static Pattern words(String... alternatives) {
		return Pattern.compile("\\b(?:" + String.join("|", alternatives) + ")\\b", Pattern.CASE_INSENSITIVE);
	}

}
