package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Represents a Jira issue as stored in the raw record store.
 *
 * <p>
 * Identity is the {@code key}; storing an issue with the same key again replaces the
 * previous record.
 *
 * @param key the issue key (e.g. "HADOOP-1234")
 * @param project the project key (e.g. "HADOOP")
 * @param title the issue summary
 * @param description the issue description (null if not provided)
 * @param status workflow status name (e.g. "Resolved")
 * @param priority priority name (e.g. "Major")
 * @param issueType issue type name (e.g. "Bug")
 * @param reporter display name of the reporter
 * @param assignee display name of the assignee (null if unassigned)
 * @param created when the issue was created
 * @param updated when the issue was last updated
 * @param resolution resolution name (null if unresolved)
 * @param resolutionDate when the issue was resolved (null if unresolved)
 * @param comments comments in the order Jira returned them
 */
public record Issue(String key, String project, String title, @Nullable String description, String status,
		String priority, String issueType, String reporter, @Nullable String assignee, Instant created,
		Instant updated, @Nullable String resolution, @Nullable Instant resolutionDate, List<Comment> comments) {

	private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_.-]+");

	/**
	 * Check required fields and fill defaults for optional ones.
	 *
	 * <p>
	 * Records read back from disk may carry nulls anywhere, so every component is
	 * re-checked here.
	 * @return a normalized copy of this issue
	 * @throws IssueValidationException if the key is missing or unsafe as a file name, or the
	 * title, created or updated is missing
	 */
	public Issue validated() {
		String validatedKey = key == null ? "" : key.trim();
		if (validatedKey.isEmpty()) {
			throw new IssueValidationException("<unknown>", "Missing issue key");
		}
		if (!SAFE_KEY.matcher(validatedKey).matches()) {
			throw new IssueValidationException(validatedKey, "Invalid issue key");
		}
		if (title == null || title.isBlank()) {
			throw new IssueValidationException(validatedKey, "Missing title");
		}
		if (created == null) {
			throw new IssueValidationException(validatedKey, "Missing created timestamp");
		}
		if (updated == null) {
			throw new IssueValidationException(validatedKey, "Missing updated timestamp");
		}

		String validatedProject = project == null || !SAFE_KEY.matcher(project).matches() ? projectOf(validatedKey)
				: project;

		List<Comment> validatedComments = new ArrayList<>();
		if (comments != null) {
			for (Comment comment : comments) {
				if (comment == null || comment.created() == null) {
					continue;
				}
				validatedComments.add(new Comment(orEmpty(comment.id()), orDefault(comment.author(), "Unknown"),
						orEmpty(comment.body()), comment.created()));
			}
		}

		return new Issue(validatedKey, validatedProject, title, description, orEmpty(status), orEmpty(priority),
				orEmpty(issueType), orDefault(reporter, "Unknown"), assignee, created, updated, resolution,
				resolutionDate, List.copyOf(validatedComments));
	}

	/**
	 * Derive the project key from an issue key ("HADOOP-1234" gives "HADOOP").
	 */
	public static String projectOf(String issueKey) {
		int dash = issueKey.lastIndexOf('-');
		return dash > 0 ? issueKey.substring(0, dash) : issueKey;
	}

	private static String orEmpty(@Nullable String value) {
		return value == null ? "" : value;
	}

	private static String orDefault(@Nullable String value, String defaultValue) {
		return value == null || value.isBlank() ? defaultValue : value;
	}

}
