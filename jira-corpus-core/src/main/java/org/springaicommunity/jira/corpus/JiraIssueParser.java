package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the JSON returned by the Jira issue endpoint into an {@link Issue}.
 */
public class JiraIssueParser {

	private static final String UNKNOWN_USER = "Unknown";

	private final JsonNodeUtils jsonUtils;

	public JiraIssueParser(JsonNodeUtils jsonUtils) {
		this.jsonUtils = jsonUtils;
	}

	/**
	 * Parse and validate one issue.
	 * @param node the issue JSON ({@code key} plus {@code fields})
	 * @return the validated issue
	 * @throws IssueValidationException if a required field is missing or unparseable
	 */
	public Issue parse(JsonNode node) {
		String key = jsonUtils.getString(node, "key").orElse("").trim();
		if (key.isEmpty()) {
			throw new IssueValidationException("<unknown>", "Missing issue key");
		}

		JsonNode fields = node.path("fields");
		String title = jsonUtils.getString(fields, "summary")
			.filter(s -> !s.isBlank())
			.orElseThrow(() -> new IssueValidationException(key, "Missing summary"));
		Instant created = jsonUtils.getInstant(fields, "created")
			.orElseThrow(() -> new IssueValidationException(key, "Missing or invalid created timestamp"));
		Instant updated = jsonUtils.getInstant(fields, "updated")
			.orElseThrow(() -> new IssueValidationException(key, "Missing or invalid updated timestamp"));

		String project = jsonUtils.getString(fields, "project", "key").orElse(Issue.projectOf(key));

		List<Comment> comments = new ArrayList<>();
		for (JsonNode comment : jsonUtils.getArray(fields, "comment", "comments")) {
			comments.add(new Comment(jsonUtils.getString(comment, "id").orElse(""), userName(comment.path("author")),
					jsonUtils.getString(comment, "body").orElse(""),
					jsonUtils.getInstant(comment, "created").orElse(null)));
		}

		return new Issue(key, project, title, jsonUtils.getString(fields, "description").orElse(null),
				name(fields, "status"), name(fields, "priority"), name(fields, "issuetype"),
				userName(fields.path("reporter")), optionalUserName(fields.path("assignee")),
				created, updated, jsonUtils.getString(fields, "resolution", "name").orElse(null),
				jsonUtils.getInstant(fields, "resolutiondate").orElse(null), comments)
			.validated();
	}

	private String name(JsonNode fields, String field) {
		return jsonUtils.getString(fields, field, "name").orElse("");
	}

	private String userName(JsonNode user) {
		String name = optionalUserName(user);
		return name != null ? name : UNKNOWN_USER;
	}

	@Nullable
	private String optionalUserName(JsonNode user) {
		return jsonUtils.getString(user, "displayName")
			.filter(s -> !s.isBlank())
			.or(() -> jsonUtils.getString(user, "name").filter(s -> !s.isBlank()))
			.orElse(null);
	}

}
