package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Issue fields carried into a corpus entry.
 *
 * @param issueKey the issue key
 * @param project the project key
 * @param title the issue summary
 * @param status workflow status name
 * @param priority priority name
 * @param issueType declared issue type name
 * @param reporter reporter display name
 * @param created when the issue was created
 * @param updated when the issue was last updated
 * @param assignee assignee display name, omitted when unassigned
 * @param resolution resolution name, omitted when unresolved
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CorpusMetadata(String issueKey, String project, String title, String status, String priority,
		String issueType, String reporter, Instant created, Instant updated, @Nullable String assignee,
		@Nullable String resolution) {
}
