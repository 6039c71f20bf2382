package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Represents a comment on a Jira issue.
 *
 * @param id the Jira comment id
 * @param author display name of the comment author ("Unknown" when not available)
 * @param body the comment text
 * @param created when the comment was created (null if Jira did not report it)
 */
public record Comment(String id, String author, String body, @Nullable Instant created) {
}
