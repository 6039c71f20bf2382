package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A comment as written to the corpus, with its body whitespace-normalized.
 *
 * @param author comment author display name
 * @param body normalized comment text
 * @param created when the comment was created
 */
public record CorpusComment(String author, String body, @Nullable Instant created) {
}
