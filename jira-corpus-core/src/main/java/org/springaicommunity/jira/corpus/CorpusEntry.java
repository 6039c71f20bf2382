package org.springaicommunity.jira.corpus;

import java.util.List;

/**
 * One line of the JSON Lines corpus.
 *
 * @param metadata issue fields
 * @param description normalized description, empty when the issue has none
 * @param comments normalized comments in issue order
 * @param tasks derived training tasks
 */
public record CorpusEntry(CorpusMetadata metadata, String description, List<CorpusComment> comments,
		CorpusTasks tasks) {
}
