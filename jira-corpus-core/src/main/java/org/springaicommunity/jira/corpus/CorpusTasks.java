package org.springaicommunity.jira.corpus;

/**
 * The derived tasks of one corpus entry.
 */
public record CorpusTasks(TextTask summarization, TextTask classification, QaTask qa) {
}
