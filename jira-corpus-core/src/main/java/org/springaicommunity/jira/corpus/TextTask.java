package org.springaicommunity.jira.corpus;

/**
 * An input/output training pair.
 *
 * @param task task name ("summarization" or "classification")
 * @param input model input text
 * @param output expected output text
 */
public record TextTask(String task, String input, String output) {
}
