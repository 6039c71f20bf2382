package org.springaicommunity.jira.corpus;

/**
 * A question-answering training example.
 *
 * @param task always "qa"
 * @param question question templated from the issue title
 * @param context title and description the question refers to
 * @param answer answer derived from resolution comments or the resolution name
 */
public record QaTask(String task, String question, String context, String answer) {
}
