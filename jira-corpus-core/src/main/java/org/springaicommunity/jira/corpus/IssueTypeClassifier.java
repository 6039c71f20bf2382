package org.springaicommunity.jira.corpus;

/**
 * Policy that decides the type label of the classification task.
 */
@FunctionalInterface
public interface IssueTypeClassifier {

	/**
	 * Infer the issue type.
	 * @param issue the issue
	 * @return a type label, or an empty string to omit the type from the label string
	 */
	String classify(Issue issue);

}
