package org.springaicommunity.jira.corpus;

/**
 * Thrown when an issue lacks a field every stored record must carry.
 */
public class IssueValidationException extends RuntimeException {

	private final String issueKey;

	public IssueValidationException(String issueKey, String message) {
		super(message + " (issue: " + issueKey + ")");
		this.issueKey = issueKey;
	}

	public String getIssueKey() {
		return issueKey;
	}

}
