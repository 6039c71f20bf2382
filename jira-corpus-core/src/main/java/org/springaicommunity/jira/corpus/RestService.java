package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Interface for Jira REST API operations used by ingestion.
 */
public interface RestService {

	/**
	 * Build the JQL for a project, optionally restricted to issues updated at or after a
	 * lower bound, ordered by update time ascending.
	 * @param project project key
	 * @param updatedSince lower bound, or null for the full history
	 * @return JQL string
	 */
	String buildJql(String project, @Nullable Instant updatedSince);

	/**
	 * Fetch one page of search results.
	 * @param jql the query
	 * @param startAt zero-based offset
	 * @param maxResults page size
	 * @return the page
	 * @throws JiraApiException if the request fails after retries
	 */
	SearchPage searchIssues(String jql, int startAt, int maxResults);

	/**
	 * Fetch the full detail of one issue.
	 * @param issueKey issue key
	 * @return the raw Jira JSON for the issue
	 * @throws JiraApiException if the request fails after retries
	 */
	JsonNode getIssue(String issueKey);

}
