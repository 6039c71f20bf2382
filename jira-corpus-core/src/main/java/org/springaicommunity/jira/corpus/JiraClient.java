package org.springaicommunity.jira.corpus;

import java.util.Map;

/**
 * Interface for Jira REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the transport, enabling testability and decorator
 * implementations such as {@link RetryingJiraClient}.
 */
public interface JiraClient {

	/**
	 * Execute a GET request against the Jira REST API.
	 * @param path API path relative to the base URL (e.g. "/rest/api/2/search")
	 * @param params query parameters, encoded by the implementation
	 * @return the successful response
	 * @throws JiraApiException classified failure for anything other than 2xx JSON
	 */
	FetchResponse fetch(String path, Map<String, String> params);

}
