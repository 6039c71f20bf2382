package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful response of a single Jira request.
 *
 * @param status the HTTP status code (always 2xx)
 * @param body the parsed JSON body
 */
public record FetchResponse(int status, JsonNode body) {
}
