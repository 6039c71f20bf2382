package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for Jira REST API v2 operations.
 *
 * <p>
 * Converts search responses to {@link SearchPage} at the service boundary. Issue detail
 * is returned as raw JSON and converted by {@link JiraIssueParser}.
 */
public class JiraRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(JiraRestService.class);

	static final String SEARCH_PATH = "/rest/api/2/search";

	static final String ISSUE_PATH = "/rest/api/2/issue/";

	static final String ISSUE_FIELDS = String.join(",", "summary", "description", "created", "updated", "status",
			"priority", "assignee", "reporter", "issuetype", "project", "resolution", "resolutiondate", "comment");

	private static final String SEARCH_FIELDS = "key,updated";

	private static final DateTimeFormatter JQL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm");

	private final JiraClient client;

	private final JsonNodeUtils jsonUtils;

	private final ZoneId queryZone;

	public JiraRestService(JiraClient client, JsonNodeUtils jsonUtils, ZoneId queryZone) {
		this.client = client;
		this.jsonUtils = jsonUtils;
		this.queryZone = queryZone;
	}

	@Override
	public String buildJql(String project, @Nullable Instant updatedSince) {
		StringBuilder jql = new StringBuilder("project = ").append(project);
		if (updatedSince != null && updatedSince.isAfter(Instant.EPOCH)) {
			// Minute precision rounds down, so the boundary issue is returned again and
			// skipped as already processed.
			jql.append(" AND updated >= \"").append(JQL_TIMESTAMP.format(updatedSince.atZone(queryZone))).append('"');
		}
		jql.append(" ORDER BY updated ASC");
		return jql.toString();
	}

	@Override
	public SearchPage searchIssues(String jql, int startAt, int maxResults) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("jql", jql);
		params.put("startAt", String.valueOf(startAt));
		params.put("maxResults", String.valueOf(maxResults));
		params.put("fields", SEARCH_FIELDS);

		JsonNode body = client.fetch(SEARCH_PATH, params).body();

		List<JsonNode> issues = jsonUtils.getArray(body, "issues");
		List<SearchHit> hits = new ArrayList<>();
		for (JsonNode issue : issues) {
			String key = jsonUtils.getString(issue, "key").orElse("");
			if (key.isBlank()) {
				logger.warn("Search result without issue key skipped (jql: {})", jql);
				continue;
			}
			hits.add(new SearchHit(key, jsonUtils.getInstant(issue, "fields", "updated").orElse(null)));
		}

		int total = jsonUtils.getInt(body, "total").orElse(0);
		int pageStart = jsonUtils.getInt(body, "startAt").orElse(startAt);
		int pageSize = jsonUtils.getInt(body, "maxResults").orElse(maxResults);
		logger.debug("Search startAt={} returned {} of {} issues", pageStart, issues.size(), total);
		return new SearchPage(pageStart, pageSize, total, issues.size(), hits);
	}

	@Override
	public JsonNode getIssue(String issueKey) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("fields", ISSUE_FIELDS);
		return client.fetch(ISSUE_PATH + issueKey, params).body();
	}

}
