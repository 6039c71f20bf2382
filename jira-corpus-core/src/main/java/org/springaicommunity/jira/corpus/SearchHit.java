package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * One issue reference returned by the search endpoint.
 *
 * @param key the issue key (e.g. "HADOOP-1234")
 * @param updated the issue's last update time as reported by search, if present
 */
public record SearchHit(String key, @Nullable Instant updated) {
}
