package org.springaicommunity.jira.corpus;

import java.time.Instant;
import java.util.Set;

/**
 * Persisted ingestion progress for one project.
 *
 * @param project the project key
 * @param lastUpdateTimestamp watermark: the greatest {@code updated} of any stored issue
 * (epoch when nothing has been stored)
 * @param processedKeys keys of every issue already stored
 */
public record Checkpoint(String project, Instant lastUpdateTimestamp, Set<String> processedKeys) {

	/**
	 * The state of a project that has never been ingested.
	 */
	public static Checkpoint empty(String project) {
		return new Checkpoint(project, Instant.EPOCH, Set.of());
	}

}
