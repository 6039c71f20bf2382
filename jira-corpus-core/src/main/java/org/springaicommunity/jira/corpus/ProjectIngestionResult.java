package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Outcome of ingesting one project.
 *
 * @param project the project key
 * @param examined search hits looked at
 * @param stored issues fetched, validated and written to the raw store
 * @param duplicatesSkipped hits skipped because the key was already processed
 * @param invalidSkipped issues skipped because they failed validation
 * @param failedFetches issues skipped because their detail could not be fetched
 * @param watermark the project's watermark after the run
 * @param aborted true if the project stopped early
 * @param abortReason why the project stopped early (null when not aborted)
 */
public record ProjectIngestionResult(String project, int examined, int stored, int duplicatesSkipped,
		int invalidSkipped, int failedFetches, Instant watermark, boolean aborted, @Nullable String abortReason) {
}
