package org.springaicommunity.jira.corpus;

import java.time.Instant;

/**
 * Durable per-project ingestion progress.
 *
 * <p>
 * Mutations are held in memory until {@link #flush()}; a crash loses at most the changes
 * since the last flush, never the previously persisted state.
 */
public interface CheckpointStore {

	/**
	 * Load the checkpoint for a project.
	 * @param project project key
	 * @return the persisted state, or {@link Checkpoint#empty(String)} when none exists or
	 * the stored state cannot be read
	 */
	Checkpoint load(String project);

	/**
	 * Returns true if the key has been recorded for the project.
	 */
	boolean isProcessed(String project, String issueKey);

	/**
	 * Add a key to the project's processed set. Recording a key twice has no effect.
	 * @param project project key
	 * @param issueKey issue key
	 */
	void recordProcessed(String project, String issueKey);

	/**
	 * Move the watermark forward. A timestamp older than the current watermark is
	 * ignored.
	 * @param project project key
	 * @param timestamp candidate watermark
	 */
	void advanceWatermark(String project, Instant timestamp);

	/**
	 * Persist every project changed since the last flush.
	 * @throws StorageException if a checkpoint cannot be written
	 */
	void flush();

}
