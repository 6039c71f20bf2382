package org.springaicommunity.jira.corpus;

import java.util.List;

/**
 * Results of an ingestion run.
 *
 * @param projects per-project outcomes in the order they were processed
 */
public record IngestionResult(List<ProjectIngestionResult> projects) {

	public int totalStored() {
		return projects.stream().mapToInt(ProjectIngestionResult::stored).sum();
	}

	public int totalExamined() {
		return projects.stream().mapToInt(ProjectIngestionResult::examined).sum();
	}

	/**
	 * Returns true if any project stopped early.
	 */
	public boolean hasAbortedProjects() {
		return projects.stream().anyMatch(ProjectIngestionResult::aborted);
	}

}
