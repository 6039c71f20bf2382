package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parameters for one ingestion run.
 *
 * @param projects project keys to ingest, in order (empty = configured defaults)
 * @param startDate earliest update date to consider, or null for no lower bound beyond
 * the checkpoint
 * @param maxIssues maximum search hits to examine per project, or null for unlimited
 */
public record IngestionRequest(List<String> projects, @Nullable LocalDate startDate, @Nullable Integer maxIssues) {

	/**
	 * Request for the configured default projects with no limits.
	 */
	public static IngestionRequest defaults() {
		return new IngestionRequest(List.of(), null, null);
	}

	/**
	 * Validate parameters and provide defaults.
	 * @param properties supplies the default project list
	 * @return a request with trimmed, upper-cased, de-duplicated project keys and a
	 * positive or absent issue limit
	 */
	public IngestionRequest validated(CorpusProperties properties) {
		List<String> source = projects == null || projects.isEmpty() ? properties.getDefaultProjects() : projects;

		List<String> validatedProjects = new ArrayList<>();
		for (String project : source) {
			// Jira project keys are upper case; raw files are stored under fields.project.key
			String trimmed = project == null ? "" : project.trim().toUpperCase(Locale.ROOT);
			if (!trimmed.isEmpty() && !validatedProjects.contains(trimmed)) {
				validatedProjects.add(trimmed);
			}
		}

		Integer validatedMaxIssues = maxIssues != null && maxIssues > 0 ? maxIssues : null;

		return new IngestionRequest(List.copyOf(validatedProjects), startDate, validatedMaxIssues);
	}

}
