package org.springaicommunity.jira.corpus;

import java.util.Optional;

/**
 * Policy that derives the answer of the Q&A task from an issue's discussion.
 */
@FunctionalInterface
public interface ResolutionExtractor {

	/**
	 * Extract text describing how the issue was resolved.
	 * @param issue the issue
	 * @return the answer text, or empty if the discussion carries none
	 */
	Optional<String> extractAnswer(Issue issue);

}
