package org.springaicommunity.jira.corpus;

import java.util.List;

/**
 * One page of search results.
 *
 * @param startAt offset of the first hit in this page
 * @param maxResults page size the server applied
 * @param total total number of issues matching the query
 * @param returned number of results the server returned, including any dropped from
 * {@code hits} for lacking a key
 * @param hits issue references in update-time order
 */
public record SearchPage(int startAt, int maxResults, int total, int returned, List<SearchHit> hits) {

	/**
	 * Page whose hits are everything the server returned.
	 */
	public SearchPage(int startAt, int maxResults, int total, List<SearchHit> hits) {
		this(startAt, maxResults, total, hits.size(), hits);
	}

	/**
	 * Returns true if the server returned nothing for this offset.
	 */
	public boolean isEmpty() {
		return returned == 0;
	}

	/**
	 * Returns true if the server reports issues beyond this page.
	 */
	public boolean hasMore() {
		return returned > 0 && startAt + returned < total;
	}

}
