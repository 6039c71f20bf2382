package org.springaicommunity.jira.corpus;

/**
 * Repository interface for raw issue records.
 *
 * <p>
 * Abstracts where raw records live so a blob store can stand in for the local file
 * system.
 */
public interface RawRecordStore {

	/**
	 * Persist one issue, replacing any previous record with the same key.
	 * @param issue the validated issue
	 * @return a description of where the record was written
	 * @throws StorageException if the record cannot be written
	 */
	String store(Issue issue);

}
