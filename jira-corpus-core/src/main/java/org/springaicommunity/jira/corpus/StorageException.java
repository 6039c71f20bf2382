package org.springaicommunity.jira.corpus;

/**
 * Thrown when a durable write (raw record, checkpoint or corpus) fails.
 */
public class StorageException extends RuntimeException {

	public StorageException(String message, Throwable cause) {
		super(message, cause);
	}

}
