package org.springaicommunity.jira.corpus;

/**
 * Classification of a single Jira request outcome.
 *
 * <p>
 * Every response or transport exception maps to exactly one kind. Only
 * {@link #RATE_LIMITED}, {@link #SERVER_ERROR} and {@link #TIMEOUT} are retried.
 */
public enum FailureKind {

	SUCCESS(false),

	/** HTTP 429. */
	RATE_LIMITED(true),

	/** HTTP 5xx. */
	SERVER_ERROR(true),

	/** Connect or request timeout, or another transport-level I/O failure. */
	TIMEOUT(true),

	/** HTTP 4xx other than 429. */
	CLIENT_ERROR(false),

	/** A 2xx response whose body is not valid JSON. */
	MALFORMED_RESPONSE(false);

	private final boolean retryable;

	FailureKind(boolean retryable) {
		this.retryable = retryable;
	}

	public boolean isRetryable() {
		return retryable;
	}

	/**
	 * Classify an HTTP status code.
	 * @param statusCode the response status
	 * @return the matching kind ({@link #SUCCESS} for 2xx)
	 */
	public static FailureKind fromStatus(int statusCode) {
		if (statusCode >= 200 && statusCode < 300) {
			return SUCCESS;
		}
		if (statusCode == 429) {
			return RATE_LIMITED;
		}
		if (statusCode >= 500 && statusCode < 600) {
			return SERVER_ERROR;
		}
		return CLIENT_ERROR;
	}

}
