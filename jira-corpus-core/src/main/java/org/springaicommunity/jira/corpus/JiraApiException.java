package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Exception thrown when a Jira API call fails.
 *
 * <p>
 * Carries the {@link FailureKind} and, for rate-limited responses, the server supplied
 * {@code Retry-After} delay, enabling the retry logic in {@link RetryingJiraClient}.
 */
public class JiraApiException extends RuntimeException {

	private final FailureKind kind;

	private final int statusCode;

	@Nullable
	private final Duration retryAfter;

	public JiraApiException(FailureKind kind, String message, int statusCode) {
		this(kind, message, statusCode, null);
	}

	public JiraApiException(FailureKind kind, String message, int statusCode, @Nullable Duration retryAfter) {
		super(message);
		this.kind = kind;
		this.statusCode = statusCode;
		this.retryAfter = retryAfter;
	}

	public JiraApiException(FailureKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = -1;
		this.retryAfter = null;
	}

	public FailureKind getKind() {
		return kind;
	}

	/**
	 * Returns the HTTP status, or -1 when the failure happened before a response arrived.
	 */
	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public Duration getRetryAfter() {
		return retryAfter;
	}

	public boolean isRetryable() {
		return kind.isRetryable();
	}

}
