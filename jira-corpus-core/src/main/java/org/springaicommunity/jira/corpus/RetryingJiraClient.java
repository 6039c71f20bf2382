package org.springaicommunity.jira.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Decorator that adds bounded retry with exponential backoff to a {@link JiraClient}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Exponential backoff for transient errors (5xx, timeouts):
 * {@code delay = min(maxDelay, baseDelay * 2^(attempt-1))}</li>
 * <li>Retry-After aware waits for 429 responses: sleeps exactly the server supplied
 * delay, falling back to exponential backoff when the header is absent</li>
 * <li>No retry for client errors (4xx other than 429) or malformed bodies</li>
 * <li>Polite pacing: an optional fixed delay between consecutive logical requests</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * JiraClient client = RetryingJiraClient.builder()
 *     .wrapping(new JiraHttpClient(baseUrl, mapper, connectTimeout, requestTimeout))
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofMinutes(5))
 *     .requestDelay(Duration.ofMillis(3600))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingJiraClient implements JiraClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingJiraClient.class);

	private final JiraClient delegate;

	private final int maxAttempts;

	private final long baseDelayMs;

	private final long maxDelayMs;

	private final long requestDelayMs;

	private final Sleeper sleeper;

	private long lastRequestNanos = -1;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private RetryingJiraClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxAttempts = builder.maxAttempts;
		this.baseDelayMs = builder.baseDelayMs;
		this.maxDelayMs = builder.maxDelayMs;
		this.requestDelayMs = builder.requestDelayMs;
		this.sleeper = builder.sleeper;
	}

	/**
	 * Create a new builder for RetryingJiraClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public FetchResponse fetch(String path, Map<String, String> params) {
		String description = "GET " + path;
		paceIfNeeded();

		for (int attempt = 1;; attempt++) {
			try {
				return delegate.fetch(path, params);
			}
			catch (JiraApiException e) {
				if (!e.isRetryable()) {
					logger.debug("{} failed with non-retryable {}: {}", description, e.getKind(), e.getMessage());
					throw e;
				}
				if (attempt >= maxAttempts) {
					logger.error("{} failed after {} attempts: {}", description, attempt, e.getMessage());
					throw e;
				}

				Duration wait = computeWaitTime(e, attempt);
				logger.warn("{} failed with {} (attempt {}/{}). Waiting {}ms...", description, e.getKind(), attempt,
						maxAttempts, wait.toMillis());
				sleep(wait);
			}
			finally {
				lastRequestNanos = System.nanoTime();
			}
		}
	}

	/**
	 * Compute how long to wait before the next attempt. A 429 with a Retry-After value
	 * waits exactly that long; everything else uses exponential backoff.
	 */
	Duration computeWaitTime(JiraApiException e, int attempt) {
		if (e.getKind() == FailureKind.RATE_LIMITED && e.getRetryAfter() != null) {
			logger.info("Rate limited. Honouring Retry-After of {}s", e.getRetryAfter().toSeconds());
			return e.getRetryAfter();
		}
		return backoffDelay(attempt);
	}

	/**
	 * Exponential backoff delay after the given failed attempt (1-based).
	 */
	Duration backoffDelay(int attempt) {
		int exponent = Math.min(Math.max(attempt - 1, 0), 30);
		long factor = 1L << exponent;
		if (baseDelayMs > maxDelayMs / factor) {
			return Duration.ofMillis(maxDelayMs);
		}
		return Duration.ofMillis(Math.min(maxDelayMs, baseDelayMs * factor));
	}

	private void paceIfNeeded() {
		if (requestDelayMs <= 0 || lastRequestNanos < 0) {
			return;
		}
		long elapsedMs = (System.nanoTime() - lastRequestNanos) / 1_000_000;
		long remaining = requestDelayMs - elapsedMs;
		if (remaining > 0) {
			logger.trace("Pacing: sleeping {}ms before next request", remaining);
			sleep(Duration.ofMillis(remaining));
		}
	}

	private void sleep(Duration duration) {
		try {
			sleeper.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingJiraClient}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>maxAttempts: 5</li>
	 * <li>baseDelay: 1 second</li>
	 * <li>maxDelay: 300 seconds</li>
	 * <li>requestDelay: none</li>
	 * </ul>
	 */
	public static class Builder {

		private JiraClient delegate;

		private int maxAttempts = 5;

		private long baseDelayMs = 1000;

		private long maxDelayMs = 300_000;

		private long requestDelayMs = 0;

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the JiraClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(JiraClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the maximum number of attempts per logical request, including the first.
		 * @param maxAttempts total attempts (default: 5)
		 * @return this builder
		 */
		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		/**
		 * Set the base backoff delay; it doubles on each failed attempt.
		 * @param delay base delay (default: 1 second)
		 * @return this builder
		 */
		public Builder baseDelay(Duration delay) {
			this.baseDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the backoff ceiling.
		 * @param delay maximum delay (default: 300 seconds)
		 * @return this builder
		 */
		public Builder maxDelay(Duration delay) {
			this.maxDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the minimum gap between consecutive logical requests.
		 * @param delay request delay (default: none)
		 * @return this builder
		 */
		public Builder requestDelay(Duration delay) {
			this.requestDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Replace the sleeping strategy.
		 * @param sleeper sleeper to use (default: {@link Sleeper#SYSTEM})
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RetryingJiraClient.
		 * @return configured RetryingJiraClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingJiraClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A JiraClient to wrap is required. Call wrapping() first.");
			}
			if (maxAttempts < 1) {
				throw new IllegalStateException("maxAttempts must be at least 1");
			}
			if (baseDelayMs <= 0) {
				throw new IllegalStateException("baseDelay must be positive");
			}
			if (maxDelayMs < baseDelayMs) {
				throw new IllegalStateException("maxDelay must not be smaller than baseDelay");
			}
			if (requestDelayMs < 0) {
				throw new IllegalStateException("requestDelay must not be negative");
			}
			return new RetryingJiraClient(this);
		}

	}

}
