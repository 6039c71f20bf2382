package org.springaicommunity.jira.corpus;

import java.time.Duration;

/**
 * Blocking pause used between request attempts. Replaceable in tests so backoff delays
 * can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;

}
