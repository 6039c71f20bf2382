package org.springaicommunity.jira.corpus;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Jira ingestion and corpus generation.
 *
 * <p>
 * Properties can be set directly via setters or loaded from the environment by the
 * command-line module, then passed to {@link JiraCorpusBuilder}. Nothing in this class
 * reads the environment itself.
 *
 * <p>
 * Default values target the public Apache Jira instance and are polite enough for
 * unauthenticated use.
 */
public class CorpusProperties {

	/**
	 * Base URL of the Jira instance, without a trailing {@code /rest} path.
	 */
	private String baseUrl = "https://issues.apache.org/jira";

	/**
	 * Projects ingested when a request names none.
	 */
	private List<String> defaultProjects = new ArrayList<>(List.of("HADOOP", "SPARK", "KAFKA"));

	/**
	 * Number of search hits requested per page.
	 */
	private int pageSize = 50;

	/**
	 * Minimum delay in milliseconds between consecutive requests.
	 */
	private long requestDelayMs = 3600;

	/**
	 * Maximum attempts per request, including the first.
	 */
	private int maxAttempts = 5;

	/**
	 * Base delay in milliseconds for exponential backoff.
	 */
	private long retryBaseDelayMs = 1000;

	/**
	 * Upper bound in milliseconds for a single backoff delay.
	 */
	private long retryMaxDelayMs = 300000;

	/**
	 * HTTP connect timeout in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * HTTP request timeout in seconds.
	 */
	private int requestTimeoutSeconds = 60;

	/**
	 * Root directory for raw issue records.
	 */
	private String rawDir = "data/raw";

	/**
	 * Directory holding one checkpoint file per project.
	 */
	private String stateDir = "data/state";

	/**
	 * Default path of the JSON Lines corpus.
	 */
	private String corpusOutput = "data/corpus/jira_corpus.jsonl";

	/**
	 * Number of stored issues after which the checkpoint is flushed mid-page.
	 */
	private int checkpointInterval = 100;

	/**
	 * Abort a project on the first invalid issue instead of skipping it.
	 */
	private boolean validationStrictMode = false;

	/**
	 * Time zone used to render the {@code updated >=} bound in JQL.
	 */
	private String queryZone = "UTC";

	/**
	 * Returns the Jira base URL.
	 * @return the Jira base URL
	 */
	public String getBaseUrl() {
		return baseUrl;
	}

	/**
	 * Sets the Jira base URL.
	 * @param baseUrl the Jira base URL
	 */
	public void setBaseUrl(String baseUrl) {
		this.baseUrl = baseUrl;
	}

	/**
	 * Returns the default project keys.
	 * @return the default project keys
	 */
	public List<String> getDefaultProjects() {
		return defaultProjects;
	}

	/**
	 * Sets the default project keys.
	 * @param defaultProjects the default project keys
	 */
	public void setDefaultProjects(List<String> defaultProjects) {
		this.defaultProjects = defaultProjects;
	}

	/**
	 * Returns the search page size.
	 * @return the search page size
	 */
	public int getPageSize() {
		return pageSize;
	}

	/**
	 * Sets the search page size.
	 * @param pageSize the search page size
	 */
	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	/**
	 * Returns the request delay in milliseconds.
	 * @return the request delay in milliseconds
	 */
	public long getRequestDelayMs() {
		return requestDelayMs;
	}

	/**
	 * Sets the request delay in milliseconds.
	 * @param requestDelayMs the request delay in milliseconds
	 */
	public void setRequestDelayMs(long requestDelayMs) {
		this.requestDelayMs = requestDelayMs;
	}

	/**
	 * Returns the maximum attempts.
	 * @return the maximum attempts
	 */
	public int getMaxAttempts() {
		return maxAttempts;
	}

	/**
	 * Sets the maximum attempts.
	 * @param maxAttempts the maximum attempts
	 */
	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	/**
	 * Returns the base backoff delay in milliseconds.
	 * @return the base backoff delay in milliseconds
	 */
	public long getRetryBaseDelayMs() {
		return retryBaseDelayMs;
	}

	/**
	 * Sets the base backoff delay in milliseconds.
	 * @param retryBaseDelayMs the base backoff delay in milliseconds
	 */
	public void setRetryBaseDelayMs(long retryBaseDelayMs) {
		this.retryBaseDelayMs = retryBaseDelayMs;
	}

	/**
	 * Returns the maximum backoff delay in milliseconds.
	 * @return the maximum backoff delay in milliseconds
	 */
	public long getRetryMaxDelayMs() {
		return retryMaxDelayMs;
	}

	/**
	 * Sets the maximum backoff delay in milliseconds.
	 * @param retryMaxDelayMs the maximum backoff delay in milliseconds
	 */
	public void setRetryMaxDelayMs(long retryMaxDelayMs) {
		this.retryMaxDelayMs = retryMaxDelayMs;
	}

	/**
	 * Returns the connect timeout in seconds.
	 * @return the connect timeout in seconds
	 */
	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	/**
	 * Sets the connect timeout in seconds.
	 * @param connectTimeoutSeconds the connect timeout in seconds
	 */
	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	/**
	 * Returns the request timeout in seconds.
	 * @return the request timeout in seconds
	 */
	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	/**
	 * Sets the request timeout in seconds.
	 * @param requestTimeoutSeconds the request timeout in seconds
	 */
	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	/**
	 * Returns the raw record directory.
	 * @return the raw record directory
	 */
	public String getRawDir() {
		return rawDir;
	}

	/**
	 * Sets the raw record directory.
	 * @param rawDir the raw record directory
	 */
	public void setRawDir(String rawDir) {
		this.rawDir = rawDir;
	}

	/**
	 * Returns the checkpoint directory.
	 * @return the checkpoint directory
	 */
	public String getStateDir() {
		return stateDir;
	}

	/**
	 * Sets the checkpoint directory.
	 * @param stateDir the checkpoint directory
	 */
	public void setStateDir(String stateDir) {
		this.stateDir = stateDir;
	}

	/**
	 * Returns the corpus output path.
	 * @return the corpus output path
	 */
	public String getCorpusOutput() {
		return corpusOutput;
	}

	/**
	 * Sets the corpus output path.
	 * @param corpusOutput the corpus output path
	 */
	public void setCorpusOutput(String corpusOutput) {
		this.corpusOutput = corpusOutput;
	}

	/**
	 * Returns the checkpoint interval.
	 * @return the checkpoint interval
	 */
	public int getCheckpointInterval() {
		return checkpointInterval;
	}

	/**
	 * Sets the checkpoint interval.
	 * @param checkpointInterval the checkpoint interval
	 */
	public void setCheckpointInterval(int checkpointInterval) {
		this.checkpointInterval = checkpointInterval;
	}

	/**
	 * Returns true if strict validation is enabled.
	 * @return true if strict validation is enabled
	 */
	public boolean isValidationStrictMode() {
		return validationStrictMode;
	}

	/**
	 * Enables or disables strict validation.
	 * @param validationStrictMode true to abort a project on the first invalid issue
	 */
	public void setValidationStrictMode(boolean validationStrictMode) {
		this.validationStrictMode = validationStrictMode;
	}

	/**
	 * Returns the JQL time zone id.
	 * @return the JQL time zone id
	 */
	public String getQueryZone() {
		return queryZone;
	}

	/**
	 * Sets the JQL time zone id.
	 * @param queryZone the JQL time zone id
	 */
	public void setQueryZone(String queryZone) {
		this.queryZone = queryZone;
	}

}
