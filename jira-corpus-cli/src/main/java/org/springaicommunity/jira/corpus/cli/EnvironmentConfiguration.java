package org.springaicommunity.jira.corpus.cli;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.jira.corpus.CorpusProperties;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds {@link CorpusProperties} from environment variables.
 *
 * <p>
 * Unset or blank variables keep the property default. A value that cannot be parsed is
 * rejected with an {@link IllegalArgumentException} naming the variable.
 */
public class EnvironmentConfiguration {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentConfiguration.class);

	private final Function<String, @Nullable String> lookup;

	/**
	 * Read from {@code .env} files and the process environment.
	 */
	public EnvironmentConfiguration() {
		this(EnvironmentSupport.standard()::get);
	}

	/**
	 * Read from a custom source, for tests.
	 * @param lookup returns the value of a variable or null when unset
	 */
	public EnvironmentConfiguration(Function<String, @Nullable String> lookup) {
		this.lookup = lookup;
	}

	public CorpusProperties load() {
		CorpusProperties properties = new CorpusProperties();

		string("JIRA_BASE_URL", properties::setBaseUrl);
		string("JIRA_PROJECTS", value -> properties.setDefaultProjects(splitList(value)));
		integer("JIRA_PAGE_SIZE", properties::setPageSize);
		longValue("REQUEST_DELAY_MS", properties::setRequestDelayMs);
		integer("RETRY_MAX_ATTEMPTS", properties::setMaxAttempts);
		longValue("RETRY_BASE_DELAY_MS", properties::setRetryBaseDelayMs);
		longValue("RETRY_MAX_DELAY_MS", properties::setRetryMaxDelayMs);
		integer("CONNECT_TIMEOUT_SECONDS", properties::setConnectTimeoutSeconds);
		integer("REQUEST_TIMEOUT_SECONDS", properties::setRequestTimeoutSeconds);
		string("RAW_DIR", properties::setRawDir);
		string("STATE_DIR", properties::setStateDir);
		string("CORPUS_OUTPUT", properties::setCorpusOutput);
		integer("CHECKPOINT_INTERVAL", properties::setCheckpointInterval);
		string("VALIDATION_STRICT_MODE", value -> properties.setValidationStrictMode(Boolean.parseBoolean(value)));
		string("JIRA_QUERY_ZONE", value -> properties.setQueryZone(zone(value)));

		logger.debug("Loaded configuration: baseUrl={}, projects={}, rawDir={}, stateDir={}", properties.getBaseUrl(),
				properties.getDefaultProjects(), properties.getRawDir(), properties.getStateDir());
		return properties;
	}

	static List<String> splitList(String value) {
		return Arrays.stream(value.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.collect(Collectors.toList());
	}

	private void string(String name, Consumer<String> setter) {
		String value = lookup.apply(name);
		if (value != null && !value.isBlank()) {
			setter.accept(value.trim());
		}
	}

	private void integer(String name, Consumer<Integer> setter) {
		string(name, value -> {
			try {
				setter.accept(Integer.parseInt(value));
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be an integer");
			}
		});
	}

	private void longValue(String name, Consumer<Long> setter) {
		string(name, value -> {
			try {
				setter.accept(Long.parseLong(value));
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be an integer");
			}
		});
	}

	private static String zone(String value) {
		try {
			return ZoneId.of(value).getId();
		}
		catch (DateTimeException e) {
			throw new IllegalArgumentException("Invalid JIRA_QUERY_ZONE '" + value + "': " + e.getMessage());
		}
	}

}
