package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Utility for JsonNode navigation. Missing and JSON {@code null} nodes are both treated
 * as absent.
 */
public class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	/**
	 * Jira's timestamp format, e.g. {@code 2024-01-15T10:30:00.000+0000}.
	 */
	private static final DateTimeFormatter JIRA_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

	public Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return isAbsent(target) ? Optional.empty() : Optional.of(target.asText());
	}

	public Optional<Integer> getInt(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return isAbsent(target) || !target.canConvertToInt() ? Optional.empty() : Optional.of(target.asInt());
	}

	public Optional<Instant> getInstant(JsonNode node, String... path) {
		return getString(node, path).flatMap(JsonNodeUtils::parseTimestamp);
	}

	public List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);

		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}

		return List.of();
	}

	/**
	 * Parse a Jira or ISO-8601 offset timestamp.
	 * @param value the timestamp text
	 * @return the instant, or empty if the text matches neither format
	 */
	static Optional<Instant> parseTimestamp(String value) {
		try {
			return Optional.of(OffsetDateTime.parse(value, JIRA_TIMESTAMP).toInstant());
		}
		catch (DateTimeParseException e) {
			// fall through to ISO-8601
		}
		try {
			return Optional.of(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse timestamp: {}", value);
			return Optional.empty();
		}
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

	private static boolean isAbsent(JsonNode node) {
		return node.isMissingNode() || node.isNull();
	}

}
