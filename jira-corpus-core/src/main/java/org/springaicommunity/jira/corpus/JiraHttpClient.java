package org.springaicommunity.jira.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * HTTP client for the Jira REST API using the Java 11+ HttpClient.
 *
 * <p>
 * Classifies every outcome into a {@link FailureKind}: non-2xx statuses, timeouts,
 * transport failures and unparseable bodies are all surfaced as
 * {@link JiraApiException}. The {@code Retry-After} header of a 429 response is carried
 * on the exception.
 */
public class JiraHttpClient implements JiraClient {

	private static final Logger logger = LoggerFactory.getLogger(JiraHttpClient.class);

	private static final int MAX_LOGGED_BODY = 500;

	private static final Pattern DELTA_SECONDS = Pattern.compile("\\d{1,18}");

	private final HttpClient httpClient;

	private final String baseUrl;

	private final ObjectMapper objectMapper;

	private final Duration requestTimeout;

	public JiraHttpClient(String baseUrl, ObjectMapper objectMapper, Duration connectTimeout,
			Duration requestTimeout) {
		this.baseUrl = stripTrailingSlash(baseUrl);
		this.objectMapper = objectMapper;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public FetchResponse fetch(String path, Map<String, String> params) {
		URI uri = URI.create(buildUrl(path, params));
		logger.debug("GET {}", uri);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(requestTimeout)
			.header("Accept", "application/json")
			.header("User-Agent", "jira-corpus/1.0")
			.GET()
			.build();

		HttpResponse<String> response = send(request);
		int statusCode = response.statusCode();
		FailureKind kind = FailureKind.fromStatus(statusCode);
		logger.debug("GET {} returned {} in {}ms", uri, statusCode, System.currentTimeMillis() - start);

		if (kind == FailureKind.SUCCESS) {
			return new FetchResponse(statusCode, parseBody(uri, response.body()));
		}
		if (kind == FailureKind.RATE_LIMITED) {
			Duration retryAfter = response.headers()
				.firstValue("Retry-After")
				.map(value -> parseRetryAfter(value, Instant.now()))
				.orElse(null);
			throw new JiraApiException(kind, "Too Many Requests (429) for " + uri, statusCode, retryAfter);
		}
		logger.debug("Error body for {}: {}", uri, abbreviate(response.body()));
		throw new JiraApiException(kind, "Jira API error " + statusCode + " for " + uri, statusCode);
	}

	private HttpResponse<String> send(HttpRequest request) {
		try {
			return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
		}
		catch (HttpTimeoutException e) {
			throw new JiraApiException(FailureKind.TIMEOUT, "Request timed out: " + request.uri(), e);
		}
		catch (IOException e) {
			throw new JiraApiException(FailureKind.TIMEOUT, "HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new JiraApiException(FailureKind.TIMEOUT, "HTTP request interrupted", e);
		}
	}

	private JsonNode parseBody(URI uri, String body) {
		try {
			JsonNode node = objectMapper.readTree(body);
			if (node == null || node.isMissingNode()) {
				throw new JiraApiException(FailureKind.MALFORMED_RESPONSE, "Empty response body from " + uri, 200);
			}
			return node;
		}
		catch (JsonProcessingException e) {
			logger.warn("Malformed JSON from {}: {}", uri, abbreviate(body));
			throw new JiraApiException(FailureKind.MALFORMED_RESPONSE, "Malformed JSON from " + uri, e);
		}
	}

	String buildUrl(String path, Map<String, String> params) {
		String url = baseUrl + (path.startsWith("/") ? path : "/" + path);
		if (params.isEmpty()) {
			return url;
		}
		String query = params.entrySet()
			.stream()
			.map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
			.collect(Collectors.joining("&"));
		return url + "?" + query;
	}

	/**
	 * Parse a {@code Retry-After} header value, either delta-seconds or an HTTP-date.
	 * @param value the raw header value
	 * @param now reference time for HTTP-date values
	 * @return the delay, or null if the value cannot be parsed
	 */
	@Nullable
	static Duration parseRetryAfter(String value, Instant now) {
		String trimmed = value.trim();
		if (DELTA_SECONDS.matcher(trimmed).matches()) {
			return Duration.ofSeconds(Long.parseLong(trimmed));
		}
		try {
			Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
			Duration delay = Duration.between(now, at);
			return delay.isNegative() ? Duration.ZERO : delay;
		}
		catch (DateTimeParseException e) {
			logger.debug("Ignoring unparseable Retry-After value: {}", trimmed);
			return null;
		}
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private static String stripTrailingSlash(String url) {
		String result = url;
		while (result.endsWith("/")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

	private static String abbreviate(@Nullable String body) {
		if (body == null) {
			return "";
		}
		return body.length() > MAX_LOGGED_BODY ? body.substring(0, MAX_LOGGED_BODY) + "..." : body;
	}

}
