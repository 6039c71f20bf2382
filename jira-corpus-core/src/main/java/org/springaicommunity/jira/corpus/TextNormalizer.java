package org.springaicommunity.jira.corpus;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Whitespace normalization and length limits for corpus text.
 */
final class TextNormalizer {

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private TextNormalizer() {
	}

	/**
	 * Collapse every whitespace run to a single space and trim.
	 */
	static String normalize(@Nullable String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		return WHITESPACE.matcher(text).replaceAll(" ").trim();
	}

	/**
	 * Cut text to at most {@code maxLength} characters without splitting a surrogate pair.
	 */
	static String truncate(String text, int maxLength) {
		if (text.length() <= maxLength) {
			return text;
		}
		int end = maxLength;
		if (Character.isHighSurrogate(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(0, end);
	}

}
