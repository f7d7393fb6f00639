/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.util;

import java.util.UUID;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Truncates the given text to at most {@code maxLength} characters.
	 * @param text the text to truncate, may be {@code null}
	 * @param maxLength the maximum number of characters to keep
	 * @return the truncated text, or an empty string for {@code null}
	 */
	public static String truncate(@Nullable String text, int maxLength) {
		if (text == null) {
			return "";
		}
		return text.length() <= maxLength ? text : text.substring(0, Math.max(0, maxLength));
	}

	/**
	 * Generates a new correlation identifier for a logical backend call.
	 * @return a random UUID string
	 */
	public static String newCorrelationId() {
		return UUID.randomUUID().toString();
	}

}
