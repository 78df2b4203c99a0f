/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.util;

import java.net.URI;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given string has no non-whitespace character.
	 * @param str the string to check
	 * @return {@code true} if the string is {@code null}, empty or whitespace only
	 */
	public static boolean isBlank(String str) {
		return str == null || str.trim().isEmpty();
	}

	/**
	 * Shortens a string to at most {@code maxLength} characters, marking the cut with an
	 * ellipsis.
	 * @param text the text to shorten, may be {@code null}
	 * @param maxLength maximum number of characters kept from the original text
	 * @return the shortened text, or an empty string for {@code null}
	 */
	public static String truncate(String text, int maxLength) {
		if (text == null) {
			return "";
		}
		return text.length() > maxLength ? text.substring(0, maxLength) + "…" : text;
	}

	/**
	 * Appends an endpoint path to a base URI. Unlike {@link URI#resolve(String)} the path
	 * of the base URI is kept, so {@code https://host/api} and {@code /mcp} give
	 * {@code https://host/api/mcp}. Absolute endpoints are returned unchanged.
	 * @param baseUri the base URI
	 * @param endpoint the endpoint path or absolute URL
	 * @return the resolved URI
	 */
	public static URI resolveUri(URI baseUri, String endpoint) {
		URI endpointUri = URI.create(endpoint);
		if (endpointUri.isAbsolute()) {
			return endpointUri;
		}
		String base = baseUri.toString();
		while (base.endsWith("/")) {
			base = base.substring(0, base.length() - 1);
		}
		return URI.create(base + (endpoint.startsWith("/") ? endpoint : "/" + endpoint));
	}

}
