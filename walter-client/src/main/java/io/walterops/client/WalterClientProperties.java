/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.client;

import io.walterops.client.transport.HttpClientJsonRpcTransport;
import io.walterops.util.Utils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

/**
 * Connection settings supplied by the host application, validated.
 * <p>
 * Recognized keys: {@code token} (required, the Walter API token) and {@code url}
 * (optional, defaults to {@value #DEFAULT_URL}).
 */
public final class WalterClientProperties {

	public static final String DEFAULT_URL = "https://walterops.com";

	public static final String TOKEN_KEY = "token";

	public static final String URL_KEY = "url";

	private final String url;

	private final String token;

	private WalterClientProperties(String url, String token) {
		this.url = url;
		this.token = token;
	}

	/**
	 * Validates raw configuration.
	 * @param raw configuration map, typically parsed from the host's config file
	 * @return the validated properties
	 * @throws IllegalArgumentException naming the offending key
	 */
	public static WalterClientProperties from(Map<String, ?> raw) {
		if (raw == null) {
			throw new IllegalArgumentException(
					"Walter client requires configuration with at least a '" + TOKEN_KEY + "' entry");
		}

		Object token = raw.get(TOKEN_KEY);
		if (!(token instanceof String) || Utils.isBlank((String) token)) {
			throw new IllegalArgumentException(
					"Walter client config requires '" + TOKEN_KEY + "' (your Walter API token)");
		}

		String url = DEFAULT_URL;
		Object rawUrl = raw.get(URL_KEY);
		if (rawUrl instanceof String && !Utils.isBlank((String) rawUrl)) {
			url = normalizeUrl((String) rawUrl);
		}

		return new WalterClientProperties(url, ((String) token).trim());
	}

	private static String normalizeUrl(String rawUrl) {
		String trimmed = rawUrl.trim();
		while (trimmed.endsWith("/")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1);
		}
		String detail;
		try {
			URI uri = new URI(trimmed);
			String scheme = uri.getScheme();
			if (!uri.isAbsolute() || uri.getHost() == null) {
				detail = "invalid format";
			}
			else if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
				detail = "must use http or https";
			}
			else {
				return trimmed;
			}
		}
		catch (URISyntaxException e) {
			detail = e.getReason();
		}
		throw new IllegalArgumentException("Walter client config '" + URL_KEY + "' is not a valid URL: " + detail);
	}

	/**
	 * @return base URL without trailing slash
	 */
	public String getUrl() {
		return this.url;
	}

	public String getToken() {
		return this.token;
	}

	/**
	 * @return a transport builder preset with these settings
	 */
	public HttpClientJsonRpcTransport.Builder transportBuilder() {
		return HttpClientJsonRpcTransport.builder(this.url).token(this.token);
	}

	@Override
	public String toString() {
		return "WalterClientProperties[url=" + this.url + ", token=****]";
	}

}
