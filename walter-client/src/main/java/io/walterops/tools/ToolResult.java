/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.tools;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a tool invocation as handed back to the agent host: text for the model plus
 * structured details for the host.
 */
@Value
public class ToolResult {

	String text;

	boolean isError;

	Map<String, Object> details;

	private ToolResult(String text, boolean isError, Map<String, Object> details) {
		this.text = text;
		this.isError = isError;
		this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
	}

	public static ToolResult success(String text) {
		return success(text, Collections.<String, Object>emptyMap());
	}

	public static ToolResult success(String text, Map<String, Object> details) {
		return new ToolResult(text, false, details);
	}

	public static ToolResult error(String message) {
		return error(message, Collections.<String, Object>emptyMap());
	}

	/**
	 * The text is prefixed with {@code Error: } and the message is repeated in the
	 * {@code error} detail.
	 */
	public static ToolResult error(String message, Map<String, Object> details) {
		Map<String, Object> merged = new LinkedHashMap<>();
		merged.put("error", message);
		merged.putAll(details);
		return new ToolResult("Error: " + message, true, merged);
	}

}
