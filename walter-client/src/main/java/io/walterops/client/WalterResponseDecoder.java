/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.walterops.spec.McpSchema;
import io.walterops.spec.WalterDecodeException;
import io.walterops.spec.WalterSchema;
import io.walterops.spec.WalterSchema.ResponseStatus;
import io.walterops.util.Assert;
import io.walterops.util.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Turns the text payload of a Walter tool result into domain values.
 * <p>
 * Required fields that are absent or of the wrong type are rejected with a
 * {@link WalterDecodeException} naming the record, its path and the field. Optional
 * fields of the wrong type are treated as absent.
 */
public class WalterResponseDecoder {

	static final int MAX_PREVIEW = 200;

	static final double DEFAULT_RETRY_AFTER_SECONDS = 4;

	private static final String CHAT = "Chat";

	private static final String TURF = "Turf";

	private static final String RESPONSE_STATUS = "ResponseStatus";

	private final ObjectMapper objectMapper;

	public WalterResponseDecoder(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "The objectMapper can not be null");
		this.objectMapper = objectMapper;
	}

	/**
	 * Parses the concatenated text content of a tool result as JSON.
	 * @throws WalterDecodeException if the text is not a JSON document
	 */
	public JsonNode parseJson(McpSchema.CallToolResult result) {
		String text = result.text();
		JsonNode node;
		try {
			node = this.objectMapper.reader()
				.with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
				.readTree(text);
		}
		catch (JsonProcessingException e) {
			throw notJson(text);
		}
		if (node == null || node.isMissingNode()) {
			throw notJson(text);
		}
		return node;
	}

	public String decodeChatId(McpSchema.CallToolResult result) {
		JsonNode data = requireObject(parseJson(result), "createChat", null);
		return requireString(data, "chat_id", "createChat", null);
	}

	public List<WalterSchema.Chat> decodeChats(McpSchema.CallToolResult result) {
		JsonNode data = requireObject(parseJson(result), "listChats", null);
		return requireArray(data, "chats", "listChats", this::decodeChat);
	}

	public WalterSchema.PendingExchange decodePendingExchange(McpSchema.CallToolResult result) {
		JsonNode data = requireObject(parseJson(result), "sendMessage", null);
		return new WalterSchema.PendingExchange(requireString(data, "request_id", "sendMessage", null),
				requireString(data, "chat_id", "sendMessage", null));
	}

	public ResponseStatus decodeResponseStatus(McpSchema.CallToolResult result) {
		return decodeResponseStatus(parseJson(result), "getResponse");
	}

	public WalterSchema.CancelResult decodeCancelResult(McpSchema.CallToolResult result) {
		JsonNode data = requireObject(parseJson(result), "cancelProcessing", null);
		return new WalterSchema.CancelResult(requireString(data, "status", "cancelProcessing", null),
				optionalString(data, "message"));
	}

	public List<WalterSchema.Turf> decodeTurfs(McpSchema.CallToolResult result) {
		JsonNode data = requireObject(parseJson(result), "listTurfs", null);
		return requireArray(data, "turfs", "listTurfs", this::decodeTurf);
	}

	public WalterSchema.TurfSearchResult decodeTurfSearch(McpSchema.CallToolResult result) {
		JsonNode data = requireObject(parseJson(result), "searchTurfs", null);
		List<WalterSchema.Turf> turfs = requireArray(data, "turfs", "searchTurfs", this::decodeTurf);
		return new WalterSchema.TurfSearchResult(turfs, requireCount(data, "count", "searchTurfs", null));
	}

	WalterSchema.Chat decodeChat(JsonNode raw, String path) {
		String context = path + " (" + CHAT + ")";
		JsonNode obj = requireObject(raw, context, CHAT);
		return new WalterSchema.Chat(requireString(obj, "id", context, CHAT), optionalString(obj, "name"),
				optionalString(obj, "first_message"), optionalString(obj, "last_message"),
				optionalString(obj, "last_activity_at"), requireString(obj, "status", context, CHAT));
	}

	WalterSchema.Turf decodeTurf(JsonNode raw, String path) {
		String context = path + " (" + TURF + ")";
		JsonNode obj = requireObject(raw, context, TURF);
		return new WalterSchema.Turf(requireString(obj, "turf_id", context, TURF),
				requireString(obj, "name", context, TURF), requireString(obj, "type", context, TURF),
				requireString(obj, "status", context, TURF), optionalString(obj, "os"),
				optionalString(obj, "hostname"), optionalString(obj, "arch"), optionalString(obj, "version"));
	}

	ResponseStatus decodeResponseStatus(JsonNode raw, String path) {
		String context = path + " (" + RESPONSE_STATUS + ")";
		JsonNode obj = requireObject(raw, context, RESPONSE_STATUS);
		String status = requireString(obj, "status", context, RESPONSE_STATUS);
		switch (status) {
			case "processing":
				JsonNode retryAfter = obj.get("retry_after_seconds");
				double seconds = retryAfter != null && retryAfter.isNumber() ? retryAfter.doubleValue()
						: DEFAULT_RETRY_AFTER_SECONDS;
				return new ResponseStatus.Processing(optionalString(obj, "partial"), seconds);
			case "complete":
				return new ResponseStatus.Complete(requireString(obj, "response", context, RESPONSE_STATUS));
			case "error":
				return new ResponseStatus.Error(requireString(obj, "error", context, RESPONSE_STATUS));
			default:
				throw new WalterDecodeException(RESPONSE_STATUS, "status",
						context + ": unknown status '" + status + "'");
		}
	}

	private static WalterDecodeException notJson(String text) {
		return new WalterDecodeException("Expected JSON from Walter, got: " + Utils.truncate(text, MAX_PREVIEW));
	}

	private static JsonNode requireObject(JsonNode value, String context, String recordKind) {
		if (value == null || !value.isObject()) {
			throw new WalterDecodeException(recordKind, null,
					context + ": expected object, got " + McpSchema.nodeType(value));
		}
		return value;
	}

	private static String requireString(JsonNode obj, String field, String context, String recordKind) {
		JsonNode value = obj.get(field);
		if (value == null || !value.isTextual()) {
			throw fieldError(recordKind, field, context, "string", value);
		}
		return value.textValue();
	}

	private static int requireCount(JsonNode obj, String field, String context, String recordKind) {
		JsonNode value = obj.get(field);
		if (value == null || !value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 0) {
			throw fieldError(recordKind, field, context, "non-negative integer", value);
		}
		return value.intValue();
	}

	private static String optionalString(JsonNode obj, String field) {
		JsonNode value = obj.get(field);
		return value != null && value.isTextual() ? value.textValue() : null;
	}

	private static <T> List<T> requireArray(JsonNode obj, String field, String context,
			BiFunction<JsonNode, String, T> itemDecoder) {
		JsonNode value = obj.get(field);
		if (value == null || !value.isArray()) {
			throw fieldError(null, field, context, "array", value);
		}
		List<T> items = new ArrayList<>(value.size());
		for (int i = 0; i < value.size(); i++) {
			items.add(itemDecoder.apply(value.get(i), context + "." + field + "[" + i + "]"));
		}
		return Collections.unmodifiableList(items);
	}

	private static WalterDecodeException fieldError(String recordKind, String field, String context, String expected,
			JsonNode actual) {
		return new WalterDecodeException(recordKind, field,
				context + ": expected " + expected + " for '" + field + "', got " + McpSchema.nodeType(actual));
	}

}
