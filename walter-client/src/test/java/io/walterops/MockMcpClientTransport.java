/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walterops.spec.CancellationToken;
import io.walterops.spec.McpClientTransport;
import io.walterops.spec.McpSchema;
import io.walterops.spec.McpTransportSession;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory {@link McpClientTransport} that answers the handshake and dispatches tool
 * calls to per-tool handlers. Every handshake hands out a fresh session id
 * ({@code session-1}, {@code session-2}, ...).
 */
public class MockMcpClientTransport implements McpClientTransport {

	public static final ObjectMapper MAPPER = new ObjectMapper();

	private final List<Sent> sent = new CopyOnWriteArrayList<>();

	private final List<McpSchema.JSONRPCNotification> notifications = new CopyOnWriteArrayList<>();

	private final Map<String, Function<JsonNode, Mono<JsonNode>>> toolHandlers = new ConcurrentHashMap<>();

	private final AtomicInteger handshakes = new AtomicInteger();

	private volatile Function<McpSchema.JSONRPCRequest, Mono<JsonNode>> initializeHandler = request -> Mono
		.just(initializeResult());

	private volatile boolean closed;

	public MockMcpClientTransport onInitialize(Function<McpSchema.JSONRPCRequest, Mono<JsonNode>> handler) {
		this.initializeHandler = handler;
		return this;
	}

	/**
	 * Registers the handler for a tool. It receives the call's {@code arguments}.
	 */
	public MockMcpClientTransport onTool(String name, Function<JsonNode, Mono<JsonNode>> handler) {
		this.toolHandlers.put(name, handler);
		return this;
	}

	@Override
	public Mono<JsonNode> sendRequest(McpTransportSession session, McpSchema.JSONRPCRequest request,
			CancellationToken cancellation) {
		return Mono.defer(() -> {
			JsonNode params = MAPPER.valueToTree(request.getParams());
			this.sent.add(new Sent(request, params, session.sessionId().orElse(null)));
			if (McpSchema.METHOD_INITIALIZE.equals(request.getMethod())) {
				return this.initializeHandler.apply(request)
					.doOnNext(result -> session.markSessionId("session-" + this.handshakes.incrementAndGet()));
			}
			if (McpSchema.METHOD_TOOLS_CALL.equals(request.getMethod())) {
				String name = params.path("name").asText();
				Function<JsonNode, Mono<JsonNode>> handler = this.toolHandlers.get(name);
				if (handler == null) {
					return Mono.error(new IllegalStateException("No handler for tool " + name));
				}
				return handler.apply(params.path("arguments"));
			}
			return Mono.error(new IllegalStateException("Unexpected method " + request.getMethod()));
		});
	}

	@Override
	public Mono<Void> sendNotification(McpTransportSession session, McpSchema.JSONRPCNotification notification,
			CancellationToken cancellation) {
		return Mono.fromRunnable(() -> this.notifications.add(notification));
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> this.closed = true);
	}

	public List<Sent> requests(String method) {
		return this.sent.stream().filter(s -> s.request.getMethod().equals(method)).collect(Collectors.toList());
	}

	public List<Sent> toolCalls(String name) {
		return requests(McpSchema.METHOD_TOOLS_CALL).stream()
			.filter(s -> name.equals(s.params.path("name").asText()))
			.collect(Collectors.toList());
	}

	public List<Sent> allRequests() {
		return this.sent;
	}

	public List<McpSchema.JSONRPCNotification> notifications() {
		return this.notifications;
	}

	public boolean isClosed() {
		return this.closed;
	}

	// --------------------------
	// Tool result fixtures
	// --------------------------

	public static JsonNode initializeResult() {
		ObjectNode result = MAPPER.createObjectNode();
		result.put("protocolVersion", McpSchema.LATEST_PROTOCOL_VERSION);
		result.putObject("serverInfo").put("name", "walter").put("version", "test");
		return result;
	}

	public static JsonNode textResult(String... texts) {
		return toolResult(false, texts);
	}

	public static JsonNode errorResult(String... texts) {
		return toolResult(true, texts);
	}

	public static JsonNode toolResult(boolean isError, String... texts) {
		ObjectNode result = MAPPER.createObjectNode();
		ArrayNode content = result.putArray("content");
		for (String text : texts) {
			content.addObject().put("type", "text").put("text", text);
		}
		result.put("isError", isError);
		return result;
	}

	public static JsonNode json(String json) {
		try {
			return MAPPER.readTree(json);
		}
		catch (Exception e) {
			throw new IllegalArgumentException(json, e);
		}
	}

	/**
	 * A request as it reached the transport.
	 */
	public static final class Sent {

		public final McpSchema.JSONRPCRequest request;

		public final JsonNode params;

		/** Session id attached to the request, {@code null} if none */
		public final String sessionId;

		Sent(McpSchema.JSONRPCRequest request, JsonNode params, String sessionId) {
			this.request = request;
			this.params = params;
			this.sessionId = sessionId;
		}

		public int id() {
			return ((Number) this.request.getId()).intValue();
		}

	}

}
