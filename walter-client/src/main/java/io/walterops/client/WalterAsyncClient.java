/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.walterops.spec.CancellationToken;
import io.walterops.spec.McpClientSession;
import io.walterops.spec.McpClientTransport;
import io.walterops.spec.McpSchema;
import io.walterops.spec.WalterClientInfo;
import io.walterops.spec.WalterSchema;
import io.walterops.spec.WalterSchema.ChatResponse;
import io.walterops.spec.WalterSchema.ResponseStatus;
import io.walterops.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reactive client for the Walter agent service.
 *
 * <p>
 * Every operation is a tool call on a lazily established MCP session, see
 * {@link McpClientSession}. Each operation accepts a {@link CancellationToken}; the
 * overloads without one cannot be cancelled except by disposing the subscription.
 * </p>
 *
 * <pre>{@code
 * WalterAsyncClient client = WalterAsyncClient
 *     .builder(HttpClientJsonRpcTransport.builder("https://walterops.com").token(token).build())
 *     .build();
 *
 * client.createChat()
 *     .flatMap(chatId -> client.chatStreaming(chatId, "check disk usage on web-1", System.out::println))
 *     .subscribe(answer -> System.out.println(answer.getResponse()));
 * }</pre>
 */
public class WalterAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(WalterAsyncClient.class);

	private final McpClientSession session;

	private final WalterResponseDecoder decoder;

	private final ChatResponsePoller poller;

	WalterAsyncClient(McpClientSession session, WalterResponseDecoder decoder, ChatResponsePoller poller) {
		Assert.notNull(session, "The session can not be null");
		Assert.notNull(decoder, "The decoder can not be null");
		Assert.notNull(poller, "The poller can not be null");
		this.session = session;
		this.decoder = decoder;
		this.poller = poller;
	}

	public static Builder builder(McpClientTransport transport) {
		return new Builder(transport);
	}

	/**
	 * @return the session this client runs its tool calls on
	 */
	public McpClientSession getSession() {
		return this.session;
	}

	// --------------------------
	// Chats
	// --------------------------

	public Mono<String> createChat() {
		return createChat(CancellationToken.NONE);
	}

	/**
	 * Starts a new conversation.
	 * @return the id of the new chat
	 */
	public Mono<String> createChat(CancellationToken cancellation) {
		return callTool(WalterSchema.TOOL_START_CHAT, Collections.<String, Object>emptyMap(), cancellation)
			.map(this.decoder::decodeChatId);
	}

	public Mono<List<WalterSchema.Chat>> listChats() {
		return listChats(CancellationToken.NONE);
	}

	public Mono<List<WalterSchema.Chat>> listChats(CancellationToken cancellation) {
		return callTool(WalterSchema.TOOL_LIST_CHATS, Collections.<String, Object>emptyMap(), cancellation)
			.map(this.decoder::decodeChats);
	}

	public Mono<WalterSchema.PendingExchange> sendMessage(String chatId, String message) {
		return sendMessage(chatId, message, CancellationToken.NONE);
	}

	/**
	 * Submits a message without waiting for the answer. Poll it with
	 * {@link #getResponse(String, CancellationToken)} or use
	 * {@link #chatStreaming(String, String, Consumer, CancellationToken)} instead.
	 */
	public Mono<WalterSchema.PendingExchange> sendMessage(String chatId, String message,
			CancellationToken cancellation) {
		Assert.hasText(chatId, "chatId must not be empty");
		Assert.notNull(message, "message must not be null");
		Map<String, Object> arguments = new LinkedHashMap<>();
		arguments.put("chat_id", chatId);
		arguments.put("message", message);
		return callTool(WalterSchema.TOOL_SEND_MESSAGE, arguments, cancellation)
			.map(this.decoder::decodePendingExchange);
	}

	public Mono<ResponseStatus> getResponse(String requestId) {
		return getResponse(requestId, CancellationToken.NONE);
	}

	public Mono<ResponseStatus> getResponse(String requestId, CancellationToken cancellation) {
		Assert.hasText(requestId, "requestId must not be empty");
		return callTool(WalterSchema.TOOL_GET_RESPONSE, Collections.<String, Object>singletonMap("request_id", requestId),
				cancellation)
			.map(this.decoder::decodeResponseStatus);
	}

	public Mono<WalterSchema.CancelResult> cancelProcessing(String chatId) {
		return cancelProcessing(chatId, CancellationToken.NONE);
	}

	/**
	 * Asks the server to stop the work running in a chat. The chat stays usable.
	 */
	public Mono<WalterSchema.CancelResult> cancelProcessing(String chatId, CancellationToken cancellation) {
		Assert.hasText(chatId, "chatId must not be empty");
		return callTool(WalterSchema.TOOL_CANCEL, Collections.<String, Object>singletonMap("chat_id", chatId),
				cancellation)
			.map(this.decoder::decodeCancelResult);
	}

	public Mono<ChatResponse> chatStreaming(String chatId, String message, Consumer<String> onPartial) {
		return chatStreaming(chatId, message, onPartial, CancellationToken.NONE);
	}

	/**
	 * Sends a message and waits for the complete answer, reporting partial output as it
	 * changes.
	 * @param chatId the chat to continue
	 * @param message the message to send
	 * @param onPartial receives each new partial output, may be {@code null}
	 * @param cancellation aborts the wait; the server-side work is not cancelled, see
	 * {@link #cancelProcessing(String, CancellationToken)}
	 * @return the final answer; fails with {@code WalterTaskException} when the server
	 * reports an error, {@code WalterTimeoutException} when no answer arrives in time and
	 * {@code WalterCancelledException} when cancelled
	 */
	public Mono<ChatResponse> chatStreaming(String chatId, String message, Consumer<String> onPartial,
			CancellationToken cancellation) {
		CancellationToken token = CancellationToken.orNone(cancellation);
		return this.poller.stream(sendMessage(chatId, message, token), requestId -> getResponse(requestId, token),
				onPartial, token);
	}

	// --------------------------
	// Turfs
	// --------------------------

	public Mono<List<WalterSchema.Turf>> listTurfs() {
		return listTurfs(CancellationToken.NONE);
	}

	public Mono<List<WalterSchema.Turf>> listTurfs(CancellationToken cancellation) {
		return callTool(WalterSchema.TOOL_LIST_TURFS, Collections.<String, Object>emptyMap(), cancellation)
			.map(this.decoder::decodeTurfs);
	}

	public Mono<WalterSchema.TurfSearchResult> searchTurfs(WalterSchema.TurfFilter filter) {
		return searchTurfs(filter, CancellationToken.NONE);
	}

	/**
	 * Searches connected systems. Only the criteria set on {@code filter} are sent.
	 */
	public Mono<WalterSchema.TurfSearchResult> searchTurfs(WalterSchema.TurfFilter filter,
			CancellationToken cancellation) {
		Assert.notNull(filter, "filter must not be null");
		return callTool(WalterSchema.TOOL_SEARCH_TURFS, filter.toArguments(), cancellation)
			.map(this.decoder::decodeTurfSearch);
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	public Mono<Void> closeGracefully() {
		return this.session.closeGracefully();
	}

	private Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments,
			CancellationToken cancellation) {
		return this.session.callTool(name, arguments, cancellation)
			.doOnError(ex -> logger.debug("Tool {} failed: {}", name, ex.toString()));
	}

	public static class Builder {

		private final McpClientTransport transport;

		private ObjectMapper objectMapper = new ObjectMapper();

		private McpSchema.Implementation clientInfo = WalterClientInfo.implementation();

		private String protocolVersion = McpSchema.LATEST_PROTOCOL_VERSION;

		private int maxRequestId = McpClientSession.DEFAULT_MAX_REQUEST_ID;

		private Duration settleDelay = ChatResponsePoller.DEFAULT_SETTLE_DELAY;

		private Duration streamDeadline = ChatResponsePoller.DEFAULT_DEADLINE;

		private Duration pollBackoff = ChatResponsePoller.DEFAULT_BACKOFF;

		private int maxConsecutivePollFailures = ChatResponsePoller.DEFAULT_MAX_CONSECUTIVE_FAILURES;

		private Duration minRetryInterval = ChatResponsePoller.DEFAULT_MIN_RETRY_INTERVAL;

		private Builder(McpClientTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Sets the identity announced in the handshake.
		 */
		public Builder clientInfo(McpSchema.Implementation clientInfo) {
			Assert.notNull(clientInfo, "clientInfo must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public Builder protocolVersion(String protocolVersion) {
			Assert.hasText(protocolVersion, "protocolVersion must not be empty");
			this.protocolVersion = protocolVersion;
			return this;
		}

		/**
		 * Sets the value after which request ids wrap back to 1.
		 */
		public Builder maxRequestId(int maxRequestId) {
			Assert.isTrue(maxRequestId > 0, "maxRequestId must be positive");
			this.maxRequestId = maxRequestId;
			return this;
		}

		/**
		 * Sets how long a streamed message is left alone before its first poll.
		 */
		public Builder settleDelay(Duration settleDelay) {
			this.settleDelay = settleDelay;
			return this;
		}

		/**
		 * Sets how long a streamed message may take, counted from its submission.
		 */
		public Builder streamDeadline(Duration streamDeadline) {
			this.streamDeadline = streamDeadline;
			return this;
		}

		/**
		 * Sets the wait after the first failed poll. It doubles with every further
		 * consecutive failure.
		 */
		public Builder pollBackoff(Duration pollBackoff) {
			this.pollBackoff = pollBackoff;
			return this;
		}

		public Builder maxConsecutivePollFailures(int maxConsecutivePollFailures) {
			this.maxConsecutivePollFailures = maxConsecutivePollFailures;
			return this;
		}

		/**
		 * Sets the lower bound applied to the retry interval suggested by the server.
		 */
		public Builder minRetryInterval(Duration minRetryInterval) {
			this.minRetryInterval = minRetryInterval;
			return this;
		}

		public WalterAsyncClient build() {
			McpClientSession session = new McpClientSession(this.transport, this.objectMapper, this.clientInfo,
					this.protocolVersion, this.maxRequestId);
			ChatResponsePoller poller = new ChatResponsePoller(this.settleDelay, this.streamDeadline,
					this.pollBackoff, this.maxConsecutivePollFailures, this.minRetryInterval);
			return new WalterAsyncClient(session, new WalterResponseDecoder(this.objectMapper), poller);
		}

	}

}
