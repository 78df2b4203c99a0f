/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.client.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.walterops.spec.CancellationToken;
import io.walterops.spec.McpClientTransport;
import io.walterops.spec.McpError;
import io.walterops.spec.McpProtocolException;
import io.walterops.spec.McpSchema;
import io.walterops.spec.McpTransportException;
import io.walterops.spec.McpTransportSession;
import io.walterops.spec.McpTransportSessionNotFoundException;
import io.walterops.spec.WalterClientInfo;
import io.walterops.util.Assert;
import io.walterops.util.Utils;
import lombok.Value;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Plain request/response JSON-RPC over HTTP POST, as spoken by the Walter {@code /mcp}
 * endpoint.
 *
 * <p>
 * Every call carries the bearer token, the client identity and, once the server handed
 * one out, the session identifier. Each call is bounded by its own timeout and is raced
 * against the caller's {@link CancellationToken}; whichever fires first aborts the
 * underlying OkHttp {@link Call}.
 * </p>
 * <p>
 * Failures are classified so the session layer can react to them: a {@code 404} becomes
 * {@link McpTransportSessionNotFoundException}, any other non-success status an
 * {@link McpTransportException} carrying that status, a body that is not a JSON-RPC
 * envelope an {@link McpProtocolException} and a JSON-RPC {@code error} member an
 * {@link McpError}.
 * </p>
 */
public class HttpClientJsonRpcTransport implements McpClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpClientJsonRpcTransport.class);

	private static final String DEFAULT_ENDPOINT = "/mcp";

	private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private static final String APPLICATION_JSON = "application/json";

	private static final MediaType JSON_MEDIA_TYPE = MediaType.get(APPLICATION_JSON);

	public static final String SESSION_ID_HEADER = "Mcp-Session-Id";

	public static final String CLIENT_IDENTITY_HEADER = "User-Agent";

	/** Longest part of an unparseable body quoted in error messages */
	private static final int MAX_BODY_SNIPPET = 200;

	/**
	 * HTTP client for sending messages to the server. Uses HTTP POST over the message
	 * endpoint
	 */
	private final OkHttpClient httpClient;

	private final Consumer<Request.Builder> requestCustomizer;

	private final ObjectMapper objectMapper;

	private final URI endpointUri;

	private final String token;

	private final McpSchema.Implementation clientInfo;

	private final Duration requestTimeout;

	private HttpClientJsonRpcTransport(ObjectMapper objectMapper, OkHttpClient httpClient,
			Consumer<Request.Builder> requestCustomizer, URI endpointUri, String token,
			McpSchema.Implementation clientInfo, Duration requestTimeout) {
		this.objectMapper = objectMapper;
		this.httpClient = httpClient;
		this.requestCustomizer = requestCustomizer;
		this.endpointUri = endpointUri;
		this.token = token;
		this.clientInfo = clientInfo;
		this.requestTimeout = requestTimeout;
	}

	public static Builder builder(String baseUri) {
		return new Builder(baseUri);
	}

	public URI getEndpointUri() {
		return this.endpointUri;
	}

	@Override
	public Mono<JsonNode> sendRequest(McpTransportSession session, McpSchema.JSONRPCRequest request,
			CancellationToken cancellation) {
		return Mono.defer(() -> {
			logger.debug("Sending request {}", request);
			Request httpRequest = buildRequest(session, toJson(request));
			return exchange(httpRequest, request.getMethod(), cancellation)
				.map(response -> toResult(session, request.getMethod(), response));
		});
	}

	@Override
	public Mono<Void> sendNotification(McpTransportSession session, McpSchema.JSONRPCNotification notification,
			CancellationToken cancellation) {
		return Mono.defer(() -> {
			logger.debug("Sending notification {}", notification);
			Request httpRequest = buildRequest(session, toJson(notification));
			return exchange(httpRequest, notification.getMethod(), cancellation).flatMap(response -> {
				if (!response.isSuccessful()) {
					return Mono.<Void>error(statusError(session, notification.getMethod(), response));
				}
				return Mono.<Void>empty();
			});
		});
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			logger.debug("Graceful close triggered");
			this.httpClient.dispatcher().cancelAll();
		});
	}

	private Request buildRequest(McpTransportSession session, String jsonBody) {
		Request.Builder requestBuilder = new Request.Builder();
		this.requestCustomizer.accept(requestBuilder);

		requestBuilder.url(this.endpointUri.toString())
			.header("Authorization", "Bearer " + this.token)
			.header("Content-Type", APPLICATION_JSON)
			.header("Accept", APPLICATION_JSON)
			.header(CLIENT_IDENTITY_HEADER, this.clientInfo.toUserAgent())
			.post(RequestBody.create(jsonBody, JSON_MEDIA_TYPE));

		if (session.sessionId().isPresent()) {
			requestBuilder.header(SESSION_ID_HEADER, session.sessionId().get());
		}
		return requestBuilder.build();
	}

	/**
	 * Executes the call, bounded by the per-call timeout and the caller's cancellation.
	 * Unsubscribing cancels the OkHttp call.
	 */
	private Mono<HttpResponse> exchange(Request request, String method, CancellationToken cancellation) {
		Mono<HttpResponse> call = Mono.create(sink -> {
			Call httpCall = this.httpClient.newCall(request);
			sink.onCancel(httpCall::cancel);
			httpCall.enqueue(new Callback() {
				@Override
				public void onFailure(@NotNull Call call, @NotNull IOException e) {
					if (call.isCanceled()) {
						logger.debug("{} call cancelled", method);
						return;
					}
					sink.error(new McpTransportException("Walter request '" + method + "' failed: " + e.getMessage(), e));
				}

				@Override
				public void onResponse(@NotNull Call call, @NotNull Response response) {
					try (Response r = response) {
						ResponseBody body = r.body();
						sink.success(new HttpResponse(r.code(), r.message(), r.header(SESSION_ID_HEADER),
								body != null ? body.string() : ""));
					}
					catch (IOException e) {
						sink.error(new McpTransportException(
								"Failed to read Walter response to '" + method + "': " + e.getMessage(), e));
					}
				}
			});
		});

		Mono<HttpResponse> bounded = call.timeout(this.requestTimeout,
				Mono.error(() -> new McpTransportException(
						"Walter request '" + method + "' timed out after " + this.requestTimeout.toMillis() + " ms",
						McpTransportException.NO_STATUS)));

		return CancellationToken.orNone(cancellation).guard(bounded);
	}

	private JsonNode toResult(McpTransportSession session, String method, HttpResponse response) {
		if (!response.isSuccessful()) {
			throw statusError(session, method, response);
		}

		if (session.markSessionId(response.getSessionId())) {
			logger.debug("Server assigned session id {}", response.getSessionId());
		}

		JsonNode envelope;
		try {
			envelope = this.objectMapper.readTree(response.getBody());
		}
		catch (JsonProcessingException e) {
			throw new McpProtocolException(
					"Expected JSON from Walter, got: " + Utils.truncate(response.getBody(), MAX_BODY_SNIPPET), e);
		}
		if (envelope == null || !envelope.isObject()) {
			throw new McpProtocolException("Expected JSON-RPC response object from Walter, got: "
					+ Utils.truncate(response.getBody(), MAX_BODY_SNIPPET));
		}

		McpSchema.JSONRPCResponse rpcResponse;
		try {
			rpcResponse = this.objectMapper.treeToValue(envelope, McpSchema.JSONRPCResponse.class);
		}
		catch (JsonProcessingException | IllegalArgumentException e) {
			throw new McpProtocolException("Malformed JSON-RPC response to '" + method + "': "
					+ Utils.truncate(response.getBody(), MAX_BODY_SNIPPET), e);
		}

		if (rpcResponse.getError() != null) {
			throw new McpError(rpcResponse.getError());
		}
		return rpcResponse.getResult() != null ? rpcResponse.getResult() : NullNode.getInstance();
	}

	private McpTransportException statusError(McpTransportSession session, String method, HttpResponse response) {
		if (response.getCode() == McpTransportSessionNotFoundException.NOT_FOUND) {
			return new McpTransportSessionNotFoundException(session.toString());
		}
		logger.debug("Walter answered {} with status {}", method, response.getCode());
		String reason = Utils.isBlank(response.getMessage()) ? "" : " " + response.getMessage();
		return new McpTransportException("Walter API error: " + response.getCode() + reason, response.getCode());
	}

	private String toJson(McpSchema.JSONRPCMessage message) {
		try {
			return this.objectMapper.writeValueAsString(message);
		}
		catch (IOException e) {
			throw new RuntimeException("Failed to serialize JSON-RPC message", e);
		}
	}

	@Value
	static class HttpResponse {

		int code;

		String message;

		String sessionId;

		String body;

		boolean isSuccessful() {
			return this.code >= 200 && this.code < 300;
		}

	}

	/**
	 * Builder for {@link HttpClientJsonRpcTransport}.
	 */
	public static class Builder {

		private final String baseUri;

		private ObjectMapper objectMapper;

		private OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder().connectTimeout(Duration.ofSeconds(10));

		private Consumer<Request.Builder> requestCustomizer = requestBuilder -> {
		};

		private String endpoint = DEFAULT_ENDPOINT;

		private String token;

		private McpSchema.Implementation clientInfo;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		/**
		 * Creates a new builder with the specified base URI.
		 * @param baseUri the base URI of the Walter server
		 */
		private Builder(String baseUri) {
			Assert.hasText(baseUri, "baseUri must not be empty");
			this.baseUri = baseUri;
		}

		/**
		 * Sets the HTTP client builder.
		 * @param clientBuilder the HTTP client builder
		 * @return this builder
		 */
		public Builder clientBuilder(OkHttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		/**
		 * Customizes the HTTP client builder.
		 * @param clientCustomizer the consumer to customize the HTTP client builder
		 * @return this builder
		 */
		public Builder customizeClient(final Consumer<OkHttpClient.Builder> clientCustomizer) {
			Assert.notNull(clientCustomizer, "clientCustomizer must not be null");
			clientCustomizer.accept(this.clientBuilder);
			return this;
		}

		/**
		 * Customizes every HTTP request before the protocol headers are applied.
		 * @param requestCustomizer the consumer to customize the HTTP request builder
		 * @return this builder
		 */
		public Builder customizeRequest(final Consumer<Request.Builder> requestCustomizer) {
			Assert.notNull(requestCustomizer, "requestCustomizer must not be null");
			this.requestCustomizer = requestCustomizer;
			return this;
		}

		/**
		 * Configure the {@link ObjectMapper} to use.
		 * @param objectMapper instance to use
		 * @return the builder instance
		 */
		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Configure the endpoint to make HTTP requests against.
		 * @param endpoint endpoint to use
		 * @return the builder instance
		 */
		public Builder endpoint(String endpoint) {
			Assert.hasText(endpoint, "endpoint must be a non-empty String");
			this.endpoint = endpoint;
			return this;
		}

		/**
		 * Configure the API token sent as bearer credential.
		 * @param token the Walter API token
		 * @return the builder instance
		 */
		public Builder token(String token) {
			Assert.hasText(token, "token must not be empty");
			this.token = token;
			return this;
		}

		/**
		 * Configure the identity sent in the {@value #CLIENT_IDENTITY_HEADER} header.
		 * @param clientInfo client name and version
		 * @return the builder instance
		 */
		public Builder clientInfo(McpSchema.Implementation clientInfo) {
			Assert.notNull(clientInfo, "clientInfo must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		/**
		 * Configure the timeout applied to every single HTTP exchange.
		 * @param requestTimeout the timeout, 30 seconds by default
		 * @return the builder instance
		 */
		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(), "requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * Construct a fresh instance of {@link HttpClientJsonRpcTransport} using the
		 * current builder configuration.
		 * @return a new instance of {@link HttpClientJsonRpcTransport}
		 */
		public HttpClientJsonRpcTransport build() {
			Assert.hasText(this.token, "token must be configured");
			ObjectMapper objectMapper = this.objectMapper != null ? this.objectMapper : new ObjectMapper();
			McpSchema.Implementation clientInfo = this.clientInfo != null ? this.clientInfo
					: WalterClientInfo.implementation();

			return new HttpClientJsonRpcTransport(objectMapper, this.clientBuilder.build(), this.requestCustomizer,
					Utils.resolveUri(URI.create(this.baseUri), this.endpoint), this.token, clientInfo,
					this.requestTimeout);
		}

	}

}
