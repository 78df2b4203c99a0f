/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.walterops.MockMcpClientTransport;
import io.walterops.spec.CancellationToken;
import io.walterops.spec.McpClientSession;
import io.walterops.spec.McpSchema;
import io.walterops.spec.WalterCancelledException;
import io.walterops.spec.WalterDecodeException;
import io.walterops.spec.WalterSchema;
import io.walterops.spec.WalterSchema.ResponseStatus;
import io.walterops.spec.WalterToolException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static io.walterops.MockMcpClientTransport.errorResult;
import static io.walterops.MockMcpClientTransport.textResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(15)
class WalterAsyncClientTests {

	private MockMcpClientTransport transport;

	private WalterAsyncClient client;

	@BeforeEach
	void setUp() {
		transport = new MockMcpClientTransport();
		client = WalterAsyncClient.builder(transport).build();
	}

	private JsonNode onlyCallArguments(String tool) {
		List<MockMcpClientTransport.Sent> calls = transport.toolCalls(tool);
		assertThat(calls).hasSize(1);
		return calls.get(0).params.path("arguments");
	}

	@Test
	void testCreateChat() {
		transport.onTool("start_chat", args -> Mono.just(textResult("{\"chat_id\":\"chat_k7xm9pq3\"}")));

		StepVerifier.create(client.createChat()).expectNext("chat_k7xm9pq3").verifyComplete();

		assertThat(onlyCallArguments("start_chat").size()).isZero();
		assertThat(client.getSession().state()).isEqualTo(McpClientSession.State.READY);
	}

	@Test
	void testListChats() {
		transport.onTool("list_chats", args -> Mono.just(textResult(
				"{\"chats\":[{\"id\":\"chat_1\",\"name\":\"Nginx\",\"status\":\"idle\"}]}")));

		StepVerifier.create(client.listChats())
			.assertNext(chats -> assertThat(chats).extracting(WalterSchema.Chat::getId).containsExactly("chat_1"))
			.verifyComplete();
	}

	@Test
	void testSendMessageAndGetResponse() {
		transport.onTool("send_message",
				args -> Mono.just(textResult("{\"request_id\":\"req_1\",\"chat_id\":\"chat_1\"}")));
		transport.onTool("get_response", args -> Mono.just(textResult("{\"status\":\"complete\",\"response\":\"hi\"}")));

		StepVerifier.create(client.sendMessage("chat_1", "check disk"))
			.expectNext(new WalterSchema.PendingExchange("req_1", "chat_1"))
			.verifyComplete();
		StepVerifier.create(client.getResponse("req_1"))
			.expectNext(new ResponseStatus.Complete("hi"))
			.verifyComplete();

		JsonNode sendArgs = onlyCallArguments("send_message");
		assertThat(sendArgs.path("chat_id").asText()).isEqualTo("chat_1");
		assertThat(sendArgs.path("message").asText()).isEqualTo("check disk");
		assertThat(onlyCallArguments("get_response").path("request_id").asText()).isEqualTo("req_1");
	}

	@Test
	void testCancelProcessing() {
		transport.onTool("cancel", args -> Mono.just(textResult("{\"status\":\"cancelled\"}")));

		StepVerifier.create(client.cancelProcessing("chat_1"))
			.assertNext(result -> assertThat(result.isCancelled()).isTrue())
			.verifyComplete();

		assertThat(onlyCallArguments("cancel").path("chat_id").asText()).isEqualTo("chat_1");
	}

	@Test
	void testListTurfs() {
		transport.onTool("list_turfs", args -> Mono.just(textResult("{\"turfs\":[{\"turf_id\":\"t1\",\"name\":\"web-1\","
				+ "\"type\":\"server\",\"status\":\"online\"}]}")));

		StepVerifier.create(client.listTurfs())
			.assertNext(turfs -> assertThat(turfs).extracting(WalterSchema.Turf::getName).containsExactly("web-1"))
			.verifyComplete();
	}

	@Test
	void testSearchTurfsSendsOnlyGivenFilters() {
		transport.onTool("search_turfs", args -> Mono.just(textResult("{\"turfs\":[],\"count\":0}")));

		StepVerifier
			.create(client.searchTurfs(WalterSchema.TurfFilter.builder().name("web").status("online").build()))
			.assertNext(found -> assertThat(found.getCount()).isZero())
			.verifyComplete();

		JsonNode args = onlyCallArguments("search_turfs");
		List<String> names = new ArrayList<>();
		Iterator<String> it = args.fieldNames();
		it.forEachRemaining(names::add);
		assertThat(names).containsExactly("name", "status");
		assertThat(args.path("name").asText()).isEqualTo("web");
	}

	@Test
	void testMalformedPayloadIsDecodeError() {
		transport.onTool("list_chats", args -> Mono.just(textResult("Service temporarily unavailable")));

		StepVerifier.create(client.listChats())
			.expectErrorSatisfies(ex -> assertThat(ex).isInstanceOf(WalterDecodeException.class)
				.hasMessage("Expected JSON from Walter, got: Service temporarily unavailable"))
			.verify();
	}

	@Test
	void testToolErrorPropagates() {
		transport.onTool("cancel", args -> Mono.just(errorResult("Chat chat_x not found")));

		StepVerifier.create(client.cancelProcessing("chat_x"))
			.expectErrorSatisfies(ex -> assertThat(ex).isInstanceOf(WalterToolException.class)
				.hasMessage("Chat chat_x not found"))
			.verify();
	}

	@Test
	void testInvalidArgumentsAreRejected() {
		assertThatThrownBy(() -> client.sendMessage(" ", "hi")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> client.getResponse(null)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> client.searchTurfs(null)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testChatStreaming() {
		AtomicInteger polls = new AtomicInteger();
		transport.onTool("send_message",
				args -> Mono.just(textResult("{\"request_id\":\"req_9\",\"chat_id\":\"chat_1\"}")));
		transport.onTool("get_response", args -> {
			switch (polls.incrementAndGet()) {
				case 1:
					return Mono.just(textResult("{\"status\":\"processing\",\"partial\":\"Looking at /var\","
							+ "\"retry_after_seconds\":1}"));
				case 2:
					return Mono.just(textResult("{\"status\":\"processing\",\"partial\":\"Looking at /var\","
							+ "\"retry_after_seconds\":1}"));
				default:
					return Mono.just(textResult("{\"status\":\"complete\",\"response\":\"/var/log is 9 GB\"}"));
			}
		});
		List<String> partials = new ArrayList<>();

		StepVerifier.withVirtualTime(() -> client.chatStreaming("chat_1", "why is the disk full?", partials::add))
			.expectSubscription()
			.thenAwait(Duration.ofSeconds(4))
			.assertNext(response -> {
				assertThat(response.getResponse()).isEqualTo("/var/log is 9 GB");
				assertThat(response.getChatId()).isEqualTo("chat_1");
			})
			.verifyComplete();

		assertThat(partials).containsExactly("Looking at /var");
		assertThat(transport.toolCalls("get_response"))
			.allSatisfy(sent -> assertThat(sent.params.path("arguments").path("request_id").asText())
				.isEqualTo("req_9"));
		assertThat(transport.requests(McpSchema.METHOD_INITIALIZE)).hasSize(1);
	}

	@Test
	void testChatStreamingCancelledBeforeFirstPoll() {
		transport.onTool("send_message",
				args -> Mono.just(textResult("{\"request_id\":\"req_9\",\"chat_id\":\"chat_1\"}")));
		transport.onTool("get_response", args -> Mono.just(textResult("{\"status\":\"processing\"}")));
		CancellationToken token = CancellationToken.create();

		StepVerifier.withVirtualTime(() -> client.chatStreaming("chat_1", "hello", null, token))
			.expectSubscription()
			.thenAwait(Duration.ofMillis(500))
			.then(token::cancel)
			.expectError(WalterCancelledException.class)
			.verify();

		assertThat(transport.toolCalls("get_response")).isEmpty();
	}

	@Test
	void testCloseGracefully() {
		StepVerifier.create(client.closeGracefully()).verifyComplete();

		assertThat(transport.isClosed()).isTrue();
	}

	@Test
	void testSyncClientBlocksAndRethrows() {
		transport.onTool("start_chat", args -> Mono.just(textResult("{\"chat_id\":\"chat_sync\"}")));
		transport.onTool("cancel", args -> Mono.just(errorResult("nope")));

		try (WalterSyncClient sync = new WalterSyncClient(client)) {
			assertThat(sync.createChat()).isEqualTo("chat_sync");
			assertThatThrownBy(() -> sync.cancelProcessing("chat_sync")).isInstanceOf(WalterToolException.class)
				.hasMessage("nope");
			assertThat(sync.getAsyncClient()).isSameAs(client);
		}
		assertThat(transport.isClosed()).isTrue();
	}

}
