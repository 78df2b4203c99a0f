/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.tools;

import io.walterops.client.WalterAsyncClient;
import io.walterops.spec.CancellationToken;
import io.walterops.spec.WalterSchema;
import io.walterops.util.Assert;
import io.walterops.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * The agent-facing Walter tools. Each operation validates its arguments, calls the client
 * and renders the outcome as a {@link ToolResult}; failures become error results rather
 * than error signals.
 */
public class WalterTools {

	private static final Logger logger = LoggerFactory.getLogger(WalterTools.class);

	public static final String CHAT = "walter_chat";

	public static final String CANCEL = "walter_cancel";

	public static final String LIST_CHATS = "walter_list_chats";

	public static final String LIST_TURFS = "walter_list_turfs";

	public static final String SEARCH_TURFS = "walter_search_turfs";

	private final WalterAsyncClient client;

	public WalterTools(WalterAsyncClient client) {
		Assert.notNull(client, "The client can not be null");
		this.client = client;
	}

	/**
	 * Sends a message and waits for Walter's complete answer.
	 * @param message what Walter should investigate or do
	 * @param chatId chat to continue; a new chat is started when blank
	 * @param onUpdate receives a processing result for each new partial answer, may be
	 * {@code null}
	 * @param cancellation aborts the wait
	 */
	public Mono<ToolResult> chat(String message, String chatId, Consumer<ToolResult> onUpdate,
			CancellationToken cancellation) {
		if (Utils.isBlank(message)) {
			return Mono.just(ToolResult.error("message is required"));
		}
		CancellationToken token = CancellationToken.orNone(cancellation);
		Mono<String> resolvedChatId = Utils.isBlank(chatId) ? this.client.createChat(token)
				: Mono.just(chatId.trim());

		return resolvedChatId.flatMap(id -> this.client.chatStreaming(id, message, partial -> {
			if (onUpdate != null) {
				onUpdate.accept(ToolResult.success(partial, details("status", "processing", "chat_id", id)));
			}
		}, token))
			.map(answer -> ToolResult.success(answer.getResponse(),
					details("chat_id", answer.getChatId(), "status", "complete")))
			.onErrorResume(ex -> Mono.just(failed(CHAT, ex)));
	}

	/**
	 * Stops the work currently running in a chat.
	 */
	public Mono<ToolResult> cancel(String chatId) {
		if (Utils.isBlank(chatId)) {
			return Mono.just(ToolResult.error("chat_id is required"));
		}
		return this.client.cancelProcessing(chatId).map(result -> {
			String text = result.isCancelled()
					? "Cancelled active operation in " + chatId + ". You can send a new message to redirect Walter."
					: "Nothing was running in " + chatId + ".";
			Map<String, Object> details = details("chat_id", chatId, "status", result.getStatus());
			if (result.getMessage() != null) {
				details.put("message", result.getMessage());
			}
			return ToolResult.success(text, details);
		}).onErrorResume(ex -> Mono.just(failed(CANCEL, ex)));
	}

	public Mono<ToolResult> listChats() {
		return this.client.listChats().map(chats -> {
			if (chats.isEmpty()) {
				return ToolResult.success("No existing conversations. Use " + CHAT + " to start one.",
						details("chats", Collections.emptyList(), "count", 0));
			}
			String lines = chats.stream().map(ToolResults::formatChat).collect(Collectors.joining("\n"));
			return ToolResult.success(chats.size() + " conversation(s):\n\n" + lines,
					details("chats", chats, "count", chats.size()));
		}).onErrorResume(ex -> Mono.just(failed(LIST_CHATS, ex)));
	}

	public Mono<ToolResult> listTurfs() {
		return this.client.listTurfs().map(turfs -> {
			if (turfs.isEmpty()) {
				return ToolResult.success("No systems connected. Set up a turf in Walter first.",
						details("turfs", Collections.emptyList(), "count", 0));
			}
			return ToolResult.success(turfs.size() + " connected system(s):\n\n" + formatTurfs(turfs),
					details("turfs", turfs, "count", turfs.size()));
		}).onErrorResume(ex -> Mono.just(failed(LIST_TURFS, ex)));
	}

	/**
	 * Finds connected systems matching a filter. At least one criterion is required.
	 */
	public Mono<ToolResult> searchTurfs(WalterSchema.TurfFilter filter) {
		if (filter == null || filter.isEmpty()) {
			return Mono.just(ToolResult.success(
					"Provide at least one filter (name, type, os, or status). Use " + LIST_TURFS
							+ " to see all systems.",
					details("error", "no filters provided")));
		}
		return this.client.searchTurfs(filter).map(found -> {
			if (found.getCount() == 0) {
				return ToolResult.success("No systems matched your search.",
						details("turfs", Collections.emptyList(), "count", 0));
			}
			return ToolResult.success(found.getCount() + " matching system(s):\n\n" + formatTurfs(found.getTurfs()),
					details("turfs", found.getTurfs(), "count", found.getCount()));
		}).onErrorResume(ex -> Mono.just(failed(SEARCH_TURFS, ex)));
	}

	private static ToolResult failed(String tool, Throwable ex) {
		String message = ToolResults.toUserMessage(ex);
		if (ToolResults.UNEXPECTED_RESPONSE.equals(message)) {
			logger.warn("{} failed", tool, ex);
		}
		else {
			logger.debug("{} failed: {}", tool, message);
		}
		return ToolResult.error(message);
	}

	private static String formatTurfs(List<WalterSchema.Turf> turfs) {
		return turfs.stream().map(ToolResults::formatTurf).collect(Collectors.joining("\n"));
	}

	private static Map<String, Object> details(Object... keyValues) {
		Map<String, Object> details = new LinkedHashMap<>();
		for (int i = 0; i < keyValues.length; i += 2) {
			details.put((String) keyValues[i], keyValues[i + 1]);
		}
		return details;
	}

}
