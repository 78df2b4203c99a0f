/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.client;

import io.walterops.spec.CancellationToken;
import io.walterops.spec.WalterSchema;
import io.walterops.spec.WalterSchema.ChatResponse;
import io.walterops.spec.WalterSchema.ResponseStatus;
import io.walterops.util.Assert;

import java.util.List;
import java.util.function.Consumer;

/**
 * Blocking facade over {@link WalterAsyncClient}. Each method blocks the calling thread
 * until the corresponding reactive operation completes and rethrows its error unchanged.
 */
public class WalterSyncClient implements AutoCloseable {

	private final WalterAsyncClient delegate;

	public WalterSyncClient(WalterAsyncClient delegate) {
		Assert.notNull(delegate, "The async client can not be null");
		this.delegate = delegate;
	}

	public String createChat() {
		return createChat(CancellationToken.NONE);
	}

	public String createChat(CancellationToken cancellation) {
		return this.delegate.createChat(cancellation).block();
	}

	public List<WalterSchema.Chat> listChats() {
		return listChats(CancellationToken.NONE);
	}

	public List<WalterSchema.Chat> listChats(CancellationToken cancellation) {
		return this.delegate.listChats(cancellation).block();
	}

	public WalterSchema.PendingExchange sendMessage(String chatId, String message) {
		return sendMessage(chatId, message, CancellationToken.NONE);
	}

	public WalterSchema.PendingExchange sendMessage(String chatId, String message, CancellationToken cancellation) {
		return this.delegate.sendMessage(chatId, message, cancellation).block();
	}

	public ResponseStatus getResponse(String requestId) {
		return getResponse(requestId, CancellationToken.NONE);
	}

	public ResponseStatus getResponse(String requestId, CancellationToken cancellation) {
		return this.delegate.getResponse(requestId, cancellation).block();
	}

	public WalterSchema.CancelResult cancelProcessing(String chatId) {
		return cancelProcessing(chatId, CancellationToken.NONE);
	}

	public WalterSchema.CancelResult cancelProcessing(String chatId, CancellationToken cancellation) {
		return this.delegate.cancelProcessing(chatId, cancellation).block();
	}

	public ChatResponse chatStreaming(String chatId, String message, Consumer<String> onPartial) {
		return chatStreaming(chatId, message, onPartial, CancellationToken.NONE);
	}

	/**
	 * Blocks until the final answer arrives. {@code onPartial} is invoked on a Reactor
	 * thread, not the calling one. Another thread may abort the wait through
	 * {@code cancellation}.
	 */
	public ChatResponse chatStreaming(String chatId, String message, Consumer<String> onPartial,
			CancellationToken cancellation) {
		return this.delegate.chatStreaming(chatId, message, onPartial, cancellation).block();
	}

	public List<WalterSchema.Turf> listTurfs() {
		return listTurfs(CancellationToken.NONE);
	}

	public List<WalterSchema.Turf> listTurfs(CancellationToken cancellation) {
		return this.delegate.listTurfs(cancellation).block();
	}

	public WalterSchema.TurfSearchResult searchTurfs(WalterSchema.TurfFilter filter) {
		return searchTurfs(filter, CancellationToken.NONE);
	}

	public WalterSchema.TurfSearchResult searchTurfs(WalterSchema.TurfFilter filter, CancellationToken cancellation) {
		return this.delegate.searchTurfs(filter, cancellation).block();
	}

	/**
	 * Retrieves the underlying asynchronous client.
	 * @return the underlying asynchronous client
	 */
	public WalterAsyncClient getAsyncClient() {
		return this.delegate;
	}

	public boolean closeGracefully() {
		this.delegate.closeGracefully().block();
		return true;
	}

	@Override
	public void close() {
		closeGracefully();
	}

}
