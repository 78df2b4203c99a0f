/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.client;

import io.walterops.spec.CancellationToken;
import io.walterops.spec.WalterCancelledException;
import io.walterops.spec.WalterSchema.ChatResponse;
import io.walterops.spec.WalterSchema.PendingExchange;
import io.walterops.spec.WalterSchema.ResponseStatus;
import io.walterops.spec.WalterTaskException;
import io.walterops.spec.WalterTimeoutException;
import io.walterops.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Turns a submitted message into its final answer by polling its status.
 * <p>
 * After submission the poller waits for the settling delay, then fetches the status
 * until it is complete or failed, forwarding each new partial output. Transient fetch
 * failures are retried with exponential backoff up to a bound of consecutive failures.
 * The whole stream is bounded by a deadline measured from the submission. Every wait is
 * raced against the caller's {@link CancellationToken}, and cancellation is never
 * counted as a transient failure.
 * <p>
 * Time is read from the Reactor parallel scheduler, the one {@link Mono#delay(Duration)}
 * sleeps on.
 */
final class ChatResponsePoller {

	private static final Logger logger = LoggerFactory.getLogger(ChatResponsePoller.class);

	static final Duration DEFAULT_SETTLE_DELAY = Duration.ofSeconds(2);

	static final Duration DEFAULT_DEADLINE = Duration.ofMinutes(5);

	static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(2);

	static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 3;

	static final Duration DEFAULT_MIN_RETRY_INTERVAL = Duration.ofMillis(500);

	private final Duration settleDelay;

	private final Duration deadline;

	private final Duration backoff;

	private final int maxConsecutiveFailures;

	private final Duration minRetryInterval;

	ChatResponsePoller() {
		this(DEFAULT_SETTLE_DELAY, DEFAULT_DEADLINE, DEFAULT_BACKOFF, DEFAULT_MAX_CONSECUTIVE_FAILURES,
				DEFAULT_MIN_RETRY_INTERVAL);
	}

	ChatResponsePoller(Duration settleDelay, Duration deadline, Duration backoff, int maxConsecutiveFailures,
			Duration minRetryInterval) {
		Assert.notNull(settleDelay, "settleDelay must not be null");
		Assert.notNull(deadline, "deadline must not be null");
		Assert.notNull(backoff, "backoff must not be null");
		Assert.notNull(minRetryInterval, "minRetryInterval must not be null");
		Assert.isTrue(!settleDelay.isNegative(), "settleDelay must not be negative");
		Assert.isTrue(!deadline.isNegative() && !deadline.isZero(), "deadline must be positive");
		Assert.isTrue(!backoff.isNegative(), "backoff must not be negative");
		Assert.isTrue(maxConsecutiveFailures > 0, "maxConsecutiveFailures must be positive");
		Assert.isTrue(!minRetryInterval.isNegative(), "minRetryInterval must not be negative");
		this.settleDelay = settleDelay;
		this.deadline = deadline;
		this.backoff = backoff;
		this.maxConsecutiveFailures = maxConsecutiveFailures;
		this.minRetryInterval = minRetryInterval;
	}

	/**
	 * @param submission submits the message, subscribed once
	 * @param fetcher fetches the status of a request id
	 * @param onPartial receives each new non-empty partial output, may be {@code null}
	 * @param cancellation aborts the stream
	 * @return the final answer
	 */
	Mono<ChatResponse> stream(Mono<PendingExchange> submission, Function<String, Mono<ResponseStatus>> fetcher,
			Consumer<String> onPartial, CancellationToken cancellation) {
		CancellationToken token = CancellationToken.orNone(cancellation);
		return token.guard(submission).flatMap(exchange -> {
			Poll poll = new Poll(exchange, now() + this.deadline.toMillis(), fetcher, onPartial, token);
			logger.debug("Message accepted as request {} in chat {}", exchange.getRequestId(), exchange.getChatId());
			return sleep(this.settleDelay, token).then(Mono.defer(() -> next(poll)));
		});
	}

	private Mono<ChatResponse> next(Poll poll) {
		return Mono.defer(() -> {
			if (poll.token.isCancelled()) {
				return Mono.error(new WalterCancelledException());
			}
			if (now() >= poll.deadlineAt) {
				logger.warn("No final response for request {} within {}", poll.exchange.getRequestId(), this.deadline);
				return Mono.error(new WalterTimeoutException(this.deadline));
			}
			return poll.fetcher.apply(poll.exchange.getRequestId())
				.map(Attempt::succeeded)
				.onErrorResume(ex -> !(ex instanceof WalterCancelledException), ex -> Mono.just(Attempt.failed(ex)))
				.flatMap(attempt -> attempt.failure != null ? onFailure(poll, attempt.failure)
						: onStatus(poll, attempt.status));
		});
	}

	private Mono<ChatResponse> onFailure(Poll poll, Throwable failure) {
		int failures = ++poll.consecutiveFailures;
		if (failures >= this.maxConsecutiveFailures) {
			logger.warn("Giving up on request {} after {} consecutive poll failures", poll.exchange.getRequestId(),
					failures);
			return Mono.error(failure);
		}
		Duration wait = this.backoff.multipliedBy(1L << (failures - 1));
		logger.warn("Poll {} of request {} failed, retrying in {}: {}", failures, poll.exchange.getRequestId(), wait,
				failure.getMessage());
		return sleep(capToDeadline(poll, wait), poll.token).then(next(poll));
	}

	private Mono<ChatResponse> onStatus(Poll poll, ResponseStatus status) {
		poll.consecutiveFailures = 0;
		switch (status.getKind()) {
			case COMPLETE:
				logger.debug("Request {} complete", poll.exchange.getRequestId());
				return Mono.just(new ChatResponse(((ResponseStatus.Complete) status).getResponse(),
						poll.exchange.getChatId()));
			case ERROR:
				return Mono.error(new WalterTaskException(((ResponseStatus.Error) status).getError()));
			default:
				ResponseStatus.Processing processing = (ResponseStatus.Processing) status;
				poll.emitPartial(processing.getPartial());
				Duration wait = capToDeadline(poll, retryInterval(processing.getRetryAfterSeconds()));
				return sleep(wait, poll.token).then(next(poll));
		}
	}

	Duration retryInterval(double retryAfterSeconds) {
		if (retryAfterSeconds * 1000 >= this.deadline.toMillis()) {
			return this.deadline;
		}
		Duration requested = Duration.ofMillis((long) (retryAfterSeconds * 1000));
		return requested.compareTo(this.minRetryInterval) < 0 ? this.minRetryInterval : requested;
	}

	/**
	 * No sleep outlasts the stream's deadline, so the next step can report the timeout.
	 */
	private static Duration capToDeadline(Poll poll, Duration wait) {
		long remaining = Math.max(0, poll.deadlineAt - now());
		return wait.toMillis() > remaining ? Duration.ofMillis(remaining) : wait;
	}

	private static Mono<Void> sleep(Duration duration, CancellationToken token) {
		return token.guard(Mono.delay(duration)).then();
	}

	private static long now() {
		return Schedulers.parallel().now(TimeUnit.MILLISECONDS);
	}

	/**
	 * Mutable state of one stream. Only touched from the stream's own sequential
	 * callbacks.
	 */
	private static final class Poll {

		final PendingExchange exchange;

		final long deadlineAt;

		final Function<String, Mono<ResponseStatus>> fetcher;

		final Consumer<String> onPartial;

		final CancellationToken token;

		int consecutiveFailures;

		String lastPartial = "";

		Poll(PendingExchange exchange, long deadlineAt, Function<String, Mono<ResponseStatus>> fetcher,
				Consumer<String> onPartial, CancellationToken token) {
			this.exchange = exchange;
			this.deadlineAt = deadlineAt;
			this.fetcher = fetcher;
			this.onPartial = onPartial;
			this.token = token;
		}

		void emitPartial(String partial) {
			if (partial == null || partial.isEmpty() || partial.equals(this.lastPartial)) {
				return;
			}
			this.lastPartial = partial;
			if (this.onPartial != null) {
				this.onPartial.accept(partial);
			}
		}

	}

	private static final class Attempt {

		final ResponseStatus status;

		final Throwable failure;

		private Attempt(ResponseStatus status, Throwable failure) {
			this.status = status;
			this.failure = failure;
		}

		static Attempt succeeded(ResponseStatus status) {
			return new Attempt(status, null);
		}

		static Attempt failed(Throwable failure) {
			return new Attempt(null, failure);
		}

	}

}
