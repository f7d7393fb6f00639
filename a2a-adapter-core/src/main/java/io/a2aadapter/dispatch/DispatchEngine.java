/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.dispatch;

import java.time.Duration;
import java.util.function.Consumer;

import io.a2aadapter.backend.Backend;
import io.a2aadapter.backend.BackendRequest;
import io.a2aadapter.backend.BackendResponse;
import io.a2aadapter.backend.BackendStatusException;
import io.a2aadapter.spec.AdapterError;
import io.a2aadapter.spec.AsyncCloseable;
import io.a2aadapter.util.Assert;
import io.a2aadapter.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Executes logical calls against a {@link Backend} with per-attempt timeouts,
 * classification of failures and exponential backoff between retries.
 *
 * <p>
 * Attempts of one logical call run strictly one after another. A client error ends the
 * call at once; transient failures are retried as allowed by the {@link RetryPolicy}.
 * When the budget is spent the call fails with {@link AdapterError.Kind#SERVER_ERROR} if
 * the last attempt received a 5xx status, or {@link AdapterError.Kind#TRANSPORT_ERROR}
 * if it received no response. Exceptions the {@link ErrorClassifier} does not recognize
 * are propagated unchanged.
 *
 * <p>
 * The engine owns its backend. The backend is opened by the first dispatch and released
 * once by {@link #close()}; dispatching on a closed engine fails with
 * {@link IllegalStateException} until {@link #reopen()} is called. Cancelling a dispatch
 * cancels the pending attempt or backoff delay.
 */
public class DispatchEngine implements AsyncCloseable {

	private static final Logger logger = LoggerFactory.getLogger(DispatchEngine.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	public static final int DEFAULT_BODY_PREVIEW_LENGTH = 512;

	private enum State {

		IDLE, OPEN, CLOSED

	}

	private final Backend backend;

	private final Duration timeout;

	private final RetryPolicy retryPolicy;

	private final int bodyPreviewLength;

	private final Consumer<CallAttempt> attemptListener;

	private final Scheduler scheduler;

	private final Object lock = new Object();

	private State state = State.IDLE;

	protected DispatchEngine(Builder builder) {
		this.backend = builder.backend;
		this.timeout = builder.timeout;
		this.retryPolicy = builder.retryPolicy;
		this.bodyPreviewLength = builder.bodyPreviewLength;
		this.attemptListener = builder.attemptListener;
		this.scheduler = builder.scheduler;
	}

	/**
	 * Executes a logical call.
	 * @param request the request; its correlation id is shared by all attempts
	 * @return the first successful response, or the terminal error
	 */
	public Mono<BackendResponse> dispatch(BackendRequest request) {
		Assert.notNull(request, "request must not be null");
		return Mono.defer(() -> {
			acquire();
			return attempt(request, 0, System.nanoTime());
		});
	}

	private Mono<BackendResponse> attempt(BackendRequest request, int index, long callStart) {
		return Mono.defer(() -> {
			if (isClosed()) {
				return Mono.error(closedError());
			}
			long attemptStart = System.nanoTime();
			return this.backend.call(request, this.timeout)
				.timeout(this.timeout, this.scheduler)
				.switchIfEmpty(Mono.error(() -> new IllegalStateException(
						"Backend " + this.backend.describe() + " completed without a response")))
				.doOnNext(response -> report(new CallAttempt(request.correlationId(), index, since(attemptStart),
						CallAttempt.Outcome.SUCCESS, null, null)))
				.onErrorResume(error -> onFailure(request, index, callStart, attemptStart, error));
		});
	}

	private Mono<BackendResponse> onFailure(BackendRequest request, int index, long callStart, long attemptStart,
			Throwable error) {
		Duration attemptElapsed = since(attemptStart);
		Throwable cause = ErrorClassifier.unwrap(error);
		Integer statusCode = (cause instanceof BackendStatusException statusException)
				? statusException.getStatusCode() : null;
		ErrorCategory category = ErrorClassifier.classify(cause);
		String correlationId = request.correlationId();

		if (category == null) {
			report(new CallAttempt(correlationId, index, attemptElapsed, CallAttempt.Outcome.UNCLASSIFIED, statusCode,
					cause));
			return Mono.error(error);
		}

		if (category == ErrorCategory.CLIENT_ERROR) {
			report(new CallAttempt(correlationId, index, attemptElapsed, CallAttempt.Outcome.CLIENT_ERROR, statusCode,
					cause));
			String body = (cause instanceof BackendStatusException statusException) ? statusException.getBody() : "";
			String preview = Utils.truncate(body, this.bodyPreviewLength);
			Duration elapsed = since(callStart);
			return Mono.error(AdapterError.builder(AdapterError.Kind.CLIENT_ERROR)
				.message(terminalMessage("rejected request " + correlationId + " with status " + statusCode, index + 1,
						elapsed, preview))
				.cause(cause)
				.correlationId(correlationId)
				.attempts(index + 1)
				.elapsed(elapsed)
				.statusCode(statusCode)
				.bodyPreview(preview)
				.build());
		}

		report(new CallAttempt(correlationId, index, attemptElapsed, CallAttempt.Outcome.TRANSIENT, statusCode, cause));

		if (this.retryPolicy.shouldRetry(index, category)) {
			Duration delay = this.retryPolicy.backoff(index);
			logger.warn("Attempt {} of {} for request {} failed ({}), retrying in {} ms", index + 1,
					this.retryPolicy.maxAttempts(), correlationId, describe(cause), delay.toMillis());
			return Mono.delay(delay, this.scheduler).then(attempt(request, index + 1, callStart));
		}

		AdapterError.Kind kind = statusCode != null ? AdapterError.Kind.SERVER_ERROR
				: AdapterError.Kind.TRANSPORT_ERROR;
		String body = (cause instanceof BackendStatusException statusException) ? statusException.getBody() : null;
		String preview = body != null ? Utils.truncate(body, this.bodyPreviewLength) : null;
		Duration elapsed = since(callStart);
		return Mono.error(AdapterError.builder(kind)
			.message(terminalMessage("failed request " + correlationId + " (" + describe(cause) + ")", index + 1,
					elapsed, preview))
			.cause(cause)
			.correlationId(correlationId)
			.attempts(index + 1)
			.elapsed(elapsed)
			.statusCode(statusCode)
			.bodyPreview(preview)
			.build());
	}

	/**
	 * Formats a terminal error message. Task records keep only the message, so it
	 * repeats the attempt count, the elapsed time and the body preview.
	 */
	private String terminalMessage(String outcome, int attempts, Duration elapsed, String preview) {
		StringBuilder message = new StringBuilder("Backend ").append(this.backend.describe())
			.append(' ')
			.append(outcome)
			.append(" after ")
			.append(attempts)
			.append(" attempt(s) in ")
			.append(elapsed.toMillis())
			.append(" ms");
		if (Utils.hasText(preview)) {
			message.append(": ").append(preview);
		}
		return message.toString();
	}

	private void report(CallAttempt attempt) {
		if (logger.isDebugEnabled()) {
			logger.debug("Request {} attempt {} finished in {} ms: {}", attempt.correlationId(), attempt.index(),
					attempt.elapsed().toMillis(), attempt.outcome());
		}
		if (this.attemptListener == null) {
			return;
		}
		try {
			this.attemptListener.accept(attempt);
		}
		catch (RuntimeException e) {
			logger.warn("Attempt listener failed for request {}", attempt.correlationId(), e);
		}
	}

	private static String describe(Throwable cause) {
		if (cause instanceof BackendStatusException statusException) {
			return "status " + statusException.getStatusCode();
		}
		return cause.getMessage() != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
				: cause.getClass().getSimpleName();
	}

	private static Duration since(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos);
	}

	private void acquire() {
		synchronized (this.lock) {
			if (this.state == State.CLOSED) {
				throw closedError();
			}
			if (this.state == State.IDLE) {
				this.backend.open();
				this.state = State.OPEN;
				logger.debug("Opened {}", this.backend.describe());
			}
		}
	}

	private IllegalStateException closedError() {
		return new IllegalStateException("Dispatch engine for " + this.backend.describe() + " is closed");
	}

	public boolean isClosed() {
		synchronized (this.lock) {
			return this.state == State.CLOSED;
		}
	}

	/**
	 * Makes a closed engine usable again. The backend is opened again by the next
	 * dispatch.
	 */
	public void reopen() {
		synchronized (this.lock) {
			if (this.state == State.CLOSED) {
				this.state = State.IDLE;
			}
		}
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(this::close);
	}

	@Override
	public void close() {
		boolean release;
		synchronized (this.lock) {
			release = this.state == State.OPEN;
			this.state = State.CLOSED;
			if (release) {
				this.backend.close();
			}
		}
		if (release) {
			logger.debug("Closed {}", this.backend.describe());
		}
	}

	public Backend getBackend() {
		return this.backend;
	}

	public Duration getTimeout() {
		return this.timeout;
	}

	public RetryPolicy getRetryPolicy() {
		return this.retryPolicy;
	}

	public static Builder builder(Backend backend) {
		return new Builder(backend);
	}

	/**
	 * Builder for {@link DispatchEngine}.
	 */
	public static class Builder {

		private final Backend backend;

		private Duration timeout = DEFAULT_TIMEOUT;

		private RetryPolicy retryPolicy = RetryPolicy.defaults();

		private int bodyPreviewLength = DEFAULT_BODY_PREVIEW_LENGTH;

		private Consumer<CallAttempt> attemptListener;

		private Scheduler scheduler = Schedulers.parallel();

		private Builder(Backend backend) {
			Assert.notNull(backend, "backend must not be null");
			this.backend = backend;
		}

		public Builder timeout(Duration timeout) {
			Assert.notNull(timeout, "timeout must not be null");
			Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
			this.timeout = timeout;
			return this;
		}

		public Builder retryPolicy(RetryPolicy retryPolicy) {
			Assert.notNull(retryPolicy, "retryPolicy must not be null");
			this.retryPolicy = retryPolicy;
			return this;
		}

		public Builder bodyPreviewLength(int bodyPreviewLength) {
			Assert.isTrue(bodyPreviewLength >= 0, "bodyPreviewLength must not be negative");
			this.bodyPreviewLength = bodyPreviewLength;
			return this;
		}

		/**
		 * Registers a listener notified after every attempt. Listener failures are
		 * logged and otherwise ignored.
		 * @param attemptListener the listener
		 * @return this builder
		 */
		public Builder attemptListener(Consumer<CallAttempt> attemptListener) {
			this.attemptListener = attemptListener;
			return this;
		}

		/**
		 * Sets the scheduler used for attempt timeouts and backoff delays.
		 * @param scheduler the scheduler
		 * @return this builder
		 */
		public Builder scheduler(Scheduler scheduler) {
			Assert.notNull(scheduler, "scheduler must not be null");
			this.scheduler = scheduler;
			return this;
		}

		public DispatchEngine build() {
			return new DispatchEngine(this);
		}

	}

}
