/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.adapter;

import java.time.Duration;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.a2aadapter.backend.Backend;
import io.a2aadapter.backend.BackendRequest;
import io.a2aadapter.backend.BackendResponse;
import io.a2aadapter.dispatch.CallAttempt;
import io.a2aadapter.dispatch.DispatchEngine;
import io.a2aadapter.dispatch.RetryPolicy;
import io.a2aadapter.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Base class for adapters. Owns the {@link DispatchEngine} so that concrete adapters
 * only implement the translation pair and describe their backend.
 */
public abstract class AbstractAgentAdapter implements AgentAdapter {

	private final DispatchEngine dispatchEngine;

	protected AbstractAgentAdapter(Backend backend, AbstractBuilder<?> builder) {
		DispatchEngine.Builder engine = DispatchEngine.builder(backend)
			.timeout(builder.timeout)
			.retryPolicy(RetryPolicy.of(builder.maxRetries, builder.backoff))
			.attemptListener(builder.attemptListener);
		if (builder.scheduler != null) {
			engine.scheduler(builder.scheduler);
		}
		this.dispatchEngine = engine.build();
	}

	@Override
	public Mono<BackendResponse> callBackend(BackendRequest request) {
		return this.dispatchEngine.dispatch(request);
	}

	public DispatchEngine getDispatchEngine() {
		return this.dispatchEngine;
	}

	/**
	 * Makes a closed adapter usable again.
	 */
	public void reopen() {
		this.dispatchEngine.reopen();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return this.dispatchEngine.closeGracefully();
	}

	@Override
	public void close() {
		this.dispatchEngine.close();
	}

	/**
	 * Dispatch settings shared by all adapter builders.
	 *
	 * @param <B> the concrete builder type
	 */
	public abstract static class AbstractBuilder<B extends AbstractBuilder<B>> {

		protected Duration timeout = DispatchEngine.DEFAULT_TIMEOUT;

		protected int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;

		protected Duration backoff = RetryPolicy.DEFAULT_BASE_BACKOFF;

		protected ObjectMapper objectMapper;

		protected Consumer<CallAttempt> attemptListener;

		protected Scheduler scheduler;

		protected abstract B self();

		public B timeout(Duration timeout) {
			Assert.notNull(timeout, "timeout must not be null");
			this.timeout = timeout;
			return self();
		}

		/**
		 * Sets the number of retries after the first attempt. Negative values mean no
		 * retries.
		 * @param maxRetries the retry budget
		 * @return this builder
		 */
		public B maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return self();
		}

		public B backoff(Duration backoff) {
			Assert.notNull(backoff, "backoff must not be null");
			this.backoff = backoff;
			return self();
		}

		public B objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return self();
		}

		public B attemptListener(Consumer<CallAttempt> attemptListener) {
			this.attemptListener = attemptListener;
			return self();
		}

		/**
		 * Sets the scheduler used for attempt timeouts and backoff delays.
		 * @param scheduler the scheduler
		 * @return this builder
		 */
		public B scheduler(Scheduler scheduler) {
			this.scheduler = scheduler;
			return self();
		}

		protected ObjectMapper objectMapperOrDefault() {
			if (this.objectMapper == null) {
				this.objectMapper = new ObjectMapper();
			}
			return this.objectMapper;
		}

	}

}
