/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.a2aadapter.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Invokes an {@link AgentRunnable} on the bounded elastic scheduler. The runnable
 * receives the request payload as its input map.
 *
 * <p>
 * The timeout is enforced by the dispatch engine; a runnable that ignores interruption
 * keeps running on its worker thread after the attempt has been abandoned.
 */
public final class RunnableBackend implements Backend {

	private static final Logger logger = LoggerFactory.getLogger(RunnableBackend.class);

	private final AgentRunnable runnable;

	private final String name;

	private final ObjectMapper objectMapper;

	private volatile boolean open;

	public RunnableBackend(AgentRunnable runnable, String name, ObjectMapper objectMapper) {
		Assert.notNull(runnable, "runnable must not be null");
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.runnable = runnable;
		this.name = name;
		this.objectMapper = objectMapper;
	}

	public RunnableBackend(AgentRunnable runnable) {
		this(runnable, runnable.getClass().getSimpleName(), new ObjectMapper());
	}

	@Override
	public void open() {
		this.open = true;
	}

	@Override
	public Mono<BackendResponse> call(BackendRequest request, Duration timeout) {
		return Mono.defer(() -> {
			if (!this.open) {
				return Mono.error(new IllegalStateException("Runnable backend " + this.name + " is not open"));
			}
			// a null return value becomes a JSON null body rather than an empty Mono
			return Mono
				.fromCallable(() -> BackendResponse.fromValue(this.runnable.invoke(request.payload()), this.objectMapper))
				.subscribeOn(Schedulers.boundedElastic());
		});
	}

	@Override
	public void close() {
		this.open = false;
		if (this.runnable instanceof AutoCloseable closeable) {
			try {
				closeable.close();
			}
			catch (Exception e) {
				logger.warn("Failed to close runnable {}", this.name, e);
			}
		}
	}

	@Override
	public String describe() {
		return "runnable " + this.name;
	}

}
