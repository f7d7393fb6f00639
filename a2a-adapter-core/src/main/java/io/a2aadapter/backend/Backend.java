/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

import java.time.Duration;

import reactor.core.publisher.Mono;

/**
 * The execution engine an adapter talks to. The set of backends is closed: a webhook
 * reached over HTTP, a command-line agent run as a subprocess, or a runnable invoked in
 * process. Retry, backoff and error classification live in
 * {@link io.a2aadapter.dispatch.DispatchEngine} and are shared by all of them.
 *
 * <p>
 * A backend owns a client resource that is acquired by {@link #open()} and released by
 * {@link #close()}. Calls made while the backend is not open fail immediately.
 */
public sealed interface Backend permits WebhookBackend, SubprocessBackend, RunnableBackend {

	/**
	 * Acquires the backend's client resource. Called once per open scope by the dispatch
	 * engine before the first call.
	 */
	void open();

	/**
	 * Executes a single attempt. Implementations must honour cancellation of the returned
	 * {@link Mono} by abandoning the in-flight exchange.
	 * @param request the request
	 * @param timeout upper bound for this attempt
	 * @return the response, or an error: {@link BackendStatusException} for a failure
	 * status, an {@link java.io.IOException} or {@link java.util.concurrent.TimeoutException}
	 * when no response was received
	 */
	Mono<BackendResponse> call(BackendRequest request, Duration timeout);

	/**
	 * Releases the client resource and aborts in-flight work where possible.
	 */
	void close();

	/**
	 * Short description for log messages.
	 * @return the description
	 */
	String describe();

}
