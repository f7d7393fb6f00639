/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.adapter;

import io.a2aadapter.backend.BackendRequest;
import io.a2aadapter.backend.BackendResponse;
import io.a2aadapter.spec.A2aSchema.Message;
import io.a2aadapter.spec.A2aSchema.MessageSendParams;
import io.a2aadapter.spec.AsyncCloseable;
import io.a2aadapter.util.Utils;
import reactor.core.publisher.Mono;

/**
 * Bridges protocol messages to a single backend.
 *
 * <p>
 * A call is translated to a {@link BackendRequest} by {@link #toBackend}, executed by
 * {@link #callBackend} and the response translated back by {@link #fromBackend}.
 * {@link #handle(MessageSendParams)} chains the three and is the synchronous entry point
 * used by a protocol server. Adapters reporting {@link #supportsAsyncTasks()} expect the
 * server to route requests through a {@link io.a2aadapter.tasks.TaskManager} instead.
 *
 * <p>
 * A failed backend call always surfaces as an error, never as an empty reply.
 *
 * @see AbstractAgentAdapter
 */
public interface AgentAdapter extends AsyncCloseable {

	/**
	 * Translates inbound parameters to a backend request.
	 * @param params the inbound parameters
	 * @param correlationId the correlation id of the logical call
	 * @return the backend request
	 */
	BackendRequest toBackend(MessageSendParams params, String correlationId);

	/**
	 * Executes the request, retrying transient failures.
	 * @param request the backend request
	 * @return the backend response, or a terminal
	 * {@link io.a2aadapter.spec.AdapterError AdapterError}
	 */
	Mono<BackendResponse> callBackend(BackendRequest request);

	/**
	 * Translates a backend response to an assistant message. Must not fail on unexpected
	 * response shapes.
	 * @param response the backend response
	 * @param params the inbound parameters of the call
	 * @return the assistant message
	 */
	Message fromBackend(BackendResponse response, MessageSendParams params);

	/**
	 * Handles a message with a freshly generated correlation id.
	 * @param params the inbound parameters
	 * @return the assistant reply
	 */
	default Mono<Message> handle(MessageSendParams params) {
		return handle(params, Utils.newCorrelationId());
	}

	/**
	 * Handles a message as part of an existing logical call.
	 * @param params the inbound parameters
	 * @param correlationId the correlation id to use for every attempt
	 * @return the assistant reply
	 */
	default Mono<Message> handle(MessageSendParams params, String correlationId) {
		return Mono.fromCallable(() -> toBackend(params, correlationId))
			.flatMap(this::callBackend)
			.map(response -> fromBackend(response, params));
	}

	default boolean supportsStreaming() {
		return false;
	}

	default boolean supportsAsyncTasks() {
		return false;
	}

}
