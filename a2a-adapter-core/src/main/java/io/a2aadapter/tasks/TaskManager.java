/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.tasks;

import java.time.Duration;

import io.a2aadapter.spec.A2aSchema.ListTasksResult;
import io.a2aadapter.spec.A2aSchema.MessageSendParams;
import io.a2aadapter.spec.A2aSchema.Task;
import reactor.core.publisher.Mono;

/**
 * Runs adapter calls in the background and exposes them as pollable tasks.
 *
 * <p>
 * A task starts {@code SUBMITTED}, becomes {@code WORKING} when its background call
 * starts and ends {@code COMPLETED}, {@code FAILED} or {@code CANCELED}. Operations on
 * unknown tasks fail with an {@link io.a2aadapter.spec.AdapterError.Kind#NOT_FOUND
 * NOT_FOUND} error; operations not allowed in the task's current state fail with
 * {@link io.a2aadapter.spec.AdapterError.Kind#INVALID_STATE INVALID_STATE}.
 */
public interface TaskManager {

	/**
	 * Creates a task and starts its background call. Does not wait for the call.
	 * @param params the inbound parameters
	 * @return the new task in the {@code SUBMITTED} state
	 */
	Mono<Task> create(MessageSendParams params);

	Mono<Task> get(String taskId);

	/**
	 * Cancels a live task and stops waiting for its backend call. The backend may still
	 * complete the call; its result is discarded.
	 * @param taskId the task id
	 * @return the canceled task
	 */
	Mono<Task> cancel(String taskId);

	/**
	 * Deletes a terminal task.
	 * @param taskId the task id
	 * @return completes when the task has been deleted
	 */
	Mono<Void> delete(String taskId);

	Mono<ListTasksResult> list(String cursor);

	/**
	 * Polls a task until it reaches a terminal state.
	 * @param taskId the task id
	 * @param timeout the maximum time to wait
	 * @return the terminal task; fails with a {@link java.util.concurrent.TimeoutException}
	 * if the task is still live after the timeout
	 */
	Mono<Task> awaitTerminal(String taskId, Duration timeout);

	/**
	 * Cancels all live tasks and releases the task store.
	 * @return completes when shut down
	 */
	Mono<Void> shutdown();

}
