/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.tasks;

import io.a2aadapter.spec.A2aSchema.ListTasksResult;
import io.a2aadapter.spec.A2aSchema.Message;
import io.a2aadapter.spec.A2aSchema.Task;
import reactor.core.publisher.Mono;

/**
 * Storage for task state.
 *
 * <p>
 * Implementations must apply every transition atomically: a transition checks the
 * current state and replaces the task in one step, so that concurrent transitions on
 * the same task cannot both succeed. Terminal tasks never change state again.
 *
 * @see InMemoryTaskStore
 */
public interface TaskStore {

	/**
	 * Creates a task in the {@code SUBMITTED} state.
	 * @param correlationId the correlation id of the backend call owned by the task
	 * @return the new task; fails with {@link IllegalStateException} if the store is full
	 */
	Mono<Task> createTask(String correlationId);

	/**
	 * Looks up a task.
	 * @param taskId the task id
	 * @return the task, or empty if it is unknown, deleted or evicted
	 */
	Mono<Task> getTask(String taskId);

	/**
	 * Moves a task from {@code SUBMITTED} to {@code WORKING}.
	 * @param taskId the task id
	 * @return true if the transition happened, false if the task is missing or no longer
	 * submitted
	 */
	Mono<Boolean> markWorking(String taskId);

	/**
	 * Moves a live task to {@code COMPLETED}.
	 * @param taskId the task id
	 * @param result the reply produced by the backend
	 * @return true if the result was recorded, false if the task is missing or already
	 * terminal
	 */
	Mono<Boolean> complete(String taskId, Message result);

	/**
	 * Moves a live task to {@code FAILED}.
	 * @param taskId the task id
	 * @param error the description of the failure
	 * @return true if the failure was recorded, false if the task is missing or already
	 * terminal
	 */
	Mono<Boolean> fail(String taskId, String error);

	/**
	 * Moves a live task to {@code CANCELED}.
	 * @param taskId the task id
	 * @return the canceled task, or empty if the task is missing; fails with an
	 * {@link io.a2aadapter.spec.AdapterError.Kind#INVALID_STATE INVALID_STATE} error if
	 * the task is already terminal
	 */
	Mono<Task> requestCancellation(String taskId);

	/**
	 * Removes a terminal task.
	 * @param taskId the task id
	 * @return true if the task was removed, false if it is missing; fails with an
	 * {@link io.a2aadapter.spec.AdapterError.Kind#INVALID_STATE INVALID_STATE} error if
	 * the task is still live
	 */
	Mono<Boolean> deleteTask(String taskId);

	/**
	 * Lists tasks ordered by id.
	 * @param cursor the {@code nextCursor} of the previous page, or {@code null} for the
	 * first page
	 * @return the page
	 */
	Mono<ListTasksResult> listTasks(String cursor);

	/**
	 * Releases resources held by the store.
	 * @return completes when the store has shut down
	 */
	default Mono<Void> shutdown() {
		return Mono.empty();
	}

}
