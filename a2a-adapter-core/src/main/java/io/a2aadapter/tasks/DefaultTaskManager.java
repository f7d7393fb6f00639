/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.tasks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.a2aadapter.adapter.AgentAdapter;
import io.a2aadapter.spec.A2aSchema.ListTasksResult;
import io.a2aadapter.spec.A2aSchema.MessageSendParams;
import io.a2aadapter.spec.A2aSchema.Task;
import io.a2aadapter.spec.AdapterError;
import io.a2aadapter.util.Assert;
import io.a2aadapter.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Default {@link TaskManager} running every task through one {@link AgentAdapter}.
 *
 * <p>
 * Each task owns one logical backend call with its own correlation id. The
 * subscription of a running call is kept until the call ends so that
 * {@link #cancel(String)} can dispose it, which cancels the pending attempt or backoff
 * delay.
 */
public class DefaultTaskManager implements TaskManager {

	private static final Logger logger = LoggerFactory.getLogger(DefaultTaskManager.class);

	private final AgentAdapter adapter;

	private final TaskStore taskStore;

	private final Duration pollInterval;

	private final Scheduler scheduler;

	private final Map<String, Disposable.Swap> inFlight = new ConcurrentHashMap<>();

	protected DefaultTaskManager(Builder builder) {
		this.adapter = builder.adapter;
		this.taskStore = builder.taskStore != null ? builder.taskStore : new InMemoryTaskStore();
		this.pollInterval = builder.pollInterval;
		this.scheduler = builder.scheduler;
	}

	@Override
	public Mono<Task> create(MessageSendParams params) {
		Assert.notNull(params, "params must not be null");
		return this.taskStore.createTask(Utils.newCorrelationId()).doOnNext(task -> start(task, params));
	}

	private void start(Task task, MessageSendParams params) {
		String taskId = task.id();
		Disposable.Swap slot = Disposables.swap();
		this.inFlight.put(taskId, slot);
		Disposable work = this.taskStore.markWorking(taskId)
			.filter(Boolean::booleanValue)
			.flatMap(started -> {
				logger.debug("Task {} started, request {}", taskId, task.correlationId());
				return this.adapter.handle(params, task.correlationId())
					.flatMap(result -> this.taskStore.complete(taskId, result))
					.onErrorResume(error -> {
						logger.debug("Task {} failed: {}", taskId, error.toString());
						return this.taskStore.fail(taskId, errorMessage(error));
					});
			})
			.doFinally(signal -> this.inFlight.remove(taskId, slot))
			.subscribeOn(this.scheduler)
			.subscribe(null, error -> logger.error("Failed to record the outcome of task {}", taskId, error));
		// disposes the work at once if the task was canceled in the meantime
		slot.update(work);
	}

	private static String errorMessage(Throwable error) {
		String message = error.getMessage();
		return message != null ? message : error.getClass().getName();
	}

	@Override
	public Mono<Task> get(String taskId) {
		return this.taskStore.getTask(taskId).switchIfEmpty(Mono.error(() -> AdapterError.notFound(taskId)));
	}

	@Override
	public Mono<Task> cancel(String taskId) {
		return this.taskStore.requestCancellation(taskId)
			.switchIfEmpty(Mono.error(() -> AdapterError.notFound(taskId)))
			.doOnNext(task -> {
				Disposable work = this.inFlight.remove(taskId);
				if (work != null) {
					work.dispose();
				}
				logger.debug("Task {} canceled", taskId);
			});
	}

	@Override
	public Mono<Void> delete(String taskId) {
		return this.taskStore.deleteTask(taskId)
			.flatMap(deleted -> deleted ? Mono.<Void>empty() : Mono.error(AdapterError.notFound(taskId)));
	}

	@Override
	public Mono<ListTasksResult> list(String cursor) {
		return this.taskStore.listTasks(cursor);
	}

	@Override
	public Mono<Task> awaitTerminal(String taskId, Duration timeout) {
		return Flux.interval(Duration.ZERO, this.pollInterval)
			.concatMap(tick -> get(taskId))
			.filter(Task::isTerminal)
			.next()
			.timeout(timeout);
	}

	@Override
	public Mono<Void> shutdown() {
		return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(this.inFlight.keySet())))
			.concatMap(taskId -> cancel(taskId).onErrorResume(AdapterError.class, e -> {
				// the task ended while shutting down
				logger.debug("Task {} not canceled on shutdown: {}", taskId, e.getMessage());
				return Mono.empty();
			}))
			.then(this.taskStore.shutdown());
	}

	public static Builder builder(AgentAdapter adapter) {
		return new Builder(adapter);
	}

	/**
	 * Builder for {@link DefaultTaskManager}.
	 */
	public static class Builder {

		private final AgentAdapter adapter;

		private TaskStore taskStore;

		private Duration pollInterval = TaskDefaults.DEFAULT_POLL_INTERVAL;

		private Scheduler scheduler = Schedulers.boundedElastic();

		private Builder(AgentAdapter adapter) {
			Assert.notNull(adapter, "adapter must not be null");
			this.adapter = adapter;
		}

		/**
		 * Sets the store holding task state. Defaults to a new {@link InMemoryTaskStore}.
		 * @param taskStore the store
		 * @return this builder
		 */
		public Builder taskStore(TaskStore taskStore) {
			Assert.notNull(taskStore, "taskStore must not be null");
			this.taskStore = taskStore;
			return this;
		}

		public Builder pollInterval(Duration pollInterval) {
			Assert.notNull(pollInterval, "pollInterval must not be null");
			Assert.isTrue(!pollInterval.isNegative() && !pollInterval.isZero(), "pollInterval must be positive");
			this.pollInterval = pollInterval;
			return this;
		}

		/**
		 * Sets the scheduler background calls are subscribed on.
		 * @param scheduler the scheduler
		 * @return this builder
		 */
		public Builder scheduler(Scheduler scheduler) {
			Assert.notNull(scheduler, "scheduler must not be null");
			this.scheduler = scheduler;
			return this;
		}

		public DefaultTaskManager build() {
			return new DefaultTaskManager(this);
		}

	}

}
