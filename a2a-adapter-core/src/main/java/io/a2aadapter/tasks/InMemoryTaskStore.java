/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.tasks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import io.a2aadapter.spec.A2aSchema.ListTasksResult;
import io.a2aadapter.spec.A2aSchema.Message;
import io.a2aadapter.spec.A2aSchema.Task;
import io.a2aadapter.spec.A2aSchema.TaskState;
import io.a2aadapter.spec.AdapterError;
import io.a2aadapter.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * In-memory implementation of {@link TaskStore}.
 *
 * <p>
 * Tasks are kept in a concurrent sorted map keyed by id, which gives cursor pagination
 * through {@code tailMap}. Transitions use {@code computeIfPresent} so that the state
 * check and the update are atomic. A daemon thread periodically evicts tasks whose
 * retention period, counted from their terminal transition, has passed. Live tasks are
 * never evicted.
 *
 * <pre>{@code
 * InMemoryTaskStore store = InMemoryTaskStore.builder()
 *     .retention(Duration.ofMinutes(30))
 *     .maxTasks(5000)
 *     .build();
 * }</pre>
 */
public class InMemoryTaskStore implements TaskStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryTaskStore.class);

	// Counter for unique instance IDs to distinguish multiple stores in thread names
	private static final AtomicLong INSTANCE_COUNTER = new AtomicLong(0);

	private final NavigableMap<String, TaskEntry> tasks = new ConcurrentSkipListMap<>();

	private final Duration retention;

	private final int maxTasks;

	private final int pageSize;

	private final Clock clock;

	private final ScheduledExecutorService cleanupExecutor;

	// Makes the max task check and the insertion atomic
	private final Object createTaskLock = new Object();

	/**
	 * Creates a store with default settings.
	 */
	public InMemoryTaskStore() {
		this(builder());
	}

	private InMemoryTaskStore(Builder builder) {
		this.retention = builder.retention;
		this.maxTasks = builder.maxTasks;
		this.pageSize = builder.pageSize;
		this.clock = builder.clock;
		long instanceId = INSTANCE_COUNTER.incrementAndGet();
		this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "a2a-task-cleanup-" + instanceId);
			t.setDaemon(true);
			return t;
		});
		long interval = builder.cleanupInterval.toMillis();
		this.cleanupExecutor.scheduleAtFixedRate(this::cleanupExpiredTasks, interval, interval,
				TimeUnit.MILLISECONDS);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link InMemoryTaskStore}. All settings are optional and default to the
	 * values in {@link TaskDefaults}.
	 */
	public static class Builder {

		private Duration retention = TaskDefaults.DEFAULT_RETENTION;

		private Duration cleanupInterval = TaskDefaults.DEFAULT_CLEANUP_INTERVAL;

		private int maxTasks = TaskDefaults.DEFAULT_MAX_TASKS;

		private int pageSize = TaskDefaults.DEFAULT_PAGE_SIZE;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Sets how long terminal tasks are kept.
		 * @param retention the retention period, counted from the terminal transition
		 * @return this builder
		 */
		public Builder retention(Duration retention) {
			Assert.notNull(retention, "retention must not be null");
			Assert.isTrue(!retention.isNegative(), "retention must not be negative");
			this.retention = retention;
			return this;
		}

		public Builder cleanupInterval(Duration cleanupInterval) {
			Assert.notNull(cleanupInterval, "cleanupInterval must not be null");
			Assert.isTrue(cleanupInterval.toMillis() > 0, "cleanupInterval must be at least 1 ms");
			this.cleanupInterval = cleanupInterval;
			return this;
		}

		public Builder maxTasks(int maxTasks) {
			Assert.isTrue(maxTasks > 0, "maxTasks must be positive");
			this.maxTasks = maxTasks;
			return this;
		}

		public Builder pageSize(int pageSize) {
			Assert.isTrue(pageSize > 0, "pageSize must be positive");
			this.pageSize = pageSize;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public InMemoryTaskStore build() {
			return new InMemoryTaskStore(this);
		}

	}

	@Override
	public Mono<Task> createTask(String correlationId) {
		return Mono.fromCallable(() -> {
			synchronized (this.createTaskLock) {
				if (this.tasks.size() >= this.maxTasks) {
					throw new IllegalStateException("Maximum task limit reached (" + this.maxTasks + ")");
				}
				String now = this.clock.instant().toString();
				Task task = Task.builder()
					.id(UUID.randomUUID().toString())
					.state(TaskState.SUBMITTED)
					.createdAt(now)
					.lastUpdatedAt(now)
					.correlationId(correlationId)
					.build();
				this.tasks.put(task.id(), new TaskEntry(task, null));
				return task;
			}
		});
	}

	@Override
	public Mono<Task> getTask(String taskId) {
		return Mono.fromCallable(() -> {
			TaskEntry entry = this.tasks.get(taskId);
			return entry != null ? entry.task() : null;
		});
	}

	@Override
	public Mono<Boolean> markWorking(String taskId) {
		return Mono.fromCallable(() -> transition(taskId, TaskState.WORKING, null, null, null).applied());
	}

	@Override
	public Mono<Boolean> complete(String taskId, Message result) {
		Assert.notNull(result, "result must not be null");
		return Mono.fromCallable(() -> {
			Transition transition = transition(taskId, TaskState.COMPLETED, null, result, null);
			if (!transition.applied()) {
				logger.debug("Discarded result for task {}: {}", taskId, transition.describeBefore());
			}
			return transition.applied();
		});
	}

	@Override
	public Mono<Boolean> fail(String taskId, String error) {
		return Mono.fromCallable(() -> {
			Transition transition = transition(taskId, TaskState.FAILED, null, null, error != null ? error : "");
			if (!transition.applied()) {
				logger.debug("Discarded failure for task {}: {}", taskId, transition.describeBefore());
			}
			return transition.applied();
		});
	}

	@Override
	public Mono<Task> requestCancellation(String taskId) {
		return Mono.fromCallable(() -> {
			Transition transition = transition(taskId, TaskState.CANCELED, TaskDefaults.CANCELLATION_MESSAGE, null,
					null);
			if (transition.before() == null) {
				return null;
			}
			if (!transition.applied()) {
				throw AdapterError.invalidState(
						"Cannot cancel task " + taskId + ": already in terminal state " + transition.before().state());
			}
			return transition.after();
		});
	}

	@Override
	public Mono<Boolean> deleteTask(String taskId) {
		return Mono.fromCallable(() -> {
			AtomicReference<TaskState> liveState = new AtomicReference<>();
			AtomicBoolean removed = new AtomicBoolean(false);
			this.tasks.computeIfPresent(taskId, (id, entry) -> {
				if (!entry.task().isTerminal()) {
					liveState.set(entry.task().state());
					return entry;
				}
				removed.set(true);
				return null;
			});
			if (liveState.get() != null) {
				throw AdapterError
					.invalidState("Cannot delete task " + taskId + " while it is " + liveState.get() + "; cancel it first");
			}
			return removed.get();
		});
	}

	@Override
	public Mono<ListTasksResult> listTasks(String cursor) {
		return Mono.fromCallable(() -> {
			// tailMap tolerates cursors of tasks that have since been removed
			NavigableMap<String, TaskEntry> view = cursor != null ? this.tasks.tailMap(cursor, false) : this.tasks;
			List<Task> page = new ArrayList<>();
			Iterator<Map.Entry<String, TaskEntry>> iterator = view.entrySet().iterator();
			String lastKey = null;
			while (iterator.hasNext() && page.size() < this.pageSize) {
				Map.Entry<String, TaskEntry> entry = iterator.next();
				page.add(entry.getValue().task());
				lastKey = entry.getKey();
			}
			return new ListTasksResult(page, iterator.hasNext() ? lastKey : null);
		});
	}

	private Transition transition(String taskId, TaskState target, String statusMessage, Message result,
			String error) {
		AtomicReference<Task> before = new AtomicReference<>();
		AtomicReference<Task> after = new AtomicReference<>();
		this.tasks.computeIfPresent(taskId, (id, entry) -> {
			Task current = entry.task();
			before.set(current);
			if (!isAllowed(current.state(), target)) {
				return entry;
			}
			Instant now = this.clock.instant();
			Task next = current.toBuilder()
				.state(target)
				.statusMessage(statusMessage)
				.lastUpdatedAt(now.toString())
				.result(result)
				.error(error)
				.build();
			after.set(next);
			return new TaskEntry(next, target.isTerminal() ? now : null);
		});
		return new Transition(before.get(), after.get());
	}

	private static boolean isAllowed(TaskState from, TaskState to) {
		if (to == TaskState.WORKING) {
			return from == TaskState.SUBMITTED;
		}
		return to.isTerminal() && !from.isTerminal();
	}

	/**
	 * Evicts terminal tasks whose retention period has passed. Package-private for
	 * testing.
	 */
	void cleanupExpiredTasks() {
		Instant now = this.clock.instant();
		int before = this.tasks.size();
		this.tasks.entrySet().removeIf(entry -> {
			Instant terminalAt = entry.getValue().terminalAt();
			return terminalAt != null && !now.isBefore(terminalAt.plus(this.retention));
		});
		int evicted = before - this.tasks.size();
		if (evicted > 0) {
			logger.debug("Evicted {} expired task(s)", evicted);
		}
	}

	/**
	 * Shuts down the cleanup executor. Call this when the store is no longer needed.
	 */
	@Override
	public Mono<Void> shutdown() {
		return Mono.fromRunnable(() -> {
			this.cleanupExecutor.shutdown();
			try {
				if (!this.cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
					this.cleanupExecutor.shutdownNow();
				}
			}
			catch (InterruptedException e) {
				this.cleanupExecutor.shutdownNow();
				Thread.currentThread().interrupt();
			}
		});
	}

	/**
	 * A stored task and the instant it became terminal, {@code null} while it is live.
	 */
	private record TaskEntry(Task task, Instant terminalAt) {
	}

	private record Transition(Task before, Task after) {

		boolean applied() {
			return this.after != null;
		}

		String describeBefore() {
			return this.before == null ? "task not found" : "task already " + this.before.state();
		}

	}

}
