/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.tasks;

import java.time.Duration;

/**
 * Default constants for task lifecycle management. Stores and managers reference these
 * instead of defining their own.
 */
public final class TaskDefaults {

	private TaskDefaults() {
	}

	/**
	 * How long a task is kept after reaching a terminal state before the cleanup evicts
	 * it.
	 */
	public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

	/**
	 * Interval of the periodic cleanup of expired tasks.
	 */
	public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(1);

	/**
	 * Maximum number of tasks held by a store, terminal tasks awaiting eviction included.
	 */
	public static final int DEFAULT_MAX_TASKS = 10_000;

	/**
	 * Default page size for task listing.
	 */
	public static final int DEFAULT_PAGE_SIZE = 100;

	/**
	 * Interval at which {@link TaskManager#awaitTerminal} polls the task state.
	 */
	public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

	public static final String CANCELLATION_MESSAGE = "Cancellation requested";

}
