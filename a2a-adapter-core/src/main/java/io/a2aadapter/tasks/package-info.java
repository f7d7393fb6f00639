/*
 * Copyright 2026-2026 the original author or authors.
 */

/**
 * Background execution of adapter calls as pollable tasks.
 *
 * <h2>Core Types</h2>
 * <ul>
 * <li>{@link io.a2aadapter.tasks.TaskManager} - create, get, cancel and delete
 * tasks</li>
 * <li>{@link io.a2aadapter.tasks.TaskStore} - atomic task state transitions</li>
 * <li>{@link io.a2aadapter.tasks.InMemoryTaskStore} - in-memory store with retention
 * based cleanup</li>
 * </ul>
 *
 * <h2>State Machine</h2>
 * <p>
 * {@code SUBMITTED -> WORKING -> COMPLETED | FAILED | CANCELED}. Cancellation is also
 * allowed from {@code SUBMITTED}. Terminal states are final and only terminal tasks can
 * be deleted.
 */
package io.a2aadapter.tasks;
