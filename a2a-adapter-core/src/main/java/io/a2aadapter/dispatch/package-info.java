/*
 * Copyright 2026-2026 the original author or authors.
 */

/**
 * Retry and error classification shared by every backend.
 *
 * <ul>
 * <li>{@link io.a2aadapter.dispatch.ErrorClassifier} - maps statuses and exceptions to
 * an {@link io.a2aadapter.dispatch.ErrorCategory}</li>
 * <li>{@link io.a2aadapter.dispatch.RetryPolicy} - retry budget and exponential
 * backoff</li>
 * <li>{@link io.a2aadapter.dispatch.DispatchEngine} - runs the attempts of a logical
 * call and raises the terminal {@link io.a2aadapter.spec.AdapterError}</li>
 * </ul>
 */
package io.a2aadapter.dispatch;
