/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.dispatch;

import java.time.Duration;

import io.a2aadapter.util.Assert;

/**
 * Decides whether a failed attempt is retried and how long to wait before the next one.
 *
 * <p>
 * Only {@link ErrorCategory#TRANSIENT} failures are retried, at most
 * {@link #maxRetries()} times, so a logical call makes at most {@link #maxAttempts()}
 * attempts. The delay before retry {@code n} (0-based) is {@code baseBackoff * 2^n}.
 * Instances are immutable.
 */
public final class RetryPolicy {

	public static final int DEFAULT_MAX_RETRIES = 2;

	public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofMillis(250);

	private static final RetryPolicy DEFAULTS = new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_BACKOFF);

	private final int maxRetries;

	private final Duration baseBackoff;

	private RetryPolicy(int maxRetries, Duration baseBackoff) {
		this.maxRetries = Math.max(0, maxRetries);
		this.baseBackoff = baseBackoff;
	}

	/**
	 * Creates a policy. A negative retry count is treated as zero.
	 * @param maxRetries the number of retries after the first attempt
	 * @param baseBackoff the delay before the first retry
	 * @return the policy
	 */
	public static RetryPolicy of(int maxRetries, Duration baseBackoff) {
		Assert.notNull(baseBackoff, "baseBackoff must not be null");
		Assert.isTrue(!baseBackoff.isNegative(), "baseBackoff must not be negative");
		return new RetryPolicy(maxRetries, baseBackoff);
	}

	public static RetryPolicy defaults() {
		return DEFAULTS;
	}

	public static RetryPolicy none() {
		return new RetryPolicy(0, Duration.ZERO);
	}

	public int maxRetries() {
		return this.maxRetries;
	}

	public int maxAttempts() {
		return this.maxRetries + 1;
	}

	public Duration baseBackoff() {
		return this.baseBackoff;
	}

	/**
	 * Whether the failed attempt should be followed by another one.
	 * @param attempt the 0-based index of the failed attempt
	 * @param category the category of the failure
	 * @return true if another attempt is allowed
	 */
	public boolean shouldRetry(int attempt, ErrorCategory category) {
		return category == ErrorCategory.TRANSIENT && attempt < this.maxRetries;
	}

	/**
	 * Returns the delay to wait after the given failed attempt.
	 * @param attempt the 0-based index of the failed attempt
	 * @return {@code baseBackoff * 2^attempt}, saturating at {@code Long.MAX_VALUE}
	 * nanoseconds
	 */
	public Duration backoff(int attempt) {
		Assert.isTrue(attempt >= 0, "attempt must not be negative");
		long base = this.baseBackoff.toNanos();
		if (base == 0) {
			return Duration.ZERO;
		}
		if (attempt >= Long.numberOfLeadingZeros(base)) {
			return Duration.ofNanos(Long.MAX_VALUE);
		}
		return Duration.ofNanos(base << attempt);
	}

	@Override
	public String toString() {
		return "RetryPolicy[maxRetries=" + this.maxRetries + ", baseBackoff=" + this.baseBackoff + "]";
	}

}
