/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.dispatch;

import java.time.Duration;

import reactor.util.annotation.Nullable;

/**
 * Record of a single backend attempt. Attempts are reported to the dispatch engine's
 * attempt listener and logged; they are never stored.
 *
 * @param correlationId the correlation id of the logical call
 * @param index the 0-based attempt index
 * @param elapsed the duration of this attempt
 * @param outcome the outcome
 * @param statusCode the failure status, if a response was received
 * @param cause the failure, if any
 */
public record CallAttempt(String correlationId, int index, Duration elapsed, Outcome outcome,
		@Nullable Integer statusCode, @Nullable Throwable cause) {

	public enum Outcome {

		SUCCESS, TRANSIENT, CLIENT_ERROR,

		/**
		 * The failure could not be classified and was propagated unchanged.
		 */
		UNCLASSIFIED

	}

	public boolean isSuccess() {
		return this.outcome == Outcome.SUCCESS;
	}

}
